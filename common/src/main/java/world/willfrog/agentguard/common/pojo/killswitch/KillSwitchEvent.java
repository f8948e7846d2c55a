package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class KillSwitchEvent {
    private Long id;
    private KillSwitchEventType eventType;
    private TargetType targetType;
    private String targetId;
    private String ownerId;
    private String actor;
    private String reason;
    private String metadataJson;
    private OffsetDateTime createdAt;
}
