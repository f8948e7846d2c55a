package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class KillTrigger {
    private Long id;
    private String ownerId;
    private String triggerName;
    private TriggerKind triggerKind;
    private BigDecimal thresholdValue;
    private WindowUnit windowUnit;
    private TriggerScope scope;
    /** scope 为 CUSTOMER / AGENT 时对应的 customer_id / agent external_id */
    private String scopeTargetId;
    private boolean active;
    private String metadataJson;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
