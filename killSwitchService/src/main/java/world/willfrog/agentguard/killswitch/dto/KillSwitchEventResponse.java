package world.willfrog.agentguard.killswitch.dto;

import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEvent;

import java.time.OffsetDateTime;

public record KillSwitchEventResponse(
        Long id,
        String eventType,
        String targetType,
        String targetId,
        String actor,
        String reason,
        String metadata,
        OffsetDateTime createdAt
) {
    public static KillSwitchEventResponse of(KillSwitchEvent event) {
        return new KillSwitchEventResponse(
                event.getId(),
                event.getEventType() == null ? null : event.getEventType().name(),
                event.getTargetType() == null ? null : event.getTargetType().name(),
                event.getTargetId(),
                event.getActor(),
                event.getReason(),
                event.getMetadataJson(),
                event.getCreatedAt()
        );
    }
}
