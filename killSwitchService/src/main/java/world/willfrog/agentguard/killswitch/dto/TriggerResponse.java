package world.willfrog.agentguard.killswitch.dto;

import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public record TriggerResponse(
        Long id,
        String triggerName,
        String triggerKind,
        BigDecimal thresholdValue,
        String windowUnit,
        String scope,
        String scopeTargetId,
        boolean active,
        String metadata,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static TriggerResponse of(KillTrigger trigger) {
        return new TriggerResponse(
                trigger.getId(),
                trigger.getTriggerName(),
                trigger.getTriggerKind() == null ? null : trigger.getTriggerKind().name(),
                trigger.getThresholdValue(),
                trigger.getWindowUnit() == null ? null : trigger.getWindowUnit().name(),
                trigger.getScope() == null ? null : trigger.getScope().name(),
                trigger.getScopeTargetId(),
                trigger.isActive(),
                trigger.getMetadataJson(),
                trigger.getCreatedAt(),
                trigger.getUpdatedAt()
        );
    }
}
