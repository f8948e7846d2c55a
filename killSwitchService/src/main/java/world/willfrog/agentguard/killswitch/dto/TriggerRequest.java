package world.willfrog.agentguard.killswitch.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerKind;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerScope;
import world.willfrog.agentguard.common.pojo.killswitch.WindowUnit;

import java.math.BigDecimal;
import java.util.Map;

public record TriggerRequest(
        @NotBlank @Size(max = 255) String triggerName,
        @NotNull TriggerKind triggerKind,
        @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal thresholdValue,
        @NotNull WindowUnit windowUnit,
        @NotNull TriggerScope scope,
        @Size(max = 255) String scopeTargetId,
        Boolean active,
        Map<String, Object> metadata
) {
}
