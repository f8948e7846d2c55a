package world.willfrog.agentguard.killswitch.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * agentId 不做校验注解：缺失时由准入返回 MISSING_AGENT_ID，而不是参数错误。
 */
public record UsageRecordRequest(
        String agentId,
        @NotBlank @Size(max = 255) String customerId,
        @NotBlank @Size(max = 255) String eventName,
        @NotBlank @Size(max = 100) String vendor,
        @Size(max = 255) String model,
        @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal costAmount,
        @PositiveOrZero Long inputTokens,
        @PositiveOrZero Long outputTokens,
        @PositiveOrZero Long totalTokens,
        @Size(max = 255) String requestSignature,
        String error,
        Map<String, Object> metadata,
        OffsetDateTime occurredAt
) {
}
