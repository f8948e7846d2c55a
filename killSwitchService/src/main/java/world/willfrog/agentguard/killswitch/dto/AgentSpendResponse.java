package world.willfrog.agentguard.killswitch.dto;

import java.math.BigDecimal;

/**
 * utilizationPercent 在未设置月度限额时为 null。
 */
public record AgentSpendResponse(
        String agentId,
        String period,
        BigDecimal currentSpend,
        long eventCount,
        BigDecimal monthlyCostLimit,
        BigDecimal utilizationPercent,
        String status
) {
}
