package world.willfrog.agentguard.killswitch.dto;

import world.willfrog.agentguard.common.pojo.killswitch.Agent;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * effectiveStatus 叠加了全局急停与已到期的暂停，status 为库中原始状态。
 */
public record AgentStateResponse(
        String agentId,
        String agentName,
        String status,
        String effectiveStatus,
        OffsetDateTime pauseUntil,
        BigDecimal monthlyCostLimit,
        String killReason,
        OffsetDateTime killedAt,
        String killedBy
) {
    public static AgentStateResponse of(Agent agent, String effectiveStatus) {
        return new AgentStateResponse(
                agent.getExternalId(),
                agent.getAgentName(),
                agent.getStatus() == null ? null : agent.getStatus().name(),
                effectiveStatus,
                agent.getPauseUntil(),
                agent.getMonthlyCostLimit(),
                agent.getKillReason(),
                agent.getKilledAt(),
                agent.getKilledBy()
        );
    }
}
