package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 按 agent 聚合的账本花费
 */
@Data
public class AgentSpendAggregate {
    private Long agentId;
    private String externalId;
    private String ownerId;
    private BigDecimal totalCost;
    private long eventCount;
}
