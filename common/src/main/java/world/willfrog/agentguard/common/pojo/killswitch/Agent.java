package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class Agent {
    private Long id;
    private String externalId;
    private String ownerId;
    private String agentName;
    private AgentStatus status;
    private OffsetDateTime pauseUntil;
    /** null 表示不限额 */
    private BigDecimal monthlyCostLimit;
    private String killReason;
    private OffsetDateTime killedAt;
    private String killedBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public boolean hasMonthlyLimit() {
        return monthlyCostLimit != null;
    }
}
