package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Data
public class AgentErrorStats {
    private Long agentId;
    private String externalId;
    private String ownerId;
    private long totalRequests;
    private long errorCount;

    /**
     * 错误率百分比 = error_count / total * 100，保留两位小数；无样本时为 0。
     */
    public BigDecimal errorRatePercent() {
        if (totalRequests <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(errorCount)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(totalRequests), 2, RoundingMode.HALF_UP);
    }
}
