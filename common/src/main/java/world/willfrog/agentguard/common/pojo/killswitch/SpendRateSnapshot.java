package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class SpendRateSnapshot {
    private Long id;
    private String ownerId;
    private Long agentId;
    private OffsetDateTime windowStart;
    private OffsetDateTime windowEnd;
    private int windowDurationMinutes;
    private BigDecimal totalCost;
    private long totalRequests;
    private long totalTokens;
    private long errorCount;
    private BigDecimal costPerMinute;
    private BigDecimal requestsPerMinute;
    private BigDecimal errorRate;
    private OffsetDateTime createdAt;
}
