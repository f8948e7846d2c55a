package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * 账本中的一条用量事件，写入后不可修改
 */
@Data
public class UsageEvent {
    private Long id;
    private String ownerId;
    private Long agentId;
    private String customerId;
    private String eventName;
    private String vendor;
    private String model;
    private BigDecimal costAmount;
    private Long inputTokens;
    private Long outputTokens;
    private Long totalTokens;
    private String requestSignature;
    private String errorMessage;
    private String metadataJson;
    private OffsetDateTime occurredAt;
    private OffsetDateTime createdAt;
}
