package world.willfrog.agentguard.common.pojo.killswitch;

/**
 * 自动熔断规则类型
 */
public enum TriggerKind {
    /** 滑动窗口内的花费速率 */
    SPEND_RATE,
    /** 自然日累计花费 */
    DAILY_SPEND,
    /** 错误率百分比 */
    ERROR_RATE,
    /** 相同请求签名重复次数 */
    DUPLICATE_LOOP;

    public String actor() {
        return "auto_" + name().toLowerCase();
    }
}
