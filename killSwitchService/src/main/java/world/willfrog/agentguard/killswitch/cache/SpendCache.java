package world.willfrog.agentguard.killswitch.cache;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;
import java.util.Optional;

/**
 * 按 (agent, 自然月) 记录的花费累计，是账本的可重建投影，不作为权威数据。
 * <p>
 * 每个条目除累计值外还记录两项簿记：尚未完成的准入数（pending）和已完成的准入序号（seq）。
 * 对账只有在两者都表明没有账本之外的变动时才会把累计值改写为账本值，否则只允许上调。
 * 所有方法在缓存不可达时抛出 {@link SpendCacheUnavailableException}。
 */
public interface SpendCache {

    /**
     * @return 缓存中的累计值；empty 表示没有条目（区别于合法的 0）
     */
    Optional<BigDecimal> get(Long agentId, YearMonth period);

    /**
     * 仅在条目不存在时写入。
     *
     * @return 是否由本次调用写入
     */
    boolean putIfAbsent(Long agentId, YearMonth period, BigDecimal total);

    /**
     * 预占 cost 并登记一个未完成的准入，原子执行。
     *
     * @return 预占后的累计值
     */
    BigDecimal reserve(Long agentId, YearMonth period, BigDecimal cost);

    /**
     * 只登记一个未完成的准入，不改累计值。用于先检查后累加的模式。
     */
    void track(Long agentId, YearMonth period);

    /**
     * 结束一次准入：条目存在时把 delta 加到累计值上，推进 seq；tracked 为 true 时同时撤销一个 pending。
     */
    void complete(Long agentId, YearMonth period, BigDecimal delta, boolean tracked);

    /**
     * @return 当前周期内各 agent 的 seq 快照，没有记录的 agent 视为 0
     */
    Map<Long, Long> sequences(YearMonth period);

    /**
     * 用账本汇总校正累计值。
     *
     * @param expectedSeq     读取账本之前拍下的 seq
     * @param discardPending  pending 被判定为遗留时为 true，此时忽略并清零 pending
     */
    ReconcileOutcome reconcile(Long agentId, YearMonth period, BigDecimal ledgerTotal,
                               long expectedSeq, boolean discardPending);
}
