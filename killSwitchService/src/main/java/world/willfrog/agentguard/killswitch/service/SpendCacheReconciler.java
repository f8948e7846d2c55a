package world.willfrog.agentguard.killswitch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import world.willfrog.agentguard.common.dao.killswitch.UsageEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.AgentSpendAggregate;
import world.willfrog.agentguard.killswitch.cache.ReconcileOutcome;
import world.willfrog.agentguard.killswitch.cache.SpendCache;
import world.willfrog.agentguard.killswitch.cache.SpendCacheUnavailableException;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 用账本汇总校正有限额 agent 的缓存值。
 * <p>
 * 读账本前先拍下各 agent 的完成序号；只有序号未变且没有在途准入时才把缓存改写为账本值，
 * 否则只上调不下调，在途预占不会被账本覆盖掉。连续两轮序号不变但仍有在途登记的，
 * 视为进程中断遗留的登记，下一轮直接按账本改写。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpendCacheReconciler {

    private final UsageEventDao usageEventDao;
    private final SpendCache spendCache;
    private final KillSwitchProperties properties;
    private final Clock clock;

    private YearMonth lastPeriod;
    private Map<Long, Long> lastHeld = new HashMap<>();

    @Scheduled(fixedDelayString = "${killswitch.cache.reconcile-interval-ms:300000}",
            initialDelayString = "${killswitch.cache.reconcile-interval-ms:300000}")
    public void scheduledReconcile() {
        if (!properties.getCache().isReconcileEnabled()) {
            return;
        }
        reconcile(OffsetDateTime.now(clock));
    }

    public synchronized int reconcile(OffsetDateTime now) {
        YearMonth period = PeriodSpendService.periodOf(now);
        Map<Long, Long> sequences;
        try {
            sequences = spendCache.sequences(period);
        } catch (SpendCacheUnavailableException e) {
            log.warn("Spend cache reconciliation skipped, cache unavailable");
            return 0;
        }
        List<AgentSpendAggregate> totals = usageEventDao.sumPeriodForLimitedAgents(
                PeriodSpendService.periodStart(period), PeriodSpendService.periodEnd(period));
        Map<Long, Long> previousHeld = period.equals(lastPeriod) ? lastHeld : Map.of();
        Map<Long, Long> held = new HashMap<>();
        int updated = 0;
        try {
            for (AgentSpendAggregate total : totals) {
                long seq = sequences.getOrDefault(total.getAgentId(), 0L);
                boolean stale = Long.valueOf(seq).equals(previousHeld.get(total.getAgentId()));
                ReconcileOutcome outcome = spendCache.reconcile(total.getAgentId(), period,
                        total.getTotalCost(), seq, stale);
                if (outcome == ReconcileOutcome.KEPT || outcome == ReconcileOutcome.RAISED) {
                    held.put(total.getAgentId(), seq);
                }
                if (stale) {
                    log.warn("Discarded stale in-flight admissions: agentId={} period={}", total.getAgentId(), period);
                }
                updated++;
            }
        } catch (SpendCacheUnavailableException e) {
            log.warn("Spend cache reconciliation aborted, cache unavailable: updated={} of {}", updated, totals.size());
            return updated;
        } finally {
            lastPeriod = period;
            lastHeld = held;
        }
        log.info("Spend cache reconciled: period={} agents={}", period, updated);
        return updated;
    }
}
