package world.willfrog.agentguard.killswitch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentguard.common.dao.killswitch.UsageEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.AgentSpendAggregate;
import world.willfrog.agentguard.killswitch.cache.SpendCache;
import world.willfrog.agentguard.killswitch.cache.SpendCacheUnavailableException;
import world.willfrog.agentguard.killswitch.model.SpendReading;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * 当前自然月（UTC）的花费读取：先读缓存，未命中时按账本汇总回填；缓存不可用时直接返回账本汇总。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeriodSpendService {

    private final SpendCache spendCache;
    private final UsageEventDao usageEventDao;

    public static YearMonth periodOf(OffsetDateTime time) {
        return YearMonth.from(time.withOffsetSameInstant(ZoneOffset.UTC));
    }

    public static OffsetDateTime periodStart(YearMonth period) {
        return period.atDay(1).atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    public static OffsetDateTime periodEnd(YearMonth period) {
        return periodStart(period.plusMonths(1));
    }

    public SpendReading currentSpend(Agent agent, OffsetDateTime now) {
        YearMonth period = periodOf(now);
        try {
            Optional<BigDecimal> cached = spendCache.get(agent.getId(), period);
            if (cached.isPresent()) {
                return new SpendReading(cached.get(), period, SpendReading.Source.CACHE);
            }
            BigDecimal ledgerTotal = ledgerTotal(agent.getId(), period);
            if (spendCache.putIfAbsent(agent.getId(), period, ledgerTotal)) {
                log.debug("Spend cache backfilled: agentId={} period={} total={}", agent.getId(), period, ledgerTotal);
                return new SpendReading(ledgerTotal, period, SpendReading.Source.BACKFILLED);
            }
            // 并发回填已经写入，以缓存为准，避免重复累计
            BigDecimal winner = spendCache.get(agent.getId(), period).orElse(ledgerTotal);
            return new SpendReading(winner, period, SpendReading.Source.CACHE);
        } catch (SpendCacheUnavailableException e) {
            log.warn("Spend cache unavailable, falling back to ledger: agentId={} period={}", agent.getId(), period);
            return new SpendReading(ledgerTotal(agent.getId(), period), period, SpendReading.Source.LEDGER_FALLBACK);
        }
    }

    public BigDecimal ledgerTotal(Long agentId, YearMonth period) {
        BigDecimal total = usageEventDao.sumCost(agentId, periodStart(period), periodEnd(period));
        return total == null ? BigDecimal.ZERO : total;
    }

    public AgentSpendAggregate ledgerSummary(Long agentId, YearMonth period) {
        return usageEventDao.periodSummary(agentId, periodStart(period), periodEnd(period));
    }
}
