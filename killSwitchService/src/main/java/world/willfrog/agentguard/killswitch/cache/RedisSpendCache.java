package world.willfrog.agentguard.killswitch.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * key = {prefix}{yyyy-MM}，hash field：
 * {agentId} = 微单位累计花费，{agentId}:pending = 在途准入数，{agentId}:seq = 已完成准入序号。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSpendCache implements SpendCache {

    static final String PENDING_SUFFIX = ":pending";
    static final String SEQ_SUFFIX = ":seq";

    static final RedisScript<Long> RESERVE_SCRIPT = new DefaultRedisScript<>(
            "redis.call('HINCRBY', KEYS[1], ARGV[2], 1)\n" +
            "return redis.call('HINCRBY', KEYS[1], ARGV[1], ARGV[3])", Long.class);

    static final RedisScript<Long> COMPLETE_SCRIPT = new DefaultRedisScript<>(
            "if tonumber(ARGV[4]) ~= 0 and redis.call('HEXISTS', KEYS[1], ARGV[1]) == 1 then\n" +
            "  redis.call('HINCRBY', KEYS[1], ARGV[1], ARGV[4])\n" +
            "end\n" +
            "if ARGV[5] == '1' then\n" +
            "  if redis.call('HINCRBY', KEYS[1], ARGV[2], -1) < 0 then\n" +
            "    redis.call('HSET', KEYS[1], ARGV[2], '0')\n" +
            "  end\n" +
            "end\n" +
            "return redis.call('HINCRBY', KEYS[1], ARGV[3], 1)", Long.class);

    // 返回值对应 ReconcileOutcome 的序号
    static final RedisScript<Long> RECONCILE_SCRIPT = new DefaultRedisScript<>(
            "local seq = tonumber(redis.call('HGET', KEYS[1], ARGV[3]) or '0')\n" +
            "local pending = tonumber(redis.call('HGET', KEYS[1], ARGV[2]) or '0')\n" +
            "if seq == tonumber(ARGV[5]) and (pending <= 0 or ARGV[6] == '1') then\n" +
            "  redis.call('HSET', KEYS[1], ARGV[1], ARGV[4])\n" +
            "  if pending > 0 then\n" +
            "    redis.call('HSET', KEYS[1], ARGV[2], '0')\n" +
            "  end\n" +
            "  return 0\n" +
            "end\n" +
            "local total = redis.call('HGET', KEYS[1], ARGV[1])\n" +
            "if (not total) or tonumber(total) < tonumber(ARGV[4]) then\n" +
            "  redis.call('HSET', KEYS[1], ARGV[1], ARGV[4])\n" +
            "  return 1\n" +
            "end\n" +
            "return 2", Long.class);

    private final StringRedisTemplate redisTemplate;
    private final KillSwitchProperties properties;

    @Override
    public Optional<BigDecimal> get(Long agentId, YearMonth period) {
        return call("get", () -> {
            String value = hashOps().get(key(period), totalField(agentId));
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(SpendAmounts.fromMicros(Long.parseLong(value)));
        });
    }

    @Override
    public boolean putIfAbsent(Long agentId, YearMonth period, BigDecimal total) {
        return call("putIfAbsent", () -> {
            Boolean written = hashOps().putIfAbsent(key(period), totalField(agentId),
                    String.valueOf(SpendAmounts.toMicros(total)));
            touch(period);
            return Boolean.TRUE.equals(written);
        });
    }

    @Override
    public BigDecimal reserve(Long agentId, YearMonth period, BigDecimal cost) {
        return call("reserve", () -> {
            Long micros = redisTemplate.execute(RESERVE_SCRIPT, List.of(key(period)),
                    totalField(agentId), pendingField(agentId), String.valueOf(SpendAmounts.toMicros(cost)));
            touch(period);
            return SpendAmounts.fromMicros(micros == null ? 0L : micros);
        });
    }

    @Override
    public void track(Long agentId, YearMonth period) {
        call("track", () -> {
            hashOps().increment(key(period), pendingField(agentId), 1L);
            touch(period);
            return null;
        });
    }

    @Override
    public void complete(Long agentId, YearMonth period, BigDecimal delta, boolean tracked) {
        call("complete", () -> {
            redisTemplate.execute(COMPLETE_SCRIPT, List.of(key(period)),
                    totalField(agentId), pendingField(agentId), seqField(agentId),
                    String.valueOf(SpendAmounts.toMicros(delta)), tracked ? "1" : "0");
            touch(period);
            return null;
        });
    }

    @Override
    public Map<Long, Long> sequences(YearMonth period) {
        return call("sequences", () -> {
            Map<String, String> entries = hashOps().entries(key(period));
            Map<Long, Long> result = new HashMap<>();
            if (entries == null) {
                return result;
            }
            entries.forEach((field, value) -> {
                if (field.endsWith(SEQ_SUFFIX)) {
                    result.put(Long.valueOf(field.substring(0, field.length() - SEQ_SUFFIX.length())),
                            Long.valueOf(value));
                }
            });
            return result;
        });
    }

    @Override
    public ReconcileOutcome reconcile(Long agentId, YearMonth period, BigDecimal ledgerTotal,
                                      long expectedSeq, boolean discardPending) {
        return call("reconcile", () -> {
            Long code = redisTemplate.execute(RECONCILE_SCRIPT, List.of(key(period)),
                    totalField(agentId), pendingField(agentId), seqField(agentId),
                    String.valueOf(SpendAmounts.toMicros(ledgerTotal)), String.valueOf(expectedSeq),
                    discardPending ? "1" : "0");
            touch(period);
            return ReconcileOutcome.of(code == null ? ReconcileOutcome.KEPT.ordinal() : code);
        });
    }

    private HashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }

    private void touch(YearMonth period) {
        Instant expireAt = period.plusMonths(1).atDay(1).atStartOfDay()
                .plusDays(Math.max(0, properties.getCache().getExpiryGraceDays()))
                .toInstant(ZoneOffset.UTC);
        redisTemplate.expireAt(key(period), expireAt);
    }

    private String key(YearMonth period) {
        return properties.getCache().getKeyPrefix() + period;
    }

    private String totalField(Long agentId) {
        return String.valueOf(agentId);
    }

    private String pendingField(Long agentId) {
        return agentId + PENDING_SUFFIX;
    }

    private String seqField(Long agentId) {
        return agentId + SEQ_SUFFIX;
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("Spend cache {} failed: {}", operation, e.getMessage());
            throw new SpendCacheUnavailableException("spend cache unavailable during " + operation, e);
        }
    }
}
