package world.willfrog.agentguard.killswitch.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.YearMonth;

@Getter
@ToString
@AllArgsConstructor
public class SpendReading {

    public enum Source {
        CACHE,
        BACKFILLED,
        /** 缓存不可用，直接取账本汇总 */
        LEDGER_FALLBACK
    }

    private final BigDecimal total;
    private final YearMonth period;
    private final Source source;

    public boolean isDegraded() {
        return source == Source.LEDGER_FALLBACK;
    }
}
