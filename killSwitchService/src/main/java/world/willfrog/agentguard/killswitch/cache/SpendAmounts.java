package world.willfrog.agentguard.killswitch.cache;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 金额在缓存中以百万分之一为单位的整数保存，这样可以直接用 HINCRBY 做原子累加。
 */
public final class SpendAmounts {

    public static final int SCALE = 6;

    private SpendAmounts() {
    }

    public static long toMicros(BigDecimal amount) {
        if (amount == null) {
            return 0L;
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP).unscaledValue().longValueExact();
    }

    public static BigDecimal fromMicros(long micros) {
        return BigDecimal.valueOf(micros, SCALE);
    }
}
