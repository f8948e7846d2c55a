package world.willfrog.agentguard.common.pojo.killswitch;

import java.time.Duration;

public enum WindowUnit {
    PER_MINUTE(Duration.ofMinutes(1)),
    PER_HOUR(Duration.ofHours(1)),
    PER_DAY(Duration.ofDays(1)),
    PERCENTAGE(null);

    private final Duration window;

    WindowUnit(Duration window) {
        this.window = window;
    }

    /**
     * 滑动窗口长度；PERCENTAGE 没有固定窗口，按一分钟计。
     */
    public Duration window() {
        return window == null ? Duration.ofMinutes(1) : window;
    }
}
