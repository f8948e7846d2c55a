package world.willfrog.agentguard.killswitch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "killswitch")
@Data
public class KillSwitchProperties {

    private Evaluator evaluator = new Evaluator();
    private Loop loop = new Loop();
    private ErrorRate errorRate = new ErrorRate();
    private Cache cache = new Cache();
    private Admission admission = new Admission();
    private Status status = new Status();
    private Control control = new Control();

    @Data
    public static class Evaluator {
        private boolean enabled = true;
        private long intervalMs = 30000;
        private long initialDelayMs = 10000;
        /** 单次 tick 内并发评估的类别数上限 */
        private int maxConcurrency = 3;
        private long categoryTimeoutMs = 20000;
        private int snapshotWindowMinutes = 5;
    }

    @Data
    public static class Loop {
        private int lookbackMinutes = 10;
        private long repeatThreshold = 50;
    }

    @Data
    public static class ErrorRate {
        private int lookbackMinutes = 15;
        private long minSamples = 10;
    }

    @Data
    public static class Cache {
        private String keyPrefix = "agent_spend:";
        /** 周期结束后 key 继续保留的天数，便于迟到的对账 */
        private int expiryGraceDays = 5;
        private boolean reconcileEnabled = true;
        private long reconcileIntervalMs = 300000;
    }

    @Data
    public static class Admission {
        /** true: 先在缓存上预占再确认；false: 先检查后累加（允许有界超支） */
        private boolean reservationEnabled = true;
        private int warnUtilizationPercent = 80;
    }

    @Data
    public static class Status {
        private int recentEventsLimit = 10;
        private int maxEventsLimit = 200;
    }

    @Data
    public static class Control {
        private int rateLimitPerMinute = 30;
    }
}
