package world.willfrog.agentguard.killswitch.config;

import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

@Configuration
@RequiredArgsConstructor
public class RateLimitingConfig {

    /** 控制面写操作的限流配置名，每个操作者各自一个限流器 */
    public static final String CONTROL_LIMITER = "killswitch-control";

    private final KillSwitchProperties killSwitchProperties;

    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        RateLimiterConfig control = RateLimiterConfig.custom()
                .limitForPeriod(Math.max(1, killSwitchProperties.getControl().getRateLimitPerMinute()))
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiterRegistry.of(Map.of(CONTROL_LIMITER, control));
    }
}
