package world.willfrog.agentguard.killswitch.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentguard.common.dto.ResponseCode;
import world.willfrog.agentguard.killswitch.exception.BizException;

/**
 * 限流器按 {配置名}:{操作者} 懒创建，使用注册表中同名的配置。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimitingService {

    private final RateLimiterRegistry rateLimiterRegistry;

    public boolean tryAcquire(String configName, String operatorId) {
        RateLimiter rateLimiter = rateLimiterRegistry.rateLimiter(configName + ":" + operatorId, configName);
        return rateLimiter.acquirePermission();
    }

    public void requirePermit(String configName, String operatorId) {
        if (!tryAcquire(configName, operatorId)) {
            log.warn("Rate limit exceeded: limiter={} operator={}", configName, operatorId);
            throw new BizException(ResponseCode.TOO_MANY_REQUESTS, "Too many requests, please try again later");
        }
    }
}
