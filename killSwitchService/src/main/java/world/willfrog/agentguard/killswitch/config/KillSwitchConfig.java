package world.willfrog.agentguard.killswitch.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableScheduling
@MapperScan("world.willfrog.agentguard.common.dao")
public class KillSwitchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 每个 tick 在独立线程上跑，调度线程只负责派发；上一个 tick 未结束时新的 tick 直接跳过。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService evaluatorTickExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("killswitch-tick-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService evaluatorCategoryExecutor(KillSwitchProperties properties) {
        int maxConcurrency = Math.max(1, properties.getEvaluator().getMaxConcurrency());
        return Executors.newFixedThreadPool(maxConcurrency, namedThreads("killswitch-eval-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
