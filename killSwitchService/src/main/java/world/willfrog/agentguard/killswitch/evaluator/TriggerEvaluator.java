package world.willfrog.agentguard.killswitch.evaluator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 周期性扫描账本的兜底熔断。tick 之间不重叠：上一个 tick 仍在运行时，本次直接跳过而不是排队。
 * 各类别在有界线程池上并发执行，单个类别失败或超时只记录日志，不影响其它类别。
 * 超时的类别无法保证被中断，它仍在运行期间后续 tick 会跳过该类别，同一类别不会并行执行两份。
 */
@Slf4j
@Component
public class TriggerEvaluator {

    private final List<EvaluationCategory> categories;
    private final ExecutorService tickExecutor;
    private final ExecutorService categoryExecutor;
    private final KillSwitchProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<String> activeCategories = ConcurrentHashMap.newKeySet();

    public TriggerEvaluator(List<EvaluationCategory> categories,
                            @Qualifier("evaluatorTickExecutor") ExecutorService tickExecutor,
                            @Qualifier("evaluatorCategoryExecutor") ExecutorService categoryExecutor,
                            KillSwitchProperties properties,
                            Clock clock) {
        this.categories = categories;
        this.tickExecutor = tickExecutor;
        this.categoryExecutor = categoryExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${killswitch.evaluator.interval-ms:30000}",
            initialDelayString = "${killswitch.evaluator.initial-delay-ms:10000}")
    public void scheduledTick() {
        if (!properties.getEvaluator().isEnabled()) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Trigger evaluation skipped: previous tick still running");
            return;
        }
        try {
            tickExecutor.execute(() -> {
                try {
                    evaluateCategories(OffsetDateTime.now(clock));
                } finally {
                    running.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            running.set(false);
            log.error("Trigger evaluation tick rejected", e);
        }
    }

    /**
     * 同步执行一次 tick；若已有 tick 在运行则返回 skipped。
     */
    public TickReport runTick(OffsetDateTime now) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Trigger evaluation skipped: previous tick still running");
            return TickReport.skipped(now);
        }
        try {
            return evaluateCategories(now);
        } finally {
            running.set(false);
        }
    }

    private TickReport evaluateCategories(OffsetDateTime now) {
        long startNanos = System.nanoTime();
        long deadline = startNanos + TimeUnit.MILLISECONDS.toNanos(properties.getEvaluator().getCategoryTimeoutMs());

        Map<EvaluationCategory, Future<Integer>> futures = new LinkedHashMap<>();
        for (EvaluationCategory category : categories) {
            futures.put(category, categoryExecutor.submit(() -> evaluateExclusively(category, now)));
        }

        Map<String, Integer> results = new LinkedHashMap<>();
        List<String> failed = new ArrayList<>();
        for (Map.Entry<EvaluationCategory, Future<Integer>> entry : futures.entrySet()) {
            String name = entry.getKey().name();
            Future<Integer> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                results.put(name, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (ExecutionException e) {
                failed.add(name);
                if (e.getCause() instanceof CategoryBusyException) {
                    log.warn("Trigger category skipped, previous run still in progress: category={}", name);
                } else {
                    log.error("Trigger category failed: category={}", name, e.getCause());
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                failed.add(name);
                log.error("Trigger category timed out: category={} timeoutMs={}",
                        name, properties.getEvaluator().getCategoryTimeoutMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                failed.add(name);
                log.warn("Trigger evaluation interrupted: category={}", name);
            }
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        log.info("Trigger evaluation finished: results={} failed={} elapsedMs={}", results, failed, elapsedMs);
        return new TickReport(now, false, results, failed);
    }

    private int evaluateExclusively(EvaluationCategory category, OffsetDateTime now) {
        if (!activeCategories.add(category.name())) {
            throw new CategoryBusyException(category.name());
        }
        try {
            return category.evaluate(now);
        } finally {
            activeCategories.remove(category.name());
        }
    }

    private static class CategoryBusyException extends RuntimeException {
        CategoryBusyException(String category) {
            super("category still running: " + category);
        }
    }
}
