package world.willfrog.agentguard.killswitch.evaluator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TriggerEvaluatorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-15T12:00:00Z");

    private final ExecutorService tickExecutor = Executors.newSingleThreadExecutor();
    private final ExecutorService categoryExecutor = Executors.newFixedThreadPool(3);
    private final KillSwitchProperties properties = new KillSwitchProperties();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC);

    @AfterEach
    void tearDown() {
        tickExecutor.shutdownNow();
        categoryExecutor.shutdownNow();
    }

    @Test
    void runTick_failingCategoryShouldNotAffectOthers() {
        TriggerEvaluator evaluator = evaluator(List.of(
                category("SPEND", now -> 2),
                category("DUPLICATE_LOOP", now -> {
                    throw new IllegalStateException("ledger query failed");
                }),
                category("ERROR_RATE", now -> 0)));

        TickReport report = evaluator.runTick(NOW);

        assertThat(report.isSkipped()).isFalse();
        assertThat(report.getResults()).containsEntry("SPEND", 2).containsEntry("ERROR_RATE", 0);
        assertThat(report.getFailedCategories()).containsExactly("DUPLICATE_LOOP");
    }

    @Test
    void runTick_slowCategoryShouldTimeOutIndividually() {
        properties.getEvaluator().setCategoryTimeoutMs(200);
        CountDownLatch never = new CountDownLatch(1);
        TriggerEvaluator evaluator = evaluator(List.of(
                category("SPEND", now -> {
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return 0;
                }),
                category("ERROR_RATE", now -> 1)));

        TickReport report = evaluator.runTick(NOW);

        assertThat(report.getFailedCategories()).containsExactly("SPEND");
        assertThat(report.getResults()).containsEntry("ERROR_RATE", 1);
    }

    @Test
    void runTick_categoryStillRunningFromTimedOutTickShouldNotRunTwice() throws Exception {
        properties.getEvaluator().setCategoryTimeoutMs(100);
        AtomicInteger invocations = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        TriggerEvaluator evaluator = evaluator(List.of(
                category("SPEND", now -> {
                    if (invocations.incrementAndGet() == 1) {
                        awaitIgnoringInterrupts(release);
                    }
                    return 7;
                }),
                category("ERROR_RATE", now -> 1)));

        TickReport first = evaluator.runTick(NOW);
        TickReport second = evaluator.runTick(NOW.plusSeconds(30));

        assertThat(first.getFailedCategories()).containsExactly("SPEND");
        assertThat(second.getFailedCategories()).containsExactly("SPEND");
        assertThat(second.getResults()).containsEntry("ERROR_RATE", 1);
        assertThat(invocations.get()).isEqualTo(1);

        release.countDown();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        TickReport later = evaluator.runTick(NOW.plusSeconds(60));
        while (!later.getResults().containsKey("SPEND") && System.nanoTime() < deadline) {
            Thread.sleep(20);
            later = evaluator.runTick(NOW.plusSeconds(60));
        }
        assertThat(later.getResults()).containsEntry("SPEND", 7);
        assertThat(invocations.get()).isEqualTo(2);
    }

    @Test
    void runTick_shouldSkipWhilePreviousTickIsRunning() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TriggerEvaluator evaluator = evaluator(List.of(category("SPEND", now -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 1;
        })));

        CompletableFuture<TickReport> first = CompletableFuture.supplyAsync(() -> evaluator.runTick(NOW));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        TickReport second = evaluator.runTick(NOW.plusSeconds(30));
        assertThat(second.isSkipped()).isTrue();
        assertThat(second.getResults()).isEmpty();

        release.countDown();
        TickReport firstReport = first.get(5, TimeUnit.SECONDS);
        assertThat(firstReport.isSkipped()).isFalse();
        assertThat(firstReport.getResults()).containsEntry("SPEND", 1);

        assertThat(evaluator.runTick(NOW.plusSeconds(60)).isSkipped()).isFalse();
    }

    @Test
    void scheduledTick_disabledEvaluatorShouldNotRun() throws Exception {
        properties.getEvaluator().setEnabled(false);
        CountDownLatch ran = new CountDownLatch(1);
        TriggerEvaluator evaluator = evaluator(List.of(category("SPEND", now -> {
            ran.countDown();
            return 0;
        })));

        evaluator.scheduledTick();

        assertThat(ran.await(200, TimeUnit.MILLISECONDS)).isFalse();
    }

    @Test
    void scheduledTick_shouldEvaluateOnTickExecutor() throws Exception {
        properties.getEvaluator().setEnabled(true);
        CountDownLatch ran = new CountDownLatch(1);
        TriggerEvaluator evaluator = evaluator(List.of(category("SPEND", now -> {
            assertThat(now.toInstant()).isEqualTo(clock.instant());
            ran.countDown();
            return 0;
        })));

        evaluator.scheduledTick();

        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
    }

    private TriggerEvaluator evaluator(List<EvaluationCategory> categories) {
        return new TriggerEvaluator(categories, tickExecutor, categoryExecutor, properties, clock);
    }

    private static EvaluationCategory category(String name, CategoryBody body) {
        return new EvaluationCategory() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int evaluate(OffsetDateTime now) {
                return body.evaluate(now);
            }
        };
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            try {
                if (latch.await(100, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException ignored) {
                // 模拟不响应中断的 JDBC 调用
            }
        }
    }

    @FunctionalInterface
    private interface CategoryBody {
        int evaluate(OffsetDateTime now);
    }
}
