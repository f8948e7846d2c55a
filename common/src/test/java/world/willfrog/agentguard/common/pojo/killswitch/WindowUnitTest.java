package world.willfrog.agentguard.common.pojo.killswitch;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class WindowUnitTest {

    @Test
    void window_shouldMatchUnit() {
        assertThat(WindowUnit.PER_MINUTE.window()).isEqualTo(Duration.ofMinutes(1));
        assertThat(WindowUnit.PER_HOUR.window()).isEqualTo(Duration.ofHours(1));
        assertThat(WindowUnit.PER_DAY.window()).isEqualTo(Duration.ofDays(1));
    }

    @Test
    void window_percentageShouldFallBackToOneMinute() {
        assertThat(WindowUnit.PERCENTAGE.window()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void triggerKindActor_shouldBeLowerCasedWithAutoPrefix() {
        assertThat(TriggerKind.SPEND_RATE.actor()).isEqualTo("auto_spend_rate");
        assertThat(TriggerKind.DUPLICATE_LOOP.actor()).isEqualTo("auto_duplicate_loop");
    }
}
