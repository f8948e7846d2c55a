package world.willfrog.agentguard.common.pojo.killswitch;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class AgentErrorStatsTest {

    @Test
    void errorRatePercent_shouldRoundHalfUpToTwoDecimals() {
        AgentErrorStats stats = stats(3, 2);

        assertThat(stats.errorRatePercent()).isEqualTo(new BigDecimal("66.67"));
    }

    @Test
    void errorRatePercent_allErrorsShouldBeHundred() {
        assertThat(stats(4, 4).errorRatePercent()).isEqualByComparingTo("100");
    }

    @Test
    void errorRatePercent_noSamplesShouldBeZero() {
        assertThat(stats(0, 0).errorRatePercent()).isEqualByComparingTo("0");
    }

    private static AgentErrorStats stats(long total, long errors) {
        AgentErrorStats stats = new AgentErrorStats();
        stats.setAgentId(1L);
        stats.setTotalRequests(total);
        stats.setErrorCount(errors);
        return stats;
    }
}
