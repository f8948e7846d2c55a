package world.willfrog.agentguard.killswitch.service;

import org.junit.jupiter.api.Test;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.AgentStatus;
import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEventType;
import world.willfrog.agentguard.common.pojo.killswitch.TargetType;
import world.willfrog.agentguard.killswitch.dto.AgentCheckResponse;
import world.willfrog.agentguard.killswitch.dto.AgentSpendResponse;
import world.willfrog.agentguard.killswitch.dto.AgentStateResponse;
import world.willfrog.agentguard.killswitch.dto.KillSwitchStatusResponse;
import world.willfrog.agentguard.killswitch.exception.BizException;
import world.willfrog.agentguard.killswitch.support.KillSwitchFixture;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static world.willfrog.agentguard.killswitch.support.KillSwitchFixture.OWNER;

class KillSwitchStatusServiceTest {

    private final KillSwitchFixture fx = new KillSwitchFixture();
    private final KillSwitchStatusService service = new KillSwitchStatusService(fx.agentDao, fx.globalStopRegistry,
            fx.agentStateActions, fx.auditService, fx.periodSpendService, fx.properties, fx.clock);

    @Test
    void status_elapsedPauseShouldReadAsActiveWithoutWriting() {
        pausedAgent("napper", fx.now().minusMinutes(1));

        KillSwitchStatusResponse status = service.status(OWNER);

        AgentStateResponse agent = status.agents().get(0);
        assertThat(agent.status()).isEqualTo("PAUSED");
        assertThat(agent.effectiveStatus()).isEqualTo("ACTIVE");
        assertThat(fx.store.agent(OWNER, "napper").getStatus()).isEqualTo(AgentStatus.PAUSED);
        assertThat(fx.store.auditEvents(KillSwitchEventType.PAUSE_EXPIRED)).isEmpty();
    }

    @Test
    void status_globalStopShouldOverrideEveryAgent() {
        fx.store.addAgent(OWNER, "a", AgentStatus.ACTIVE, null);
        fx.agentStateActions.emergencyStop("incident", "ops");

        KillSwitchStatusResponse status = service.status(OWNER);

        assertThat(status.globalStop().active()).isTrue();
        assertThat(status.agents()).extracting(AgentStateResponse::effectiveStatus)
                .containsOnly(KillSwitchStatusService.GLOBAL_STOPPED);
        assertThat(status.recentEvents()).isNotEmpty();
    }

    @Test
    void check_elapsedPauseShouldResumeAndRecordExpiry() {
        pausedAgent("napper", fx.now().minusSeconds(1));

        AgentCheckResponse check = service.check(OWNER, "napper");

        assertThat(check.isActive()).isTrue();
        assertThat(check.status()).isEqualTo("ACTIVE");
        assertThat(fx.store.auditEvents(KillSwitchEventType.PAUSE_EXPIRED)).hasSize(1);
    }

    @Test
    void check_killedAgentShouldReportKillReason() {
        Agent agent = fx.store.addAgent(OWNER, "gone", AgentStatus.ACTIVE, null);
        fx.agentStateActions.kill(agent, "runaway cost", "ops", Map.of());

        AgentCheckResponse check = service.check(OWNER, "gone");

        assertThat(check.isActive()).isFalse();
        assertThat(check.status()).isEqualTo("KILLED");
        assertThat(check.reason()).isEqualTo("runaway cost");
    }

    @Test
    void check_unknownAgentShouldBeNotFound() {
        assertThatThrownBy(() -> service.check(OWNER, "ghost")).isInstanceOf(BizException.class);
    }

    @Test
    void spend_shouldReportUtilizationAgainstLimit() {
        Agent agent = fx.store.addAgent(OWNER, "metered", AgentStatus.ACTIVE, new BigDecimal("20"));
        fx.store.addUsage(agent, "cust-1", new BigDecimal("4"), null, null, fx.now().minusDays(2));
        fx.store.addUsage(agent, "cust-1", new BigDecimal("1"), null, null, fx.now().minusHours(2));

        AgentSpendResponse spend = service.spend(OWNER, "metered");

        assertThat(spend.period()).isEqualTo("2026-03");
        assertThat(spend.currentSpend()).isEqualByComparingTo("5");
        assertThat(spend.eventCount()).isEqualTo(2);
        assertThat(spend.utilizationPercent()).isEqualByComparingTo("25.00");
    }

    @Test
    void spend_withoutLimitShouldLeaveUtilizationEmpty() {
        fx.store.addAgent(OWNER, "free", AgentStatus.ACTIVE, null);

        AgentSpendResponse spend = service.spend(OWNER, "free");

        assertThat(spend.currentSpend()).isEqualByComparingTo("0");
        assertThat(spend.utilizationPercent()).isNull();
    }

    @Test
    void events_shouldFilterByTarget() {
        Agent a = fx.store.addAgent(OWNER, "a", AgentStatus.ACTIVE, null);
        Agent b = fx.store.addAgent(OWNER, "b", AgentStatus.ACTIVE, null);
        fx.agentStateActions.kill(a, "stop a", "ops", Map.of());
        fx.agentStateActions.kill(b, "stop b", "ops", Map.of());

        assertThat(service.events(OWNER, TargetType.AGENT, "a", null))
                .singleElement()
                .satisfies(event -> assertThat(event.reason()).isEqualTo("stop a"));
    }

    private void pausedAgent(String externalId, OffsetDateTime pauseUntil) {
        Agent agent = fx.store.addAgent(OWNER, externalId, AgentStatus.PAUSED, null);
        agent.setPauseUntil(pauseUntil);
        fx.store.update(agent);
    }
}
