package world.willfrog.agentguard.killswitch.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.AgentStatus;
import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEvent;
import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEventType;
import world.willfrog.agentguard.common.pojo.killswitch.TargetType;
import world.willfrog.agentguard.killswitch.model.DenyCode;
import world.willfrog.agentguard.killswitch.model.TransitionResult;
import world.willfrog.agentguard.killswitch.support.KillSwitchFixture;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static world.willfrog.agentguard.killswitch.support.KillSwitchFixture.OWNER;

class AgentStateActionsTest {

    private KillSwitchFixture fx;

    @BeforeEach
    void setUp() {
        fx = new KillSwitchFixture();
    }

    @Test
    void kill_twiceShouldBeIdempotent() {
        Agent agent = fx.store.addAgent(OWNER, "agent-1", AgentStatus.ACTIVE, null);

        TransitionResult first = fx.agentStateActions.kill(agent, "runaway", "ops-1", Map.of());
        TransitionResult second = fx.agentStateActions.kill(agent, "runaway again", "ops-2", Map.of());

        assertThat(first.isChanged()).isTrue();
        assertThat(second.isChanged()).isFalse();
        Agent stored = fx.store.agent(OWNER, "agent-1");
        assertThat(stored.getStatus()).isEqualTo(AgentStatus.KILLED);
        assertThat(stored.getKillReason()).isEqualTo("runaway");
        assertThat(stored.getKilledBy()).isEqualTo("ops-1");
        assertThat(fx.store.auditEvents(KillSwitchEventType.KILL_AGENT)).hasSize(1);
    }

    @Test
    void emergencyStop_shouldKillActiveAgentsAndRequireIndividualRevive() {
        fx.store.addAgent(OWNER, "a1", AgentStatus.ACTIVE, new BigDecimal("1000"));
        fx.store.addAgent(OWNER, "a2", AgentStatus.ACTIVE, null);
        Agent paused = fx.store.addAgent("owner-2", "a3", AgentStatus.PAUSED, null);
        paused.setPauseUntil(fx.now().plusHours(1));
        fx.store.update(paused);
        Agent alreadyKilled = fx.store.addAgent(OWNER, "a4", AgentStatus.ACTIVE, null);
        fx.agentStateActions.kill(alreadyKilled, "earlier", "ops", null);

        List<Agent> killed = fx.agentStateActions.emergencyStop("provider outage", "ops-1");

        assertThat(killed).extracting(Agent::getExternalId).containsExactlyInAnyOrder("a1", "a2", "a3");
        assertThat(fx.store.globalStop().isActive()).isTrue();
        assertThat(fx.admissionGate.admit(OWNER, "a1", new BigDecimal("0.01")).getDenyCode())
                .isEqualTo(DenyCode.GLOBAL_STOPPED);

        List<KillSwitchEvent> stops = fx.store.auditEvents(KillSwitchEventType.EMERGENCY_STOP);
        assertThat(stops).hasSize(1);
        assertThat(stops.get(0).getTargetType()).isEqualTo(TargetType.GLOBAL);
        // 一条全局记录 + 每个受影响 agent 一条，外加 a4 之前的那一条
        assertThat(fx.store.auditEvents(KillSwitchEventType.KILL_AGENT)).hasSize(4);

        assertThat(fx.agentStateActions.disableEmergencyStop("ops-1")).isTrue();
        assertThat(fx.store.globalStop().isActive()).isFalse();
        assertThat(fx.store.agent(OWNER, "a1").getStatus()).isEqualTo(AgentStatus.KILLED);
        assertThat(fx.admissionGate.admit(OWNER, "a1", new BigDecimal("0.01")).getDenyCode())
                .isEqualTo(DenyCode.AGENT_KILLED);

        fx.agentStateActions.revive(fx.store.agent(OWNER, "a1"), "reviewed", "ops-1");
        assertThat(fx.admissionGate.admit(OWNER, "a1", new BigDecimal("0.01")).isAllowed()).isTrue();
    }

    @Test
    void disableEmergencyStop_whenInactiveShouldNotAudit() {
        assertThat(fx.agentStateActions.disableEmergencyStop("ops-1")).isFalse();
        assertThat(fx.store.auditEvents()).isEmpty();
    }

    @Test
    void revive_shouldClearKillFieldsAndRecordPreviousStatus() {
        Agent agent = fx.store.addAgent(OWNER, "agent-1", AgentStatus.ACTIVE, null);
        fx.agentStateActions.kill(agent, "budget", "admission_gate", null);

        TransitionResult result = fx.agentStateActions.revive(fx.store.agent(OWNER, "agent-1"), null, "ops-1");

        assertThat(result.isChanged()).isTrue();
        Agent stored = result.getAgent();
        assertThat(stored.getStatus()).isEqualTo(AgentStatus.ACTIVE);
        assertThat(stored.getKillReason()).isNull();
        assertThat(stored.getKilledAt()).isNull();
        KillSwitchEvent revive = fx.store.auditEvents(KillSwitchEventType.REVIVE_AGENT).get(0);
        assertThat(revive.getMetadataJson()).contains("\"previousStatus\":\"KILLED\"");
    }

    @Test
    void revive_activeAgentShouldBeNoop() {
        Agent agent = fx.store.addAgent(OWNER, "agent-1", AgentStatus.ACTIVE, null);

        assertThat(fx.agentStateActions.revive(agent, null, "ops-1").isChanged()).isFalse();
        assertThat(fx.store.auditEvents()).isEmpty();
    }

    @Test
    void pause_onlyFromActive() {
        Agent agent = fx.store.addAgent(OWNER, "agent-1", AgentStatus.ACTIVE, null);

        TransitionResult paused = fx.agentStateActions.pause(agent, 30, "investigating", "ops-1", null);
        TransitionResult again = fx.agentStateActions.pause(paused.getAgent(), 30, "again", "ops-1", null);

        assertThat(paused.isChanged()).isTrue();
        assertThat(paused.getAgent().getPauseUntil()).isEqualTo(fx.now().plusMinutes(30));
        assertThat(again.isChanged()).isFalse();
        assertThat(fx.store.auditEvents(KillSwitchEventType.PAUSE_AGENT)).hasSize(1);
    }

    @Test
    void killCustomer_shouldOnlyKillOwnersAgentsThatServedTheCustomer() {
        Agent served = fx.store.addAgent(OWNER, "served", AgentStatus.ACTIVE, null);
        fx.store.addAgent(OWNER, "idle", AgentStatus.ACTIVE, null);
        Agent otherOwner = fx.store.addAgent("owner-2", "foreign", AgentStatus.ACTIVE, null);
        fx.store.addUsage(served, "cust-9", BigDecimal.ONE, null, null, fx.now());
        fx.store.addUsage(otherOwner, "cust-9", BigDecimal.ONE, null, null, fx.now());

        List<Agent> killed = fx.agentStateActions.killCustomer(OWNER, "cust-9", "abuse", "ops-1", null);

        assertThat(killed).extracting(Agent::getExternalId).containsExactly("served");
        assertThat(fx.store.agent(OWNER, "idle").getStatus()).isEqualTo(AgentStatus.ACTIVE);
        assertThat(fx.store.agent("owner-2", "foreign").getStatus()).isEqualTo(AgentStatus.ACTIVE);
        assertThat(fx.store.auditEvents(KillSwitchEventType.KILL_CUSTOMER)).hasSize(1);
    }
}
