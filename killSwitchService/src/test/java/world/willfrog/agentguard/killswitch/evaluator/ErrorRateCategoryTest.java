package world.willfrog.agentguard.killswitch.evaluator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.agentguard.common.dao.killswitch.KillTriggerDao;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.AgentStatus;
import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerKind;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerScope;
import world.willfrog.agentguard.common.pojo.killswitch.WindowUnit;
import world.willfrog.agentguard.killswitch.support.KillSwitchFixture;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;
import static world.willfrog.agentguard.killswitch.support.KillSwitchFixture.OWNER;

@ExtendWith(MockitoExtension.class)
class ErrorRateCategoryTest {

    @Mock
    private KillTriggerDao killTriggerDao;

    private KillSwitchFixture fx;
    private ErrorRateCategory category;

    @BeforeEach
    void setUp() {
        fx = new KillSwitchFixture();
        category = new ErrorRateCategory(killTriggerDao, fx.usageEventDao, fx.agentStateActions, fx.properties);
        when(killTriggerDao.listActiveByKinds(anyCollection())).thenReturn(List.of(trigger("50")));
    }

    @Test
    void evaluate_shouldKillAgentAboveThresholdWithEnoughSamples() {
        Agent agent = fx.store.addAgent(OWNER, "flaky", AgentStatus.ACTIVE, null);
        calls(agent, 4, 6);

        assertThat(category.evaluate(fx.now())).isEqualTo(1);
        Agent stored = fx.store.agent(OWNER, "flaky");
        assertThat(stored.getStatus()).isEqualTo(AgentStatus.KILLED);
        assertThat(stored.getKilledBy()).isEqualTo("auto_error_rate");
    }

    @Test
    void evaluate_shouldIgnoreAgentsBelowMinimumSamples() {
        Agent agent = fx.store.addAgent(OWNER, "new", AgentStatus.ACTIVE, null);
        calls(agent, 0, 9);

        assertThat(category.evaluate(fx.now())).isZero();
        assertThat(fx.store.agent(OWNER, "new").getStatus()).isEqualTo(AgentStatus.ACTIVE);
    }

    @Test
    void evaluate_rateEqualToThresholdShouldNotKill() {
        Agent agent = fx.store.addAgent(OWNER, "borderline", AgentStatus.ACTIVE, null);
        calls(agent, 5, 5);

        assertThat(category.evaluate(fx.now())).isZero();
    }

    private void calls(Agent agent, int ok, int failed) {
        for (int i = 0; i < ok; i++) {
            fx.store.addUsage(agent, "cust-1", new BigDecimal("0.01"), null, null, fx.now().minusMinutes(1));
        }
        for (int i = 0; i < failed; i++) {
            fx.store.addUsage(agent, "cust-1", new BigDecimal("0.01"), null, "429 rate limited", fx.now().minusMinutes(1));
        }
    }

    private static KillTrigger trigger(String threshold) {
        KillTrigger trigger = new KillTrigger();
        trigger.setId(3L);
        trigger.setOwnerId(OWNER);
        trigger.setTriggerName("error storm");
        trigger.setTriggerKind(TriggerKind.ERROR_RATE);
        trigger.setThresholdValue(new BigDecimal(threshold));
        trigger.setWindowUnit(WindowUnit.PERCENTAGE);
        trigger.setScope(TriggerScope.GLOBAL);
        trigger.setActive(true);
        return trigger;
    }
}
