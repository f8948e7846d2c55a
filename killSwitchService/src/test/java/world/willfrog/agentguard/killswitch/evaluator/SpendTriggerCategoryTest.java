package world.willfrog.agentguard.killswitch.evaluator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.agentguard.common.dao.killswitch.KillTriggerDao;
import world.willfrog.agentguard.common.dao.killswitch.UsageEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.AgentSpendAggregate;
import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerKind;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerScope;
import world.willfrog.agentguard.common.pojo.killswitch.WindowUnit;
import world.willfrog.agentguard.killswitch.model.TransitionResult;
import world.willfrog.agentguard.killswitch.service.AgentStateActions;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpendTriggerCategoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-15T12:34:56Z");

    @Mock
    private KillTriggerDao killTriggerDao;
    @Mock
    private UsageEventDao usageEventDao;
    @Mock
    private AgentStateActions agentStateActions;

    private SpendTriggerCategory category;

    @BeforeEach
    void setUp() {
        category = new SpendTriggerCategory(killTriggerDao, usageEventDao, agentStateActions);
    }

    @Test
    void evaluate_spendRateShouldUseSlidingWindowAndKillOffenders() {
        KillTrigger trigger = trigger(TriggerKind.SPEND_RATE, WindowUnit.PER_HOUR, TriggerScope.CUSTOMER, "cust-7");
        AgentSpendAggregate offender = new AgentSpendAggregate();
        offender.setAgentId(11L);
        offender.setExternalId("burner");
        offender.setOwnerId("owner-1");
        offender.setTotalCost(new BigDecimal("25.5"));
        when(killTriggerDao.listActiveByKinds(anyCollection())).thenReturn(List.of(trigger));
        when(usageEventDao.findSpendAbove("owner-1", "cust-7", null, NOW.minusHours(1), new BigDecimal("20")))
                .thenReturn(List.of(offender));
        when(agentStateActions.autoKill(eq(11L), eq(TriggerKind.SPEND_RATE), anyString(), anyMap()))
                .thenReturn(TransitionResult.changed(new Agent()));

        assertThat(category.evaluate(NOW)).isEqualTo(1);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(agentStateActions).autoKill(eq(11L), eq(TriggerKind.SPEND_RATE), anyString(), metadata.capture());
        assertThat(metadata.getValue())
                .containsEntry("triggerId", 5L)
                .containsEntry("observed", new BigDecimal("25.5"));
    }

    @Test
    void evaluate_dailySpendShouldCountFromUtcMidnight() {
        KillTrigger trigger = trigger(TriggerKind.DAILY_SPEND, WindowUnit.PER_DAY, TriggerScope.GLOBAL, null);
        when(killTriggerDao.listActiveByKinds(anyCollection())).thenReturn(List.of(trigger));
        when(usageEventDao.findSpendAbove(eq("owner-1"), isNull(), isNull(), any(), any())).thenReturn(List.of());

        assertThat(category.evaluate(NOW)).isZero();

        verify(usageEventDao).findSpendAbove("owner-1", null, null,
                OffsetDateTime.parse("2026-03-15T00:00:00Z"), new BigDecimal("20"));
    }

    @Test
    void evaluate_alreadyKilledAgentShouldNotCount() {
        KillTrigger trigger = trigger(TriggerKind.SPEND_RATE, WindowUnit.PER_MINUTE, TriggerScope.AGENT, "burner");
        AgentSpendAggregate offender = new AgentSpendAggregate();
        offender.setAgentId(11L);
        offender.setTotalCost(new BigDecimal("30"));
        when(killTriggerDao.listActiveByKinds(anyCollection())).thenReturn(List.of(trigger));
        when(usageEventDao.findSpendAbove("owner-1", null, "burner", NOW.minusMinutes(1), new BigDecimal("20")))
                .thenReturn(List.of(offender));
        when(agentStateActions.autoKill(eq(11L), eq(TriggerKind.SPEND_RATE), anyString(), anyMap()))
                .thenReturn(TransitionResult.unchanged(new Agent()));

        assertThat(category.evaluate(NOW)).isZero();
    }

    private static KillTrigger trigger(TriggerKind kind, WindowUnit unit, TriggerScope scope, String target) {
        KillTrigger trigger = new KillTrigger();
        trigger.setId(5L);
        trigger.setOwnerId("owner-1");
        trigger.setTriggerName("spend guard");
        trigger.setTriggerKind(kind);
        trigger.setThresholdValue(new BigDecimal("20"));
        trigger.setWindowUnit(unit);
        trigger.setScope(scope);
        trigger.setScopeTargetId(target);
        trigger.setActive(true);
        return trigger;
    }
}
