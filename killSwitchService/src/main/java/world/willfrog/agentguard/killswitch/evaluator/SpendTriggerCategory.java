package world.willfrog.agentguard.killswitch.evaluator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentguard.common.dao.killswitch.KillTriggerDao;
import world.willfrog.agentguard.common.dao.killswitch.UsageEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.AgentSpendAggregate;
import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerKind;
import world.willfrog.agentguard.killswitch.model.TransitionResult;
import world.willfrog.agentguard.killswitch.service.AgentStateActions;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * spend_rate 使用滑动窗口，daily_spend 从当天 UTC 零点开始累计。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpendTriggerCategory implements EvaluationCategory {

    private final KillTriggerDao killTriggerDao;
    private final UsageEventDao usageEventDao;
    private final AgentStateActions agentStateActions;

    @Override
    public String name() {
        return "SPEND";
    }

    @Override
    public int evaluate(OffsetDateTime now) {
        List<KillTrigger> triggers = killTriggerDao.listActiveByKinds(
                List.of(TriggerKind.SPEND_RATE, TriggerKind.DAILY_SPEND));
        int killed = 0;
        for (KillTrigger trigger : triggers) {
            TriggerScopeFilter filter = TriggerScopeFilter.of(trigger);
            OffsetDateTime since = windowStart(trigger, now);
            List<AgentSpendAggregate> offenders = usageEventDao.findSpendAbove(filter.ownerId(),
                    filter.customerId(), filter.agentExternalId(), since, trigger.getThresholdValue());
            for (AgentSpendAggregate offender : offenders) {
                String reason = trigger.getTriggerKind() == TriggerKind.DAILY_SPEND
                        ? String.format("Daily spend %s exceeded threshold %s", offender.getTotalCost(), trigger.getThresholdValue())
                        : String.format("Spend rate %s in %s exceeded threshold %s", offender.getTotalCost(),
                        trigger.getWindowUnit(), trigger.getThresholdValue());
                TransitionResult result = agentStateActions.autoKill(offender.getAgentId(), trigger.getTriggerKind(),
                        reason, TriggerMetadata.of(trigger, offender.getTotalCost()));
                if (result.isChanged()) {
                    killed++;
                }
            }
        }
        return killed;
    }

    static OffsetDateTime windowStart(KillTrigger trigger, OffsetDateTime now) {
        if (trigger.getTriggerKind() == TriggerKind.DAILY_SPEND) {
            return now.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate().atStartOfDay().atOffset(ZoneOffset.UTC);
        }
        return now.minus(trigger.getWindowUnit().window());
    }
}
