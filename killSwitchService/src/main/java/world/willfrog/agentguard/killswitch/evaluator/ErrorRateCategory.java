package world.willfrog.agentguard.killswitch.evaluator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.agentguard.common.dao.killswitch.KillTriggerDao;
import world.willfrog.agentguard.common.dao.killswitch.UsageEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.AgentErrorStats;
import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerKind;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;
import world.willfrog.agentguard.killswitch.model.TransitionResult;
import world.willfrog.agentguard.killswitch.service.AgentStateActions;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * 样本数不足 min-samples 的 agent 不参与错误率计算。
 */
@Component
@RequiredArgsConstructor
public class ErrorRateCategory implements EvaluationCategory {

    private final KillTriggerDao killTriggerDao;
    private final UsageEventDao usageEventDao;
    private final AgentStateActions agentStateActions;
    private final KillSwitchProperties properties;

    @Override
    public String name() {
        return "ERROR_RATE";
    }

    @Override
    public int evaluate(OffsetDateTime now) {
        OffsetDateTime since = now.minusMinutes(properties.getErrorRate().getLookbackMinutes());
        long minSamples = properties.getErrorRate().getMinSamples();
        int killed = 0;
        for (KillTrigger trigger : killTriggerDao.listActiveByKinds(List.of(TriggerKind.ERROR_RATE))) {
            TriggerScopeFilter filter = TriggerScopeFilter.of(trigger);
            List<AgentErrorStats> stats = usageEventDao.findErrorStats(filter.ownerId(), filter.customerId(),
                    filter.agentExternalId(), since, minSamples);
            for (AgentErrorStats stat : stats) {
                BigDecimal rate = stat.errorRatePercent();
                if (rate.compareTo(trigger.getThresholdValue()) <= 0) {
                    continue;
                }
                Map<String, Object> metadata = TriggerMetadata.of(trigger, rate);
                metadata.put("errorCount", stat.getErrorCount());
                metadata.put("totalRequests", stat.getTotalRequests());
                String reason = String.format("Error rate %s%% (%d/%d) exceeded threshold %s%%",
                        rate, stat.getErrorCount(), stat.getTotalRequests(), trigger.getThresholdValue());
                TransitionResult result = agentStateActions.autoKill(stat.getAgentId(), TriggerKind.ERROR_RATE,
                        reason, metadata);
                if (result.isChanged()) {
                    killed++;
                }
            }
        }
        return killed;
    }
}
