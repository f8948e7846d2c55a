package world.willfrog.agentguard.killswitch.evaluator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentguard.common.dao.killswitch.KillTriggerDao;
import world.willfrog.agentguard.common.dao.killswitch.UsageEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;
import world.willfrog.agentguard.common.pojo.killswitch.RepeatedRequestGroup;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerKind;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;
import world.willfrog.agentguard.killswitch.model.TransitionResult;
import world.willfrog.agentguard.killswitch.service.AgentStateActions;

import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内置规则：回看窗口内同一 (agent, event, model, request_signature) 出现次数达到阈值即判为失控循环。
 * owner 配置的 duplicate_loop 触发器在其作用域内用自己的阈值再检查一遍。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DuplicateLoopCategory implements EvaluationCategory {

    private final KillTriggerDao killTriggerDao;
    private final UsageEventDao usageEventDao;
    private final AgentStateActions agentStateActions;
    private final KillSwitchProperties properties;

    @Override
    public String name() {
        return "DUPLICATE_LOOP";
    }

    @Override
    public int evaluate(OffsetDateTime now) {
        OffsetDateTime since = now.minusMinutes(properties.getLoop().getLookbackMinutes());
        Set<Long> handled = new HashSet<>();
        int killed = 0;

        long builtInThreshold = properties.getLoop().getRepeatThreshold();
        for (RepeatedRequestGroup group : usageEventDao.findRepeatedRequests(null, null, null, since, builtInThreshold)) {
            if (handled.add(group.getAgentId()) && kill(group, builtInThreshold, null)) {
                killed++;
            }
        }

        for (KillTrigger trigger : killTriggerDao.listActiveByKinds(List.of(TriggerKind.DUPLICATE_LOOP))) {
            TriggerScopeFilter filter = TriggerScopeFilter.of(trigger);
            long threshold = trigger.getThresholdValue().setScale(0, RoundingMode.CEILING).longValue();
            List<RepeatedRequestGroup> groups = usageEventDao.findRepeatedRequests(filter.ownerId(),
                    filter.customerId(), filter.agentExternalId(), since, threshold);
            for (RepeatedRequestGroup group : groups) {
                if (handled.add(group.getAgentId()) && kill(group, threshold, trigger)) {
                    killed++;
                }
            }
        }
        return killed;
    }

    private boolean kill(RepeatedRequestGroup group, long threshold, KillTrigger trigger) {
        Map<String, Object> metadata = trigger == null ? new LinkedHashMap<>()
                : TriggerMetadata.of(trigger, group.getRepeatCount());
        metadata.put("requestSignature", group.getRequestSignature());
        metadata.put("eventName", group.getEventName());
        metadata.put("model", group.getModel());
        metadata.put("repeatCount", group.getRepeatCount());
        metadata.put("repeatThreshold", threshold);
        metadata.put("lookbackMinutes", properties.getLoop().getLookbackMinutes());
        String reason = String.format("Duplicate request loop: %d identical requests in %d minutes",
                group.getRepeatCount(), properties.getLoop().getLookbackMinutes());
        log.warn("Duplicate loop detected: agentId={} ownerId={} signature={} count={}",
                group.getExternalId(), group.getOwnerId(), group.getRequestSignature(), group.getRepeatCount());
        TransitionResult result = agentStateActions.autoKill(group.getAgentId(), TriggerKind.DUPLICATE_LOOP,
                reason, metadata);
        return result.isChanged();
    }
}
