package world.willfrog.agentguard.killswitch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.agentguard.common.dao.killswitch.KillTriggerDao;
import world.willfrog.agentguard.common.dto.ResponseCode;
import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerScope;
import world.willfrog.agentguard.killswitch.dto.TriggerRequest;
import world.willfrog.agentguard.killswitch.dto.TriggerResponse;
import world.willfrog.agentguard.killswitch.exception.BizException;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class KillTriggerService {

    private final KillTriggerDao killTriggerDao;
    private final ObjectMapper objectMapper;

    public TriggerResponse create(String ownerId, TriggerRequest request) {
        validateScope(request);
        KillTrigger trigger = new KillTrigger();
        trigger.setOwnerId(ownerId);
        apply(trigger, request);
        trigger.setTriggerKind(request.triggerKind());
        trigger.setScope(request.scope());
        trigger.setScopeTargetId(request.scope() == TriggerScope.GLOBAL ? null : request.scopeTargetId());
        killTriggerDao.insert(trigger);
        log.info("Kill trigger created: id={} ownerId={} kind={} threshold={} scope={}",
                trigger.getId(), ownerId, trigger.getTriggerKind(), trigger.getThresholdValue(), trigger.getScope());
        return TriggerResponse.of(requireTrigger(trigger.getId(), ownerId));
    }

    public List<TriggerResponse> list(String ownerId) {
        return killTriggerDao.listByOwner(ownerId).stream().map(TriggerResponse::of).toList();
    }

    /**
     * kind 与 scope 创建后不可修改，只更新名称、阈值、窗口、启用状态和元数据。
     */
    public TriggerResponse update(String ownerId, Long id, TriggerRequest request) {
        KillTrigger trigger = requireTrigger(id, ownerId);
        if (trigger.getTriggerKind() != request.triggerKind() || trigger.getScope() != request.scope()) {
            throw new BizException(ResponseCode.PARAM_ERROR, "triggerKind and scope cannot be changed");
        }
        apply(trigger, request);
        killTriggerDao.update(trigger);
        log.info("Kill trigger updated: id={} ownerId={} threshold={} active={}",
                id, ownerId, trigger.getThresholdValue(), trigger.isActive());
        return TriggerResponse.of(requireTrigger(id, ownerId));
    }

    public void delete(String ownerId, Long id) {
        if (killTriggerDao.deleteByIdAndOwner(id, ownerId) == 0) {
            throw new BizException(ResponseCode.DATA_NOT_FOUND, "trigger not found: " + id);
        }
        log.info("Kill trigger deleted: id={} ownerId={}", id, ownerId);
    }

    private void apply(KillTrigger trigger, TriggerRequest request) {
        trigger.setTriggerName(request.triggerName());
        trigger.setThresholdValue(request.thresholdValue());
        trigger.setWindowUnit(request.windowUnit());
        trigger.setActive(request.active() == null || request.active());
        trigger.setMetadataJson(toJson(request));
    }

    private void validateScope(TriggerRequest request) {
        if (request.scope() != TriggerScope.GLOBAL && StringUtils.isBlank(request.scopeTargetId())) {
            throw new BizException(ResponseCode.PARAM_ERROR, "scopeTargetId is required for scope " + request.scope());
        }
    }

    private KillTrigger requireTrigger(Long id, String ownerId) {
        KillTrigger trigger = killTriggerDao.findByIdAndOwner(id, ownerId);
        if (trigger == null) {
            throw new BizException(ResponseCode.DATA_NOT_FOUND, "trigger not found: " + id);
        }
        return trigger;
    }

    private String toJson(TriggerRequest request) {
        if (request.metadata() == null || request.metadata().isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(request.metadata());
        } catch (JsonProcessingException e) {
            throw new BizException(ResponseCode.PARAM_ERROR, "metadata is not valid JSON");
        }
    }
}
