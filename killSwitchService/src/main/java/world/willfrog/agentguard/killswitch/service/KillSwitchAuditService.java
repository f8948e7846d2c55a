package world.willfrog.agentguard.killswitch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.agentguard.common.dao.killswitch.KillSwitchEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEvent;
import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEventType;
import world.willfrog.agentguard.common.pojo.killswitch.TargetType;

import java.util.List;
import java.util.Map;

/**
 * 熔断审计日志，只追加。调用方负责把它放在与状态变更相同的事务里。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KillSwitchAuditService {

    public static final String GLOBAL_TARGET_ID = "global";

    private static final int MAX_REASON_LENGTH = 1000;

    private final KillSwitchEventDao killSwitchEventDao;
    private final ObjectMapper objectMapper;

    public KillSwitchEvent recordAgentEvent(KillSwitchEventType type, Agent agent, String actor,
                                            String reason, Map<String, Object> metadata) {
        return record(type, TargetType.AGENT, agent.getExternalId(), agent.getOwnerId(), actor, reason, metadata);
    }

    public KillSwitchEvent record(KillSwitchEventType type, TargetType targetType, String targetId, String ownerId,
                                  String actor, String reason, Map<String, Object> metadata) {
        KillSwitchEvent event = new KillSwitchEvent();
        event.setEventType(type);
        event.setTargetType(targetType);
        event.setTargetId(targetId);
        event.setOwnerId(ownerId);
        event.setActor(actor);
        event.setReason(StringUtils.abbreviate(reason, MAX_REASON_LENGTH));
        event.setMetadataJson(toJson(metadata));
        killSwitchEventDao.insert(event);
        log.info("Kill switch event recorded: type={} target={}:{} actor={}", type, targetType, targetId, actor);
        return event;
    }

    public List<KillSwitchEvent> recent(String ownerId, int limit) {
        return killSwitchEventDao.listRecent(ownerId, limit);
    }

    public List<KillSwitchEvent> query(String ownerId, TargetType targetType, String targetId, int limit) {
        return killSwitchEventDao.listByTarget(ownerId, targetType, targetId, limit);
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("kill switch metadata is not serializable", e);
        }
    }
}
