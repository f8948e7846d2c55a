package world.willfrog.agentguard.killswitch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import world.willfrog.agentguard.common.dao.killswitch.AgentDao;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEventType;
import world.willfrog.agentguard.common.pojo.killswitch.TargetType;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerKind;
import world.willfrog.agentguard.killswitch.exception.AgentStateException;
import world.willfrog.agentguard.killswitch.model.TransitionResult;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent 状态迁移：每个动作都是「带前置状态条件的单条更新 + 审计追加」，在同一事务里完成。
 * 条件不满足时不写审计，返回 unchanged。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentStateActions {

    public static final String SYSTEM_ACTOR = "system";

    private final AgentDao agentDao;
    private final GlobalStopRegistry globalStopRegistry;
    private final KillSwitchAuditService auditService;
    private final Clock clock;

    @Transactional
    public TransitionResult kill(Agent agent, String reason, String actor, Map<String, Object> metadata) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int rows = agentDao.markKilled(agent.getId(), reason, actor, now);
        if (rows == 0) {
            log.info("Kill skipped, agent already killed: agentId={} ownerId={} actor={}",
                    agent.getExternalId(), agent.getOwnerId(), actor);
            return TransitionResult.unchanged(reload(agent));
        }
        auditService.recordAgentEvent(KillSwitchEventType.KILL_AGENT, agent, actor, reason, metadata);
        log.info("Agent killed: agentId={} ownerId={} actor={} reason={}",
                agent.getExternalId(), agent.getOwnerId(), actor, reason);
        return TransitionResult.changed(reload(agent));
    }

    /**
     * 触发器自动熔断，actor 固定为 auto_{kind}。
     */
    @Transactional
    public TransitionResult autoKill(Long agentId, TriggerKind kind, String reason, Map<String, Object> metadata) {
        Agent agent = agentDao.findById(agentId);
        if (agent == null) {
            throw new AgentStateException("agent disappeared before auto kill: id=" + agentId);
        }
        return kill(agent, reason, kind.actor(), metadata);
    }

    @Transactional
    public TransitionResult pause(Agent agent, int durationMinutes, String reason, String actor,
                                  Map<String, Object> metadata) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime pauseUntil = now.plusMinutes(durationMinutes);
        int rows = agentDao.markPaused(agent.getId(), pauseUntil, now);
        if (rows == 0) {
            return TransitionResult.unchanged(reload(agent));
        }
        Map<String, Object> auditMetadata = new LinkedHashMap<>();
        if (metadata != null) {
            auditMetadata.putAll(metadata);
        }
        auditMetadata.put("durationMinutes", durationMinutes);
        auditMetadata.put("pauseUntil", pauseUntil.toString());
        auditService.recordAgentEvent(KillSwitchEventType.PAUSE_AGENT, agent, actor, reason, auditMetadata);
        log.info("Agent paused: agentId={} ownerId={} until={} actor={}",
                agent.getExternalId(), agent.getOwnerId(), pauseUntil, actor);
        return TransitionResult.changed(reload(agent));
    }

    /**
     * KILLED 或 PAUSED 恢复为 ACTIVE，清空暂停与熔断信息。
     */
    @Transactional
    public TransitionResult revive(Agent agent, String reason, String actor) {
        AgentStatusSnapshot before = AgentStatusSnapshot.of(agent);
        int rows = agentDao.markRevived(agent.getId(), OffsetDateTime.now(clock));
        if (rows == 0) {
            return TransitionResult.unchanged(reload(agent));
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousStatus", before.status());
        if (before.killReason() != null) {
            metadata.put("previousKillReason", before.killReason());
        }
        auditService.recordAgentEvent(KillSwitchEventType.REVIVE_AGENT, agent, actor,
                reason == null ? "Manual revive" : reason, metadata);
        log.info("Agent revived: agentId={} ownerId={} from={} actor={}",
                agent.getExternalId(), agent.getOwnerId(), before.status(), actor);
        return TransitionResult.changed(reload(agent));
    }

    /**
     * 暂停到期的惰性恢复，由准入检查或状态查询触发。并发调用时只有一方会写入审计。
     */
    @Transactional
    public boolean expirePauseIfElapsed(Agent agent, OffsetDateTime now) {
        int rows = agentDao.expirePause(agent.getId(), now);
        if (rows == 0) {
            return false;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (agent.getPauseUntil() != null) {
            metadata.put("pauseUntil", agent.getPauseUntil().toString());
        }
        auditService.recordAgentEvent(KillSwitchEventType.PAUSE_EXPIRED, agent, SYSTEM_ACTOR,
                "Pause expired", metadata);
        log.info("Agent pause expired: agentId={} ownerId={}", agent.getExternalId(), agent.getOwnerId());
        return true;
    }

    /**
     * 熔断某个 owner 下所有为该 customer 产生过用量的 agent。
     */
    @Transactional
    public List<Agent> killCustomer(String ownerId, String customerId, String reason, String actor,
                                    Map<String, Object> metadata) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Agent> killed = agentDao.killByCustomer(ownerId, customerId, reason, actor, now);
        Map<String, Object> customerMetadata = new LinkedHashMap<>();
        if (metadata != null) {
            customerMetadata.putAll(metadata);
        }
        customerMetadata.put("affectedAgents", killed.size());
        auditService.record(KillSwitchEventType.KILL_CUSTOMER, TargetType.CUSTOMER, customerId, ownerId,
                actor, reason, customerMetadata);
        for (Agent agent : killed) {
            auditService.recordAgentEvent(KillSwitchEventType.KILL_AGENT, agent, actor, reason,
                    Map.of("customerId", customerId));
        }
        log.info("Customer killed: customerId={} ownerId={} affectedAgents={} actor={}",
                customerId, ownerId, killed.size(), actor);
        return killed;
    }

    /**
     * 打开全局急停，并把所有未熔断的 agent 置为 KILLED。
     * 审计：一条 GLOBAL 级 EMERGENCY_STOP，外加每个受影响 agent 一条 KILL_AGENT。
     */
    @Transactional
    public List<Agent> emergencyStop(String reason, String actor) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        globalStopRegistry.activate(reason, actor, now);
        String killReason = "Emergency stop: " + reason;
        List<Agent> killed = agentDao.killAllNotKilled(killReason, actor, now);
        auditService.record(KillSwitchEventType.EMERGENCY_STOP, TargetType.GLOBAL,
                KillSwitchAuditService.GLOBAL_TARGET_ID, actor, actor, reason,
                Map.of("affectedAgents", killed.size()));
        for (Agent agent : killed) {
            auditService.recordAgentEvent(KillSwitchEventType.KILL_AGENT, agent, actor, killReason,
                    Map.of("emergencyStop", true));
        }
        log.warn("Emergency stop activated: actor={} affectedAgents={} reason={}", actor, killed.size(), reason);
        return killed;
    }

    /**
     * 只关闭全局开关，不恢复任何 agent，需逐个 revive。
     */
    @Transactional
    public boolean disableEmergencyStop(String actor) {
        if (!globalStopRegistry.clear()) {
            return false;
        }
        auditService.record(KillSwitchEventType.EMERGENCY_STOP_DISABLED, TargetType.GLOBAL,
                KillSwitchAuditService.GLOBAL_TARGET_ID, actor, actor, "Emergency stop disabled", null);
        log.warn("Emergency stop disabled: actor={}", actor);
        return true;
    }

    private Agent reload(Agent agent) {
        Agent current = agentDao.findById(agent.getId());
        if (current == null) {
            throw new AgentStateException("agent row vanished during transition: id=" + agent.getId());
        }
        return current;
    }

    private record AgentStatusSnapshot(String status, String killReason) {
        static AgentStatusSnapshot of(Agent agent) {
            return new AgentStatusSnapshot(agent.getStatus() == null ? null : agent.getStatus().name(),
                    agent.getKillReason());
        }
    }
}
