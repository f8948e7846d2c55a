package world.willfrog.agentguard.killswitch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import world.willfrog.agentguard.common.dao.killswitch.AgentDao;
import world.willfrog.agentguard.common.dto.ResponseCode;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.AgentSpendAggregate;
import world.willfrog.agentguard.common.pojo.killswitch.AgentStatus;
import world.willfrog.agentguard.common.pojo.killswitch.GlobalStop;
import world.willfrog.agentguard.common.pojo.killswitch.TargetType;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;
import world.willfrog.agentguard.killswitch.dto.AgentCheckResponse;
import world.willfrog.agentguard.killswitch.dto.AgentSpendResponse;
import world.willfrog.agentguard.killswitch.dto.AgentStateResponse;
import world.willfrog.agentguard.killswitch.dto.GlobalStopResponse;
import world.willfrog.agentguard.killswitch.dto.KillSwitchEventResponse;
import world.willfrog.agentguard.killswitch.dto.KillSwitchStatusResponse;
import world.willfrog.agentguard.killswitch.exception.BizException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.List;

@Service
@RequiredArgsConstructor
public class KillSwitchStatusService {

    public static final String GLOBAL_STOPPED = "GLOBAL_STOPPED";

    private final AgentDao agentDao;
    private final GlobalStopRegistry globalStopRegistry;
    private final AgentStateActions agentStateActions;
    private final KillSwitchAuditService auditService;
    private final PeriodSpendService periodSpendService;
    private final KillSwitchProperties properties;
    private final Clock clock;

    /**
     * 只读视图，不触发暂停到期的状态写入。
     */
    public KillSwitchStatusResponse status(String ownerId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        GlobalStop stop = globalStopRegistry.current();
        List<AgentStateResponse> agents = agentDao.listByOwner(ownerId).stream()
                .map(agent -> AgentStateResponse.of(agent, effectiveStatus(agent, stop, now)))
                .toList();
        List<KillSwitchEventResponse> events = auditService
                .recent(ownerId, properties.getStatus().getRecentEventsLimit()).stream()
                .map(KillSwitchEventResponse::of)
                .toList();
        return new KillSwitchStatusResponse(GlobalStopResponse.of(stop), agents, events);
    }

    /**
     * 单个 agent 的可用性检查，暂停到期时顺带恢复为 ACTIVE。
     */
    public AgentCheckResponse check(String ownerId, String agentId) {
        Agent agent = requireAgent(ownerId, agentId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (agent.getStatus() == AgentStatus.PAUSED && !pauseInFuture(agent, now)) {
            agentStateActions.expirePauseIfElapsed(agent, now);
            agent = requireAgent(ownerId, agentId);
        }
        GlobalStop stop = globalStopRegistry.current();
        String status = agent.getStatus().name();
        if (stop.isActive()) {
            return new AgentCheckResponse(agentId, false, status, true, stop.getReason());
        }
        return switch (agent.getStatus()) {
            case ACTIVE -> new AgentCheckResponse(agentId, true, status, false, null);
            case PAUSED -> new AgentCheckResponse(agentId, false, status, false,
                    "paused until " + agent.getPauseUntil());
            case KILLED -> new AgentCheckResponse(agentId, false, status, false, agent.getKillReason());
        };
    }

    public AgentSpendResponse spend(String ownerId, String agentId) {
        Agent agent = requireAgent(ownerId, agentId);
        YearMonth period = PeriodSpendService.periodOf(OffsetDateTime.now(clock));
        AgentSpendAggregate summary = periodSpendService.ledgerSummary(agent.getId(), period);
        BigDecimal spent = summary == null || summary.getTotalCost() == null ? BigDecimal.ZERO : summary.getTotalCost();
        long eventCount = summary == null ? 0L : summary.getEventCount();
        BigDecimal utilization = null;
        if (agent.hasMonthlyLimit() && agent.getMonthlyCostLimit().signum() > 0) {
            utilization = spent.multiply(BigDecimal.valueOf(100))
                    .divide(agent.getMonthlyCostLimit(), 2, RoundingMode.HALF_UP);
        }
        return new AgentSpendResponse(agentId, period.toString(), spent, eventCount,
                agent.getMonthlyCostLimit(), utilization, agent.getStatus().name());
    }

    public List<KillSwitchEventResponse> events(String ownerId, TargetType targetType, String targetId, Integer limit) {
        int effectiveLimit = limit == null || limit <= 0
                ? properties.getStatus().getRecentEventsLimit()
                : Math.min(limit, properties.getStatus().getMaxEventsLimit());
        return auditService.query(ownerId, targetType, targetId, effectiveLimit).stream()
                .map(KillSwitchEventResponse::of)
                .toList();
    }

    static String effectiveStatus(Agent agent, GlobalStop stop, OffsetDateTime now) {
        if (stop.isActive()) {
            return GLOBAL_STOPPED;
        }
        if (agent.getStatus() == AgentStatus.PAUSED && !pauseInFuture(agent, now)) {
            return AgentStatus.ACTIVE.name();
        }
        return agent.getStatus() == null ? null : agent.getStatus().name();
    }

    private static boolean pauseInFuture(Agent agent, OffsetDateTime now) {
        return agent.getPauseUntil() != null && agent.getPauseUntil().isAfter(now);
    }

    private Agent requireAgent(String ownerId, String agentId) {
        Agent agent = agentDao.findByOwnerAndExternalId(ownerId, agentId);
        if (agent == null) {
            throw new BizException(ResponseCode.DATA_NOT_FOUND, "agent not found: " + agentId);
        }
        return agent;
    }
}
