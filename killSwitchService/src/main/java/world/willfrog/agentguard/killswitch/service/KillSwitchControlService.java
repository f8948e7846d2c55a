package world.willfrog.agentguard.killswitch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentguard.common.dao.killswitch.AgentDao;
import world.willfrog.agentguard.common.dao.killswitch.UsageEventDao;
import world.willfrog.agentguard.common.dto.ResponseCode;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.AgentStatus;
import world.willfrog.agentguard.killswitch.dto.AgentStateResponse;
import world.willfrog.agentguard.killswitch.dto.BulkKillResponse;
import world.willfrog.agentguard.killswitch.dto.EmergencyStopRequest;
import world.willfrog.agentguard.killswitch.dto.KillRequest;
import world.willfrog.agentguard.killswitch.dto.PauseRequest;
import world.willfrog.agentguard.killswitch.dto.ReviveRequest;
import world.willfrog.agentguard.killswitch.dto.TransitionResponse;
import world.willfrog.agentguard.killswitch.exception.BizException;
import world.willfrog.agentguard.killswitch.model.TransitionResult;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * 运维侧的熔断操作入口：解析 agent、校验请求，再交给 {@link AgentStateActions} 做条件迁移。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KillSwitchControlService {

    private final AgentDao agentDao;
    private final UsageEventDao usageEventDao;
    private final AgentStateActions agentStateActions;
    private final Clock clock;

    public TransitionResponse kill(String operatorId, String agentId, KillRequest request) {
        Agent agent = requireAgent(operatorId, agentId);
        TransitionResult result = agentStateActions.kill(agent, request.reason(), operatorId, request.metadata());
        return toResponse(result);
    }

    public BulkKillResponse killCustomer(String operatorId, String customerId, KillRequest request) {
        if (!usageEventDao.existsForCustomer(operatorId, customerId)) {
            throw new BizException(ResponseCode.DATA_NOT_FOUND, "customer not found: " + customerId);
        }
        List<Agent> killed = agentStateActions.killCustomer(operatorId, customerId, request.reason(),
                operatorId, request.metadata());
        return new BulkKillResponse(killed.size(), killed.stream().map(Agent::getExternalId).toList());
    }

    public TransitionResponse pause(String operatorId, String agentId, PauseRequest request) {
        Agent agent = requireAgent(operatorId, agentId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (agent.getStatus() == AgentStatus.PAUSED && agentStateActions.expirePauseIfElapsed(agent, now)) {
            agent = requireAgent(operatorId, agentId);
        }
        TransitionResult result = agentStateActions.pause(agent, request.durationMinutes(), request.reason(),
                operatorId, request.metadata());
        if (!result.isChanged()) {
            throw new BizException(ResponseCode.STATUS_CONFLICT,
                    "agent cannot be paused in status " + result.getAgent().getStatus());
        }
        return toResponse(result);
    }

    public TransitionResponse revive(String operatorId, String agentId, ReviveRequest request) {
        Agent agent = requireAgent(operatorId, agentId);
        String reason = request == null ? null : request.reason();
        return toResponse(agentStateActions.revive(agent, reason, operatorId));
    }

    public BulkKillResponse emergencyStop(String operatorId, EmergencyStopRequest request) {
        if (!Boolean.TRUE.equals(request.confirm())) {
            throw new BizException(ResponseCode.PARAM_ERROR, "emergency stop requires confirm=true");
        }
        List<Agent> killed = agentStateActions.emergencyStop(request.reason(), operatorId);
        return new BulkKillResponse(killed.size(), killed.stream().map(Agent::getExternalId).toList());
    }

    public boolean disableEmergencyStop(String operatorId) {
        boolean cleared = agentStateActions.disableEmergencyStop(operatorId);
        if (!cleared) {
            log.info("Emergency stop disable requested while inactive: actor={}", operatorId);
        }
        return cleared;
    }

    Agent requireAgent(String ownerId, String agentId) {
        Agent agent = agentDao.findByOwnerAndExternalId(ownerId, agentId);
        if (agent == null) {
            throw new BizException(ResponseCode.DATA_NOT_FOUND, "agent not found: " + agentId);
        }
        return agent;
    }

    private TransitionResponse toResponse(TransitionResult result) {
        Agent agent = result.getAgent();
        return new TransitionResponse(result.isChanged(),
                AgentStateResponse.of(agent, agent.getStatus() == null ? null : agent.getStatus().name()));
    }
}
