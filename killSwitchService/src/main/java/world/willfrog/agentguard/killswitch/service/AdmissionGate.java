package world.willfrog.agentguard.killswitch.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.agentguard.common.dao.killswitch.AgentDao;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.AgentStatus;
import world.willfrog.agentguard.common.pojo.killswitch.GlobalStop;
import world.willfrog.agentguard.killswitch.cache.SpendCache;
import world.willfrog.agentguard.killswitch.cache.SpendCacheUnavailableException;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;
import world.willfrog.agentguard.killswitch.exception.AgentStateException;
import world.willfrog.agentguard.killswitch.model.AdmissionDecision;
import world.willfrog.agentguard.killswitch.model.DenyCode;
import world.willfrog.agentguard.killswitch.model.SpendReading;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 花费准入。检查顺序：全局急停 -> agent 状态 -> 月度预算。
 * <p>
 * 预算检查默认在缓存上先预占 cost，超额则回滚并熔断；账本写入成功后 {@link #confirm}，
 * 写入失败时 {@link #release}。关闭预占时退化为「先检查后累加」，并发下可能有界超支。
 * 缓存不可用时按账本汇总判断，不做预占。两种不预占的路径都由调用方传入同批次内
 * 已放行但尚未进入缓存的花费，避免批量请求全部按批前总额检查。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionGate {

    public static final String GATE_ACTOR = "admission_gate";

    private final GlobalStopRegistry globalStopRegistry;
    private final AgentDao agentDao;
    private final AgentStateActions agentStateActions;
    private final PeriodSpendService periodSpendService;
    private final SpendCache spendCache;
    private final KillSwitchProperties properties;
    private final Clock clock;

    public AdmissionDecision admit(String ownerId, String agentExternalId, BigDecimal cost) {
        return admit(ownerId, agentExternalId, cost, BigDecimal.ZERO);
    }

    /**
     * @param unreservedPending 同一批次内该 agent 已放行、但未计入缓存的花费
     */
    public AdmissionDecision admit(String ownerId, String agentExternalId, BigDecimal cost,
                                   BigDecimal unreservedPending) {
        if (StringUtils.isBlank(agentExternalId)) {
            return AdmissionDecision.deny(DenyCode.MISSING_AGENT_ID, "agentId is required", null);
        }
        AdmissionDecision stopped = checkGlobalStop();
        if (stopped != null) {
            return stopped;
        }
        Agent agent = agentDao.findByOwnerAndExternalId(ownerId, agentExternalId);
        if (agent == null) {
            return AdmissionDecision.deferred(cost);
        }
        return evaluate(agent, cost, unreservedPending);
    }

    public AdmissionDecision admitAfterCreation(String ownerId, String agentExternalId, BigDecimal cost) {
        return admitAfterCreation(ownerId, agentExternalId, cost, BigDecimal.ZERO);
    }

    /**
     * agent 刚被登记后的补充检查，首个事件即超额时同样熔断并拒绝。
     */
    public AdmissionDecision admitAfterCreation(String ownerId, String agentExternalId, BigDecimal cost,
                                                BigDecimal unreservedPending) {
        AdmissionDecision stopped = checkGlobalStop();
        if (stopped != null) {
            return stopped;
        }
        Agent agent = agentDao.findByOwnerAndExternalId(ownerId, agentExternalId);
        if (agent == null) {
            throw new AgentStateException("agent missing right after registration: ownerId=" + ownerId
                    + " agentId=" + agentExternalId);
        }
        return evaluate(agent, cost, unreservedPending);
    }

    /**
     * 账本写入提交之后调用。已预占的只注销在途登记；否则把 cost 累加到已存在的缓存条目上。
     */
    public void confirm(AdmissionDecision decision) {
        if (!decision.isAllowed()) {
            return;
        }
        BigDecimal delta = decision.isReserved() ? BigDecimal.ZERO : decision.getCost();
        try {
            spendCache.complete(decision.getAgent().getId(), decision.getPeriod(), delta, decision.isTracked());
        } catch (SpendCacheUnavailableException e) {
            log.warn("Spend cache confirm skipped, reconciliation will catch up: agentId={}",
                    decision.getAgent().getExternalId());
        }
    }

    /**
     * 账本写入失败时撤回预占和在途登记。
     */
    public void release(AdmissionDecision decision) {
        if (!decision.isAllowed() || !decision.isTracked()) {
            return;
        }
        BigDecimal delta = decision.isReserved() ? decision.getCost().negate() : BigDecimal.ZERO;
        try {
            spendCache.complete(decision.getAgent().getId(), decision.getPeriod(), delta, true);
        } catch (SpendCacheUnavailableException e) {
            log.warn("Spend cache release failed, reconciliation will correct it: agentId={} cost={}",
                    decision.getAgent().getExternalId(), decision.getCost());
        }
    }

    private AdmissionDecision checkGlobalStop() {
        GlobalStop stop = globalStopRegistry.current();
        if (!stop.isActive()) {
            return null;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", stop.getReason());
        details.put("stoppedAt", stop.getStoppedAt() == null ? null : stop.getStoppedAt().toString());
        return AdmissionDecision.deny(DenyCode.GLOBAL_STOPPED, "Emergency stop is active", details);
    }

    private AdmissionDecision evaluate(Agent agent, BigDecimal cost, BigDecimal unreservedPending) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (agent.getStatus() == AgentStatus.PAUSED && !isPauseInFuture(agent, now)) {
            agentStateActions.expirePauseIfElapsed(agent, now);
            agent = agentDao.findById(agent.getId());
            if (agent == null) {
                throw new AgentStateException("agent vanished after pause expiry");
            }
        }
        AdmissionDecision statusDenial = checkStatus(agent, now);
        if (statusDenial != null) {
            return statusDenial;
        }
        if (!agent.hasMonthlyLimit()) {
            return AdmissionDecision.allow(agent, cost, PeriodSpendService.periodOf(now), false, false);
        }
        SpendReading reading = periodSpendService.currentSpend(agent, now);
        if (!reading.isDegraded()) {
            try {
                if (properties.getAdmission().isReservationEnabled()) {
                    return reserve(agent, cost, reading, unreservedPending);
                }
                spendCache.track(agent.getId(), reading.getPeriod());
                return checkWithoutReservation(agent, cost, reading, unreservedPending, true);
            } catch (SpendCacheUnavailableException e) {
                log.warn("Spend cache unavailable during admission, checking without it: agentId={}",
                        agent.getExternalId());
            }
        }
        return checkWithoutReservation(agent, cost, reading, unreservedPending, false);
    }

    private AdmissionDecision checkStatus(Agent agent, OffsetDateTime now) {
        if (agent.getStatus() == AgentStatus.KILLED) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("killReason", agent.getKillReason());
            details.put("killedAt", agent.getKilledAt() == null ? null : agent.getKilledAt().toString());
            return AdmissionDecision.deny(DenyCode.AGENT_KILLED, "Agent has been killed", details);
        }
        if (agent.getStatus() == AgentStatus.PAUSED && isPauseInFuture(agent, now)) {
            return AdmissionDecision.deny(DenyCode.AGENT_PAUSED, "Agent is paused",
                    Map.of("pauseUntil", agent.getPauseUntil().toString()));
        }
        return null;
    }

    private boolean isPauseInFuture(Agent agent, OffsetDateTime now) {
        return agent.getPauseUntil() != null && agent.getPauseUntil().isAfter(now);
    }

    private AdmissionDecision reserve(Agent agent, BigDecimal cost, SpendReading reading,
                                      BigDecimal unreservedPending) {
        BigDecimal limit = agent.getMonthlyCostLimit();
        BigDecimal projected = spendCache.reserve(agent.getId(), reading.getPeriod(), cost).add(unreservedPending);
        if (projected.compareTo(limit) > 0) {
            BigDecimal current = projected.subtract(cost);
            rollback(agent, cost.negate(), reading);
            return denyOverLimit(agent, cost, current, projected);
        }
        warnIfNearLimit(agent, projected);
        return AdmissionDecision.allow(agent, cost, reading.getPeriod(), true, true);
    }

    private void rollback(Agent agent, BigDecimal delta, SpendReading reading) {
        try {
            spendCache.complete(agent.getId(), reading.getPeriod(), delta, true);
        } catch (SpendCacheUnavailableException e) {
            log.warn("Spend admission rollback failed, reconciliation will correct it: agentId={} delta={}",
                    agent.getExternalId(), delta);
        }
    }

    private AdmissionDecision checkWithoutReservation(Agent agent, BigDecimal cost, SpendReading reading,
                                                      BigDecimal unreservedPending, boolean tracked) {
        BigDecimal current = reading.getTotal().add(unreservedPending);
        BigDecimal projected = current.add(cost);
        if (projected.compareTo(agent.getMonthlyCostLimit()) > 0) {
            if (tracked) {
                rollback(agent, BigDecimal.ZERO, reading);
            }
            return denyOverLimit(agent, cost, current, projected);
        }
        warnIfNearLimit(agent, projected);
        return AdmissionDecision.allow(agent, cost, reading.getPeriod(), false, tracked);
    }

    private AdmissionDecision denyOverLimit(Agent agent, BigDecimal cost, BigDecimal current, BigDecimal projected) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentSpend", current);
        details.put("requestedCost", cost);
        details.put("monthlyLimit", agent.getMonthlyCostLimit());
        details.put("projectedSpend", projected);
        log.warn("Monthly cost limit exceeded: agentId={} ownerId={} current={} requested={} limit={}",
                agent.getExternalId(), agent.getOwnerId(), current, cost, agent.getMonthlyCostLimit());
        agentStateActions.kill(agent, "Monthly cost limit exceeded", GATE_ACTOR, details);
        return AdmissionDecision.deny(DenyCode.BUDGET_LIMIT_EXCEEDED, "Monthly cost limit exceeded", details);
    }

    private void warnIfNearLimit(Agent agent, BigDecimal projected) {
        BigDecimal limit = agent.getMonthlyCostLimit();
        if (limit.signum() <= 0) {
            return;
        }
        BigDecimal utilization = projected.multiply(BigDecimal.valueOf(100)).divide(limit, 2, RoundingMode.HALF_UP);
        if (utilization.compareTo(BigDecimal.valueOf(properties.getAdmission().getWarnUtilizationPercent())) >= 0) {
            log.warn("Agent approaching monthly limit: agentId={} ownerId={} utilization={}% projected={} limit={}",
                    agent.getExternalId(), agent.getOwnerId(), utilization, projected, limit);
        }
    }
}
