package world.willfrog.agentguard.killswitch.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collections;
import java.util.Map;

/**
 * 准入结果。拒绝是预期内的策略结果，不以异常表示。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AdmissionDecision {

    public enum Outcome {
        ALLOWED,
        /** agent 尚不存在，等创建后再做一次检查 */
        DEFERRED,
        DENIED
    }

    private final Outcome outcome;
    private final DenyCode denyCode;
    private final String message;
    private final Map<String, Object> details;
    private final Agent agent;
    private final BigDecimal cost;
    private final YearMonth period;
    /** 是否已在花费缓存上预占了本次 cost */
    private final boolean reserved;
    /** 是否在花费缓存上登记了在途准入，完成或撤回时需要注销 */
    private final boolean tracked;

    public static AdmissionDecision allow(Agent agent, BigDecimal cost, YearMonth period,
                                          boolean reserved, boolean tracked) {
        return new AdmissionDecision(Outcome.ALLOWED, null, null, Collections.emptyMap(),
                agent, cost, period, reserved, tracked);
    }

    public static AdmissionDecision deferred(BigDecimal cost) {
        return new AdmissionDecision(Outcome.DEFERRED, null, null, Collections.emptyMap(),
                null, cost, null, false, false);
    }

    public static AdmissionDecision deny(DenyCode code, String message, Map<String, Object> details) {
        return new AdmissionDecision(Outcome.DENIED, code, message,
                details == null ? Collections.emptyMap() : details, null, null, null, false, false);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }

    public boolean isDeferred() {
        return outcome == Outcome.DEFERRED;
    }

    public boolean isDenied() {
        return outcome == Outcome.DENIED;
    }
}
