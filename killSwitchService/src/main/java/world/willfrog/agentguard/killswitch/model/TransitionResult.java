package world.willfrog.agentguard.killswitch.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;

/**
 * 条件更新的结果；changed=false 表示前置状态不满足，本次为空操作。
 */
@Getter
@AllArgsConstructor
public class TransitionResult {

    private final boolean changed;
    private final Agent agent;

    public static TransitionResult changed(Agent agent) {
        return new TransitionResult(true, agent);
    }

    public static TransitionResult unchanged(Agent agent) {
        return new TransitionResult(false, agent);
    }
}
