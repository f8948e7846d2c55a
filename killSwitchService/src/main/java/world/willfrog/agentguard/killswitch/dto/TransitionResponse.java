package world.willfrog.agentguard.killswitch.dto;

/**
 * changed=false 表示目标已处于期望状态，本次为幂等空操作。
 */
public record TransitionResponse(
        boolean changed,
        AgentStateResponse agent
) {
}
