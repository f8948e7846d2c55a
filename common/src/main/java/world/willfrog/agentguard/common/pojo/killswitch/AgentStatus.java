package world.willfrog.agentguard.common.pojo.killswitch;

public enum AgentStatus {
    ACTIVE,
    PAUSED,
    KILLED
}
