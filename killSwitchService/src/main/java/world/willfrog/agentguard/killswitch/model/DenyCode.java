package world.willfrog.agentguard.killswitch.model;

public enum DenyCode {
    GLOBAL_STOPPED,
    AGENT_KILLED,
    AGENT_PAUSED,
    BUDGET_LIMIT_EXCEEDED,
    MISSING_AGENT_ID
}
