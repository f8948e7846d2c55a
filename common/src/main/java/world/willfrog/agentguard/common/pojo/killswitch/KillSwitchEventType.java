package world.willfrog.agentguard.common.pojo.killswitch;

public enum KillSwitchEventType {
    KILL_AGENT,
    KILL_CUSTOMER,
    PAUSE_AGENT,
    PAUSE_EXPIRED,
    REVIVE_AGENT,
    EMERGENCY_STOP,
    EMERGENCY_STOP_DISABLED
}
