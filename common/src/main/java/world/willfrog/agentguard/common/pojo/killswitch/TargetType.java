package world.willfrog.agentguard.common.pojo.killswitch;

public enum TargetType {
    GLOBAL,
    CUSTOMER,
    AGENT
}
