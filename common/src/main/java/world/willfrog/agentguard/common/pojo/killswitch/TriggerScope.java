package world.willfrog.agentguard.common.pojo.killswitch;

public enum TriggerScope {
    GLOBAL,
    CUSTOMER,
    AGENT
}
