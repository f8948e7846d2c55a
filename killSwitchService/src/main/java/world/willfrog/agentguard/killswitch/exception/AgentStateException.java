package world.willfrog.agentguard.killswitch.exception;

/**
 * 状态不变量被破坏（例如刚写入的 agent 读不到），属于不可恢复错误。
 */
public class AgentStateException extends RuntimeException {

    public AgentStateException(String message) {
        super(message);
    }
}
