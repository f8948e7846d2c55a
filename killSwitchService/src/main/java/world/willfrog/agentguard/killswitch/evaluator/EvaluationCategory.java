package world.willfrog.agentguard.killswitch.evaluator;

import java.time.OffsetDateTime;

/**
 * 一个 tick 内独立评估的规则类别。抛出的异常只影响本类别。
 */
public interface EvaluationCategory {

    String name();

    /**
     * @return 本次产生的动作数（熔断的 agent 数或写入的快照数）
     */
    int evaluate(OffsetDateTime now);
}
