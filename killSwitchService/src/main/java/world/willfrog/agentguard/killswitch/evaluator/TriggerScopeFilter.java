package world.willfrog.agentguard.killswitch.evaluator;

import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;

/**
 * 触发器作用域到账本查询条件的映射：global 为 owner 下全部 agent，customer / agent 再按目标收窄。
 */
record TriggerScopeFilter(String ownerId, String customerId, String agentExternalId) {

    static TriggerScopeFilter of(KillTrigger trigger) {
        return switch (trigger.getScope()) {
            case GLOBAL -> new TriggerScopeFilter(trigger.getOwnerId(), null, null);
            case CUSTOMER -> new TriggerScopeFilter(trigger.getOwnerId(), trigger.getScopeTargetId(), null);
            case AGENT -> new TriggerScopeFilter(trigger.getOwnerId(), null, trigger.getScopeTargetId());
        };
    }
}
