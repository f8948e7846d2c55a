package world.willfrog.agentguard.killswitch.evaluator;

import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;

import java.util.LinkedHashMap;
import java.util.Map;

final class TriggerMetadata {

    private TriggerMetadata() {
    }

    static Map<String, Object> of(KillTrigger trigger, Object observed) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("triggerId", trigger.getId());
        metadata.put("triggerName", trigger.getTriggerName());
        metadata.put("triggerKind", trigger.getTriggerKind().name());
        metadata.put("threshold", trigger.getThresholdValue());
        metadata.put("windowUnit", trigger.getWindowUnit() == null ? null : trigger.getWindowUnit().name());
        metadata.put("observed", observed);
        return metadata;
    }
}
