package world.willfrog.agentguard.killswitch.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import world.willfrog.agentguard.common.pojo.killswitch.UsageEvent;
import world.willfrog.agentguard.killswitch.model.AdmissionDecision;

import java.util.Collections;
import java.util.List;

@Getter
@AllArgsConstructor
public class UsageRecordResult {

    private final List<UsageEvent> events;
    /** 被拒绝时的准入结果，成功时为 null */
    private final AdmissionDecision denial;
    private final Integer deniedIndex;

    public static UsageRecordResult recorded(List<UsageEvent> events) {
        return new UsageRecordResult(events, null, null);
    }

    public static UsageRecordResult denied(AdmissionDecision denial, Integer index) {
        return new UsageRecordResult(Collections.emptyList(), denial, index);
    }

    public boolean isDenied() {
        return denial != null;
    }
}
