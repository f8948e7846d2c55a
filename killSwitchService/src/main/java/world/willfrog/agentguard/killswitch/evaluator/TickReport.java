package world.willfrog.agentguard.killswitch.evaluator;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Getter
@ToString
@AllArgsConstructor
public class TickReport {

    private final OffsetDateTime startedAt;
    private final boolean skipped;
    /** 成功完成的类别 -> 动作数 */
    private final Map<String, Integer> results;
    private final List<String> failedCategories;

    public static TickReport skipped(OffsetDateTime startedAt) {
        return new TickReport(startedAt, true, Collections.emptyMap(), Collections.emptyList());
    }
}
