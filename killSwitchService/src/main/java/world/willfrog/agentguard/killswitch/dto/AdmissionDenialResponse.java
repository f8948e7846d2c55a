package world.willfrog.agentguard.killswitch.dto;

import java.util.Map;

/**
 * 准入拒绝详情。index 为批量写入中被拒绝事件的下标，单条写入时为 null。
 */
public record AdmissionDenialResponse(
        String code,
        String message,
        Map<String, Object> details,
        Integer index
) {
}
