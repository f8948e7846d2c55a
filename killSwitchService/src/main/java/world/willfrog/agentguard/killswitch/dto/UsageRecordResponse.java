package world.willfrog.agentguard.killswitch.dto;

import java.math.BigDecimal;
import java.util.List;

public record UsageRecordResponse(
        List<Long> eventIds,
        int recorded,
        BigDecimal totalCost
) {
}
