package world.willfrog.agentguard.killswitch.dto;

import java.util.List;

public record BulkKillResponse(
        int affectedAgents,
        List<String> agentIds
) {
}
