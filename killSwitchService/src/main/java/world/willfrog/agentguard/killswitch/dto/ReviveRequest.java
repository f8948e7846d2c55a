package world.willfrog.agentguard.killswitch.dto;

import jakarta.validation.constraints.Size;

public record ReviveRequest(
        @Size(max = 500) String reason
) {
}
