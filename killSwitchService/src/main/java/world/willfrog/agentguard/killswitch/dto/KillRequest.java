package world.willfrog.agentguard.killswitch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record KillRequest(
        @NotBlank @Size(max = 500) String reason,
        Map<String, Object> metadata
) {
}
