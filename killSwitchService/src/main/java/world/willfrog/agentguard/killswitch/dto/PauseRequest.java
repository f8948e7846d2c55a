package world.willfrog.agentguard.killswitch.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record PauseRequest(
        @NotNull @Min(1) @Max(10080) Integer durationMinutes,
        @NotBlank @Size(max = 500) String reason,
        Map<String, Object> metadata
) {
}
