package world.willfrog.agentguard.killswitch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record EmergencyStopRequest(
        @NotBlank @Size(max = 1000) String reason,
        Boolean confirm
) {
}
