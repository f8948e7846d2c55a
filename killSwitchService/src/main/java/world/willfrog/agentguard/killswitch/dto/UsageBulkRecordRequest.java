package world.willfrog.agentguard.killswitch.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record UsageBulkRecordRequest(
        @NotEmpty @Size(max = 100) List<@Valid UsageRecordRequest> events
) {
}
