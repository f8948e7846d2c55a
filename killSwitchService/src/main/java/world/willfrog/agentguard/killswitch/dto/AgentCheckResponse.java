package world.willfrog.agentguard.killswitch.dto;

public record AgentCheckResponse(
        String agentId,
        boolean isActive,
        String status,
        boolean globalStopActive,
        String reason
) {
}
