package world.willfrog.agentguard.killswitch.dto;

import java.util.List;

public record KillSwitchStatusResponse(
        GlobalStopResponse globalStop,
        List<AgentStateResponse> agents,
        List<KillSwitchEventResponse> recentEvents
) {
}
