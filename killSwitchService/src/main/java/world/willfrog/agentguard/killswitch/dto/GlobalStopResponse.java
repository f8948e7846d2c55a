package world.willfrog.agentguard.killswitch.dto;

import world.willfrog.agentguard.common.pojo.killswitch.GlobalStop;

import java.time.OffsetDateTime;

public record GlobalStopResponse(
        boolean active,
        String reason,
        String actor,
        OffsetDateTime stoppedAt
) {
    public static GlobalStopResponse of(GlobalStop stop) {
        return new GlobalStopResponse(stop.isActive(), stop.getReason(), stop.getActor(), stop.getStoppedAt());
    }
}
