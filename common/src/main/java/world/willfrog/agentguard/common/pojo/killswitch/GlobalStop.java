package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class GlobalStop {
    private boolean active;
    private String reason;
    private String actor;
    private OffsetDateTime stoppedAt;

    public static GlobalStop inactive() {
        return new GlobalStop();
    }
}
