package world.willfrog.agentguard.common.pojo.killswitch;

import lombok.Data;

@Data
public class RepeatedRequestGroup {
    private Long agentId;
    private String externalId;
    private String ownerId;
    private String eventName;
    private String model;
    private String requestSignature;
    private long repeatCount;
}
