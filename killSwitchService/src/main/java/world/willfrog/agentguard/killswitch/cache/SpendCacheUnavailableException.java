package world.willfrog.agentguard.killswitch.cache;

public class SpendCacheUnavailableException extends RuntimeException {

    public SpendCacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
