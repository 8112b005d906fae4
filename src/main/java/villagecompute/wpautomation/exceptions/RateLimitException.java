package villagecompute.wpautomation.exceptions;

/**
 * Exception thrown when a remote API answers HTTP 429.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class RateLimitException extends RemoteServiceException {

    public RateLimitException(String message) {
        super(message, 429);
    }
}
