package villagecompute.wpautomation.exceptions;

/**
 * Exception thrown when a requested entity does not exist or belongs to a different owner.
 *
 * <p>
 * Both cases are reported identically so callers cannot discover other users' records.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
