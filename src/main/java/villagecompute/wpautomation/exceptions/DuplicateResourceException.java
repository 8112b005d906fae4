package villagecompute.wpautomation.exceptions;

/**
 * Exception thrown when creating something that already exists, such as a second job for the same feed item.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
