package villagecompute.wpautomation.exceptions;

/**
 * Exception thrown when caller-supplied input is rejected (blank topic, invalid cron expression, mismatched bulk
 * payload).
 *
 * <p>
 * Extends RuntimeException per project standards. Raised synchronously to the caller before anything is persisted.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
