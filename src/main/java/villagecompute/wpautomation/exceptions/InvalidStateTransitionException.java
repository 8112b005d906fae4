package villagecompute.wpautomation.exceptions;

/**
 * Exception thrown when a status change is not allowed by the job or bulk operation lifecycle.
 */
public class InvalidStateTransitionException extends RuntimeException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
