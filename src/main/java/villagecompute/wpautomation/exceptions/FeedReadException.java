package villagecompute.wpautomation.exceptions;

/**
 * Exception thrown when a syndication feed cannot be fetched or parsed.
 */
public class FeedReadException extends RuntimeException {

    public FeedReadException(String message) {
        super(message);
    }

    public FeedReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
