package villagecompute.wpautomation.exceptions;

/**
 * Exception thrown when a remote collaborator (WordPress, image search, research API) times out, refuses the request,
 * or returns a response that cannot be used.
 *
 * <p>
 * Carries the HTTP status when one was received ({@code 0} for transport failures). No retry is attempted; the error
 * text ends up on the failed job or bulk item.
 */
public class RemoteServiceException extends RuntimeException {

    private final int statusCode;

    public RemoteServiceException(String message) {
        this(message, 0);
    }

    public RemoteServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
