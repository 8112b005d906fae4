package villagecompute.wpautomation.exceptions;

/**
 * Exception thrown when an external collaborator cannot be used because of missing or invalid configuration (site
 * credentials, image provider keys, exhausted token allowance).
 *
 * <p>
 * Configuration errors are surfaced to the caller as-is and never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
