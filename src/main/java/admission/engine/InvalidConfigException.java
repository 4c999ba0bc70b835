package admission.engine;

/**
 * Raised when limiter or throttler configuration is rejected at construction time.
 * This is the only failure that stops the admission core from starting.
 */
public class InvalidConfigException extends IllegalArgumentException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
