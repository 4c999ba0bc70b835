package admission.throttle;

/**
 * Base of the throttler's typed failures.
 */
public abstract class ThrottleException extends RuntimeException {

    protected ThrottleException(String message) {
        super(message);
    }
}
