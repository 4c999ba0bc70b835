package admission.core.model;

/**
 * Outcome of a rate limit check.
 * REJECT is the algorithm saying no; BLOCKED is an administrative block in effect.
 */
public enum Decision {
    ALLOW,
    REJECT,
    BLOCKED
}
