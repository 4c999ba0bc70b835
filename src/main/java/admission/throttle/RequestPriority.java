package admission.throttle;

/**
 * Priority of a throttled request, lowest first. Declaration order is the dispatch order reversed.
 */
public enum RequestPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
