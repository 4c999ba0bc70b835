package admission.throttle;

/**
 * Live states of a submitted request. Completed, expired and cancelled requests are forgotten.
 */
public enum RequestState {
    QUEUED,
    DISPATCHED
}
