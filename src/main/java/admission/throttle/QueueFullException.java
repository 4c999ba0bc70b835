package admission.throttle;

/**
 * Submission refused: every slot is busy and the queue is at capacity. Nothing was created.
 */
public class QueueFullException extends ThrottleException {

    private final String clientId;
    private final int queueSize;

    public QueueFullException(String clientId, int queueSize) {
        super("Request queue is full (" + queueSize + "), rejecting request from " + clientId);
        this.clientId = clientId;
        this.queueSize = queueSize;
    }

    public String clientId() {
        return clientId;
    }

    public int queueSize() {
        return queueSize;
    }
}
