package ai.gameadvisor.backend.service.exception;

/**
 * The queue backend is unreachable. Workers back off and reconnect instead of failing jobs.
 */
public class QueueConnectionException extends QueueServiceException {

    public QueueConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
