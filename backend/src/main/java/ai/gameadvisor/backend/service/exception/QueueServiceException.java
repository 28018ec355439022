package ai.gameadvisor.backend.service.exception;

/**
 * Thrown when Redis-backed job queue operations fail.
 */
public class QueueServiceException extends RuntimeException {

    public QueueServiceException(String message) {
        super(message);
    }

    public QueueServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
