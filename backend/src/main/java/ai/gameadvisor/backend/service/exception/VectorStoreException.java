package ai.gameadvisor.backend.service.exception;

/**
 * Thrown when reads and writes of game vectors fail.
 */
public class VectorStoreException extends RuntimeException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
