package ai.gameadvisor.backend.service.exception;

/**
 * Thrown when object storage uploads, downloads and deletes fail.
 */
public class ObjectStorageException extends RuntimeException {

    public ObjectStorageException(String message) {
        super(message);
    }

    public ObjectStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
