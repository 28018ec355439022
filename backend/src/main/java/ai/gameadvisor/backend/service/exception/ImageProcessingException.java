package ai.gameadvisor.backend.service.exception;

/**
 * Thrown when processing a single image fail.
 */
public class ImageProcessingException extends RuntimeException {

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
