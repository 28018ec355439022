package ai.gameadvisor.backend.service.exception;

/**
 * Thrown when calls to the AI extraction service fail.
 */
public class AiProcessingException extends RuntimeException {

    public AiProcessingException(String message) {
        super(message);
    }

    public AiProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
