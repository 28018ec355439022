package ai.gameadvisor.backend.model.entity;

/**
 * Processing status of a single uploaded {@link GameImage}.
 */
public enum ImageProcessingStatus {
    UPLOADED,
    PROCESSING,
    COMPLETED,
    FAILED,
    RETRYING
}
