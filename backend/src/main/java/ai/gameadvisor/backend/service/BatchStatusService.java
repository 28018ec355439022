package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.BatchStatusResponse;
import ai.gameadvisor.backend.model.dto.ImageStatusResponse;
import ai.gameadvisor.backend.model.entity.GameImage;
import ai.gameadvisor.backend.model.entity.ImageBatch;
import ai.gameadvisor.backend.repository.GameImageRepository;
import ai.gameadvisor.backend.repository.ImageBatchRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only progress views for polling callers.
 */
@Service
public class BatchStatusService {

    private final ImageBatchRepository batchRepository;
    private final GameImageRepository imageRepository;

    public BatchStatusService(ImageBatchRepository batchRepository, GameImageRepository imageRepository) {
        this.batchRepository = batchRepository;
        this.imageRepository = imageRepository;
    }

    @Transactional(readOnly = true)
    public Optional<BatchStatusResponse> getBatchStatus(UUID batchId) {
        return batchRepository.findById(batchId).map(BatchStatusService::toResponse);
    }

    @Transactional(readOnly = true)
    public Optional<ImageStatusResponse> getImageStatus(UUID imageId) {
        return imageRepository.findById(imageId).map(BatchStatusService::toResponse);
    }

    static String progressMessage(ImageBatch batch) {
        switch (batch.getStatus()) {
            case PENDING:
                return "Pending - " + batch.getTotalImages() + " images to process";
            case PROCESSING:
                return "Processing - " + batch.getProgressRatio() + " images processed";
            case RETRYING:
                return "Retrying - " + batch.getProgressRatio() + " images processed, "
                        + batch.getFailedRatio() + " failed (attempt "
                        + batch.getRetryCount() + "/" + batch.getMaxRetries() + ")";
            case COMPLETED:
                return "Completed - " + batch.getProgressRatio() + " images processed successfully";
            case PARTIALLY_COMPLETED:
                return "Partially completed - " + batch.getProgressRatio() + " images processed, "
                        + batch.getFailedRatio() + " permanently failed";
            case FAILED:
                return "Failed - " + batch.getFailedRatio() + " images failed after "
                        + batch.getRetryCount() + " attempts";
            default:
                return batch.getStatus().getValue();
        }
    }

    private static BatchStatusResponse toResponse(ImageBatch batch) {
        return BatchStatusResponse.builder()
                .batchId(batch.getId())
                .gameId(batch.getGameId())
                .status(batch.getStatus())
                .totalImages(batch.getTotalImages())
                .processedImages(batch.getProcessedImages())
                .failedImages(batch.getFailedImages())
                .retryCount(batch.getRetryCount())
                .maxRetries(batch.getMaxRetries())
                .progressRatio(batch.getProgressRatio())
                .failedRatio(batch.getFailedRatio())
                .completionPercentage(batch.getCompletionPercentage())
                .failurePercentage(batch.getFailurePercentage())
                .canRetry(batch.canRetry())
                .progressMessage(progressMessage(batch))
                .createdAt(batch.getCreatedAt())
                .processingStartedAt(batch.getProcessingStartedAt())
                .completedAt(batch.getCompletedAt())
                .build();
    }

    private static ImageStatusResponse toResponse(GameImage image) {
        Long processingTimeMs = null;
        if (image.getProcessingStartedAt() != null && image.getProcessingCompletedAt() != null) {
            processingTimeMs = Duration.between(image.getProcessingStartedAt(), image.getProcessingCompletedAt()).toMillis();
        }
        return ImageStatusResponse.builder()
                .imageId(image.getId())
                .gameId(image.getGameId())
                .batchId(image.getBatchId())
                .originalFilename(image.getOriginalFilename())
                .status(image.getProcessingStatus())
                .processingError(image.getProcessingError())
                .retryCount(image.getRetryCount())
                .createdAt(image.getCreatedAt())
                .processingStartedAt(image.getProcessingStartedAt())
                .processingCompletedAt(image.getProcessingCompletedAt())
                .processingTimeMs(processingTimeMs)
                .build();
    }
}
