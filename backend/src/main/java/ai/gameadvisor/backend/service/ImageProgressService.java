package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.ImageAttempt;
import ai.gameadvisor.backend.model.entity.GameImage;
import ai.gameadvisor.backend.model.entity.ImageBatch;
import ai.gameadvisor.backend.model.entity.ImageProcessingStatus;
import ai.gameadvisor.backend.repository.GameImageRepository;
import ai.gameadvisor.backend.repository.ImageBatchRepository;
import ai.gameadvisor.backend.service.exception.ImageProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies image outcomes to the image row and its batch in one transaction.
 * Every change to a batch's counters goes through here, under a row lock on the image
 * and then on its batch. An image counts towards its batch at most once per outcome,
 * however often its job is delivered.
 */
@Slf4j
@Service
public class ImageProgressService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final GameImageRepository imageRepository;
    private final ImageBatchRepository batchRepository;
    private final Duration inFlightTimeout;

    public ImageProgressService(GameImageRepository imageRepository,
                                ImageBatchRepository batchRepository,
                                @Value("${app.worker.in-flight-timeout:PT15M}") Duration inFlightTimeout) {
        this.imageRepository = imageRepository;
        this.batchRepository = batchRepository;
        this.inFlightTimeout = inFlightTimeout;
    }

    /**
     * Marks the image as being processed.
     *
     * <p>A PROCESSING image whose attempt started less than {@code app.worker.in-flight-timeout}
     * ago belongs to another delivery of the same job; an older one is taken over.
     *
     * @param imageId the image
     * @param retryCount retry count of the job that carries it
     * @return the attempt snapshot; a skipped attempt means the job is a duplicate
     * @throws ImageProcessingException when the image does not exist
     */
    @Transactional
    public ImageAttempt beginAttempt(UUID imageId, int retryCount) {
        GameImage image = lockImage(imageId);

        if (image.getProcessingStatus() == ImageProcessingStatus.COMPLETED) {
            return ImageAttempt.duplicate(imageId, image.getBatchId());
        }
        if (image.getProcessingStatus() == ImageProcessingStatus.PROCESSING) {
            Instant startedAt = image.getProcessingStartedAt();
            if (startedAt != null && startedAt.isAfter(Instant.now().minus(inFlightTimeout))) {
                return ImageAttempt.inFlight(imageId, image.getBatchId());
            }
            log.warn("Image {} has been processing since {}, taking over the abandoned attempt", imageId, startedAt);
        }

        boolean previouslyFailed = image.getProcessingStatus() == ImageProcessingStatus.FAILED;
        int batchRound = 0;
        if (image.getBatchId() != null) {
            batchRound = batchRepository.findById(image.getBatchId())
                    .map(ImageBatch::getRetryCount)
                    .orElse(0);
        }

        image.setProcessingStatus(ImageProcessingStatus.PROCESSING);
        image.setProcessingStartedAt(Instant.now());
        image.setProcessingCompletedAt(null);
        image.setRetryCount(retryCount);
        imageRepository.save(image);

        return ImageAttempt.started(imageId, image.getBatchId(), previouslyFailed, batchRound);
    }

    @Transactional
    public void recordSuccess(ImageAttempt attempt) {
        if (attempt.isSkipped()) {
            return;
        }
        GameImage image = lockImage(attempt.getImageId());
        if (image.getProcessingStatus() == ImageProcessingStatus.COMPLETED) {
            log.warn("Image {} was already completed by another attempt, success not counted again",
                    attempt.getImageId());
            return;
        }
        boolean failureCounted = image.getProcessingStatus() == ImageProcessingStatus.FAILED;

        image.setProcessingStatus(ImageProcessingStatus.COMPLETED);
        image.setProcessingError(null);
        image.setProcessingCompletedAt(Instant.now());
        imageRepository.save(image);

        updateBatch(attempt, true, failureCounted);
    }

    @Transactional
    public void recordFailure(ImageAttempt attempt, String errorMessage) {
        if (attempt.isSkipped()) {
            return;
        }
        GameImage image = lockImage(attempt.getImageId());
        if (image.getProcessingStatus() == ImageProcessingStatus.COMPLETED) {
            log.warn("Image {} was already completed by another attempt, ignoring failure: {}",
                    attempt.getImageId(), errorMessage);
            return;
        }
        boolean failureCounted = image.getProcessingStatus() == ImageProcessingStatus.FAILED;

        image.setProcessingStatus(ImageProcessingStatus.FAILED);
        image.setProcessingError(truncate(errorMessage));
        image.setProcessingCompletedAt(Instant.now());
        imageRepository.save(image);

        updateBatch(attempt, false, failureCounted);
    }

    /**
     * Opens a new retry round: the batch leaves its failed images behind and every
     * FAILED image of the batch becomes RETRYING.
     *
     * @return the images that now wait for a new job
     * @throws IllegalArgumentException when the batch does not exist
     * @throws IllegalStateException when the batch cannot be retried
     */
    @Transactional
    public List<GameImage> startBatchRetry(UUID batchId) {
        ImageBatch batch = batchRepository.findByIdForUpdate(batchId)
                .orElseThrow(() -> new IllegalArgumentException("Batch not found: " + batchId));

        batch.startRetry();
        batchRepository.save(batch);

        List<GameImage> failedImages =
                imageRepository.findByBatchIdAndProcessingStatusForUpdate(batchId, ImageProcessingStatus.FAILED);
        for (GameImage image : failedImages) {
            image.setProcessingStatus(ImageProcessingStatus.RETRYING);
            image.setProcessingError(null);
        }
        imageRepository.saveAll(failedImages);

        log.info("Batch {} entered retry round {}/{} with {} images",
                batchId, batch.getRetryCount(), batch.getMaxRetries(), failedImages.size());
        return failedImages;
    }

    /**
     * @param failureCounted true when another attempt already left the image FAILED in the current round
     */
    private void updateBatch(ImageAttempt attempt, boolean success, boolean failureCounted) {
        if (attempt.getBatchId() == null) {
            return;
        }

        Optional<ImageBatch> locked = batchRepository.findByIdForUpdate(attempt.getBatchId());
        if (locked.isEmpty()) {
            log.warn("Batch {} of image {} no longer exists, skipping progress update",
                    attempt.getBatchId(), attempt.getImageId());
            return;
        }

        ImageBatch batch = locked.get();
        if (batch.isTerminal()) {
            log.warn("Batch {} is already {}, ignoring outcome of image {}",
                    batch.getId(), batch.getStatus().getValue(), attempt.getImageId());
            return;
        }

        // a retry round started since the attempt began has already reset the failed counter
        boolean countedAsFailed = failureCounted
                || (attempt.isPreviouslyCountedAsFailed() && attempt.getBatchRetryRound() == batch.getRetryCount());

        if (success) {
            batch.recordImageProcessed(countedAsFailed);
        } else {
            batch.recordImageFailed(countedAsFailed);
        }
        batchRepository.save(batch);

        log.info("Batch {} progress: {} processed, {} failed, status {}",
                batch.getId(), batch.getProgressRatio(), batch.getFailedRatio(), batch.getStatus().getValue());
    }

    private GameImage lockImage(UUID imageId) {
        return imageRepository.findByIdForUpdate(imageId)
                .orElseThrow(() -> new ImageProcessingException("Image not found: " + imageId));
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
