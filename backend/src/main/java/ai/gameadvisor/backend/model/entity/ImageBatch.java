package ai.gameadvisor.backend.model.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A group of rulebook images uploaded together and tracked as one unit of progress.
 *
 * <p>Counters only move through {@link #recordImageProcessed(boolean)},
 * {@link #recordImageFailed(boolean)} and {@link #startRetry()}. Every image contributes
 * at most one unit to {@code processedImages + failedImages}, which never exceeds
 * {@code totalImages}. Once the batch reaches a terminal status the counters are frozen.
 */
@Entity
@Table(name = "image_batches")
public class ImageBatch {

    @Id
    private UUID id;

    @Column(name = "game_id", nullable = false)
    private UUID gameId;

    @Column(name = "total_images", nullable = false)
    private int totalImages;

    @Column(name = "processed_images", nullable = false)
    private int processedImages;

    @Column(name = "failed_images", nullable = false)
    private int failedImages;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private BatchStatus status;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "processing_started_at")
    private Instant processingStartedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Creates a new PENDING batch with zeroed counters.
     *
     * @param gameId the game the images belong to
     * @param totalImages number of files submitted, must be positive
     * @param maxRetries number of explicit batch retries allowed
     * @return the new batch, not yet persisted
     */
    public static ImageBatch create(UUID gameId, int totalImages, int maxRetries) {
        if (totalImages <= 0) {
            throw new IllegalArgumentException("A batch needs at least one image");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        ImageBatch batch = new ImageBatch();
        batch.id = UUID.randomUUID();
        batch.gameId = gameId;
        batch.totalImages = totalImages;
        batch.processedImages = 0;
        batch.failedImages = 0;
        batch.status = BatchStatus.PENDING;
        batch.retryCount = 0;
        batch.maxRetries = maxRetries;
        batch.createdAt = Instant.now();
        return batch;
    }

    // Business rules

    public boolean canRetry() {
        return failedImages > 0 && retryCount < maxRetries;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isFullyAccounted() {
        return processedImages + failedImages == totalImages;
    }

    /**
     * Records a successful image outcome.
     *
     * @param previouslyCountedAsFailed true when a job-level retry succeeded for an image
     *                                  whose earlier failure is already in {@code failedImages}
     */
    public void recordImageProcessed(boolean previouslyCountedAsFailed) {
        ensureMutable();
        enterProcessing();
        if (previouslyCountedAsFailed && failedImages > 0) {
            failedImages--;
        } else if (processedImages + failedImages >= totalImages) {
            throw new IllegalStateException("Cannot record more outcomes than images in batch " + id);
        }
        processedImages++;
        evaluateCompletion();
    }

    /**
     * Records a failed image outcome. A repeated failure of an image already counted as
     * failed leaves the counters unchanged.
     */
    public void recordImageFailed(boolean previouslyCountedAsFailed) {
        ensureMutable();
        enterProcessing();
        if (!previouslyCountedAsFailed || failedImages == 0) {
            if (processedImages + failedImages >= totalImages) {
                throw new IllegalStateException("Cannot record more outcomes than images in batch " + id);
            }
            failedImages++;
        }
        evaluateCompletion();
    }

    /**
     * Starts an explicit retry round for the images that failed in the previous round.
     * Images already processed stay counted.
     */
    public void startRetry() {
        if (!canRetry()) {
            throw new IllegalStateException(String.format(Locale.ROOT,
                    "Batch %s cannot be retried (failed=%d, retries=%d/%d)",
                    id, failedImages, retryCount, maxRetries));
        }
        retryCount++;
        failedImages = 0;
        status = BatchStatus.RETRYING;
        completedAt = null;
    }

    /**
     * Removes one file from the batch when its upload or persistence failed at creation time.
     */
    public void excludeImage() {
        if (status != BatchStatus.PENDING) {
            throw new IllegalStateException("Images can only be excluded while the batch is pending");
        }
        if (totalImages > 0) {
            totalImages--;
        }
    }

    private void ensureMutable() {
        if (isTerminal()) {
            throw new IllegalStateException("Batch " + id + " is already " + status.getValue());
        }
    }

    private void enterProcessing() {
        if (status == BatchStatus.PENDING) {
            status = BatchStatus.PROCESSING;
            processingStartedAt = Instant.now();
        } else if (status == BatchStatus.RETRYING) {
            status = BatchStatus.PROCESSING;
        }
    }

    private void evaluateCompletion() {
        if (!isFullyAccounted()) {
            return;
        }
        if (failedImages == 0) {
            status = BatchStatus.COMPLETED;
        } else if (canRetry()) {
            // waits for an explicit retry
            return;
        } else if (processedImages == 0) {
            status = BatchStatus.FAILED;
        } else {
            status = BatchStatus.PARTIALLY_COMPLETED;
        }
        completedAt = Instant.now();
    }

    // Derived progress values

    public String getProgressRatio() {
        return processedImages + "/" + totalImages;
    }

    public String getFailedRatio() {
        return failedImages + "/" + totalImages;
    }

    public double getCompletionPercentage() {
        return totalImages == 0 ? 0.0 : (processedImages * 100.0) / totalImages;
    }

    public double getFailurePercentage() {
        return totalImages == 0 ? 0.0 : (failedImages * 100.0) / totalImages;
    }

    // Getters and setters

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getGameId() { return gameId; }
    public void setGameId(UUID gameId) { this.gameId = gameId; }

    public int getTotalImages() { return totalImages; }
    public void setTotalImages(int totalImages) { this.totalImages = totalImages; }

    public int getProcessedImages() { return processedImages; }
    public void setProcessedImages(int processedImages) { this.processedImages = processedImages; }

    public int getFailedImages() { return failedImages; }
    public void setFailedImages(int failedImages) { this.failedImages = failedImages; }

    public BatchStatus getStatus() { return status; }
    public void setStatus(BatchStatus status) { this.status = status; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getProcessingStartedAt() { return processingStartedAt; }
    public void setProcessingStartedAt(Instant processingStartedAt) { this.processingStartedAt = processingStartedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
