package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.JobStatus;
import ai.gameadvisor.backend.model.dto.ProcessingJob;

import java.util.Optional;
import java.util.UUID;

/**
 * Durable FIFO queue of image processing jobs shared by all workers.
 */
public interface QueueService {

    /**
     * Stores the job payload and appends its id to the queue.
     *
     * @param imageId the image to process
     * @param gameId the game the image belongs to
     * @param blobPath object store path of the image bytes
     * @param filename original filename
     * @param batchId owning batch, may be null
     * @return the generated job id
     */
    String enqueue(UUID imageId, UUID gameId, String blobPath, String filename, UUID batchId);

    /**
     * Blocks up to the configured timeout for the next job.
     *
     * @return the job, or empty on timeout or when the payload is missing or malformed
     * @throws ai.gameadvisor.backend.service.exception.QueueConnectionException when the queue is unreachable
     */
    Optional<ProcessingJob> dequeue();

    void markProcessing(String jobId);

    void markCompleted(String jobId);

    void markFailed(String jobId, String errorMessage);

    /**
     * Re-queues a job with an incremented retry count.
     *
     * @return false when the payload is gone or retries are exhausted
     */
    boolean retry(String jobId);

    Optional<JobStatus> getStatus(String jobId);

    /**
     * @return true when the latest job of the image is still queued, processing or retrying
     */
    boolean hasPendingJob(UUID imageId);

    long queueLength();
}
