package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.AiProcessingResult;
import ai.gameadvisor.backend.model.dto.ImageAttempt;
import ai.gameadvisor.backend.model.dto.ProcessingJob;
import ai.gameadvisor.backend.service.exception.ImageProcessingException;
import ai.gameadvisor.backend.service.exception.QueueConnectionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One consumer of the image processing queue.
 *
 * <p>Each job is handled start to finish by a single worker: download the image, run the
 * AI extraction, store the vectors, then record the outcome on the image and its batch.
 * Failures are recorded and the job is re-queued while it has retries left. No exception
 * escapes {@link #run()}.
 */
@Slf4j
public class ImageProcessingWorker implements Runnable {

    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(5);

    private final String workerId;
    private final QueueService queueService;
    private final ObjectStorageService storageService;
    private final AiProcessingService aiProcessingService;
    private final VectorStorageService vectorStorageService;
    private final ImageProgressService progressService;
    private final ImageProcessingMetricsService metricsService;
    private final Duration reconnectDelay;

    // Worker state
    private final AtomicBoolean running = new AtomicBoolean(true);

    // Statistics
    private final AtomicLong totalJobsProcessed = new AtomicLong(0);
    private final AtomicLong totalJobsFailed = new AtomicLong(0);
    private volatile Instant lastSuccessfulJob = null;

    public ImageProcessingWorker(String workerId,
                                 QueueService queueService,
                                 ObjectStorageService storageService,
                                 AiProcessingService aiProcessingService,
                                 VectorStorageService vectorStorageService,
                                 ImageProgressService progressService,
                                 ImageProcessingMetricsService metricsService,
                                 Duration reconnectDelay) {
        this.workerId = workerId;
        this.queueService = queueService;
        this.storageService = storageService;
        this.aiProcessingService = aiProcessingService;
        this.vectorStorageService = vectorStorageService;
        this.progressService = progressService;
        this.metricsService = metricsService;
        this.reconnectDelay = reconnectDelay;
    }

    @Override
    public void run() {
        log.info("Worker {} started", workerId);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                processNextJob();
            } catch (QueueConnectionException e) {
                log.warn("Worker {} lost the queue connection, retrying in {}ms: {}",
                        workerId, reconnectDelay.toMillis(), e.getMessage());
                pause(reconnectDelay);
            } catch (Exception e) {
                log.error("Worker {} - unexpected error in processing loop: {}", workerId, e.getMessage(), e);
                pause(ERROR_BACKOFF);
            }
        }
        log.info("Worker {} stopped after {} processed and {} failed jobs",
                workerId, totalJobsProcessed.get(), totalJobsFailed.get());
    }

    /**
     * Waits for one job and processes it.
     *
     * @return true when a job was handled, false when the dequeue timed out
     */
    public boolean processNextJob() {
        Optional<ProcessingJob> next = queueService.dequeue();
        if (next.isEmpty()) {
            return false;
        }
        processJob(next.get());
        return true;
    }

    /**
     * Lets the current job finish, then leaves the loop.
     */
    public void stop() {
        running.set(false);
    }

    void processJob(ProcessingJob job) {
        String jobId = job.getJobId();
        Instant startTime = Instant.now();
        ImageAttempt attempt = null;

        log.info("Worker {} processing job {} for image {} (batch {}, attempt {})",
                workerId, jobId, job.getImageId(), job.getBatchId(), job.getRetryCount());

        try {
            queueService.markProcessing(jobId);

            attempt = progressService.beginAttempt(job.getImageId(), job.getRetryCount());
            if (attempt.isSkipped()) {
                log.info("Worker {} - image {} is already {}, skipping duplicate job {}",
                        workerId, job.getImageId(), attempt.isInFlight() ? "in flight" : "processed", jobId);
                queueService.markCompleted(jobId);
                metricsService.recordDuplicateJob();
                return;
            }

            byte[] content = storageService.download(job.getBlobPath());

            AiProcessingResult result = aiProcessingService.process(content, job.getFilename());
            if (!result.isSuccess()) {
                throw new ImageProcessingException("AI processing failed: " + result.getErrorMessage());
            }
            log.debug("Worker {} - job {} extracted {}", workerId, jobId, result.getExtractedTypes());

            vectorStorageService.store(job.getGameId(), job.getImageId(), result);

            progressService.recordSuccess(attempt);
            queueService.markCompleted(jobId);

            Duration elapsed = Duration.between(startTime, Instant.now());
            totalJobsProcessed.incrementAndGet();
            lastSuccessfulJob = Instant.now();
            metricsService.recordImageProcessed(elapsed);
            log.info("Worker {} completed job {} for image {} in {}ms",
                    workerId, jobId, job.getImageId(), elapsed.toMillis());

        } catch (QueueConnectionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Worker {} - job {} for image {} failed: {}",
                    workerId, jobId, job.getImageId(), e.getMessage(), e);
            failJob(job, attempt, describe(e), Duration.between(startTime, Instant.now()));
        }
    }

    private void failJob(ProcessingJob job, ImageAttempt attempt, String errorMessage, Duration elapsed) {
        String jobId = job.getJobId();
        totalJobsFailed.incrementAndGet();
        metricsService.recordImageFailed(elapsed);

        if (attempt != null) {
            try {
                progressService.recordFailure(attempt, errorMessage);
            } catch (RuntimeException e) {
                log.error("Worker {} - could not record failure of image {}: {}",
                        workerId, job.getImageId(), e.getMessage(), e);
            }
        }

        queueService.markFailed(jobId, errorMessage);

        if (job.canRetry()) {
            if (queueService.retry(jobId)) {
                metricsService.recordJobRetried();
            }
        } else {
            log.warn("Worker {} - job {} for image {} failed permanently after {} retries",
                    workerId, jobId, job.getImageId(), job.getRetryCount());
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
        }
    }

    public String getWorkerId() {
        return workerId;
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getTotalJobsProcessed() {
        return totalJobsProcessed.get();
    }

    public long getTotalJobsFailed() {
        return totalJobsFailed.get();
    }

    public Instant getLastSuccessfulJob() {
        return lastSuccessfulJob;
    }
}
