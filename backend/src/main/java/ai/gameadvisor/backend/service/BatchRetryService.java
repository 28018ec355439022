package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.BatchRetryResult;
import ai.gameadvisor.backend.model.entity.GameImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Starts an explicit retry round for the failed images of a batch.
 * Jobs are queued only after the retry round is committed.
 */
@Slf4j
@Service
public class BatchRetryService {

    private final ImageProgressService progressService;
    private final QueueService queueService;
    private final ImageProcessingMetricsService metricsService;

    public BatchRetryService(ImageProgressService progressService,
                             QueueService queueService,
                             ImageProcessingMetricsService metricsService) {
        this.progressService = progressService;
        this.queueService = queueService;
        this.metricsService = metricsService;
    }

    public BatchRetryResult retryBatch(UUID batchId) {
        List<GameImage> images;
        try {
            images = progressService.startBatchRetry(batchId);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Cannot retry batch {}: {}", batchId, e.getMessage());
            return BatchRetryResult.failure(batchId, e.getMessage());
        }

        List<String> jobIds = new ArrayList<>();
        for (GameImage image : images) {
            // its own job-level retry is still on the queue
            if (queueService.hasPendingJob(image.getId())) {
                log.debug("Image {} of batch {} already has a pending job", image.getId(), batchId);
                continue;
            }
            try {
                jobIds.add(queueService.enqueue(image.getId(), image.getGameId(), image.getFilePath(),
                        image.getOriginalFilename(), batchId));
            } catch (RuntimeException e) {
                log.error("Failed to queue retry of image {} in batch {}: {}", image.getId(), batchId, e.getMessage());
            }
        }

        metricsService.recordBatchRetry();
        log.info("Retry of batch {} queued {} of {} failed images", batchId, jobIds.size(), images.size());

        return BatchRetryResult.builder()
                .success(true)
                .batchId(batchId)
                .jobIds(jobIds)
                .build();
    }
}
