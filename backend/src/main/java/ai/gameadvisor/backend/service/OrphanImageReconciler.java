package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.entity.GameImage;
import ai.gameadvisor.backend.model.entity.ImageProcessingStatus;
import ai.gameadvisor.backend.repository.GameImageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-queues images that are waiting for processing but have no job on the queue,
 * e.g. because the enqueue after upload failed, the job payload expired or the worker
 * holding the image died. Only images idle for longer than {@code app.reconciler.stale-after}
 * are considered.
 */
@Slf4j
@Service
public class OrphanImageReconciler {

    private final GameImageRepository imageRepository;
    private final QueueService queueService;
    private final Duration staleAfter;
    private final boolean enabled;

    public OrphanImageReconciler(GameImageRepository imageRepository,
                                 QueueService queueService,
                                 @Value("${app.reconciler.stale-after:PT15M}") Duration staleAfter,
                                 @Value("${app.reconciler.enabled:true}") boolean enabled) {
        this.imageRepository = imageRepository;
        this.queueService = queueService;
        this.staleAfter = staleAfter;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${app.reconciler.interval-ms:300000}",
            initialDelayString = "${app.reconciler.interval-ms:300000}")
    public void scheduledReconcile() {
        if (!enabled) {
            return;
        }
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Orphan image reconciliation failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of images re-queued
     */
    public int reconcile() {
        Instant cutoff = Instant.now().minus(staleAfter);

        List<GameImage> candidates = new ArrayList<>(
                imageRepository.findByProcessingStatusAndCreatedAtBefore(ImageProcessingStatus.UPLOADED, cutoff));
        candidates.addAll(imageRepository.findByProcessingStatusAndProcessingCompletedAtBefore(
                ImageProcessingStatus.RETRYING, cutoff));
        candidates.addAll(imageRepository.findByProcessingStatusAndProcessingStartedAtBefore(
                ImageProcessingStatus.PROCESSING, cutoff));

        int requeued = 0;
        for (GameImage image : candidates) {
            if (queueService.hasPendingJob(image.getId())) {
                continue;
            }
            try {
                String jobId = queueService.enqueue(image.getId(), image.getGameId(), image.getFilePath(),
                        image.getOriginalFilename(), image.getBatchId());
                requeued++;
                log.info("Re-queued orphaned image {} (batch {}) as job {}", image.getId(), image.getBatchId(), jobId);
            } catch (RuntimeException e) {
                log.warn("Could not re-queue orphaned image {}: {}", image.getId(), e.getMessage());
            }
        }

        if (requeued > 0) {
            log.info("Reconciliation re-queued {} of {} idle images", requeued, candidates.size());
        }
        return requeued;
    }
}
