package ai.gameadvisor.backend.health;

import ai.gameadvisor.backend.service.ImageProcessingWorker;
import ai.gameadvisor.backend.service.ImageWorkerPoolService;
import ai.gameadvisor.backend.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reports queue reachability, backlog and whether workers are consuming it.
 */
@Component
public class QueueHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(QueueHealthIndicator.class);

    private final QueueService queueService;
    private final ImageWorkerPoolService workerPoolService;
    private final long backlogWarningThreshold;

    public QueueHealthIndicator(QueueService queueService,
                                ImageWorkerPoolService workerPoolService,
                                @Value("${app.health.queue.backlog-warning:500}") long backlogWarningThreshold) {
        this.queueService = queueService;
        this.workerPoolService = workerPoolService;
        this.backlogWarningThreshold = backlogWarningThreshold;
    }

    @Override
    public Health health() {
        try {
            long queueLength = queueService.queueLength();
            List<ImageProcessingWorker> workers = workerPoolService.getWorkers();
            Health.Builder builder = queueLength > backlogWarningThreshold
                    ? Health.status("WARNING")
                    : Health.up();
            return builder
                    .withDetail("queue_length", queueLength)
                    .withDetail("workers", workers.size())
                    .withDetail("workers_running", workerPoolService.isPoolRunning())
                    .withDetail("jobs_processed", workers.stream().mapToLong(ImageProcessingWorker::getTotalJobsProcessed).sum())
                    .withDetail("jobs_failed", workers.stream().mapToLong(ImageProcessingWorker::getTotalJobsFailed).sum())
                    .withDetail("last_successful_job", workers.stream()
                            .map(ImageProcessingWorker::getLastSuccessfulJob)
                            .filter(Objects::nonNull)
                            .max(Comparator.naturalOrder())
                            .map(Instant::toString)
                            .orElse("never"))
                    .build();
        } catch (Exception e) {
            logger.warn("Queue health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("workers_running", workerPoolService.isPoolRunning())
                    .build();
        }
    }
}
