package ai.gameadvisor.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for the image pipeline: jobs by outcome, processing time,
 * batches created and retried, and vector searches by pair.
 */
@Slf4j
@Service
public class ImageProcessingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter imagesProcessed;
    private final Counter imagesFailed;
    private final Counter jobsRetried;
    private final Counter duplicateJobs;
    private final Counter batchesCreated;
    private final Counter batchRetries;
    private final Timer processingTimer;
    private final Map<String, Counter> searchCounters = new ConcurrentHashMap<>();

    @Autowired
    public ImageProcessingMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.imagesProcessed = Counter.builder("gameadvisor.images.processed")
                .description("Images processed successfully")
                .register(meterRegistry);
        this.imagesFailed = Counter.builder("gameadvisor.images.failed")
                .description("Image processing attempts that failed")
                .register(meterRegistry);
        this.jobsRetried = Counter.builder("gameadvisor.jobs.retried")
                .description("Jobs re-queued after a failure")
                .register(meterRegistry);
        this.duplicateJobs = Counter.builder("gameadvisor.jobs.duplicate")
                .description("Jobs skipped because their image was already processed")
                .register(meterRegistry);
        this.batchesCreated = Counter.builder("gameadvisor.batches.created")
                .description("Image batches created")
                .register(meterRegistry);
        this.batchRetries = Counter.builder("gameadvisor.batches.retried")
                .description("Explicit batch retries started")
                .register(meterRegistry);
        this.processingTimer = Timer.builder("gameadvisor.images.processing.time")
                .description("Time spent processing one image")
                .register(meterRegistry);
        log.info("ImageProcessingMetricsService initialized");
    }

    public void recordImageProcessed(Duration duration) {
        imagesProcessed.increment();
        processingTimer.record(duration);
    }

    public void recordImageFailed(Duration duration) {
        imagesFailed.increment();
        processingTimer.record(duration);
    }

    public void recordJobRetried() {
        jobsRetried.increment();
    }

    public void recordDuplicateJob() {
        duplicateJobs.increment();
    }

    public void recordBatchCreated() {
        batchesCreated.increment();
    }

    public void recordBatchRetry() {
        batchRetries.increment();
    }

    public void recordSearch(String pair) {
        searchCounters.computeIfAbsent(pair, p -> Counter.builder("gameadvisor.vector.searches")
                .description("Vector searches by pair")
                .tag("pair", p)
                .register(meterRegistry))
                .increment();
    }
}
