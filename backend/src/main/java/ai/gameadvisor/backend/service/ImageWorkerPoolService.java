package ai.gameadvisor.backend.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the image workers: starts them with the application context and stops them
 * cooperatively on shutdown.
 */
@Slf4j
@Service
public class ImageWorkerPoolService {

    private final QueueService queueService;
    private final ObjectStorageService storageService;
    private final AiProcessingService aiProcessingService;
    private final VectorStorageService vectorStorageService;
    private final ImageProgressService progressService;
    private final ImageProcessingMetricsService metricsService;

    @Value("${app.worker.pool.enabled:true}")
    private boolean poolEnabled;

    @Value("${app.worker.pool.size:2}")
    private int poolSize;

    @Value("${app.worker.reconnect-delay:PT5S}")
    private Duration reconnectDelay;

    @Value("${app.worker.pool.shutdown.timeout:30}")
    private int shutdownTimeoutSeconds;

    private ExecutorService executorService;
    private final List<ImageProcessingWorker> workers = new ArrayList<>();
    private final AtomicInteger workerIdCounter = new AtomicInteger(1);
    private volatile boolean poolRunning = false;

    @Autowired
    public ImageWorkerPoolService(QueueService queueService,
                                  ObjectStorageService storageService,
                                  AiProcessingService aiProcessingService,
                                  VectorStorageService vectorStorageService,
                                  ImageProgressService progressService,
                                  ImageProcessingMetricsService metricsService) {
        this.queueService = queueService;
        this.storageService = storageService;
        this.aiProcessingService = aiProcessingService;
        this.vectorStorageService = vectorStorageService;
        this.progressService = progressService;
        this.metricsService = metricsService;
    }

    @PostConstruct
    public void startWorkerPool() {
        if (!poolEnabled) {
            log.info("Image worker pool disabled via configuration");
            return;
        }
        if (poolSize <= 0) {
            throw new IllegalStateException("app.worker.pool.size must be positive, was " + poolSize);
        }

        log.info("Starting image worker pool with {} workers", poolSize);
        executorService = Executors.newFixedThreadPool(poolSize);
        for (int i = 0; i < poolSize; i++) {
            ImageProcessingWorker worker = createWorker();
            workers.add(worker);
            executorService.submit(worker);
        }
        poolRunning = true;
        log.info("Image worker pool started");
    }

    @PreDestroy
    public void shutdownWorkerPool() {
        if (executorService == null) {
            return;
        }
        log.info("Shutting down image worker pool...");
        poolRunning = false;
        workers.forEach(ImageProcessingWorker::stop);

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Image worker pool shutdown timeout, forcing shutdown");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Image worker pool shutdown complete");
    }

    ImageProcessingWorker createWorker() {
        return new ImageProcessingWorker(
                "image-worker-" + workerIdCounter.getAndIncrement(),
                queueService,
                storageService,
                aiProcessingService,
                vectorStorageService,
                progressService,
                metricsService,
                reconnectDelay);
    }

    public boolean isPoolRunning() {
        return poolRunning;
    }

    public List<ImageProcessingWorker> getWorkers() {
        return Collections.unmodifiableList(workers);
    }
}
