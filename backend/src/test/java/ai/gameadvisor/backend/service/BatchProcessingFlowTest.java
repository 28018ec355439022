package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.config.InMemoryQueueService;
import ai.gameadvisor.backend.model.dto.AiProcessingResult;
import ai.gameadvisor.backend.model.dto.BatchRetryResult;
import ai.gameadvisor.backend.model.dto.BatchStatusResponse;
import ai.gameadvisor.backend.model.dto.CreateBatchResult;
import ai.gameadvisor.backend.model.dto.UploadedFile;
import ai.gameadvisor.backend.model.entity.BatchStatus;
import ai.gameadvisor.backend.model.entity.GameImage;
import ai.gameadvisor.backend.model.entity.GameVector;
import ai.gameadvisor.backend.model.entity.ImageBatch;
import ai.gameadvisor.backend.model.entity.ImageProcessingStatus;
import ai.gameadvisor.backend.repository.GameImageRepository;
import ai.gameadvisor.backend.repository.GameVectorRepository;
import ai.gameadvisor.backend.repository.ImageBatchRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs uploads through the queue and a worker with in-memory repositories,
 * checking the batch counters end to end.
 */
@ExtendWith(MockitoExtension.class)
class BatchProcessingFlowTest {

    private static final int DIMENSIONS = 3;

    @Mock
    private ImageBatchRepository batchRepository;

    @Mock
    private GameImageRepository imageRepository;

    @Mock
    private GameVectorRepository vectorRepository;

    @Mock
    private AiProcessingService aiProcessingService;

    @TempDir
    Path storageRoot;

    private final Map<UUID, ImageBatch> batches = new ConcurrentHashMap<>();
    private final Map<UUID, GameImage> images = new ConcurrentHashMap<>();
    private final List<GameVector> vectors = new ArrayList<>();

    private InMemoryQueueService queueService;
    private CreateImageBatchService createService;
    private BatchRetryService retryService;
    private BatchStatusService statusService;
    private ImageProcessingWorker worker;

    private volatile boolean failBrokenImages = true;

    @BeforeEach
    void setUp() {
        lenient().when(batchRepository.save(any(ImageBatch.class))).thenAnswer(invocation -> {
            ImageBatch batch = invocation.getArgument(0);
            batches.put(batch.getId(), batch);
            return batch;
        });
        lenient().when(batchRepository.findById(any(UUID.class)))
                .thenAnswer(invocation -> Optional.ofNullable(batches.get(invocation.<UUID>getArgument(0))));
        lenient().when(batchRepository.findByIdForUpdate(any(UUID.class)))
                .thenAnswer(invocation -> Optional.ofNullable(batches.get(invocation.<UUID>getArgument(0))));

        lenient().when(imageRepository.save(any(GameImage.class))).thenAnswer(invocation -> {
            GameImage image = invocation.getArgument(0);
            images.put(image.getId(), image);
            return image;
        });
        lenient().when(imageRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(imageRepository.findById(any(UUID.class)))
                .thenAnswer(invocation -> Optional.ofNullable(images.get(invocation.<UUID>getArgument(0))));
        lenient().when(imageRepository.findByIdForUpdate(any(UUID.class)))
                .thenAnswer(invocation -> Optional.ofNullable(images.get(invocation.<UUID>getArgument(0))));
        lenient().when(imageRepository.findByBatchIdAndProcessingStatusForUpdate(any(UUID.class), any(ImageProcessingStatus.class)))
                .thenAnswer(invocation -> images.values().stream()
                        .filter(image -> image.getBatchId().equals(invocation.getArgument(0)))
                        .filter(image -> image.getProcessingStatus() == invocation.getArgument(1))
                        .collect(Collectors.toList()));

        lenient().when(vectorRepository.save(any(GameVector.class))).thenAnswer(invocation -> {
            GameVector vector = invocation.getArgument(0);
            vectors.add(vector);
            return vector;
        });

        lenient().when(aiProcessingService.process(any(byte[].class), anyString())).thenAnswer(invocation -> {
            String filename = invocation.getArgument(1);
            if (failBrokenImages && filename.startsWith("broken")) {
                return AiProcessingResult.failure("unreadable image");
            }
            return AiProcessingResult.builder()
                    .ocrContent("Text of " + filename)
                    .ocrEmbedding(new float[]{0.1f, 0.2f, 0.3f})
                    .build();
        });

        ImageProcessingMetricsService metricsService = new ImageProcessingMetricsService(new SimpleMeterRegistry());
        ObjectStorageService storageService = new LocalObjectStorageService(storageRoot.toString(), "file://");
        ImageProgressService progressService = new ImageProgressService(imageRepository, batchRepository, Duration.ofMinutes(15));
        queueService = new InMemoryQueueService(3);

        createService = new CreateImageBatchService(
                batchRepository, imageRepository, storageService, queueService, metricsService, 3);
        retryService = new BatchRetryService(progressService, queueService, metricsService);
        statusService = new BatchStatusService(batchRepository, imageRepository);
        worker = new ImageProcessingWorker("flow-worker", queueService, storageService, aiProcessingService,
                new VectorStorageService(vectorRepository, DIMENSIONS), progressService, metricsService,
                Duration.ofMillis(10));
    }

    @Test
    void allImagesSucceed_ShouldCompleteBatch() {
        // Given
        CreateBatchResult created = createService.create(UUID.randomUUID(), null,
                List.of(file("setup.png"), file("turn.png"), file("scoring.jpg")));

        // When
        int handled = drainQueue();

        // Then
        assertThat(created.isSuccess()).isTrue();
        assertThat(handled).isEqualTo(3);

        BatchStatusResponse status = statusService.getBatchStatus(created.getBatchId()).orElseThrow();
        assertThat(status.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(status.getProcessedImages()).isEqualTo(3);
        assertThat(status.getFailedImages()).isZero();
        assertThat(status.isCanRetry()).isFalse();
        assertThat(vectors).hasSize(3);
        assertThat(images.values()).allMatch(image -> image.getProcessingStatus() == ImageProcessingStatus.COMPLETED);
    }

    @Test
    void failingImage_ShouldWaitForRetryAndCompleteAfterIt() {
        // Given
        CreateBatchResult created = createService.create(UUID.randomUUID(), null,
                List.of(file("setup.png"), file("broken.png")));

        // When the failing job exhausts its job-level retries
        int handled = drainQueue();

        // Then the failure is counted once and the batch waits for an explicit retry
        assertThat(handled).isEqualTo(5);
        ImageBatch batch = batches.get(created.getBatchId());
        assertThat(batch.getProcessedImages()).isEqualTo(1);
        assertThat(batch.getFailedImages()).isEqualTo(1);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.PROCESSING);
        assertThat(batch.canRetry()).isTrue();

        // When the image becomes readable and the batch is retried
        failBrokenImages = false;
        BatchRetryResult retry = retryService.retryBatch(created.getBatchId());
        drainQueue();

        // Then
        assertThat(retry.isSuccess()).isTrue();
        assertThat(retry.getJobIds()).hasSize(1);
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(batch.getProcessedImages()).isEqualTo(2);
        assertThat(batch.getFailedImages()).isZero();
        assertThat(batch.getRetryCount()).isEqualTo(1);
    }

    @Test
    void duplicateJob_ShouldNotCountImageTwice() {
        // Given
        CreateBatchResult created = createService.create(UUID.randomUUID(), null, List.of(file("setup.png")));
        GameImage image = images.values().iterator().next();
        queueService.enqueue(image.getId(), image.getGameId(), image.getFilePath(),
                image.getOriginalFilename(), created.getBatchId());

        // When
        drainQueue();

        // Then
        ImageBatch batch = batches.get(created.getBatchId());
        assertThat(batch.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(batch.getProcessedImages()).isEqualTo(1);
        verify(aiProcessingService, times(1)).process(any(byte[].class), anyString());
    }

    private int drainQueue() {
        int handled = 0;
        while (worker.processNextJob()) {
            handled++;
        }
        return handled;
    }

    private static UploadedFile file(String name) {
        byte[] content = ("image bytes of " + name).getBytes(StandardCharsets.UTF_8);
        return new UploadedFile(name, content, content.length);
    }
}
