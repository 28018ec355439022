package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.ProcessingJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImageWorkerPoolServiceTest {

    @Mock
    private QueueService queueService;

    @Mock
    private ObjectStorageService storageService;

    @Mock
    private AiProcessingService aiProcessingService;

    @Mock
    private VectorStorageService vectorStorageService;

    @Mock
    private ImageProgressService progressService;

    @Mock
    private ImageProcessingMetricsService metricsService;

    private ImageWorkerPoolService poolService;

    @BeforeEach
    void setUp() {
        poolService = new ImageWorkerPoolService(queueService, storageService, aiProcessingService,
                vectorStorageService, progressService, metricsService);
        ReflectionTestUtils.setField(poolService, "poolEnabled", true);
        ReflectionTestUtils.setField(poolService, "poolSize", 2);
        ReflectionTestUtils.setField(poolService, "reconnectDelay", Duration.ofMillis(10));
        ReflectionTestUtils.setField(poolService, "shutdownTimeoutSeconds", 5);

        // stands in for the blocking pop timing out
        lenient().when(queueService.dequeue()).thenAnswer(invocation -> {
            Thread.sleep(10);
            return Optional.<ProcessingJob>empty();
        });
    }

    @AfterEach
    void tearDown() {
        poolService.shutdownWorkerPool();
    }

    @Test
    void startWorkerPool_Enabled_ShouldStartConfiguredWorkers() {
        // When
        poolService.startWorkerPool();

        // Then
        assertThat(poolService.isPoolRunning()).isTrue();
        assertThat(poolService.getWorkers()).hasSize(2);
        assertThat(poolService.getWorkers())
                .extracting(ImageProcessingWorker::getWorkerId)
                .containsExactly("image-worker-1", "image-worker-2");
    }

    @Test
    void startWorkerPool_Disabled_ShouldNotStartWorkers() {
        ReflectionTestUtils.setField(poolService, "poolEnabled", false);

        poolService.startWorkerPool();

        assertThat(poolService.isPoolRunning()).isFalse();
        assertThat(poolService.getWorkers()).isEmpty();
        verifyNoInteractions(queueService);
    }

    @Test
    void shutdownWorkerPool_ShouldStopAllWorkers() {
        // Given
        poolService.startWorkerPool();

        // When
        poolService.shutdownWorkerPool();

        // Then
        assertThat(poolService.isPoolRunning()).isFalse();
        assertThat(poolService.getWorkers()).noneMatch(ImageProcessingWorker::isRunning);
    }

    @Test
    void startWorkerPool_InvalidSize_ShouldFail() {
        ReflectionTestUtils.setField(poolService, "poolSize", 0);

        assertThatThrownBy(() -> poolService.startWorkerPool())
                .isInstanceOf(IllegalStateException.class);
    }
}
