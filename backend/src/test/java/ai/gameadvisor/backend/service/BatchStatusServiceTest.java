package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.BatchStatusResponse;
import ai.gameadvisor.backend.model.dto.ImageStatusResponse;
import ai.gameadvisor.backend.model.entity.BatchStatus;
import ai.gameadvisor.backend.model.entity.GameImage;
import ai.gameadvisor.backend.model.entity.ImageBatch;
import ai.gameadvisor.backend.model.entity.ImageProcessingStatus;
import ai.gameadvisor.backend.repository.GameImageRepository;
import ai.gameadvisor.backend.repository.ImageBatchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchStatusServiceTest {

    @Mock
    private ImageBatchRepository batchRepository;

    @Mock
    private GameImageRepository imageRepository;

    private BatchStatusService service;

    @BeforeEach
    void setUp() {
        service = new BatchStatusService(batchRepository, imageRepository);
    }

    @Test
    void getBatchStatus_UnknownBatch_ShouldBeEmpty() {
        UUID batchId = UUID.randomUUID();
        when(batchRepository.findById(batchId)).thenReturn(Optional.empty());

        assertThat(service.getBatchStatus(batchId)).isEmpty();
    }

    @Test
    void getBatchStatus_ProcessingBatch_ShouldExposeCountersAndMessage() {
        // Given
        ImageBatch batch = ImageBatch.create(UUID.randomUUID(), 4, 3);
        batch.recordImageProcessed(false);
        batch.recordImageProcessed(false);
        when(batchRepository.findById(batch.getId())).thenReturn(Optional.of(batch));

        // When
        BatchStatusResponse response = service.getBatchStatus(batch.getId()).orElseThrow();

        // Then
        assertThat(response.getStatus()).isEqualTo(BatchStatus.PROCESSING);
        assertThat(response.getProgressRatio()).isEqualTo("2/4");
        assertThat(response.getCompletionPercentage()).isEqualTo(50.0);
        assertThat(response.isCanRetry()).isFalse();
        assertThat(response.getProgressMessage()).isEqualTo("Processing - 2/4 images processed");
    }

    @Test
    void progressMessage_ShouldDescribeEveryState() {
        UUID gameId = UUID.randomUUID();

        ImageBatch pending = ImageBatch.create(gameId, 3, 3);
        assertThat(BatchStatusService.progressMessage(pending)).isEqualTo("Pending - 3 images to process");

        ImageBatch retrying = ImageBatch.create(gameId, 3, 3);
        retrying.recordImageProcessed(false);
        retrying.recordImageFailed(false);
        retrying.recordImageFailed(false);
        retrying.startRetry();
        assertThat(BatchStatusService.progressMessage(retrying))
                .isEqualTo("Retrying - 1/3 images processed, 0/3 failed (attempt 1/3)");

        ImageBatch completed = ImageBatch.create(gameId, 2, 3);
        completed.recordImageProcessed(false);
        completed.recordImageProcessed(false);
        assertThat(BatchStatusService.progressMessage(completed))
                .isEqualTo("Completed - 2/2 images processed successfully");

        ImageBatch partial = ImageBatch.create(gameId, 3, 0);
        partial.recordImageProcessed(false);
        partial.recordImageProcessed(false);
        partial.recordImageFailed(false);
        assertThat(BatchStatusService.progressMessage(partial))
                .isEqualTo("Partially completed - 2/3 images processed, 1/3 permanently failed");

        ImageBatch failed = ImageBatch.create(gameId, 2, 0);
        failed.recordImageFailed(false);
        failed.recordImageFailed(false);
        assertThat(BatchStatusService.progressMessage(failed))
                .isEqualTo("Failed - 2/2 images failed after 0 attempts");
    }

    @Test
    void getImageStatus_CompletedImage_ShouldReportProcessingTime() {
        // Given
        GameImage image = new GameImage();
        image.setId(UUID.randomUUID());
        image.setGameId(UUID.randomUUID());
        image.setOriginalFilename("rules-p1.png");
        image.setProcessingStatus(ImageProcessingStatus.COMPLETED);
        Instant started = Instant.parse("2024-05-01T10:00:00Z");
        image.setProcessingStartedAt(started);
        image.setProcessingCompletedAt(started.plusMillis(1500));
        when(imageRepository.findById(image.getId())).thenReturn(Optional.of(image));

        // When
        ImageStatusResponse response = service.getImageStatus(image.getId()).orElseThrow();

        // Then
        assertThat(response.getStatus()).isEqualTo(ImageProcessingStatus.COMPLETED);
        assertThat(response.getOriginalFilename()).isEqualTo("rules-p1.png");
        assertThat(response.getProcessingTimeMs()).isEqualTo(1500L);
    }
}
