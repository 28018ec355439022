package ai.gameadvisor.backend.model.dto;

import ai.gameadvisor.backend.model.entity.ImageProcessingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageStatusResponse {
    private UUID imageId;
    private UUID gameId;
    private UUID batchId;
    private String originalFilename;
    private ImageProcessingStatus status;
    private String processingError;
    private int retryCount;
    private Instant createdAt;
    private Instant processingStartedAt;
    private Instant processingCompletedAt;
    private Long processingTimeMs;
}
