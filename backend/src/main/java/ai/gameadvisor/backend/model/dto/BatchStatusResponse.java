package ai.gameadvisor.backend.model.dto;

import ai.gameadvisor.backend.model.entity.BatchStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Read model of a batch for polling callers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchStatusResponse {
    private UUID batchId;
    private UUID gameId;
    private BatchStatus status;
    private int totalImages;
    private int processedImages;
    private int failedImages;
    private int retryCount;
    private int maxRetries;
    private String progressRatio;
    private String failedRatio;
    private double completionPercentage;
    private double failurePercentage;
    private boolean canRetry;
    private String progressMessage;
    private Instant createdAt;
    private Instant processingStartedAt;
    private Instant completedAt;
}
