package ai.gameadvisor.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Queue payload describing the processing of one image.
 * Stored as snake_case JSON under {@code job_data:<jobId>}; fields added in later
 * schema versions are ignored by older readers.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProcessingJob {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    @Builder.Default
    private int schemaVersion = CURRENT_SCHEMA_VERSION;

    private String jobId;

    private UUID imageId;

    private UUID gameId;

    /**
     * Object store path of the image bytes
     */
    private String blobPath;

    private String filename;

    /**
     * Owning batch, null for single-image uploads
     */
    private UUID batchId;

    @Builder.Default
    private int retryCount = 0;

    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;

    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    /**
     * A payload without these fields cannot be processed and is dropped.
     */
    public boolean isWellFormed() {
        return jobId != null && imageId != null && gameId != null
                && blobPath != null && !blobPath.isBlank();
    }
}
