package ai.gameadvisor.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

/**
 * Snapshot taken when a worker starts processing an image.
 * {@code previouslyCountedAsFailed} is true when the image's last failure is already part
 * of its batch's failed counter; it only holds while the batch is still in
 * retry round {@code batchRetryRound}.
 */
@Data
@AllArgsConstructor
public class ImageAttempt {
    private UUID imageId;
    private UUID batchId;
    private boolean previouslyCountedAsFailed;
    private boolean alreadyCompleted;
    private boolean inFlight;
    private int batchRetryRound;

    public static ImageAttempt started(UUID imageId, UUID batchId, boolean previouslyCountedAsFailed, int batchRetryRound) {
        return new ImageAttempt(imageId, batchId, previouslyCountedAsFailed, false, false, batchRetryRound);
    }

    public static ImageAttempt duplicate(UUID imageId, UUID batchId) {
        return new ImageAttempt(imageId, batchId, false, true, false, 0);
    }

    /**
     * Another delivery of the image's job is being processed right now.
     */
    public static ImageAttempt inFlight(UUID imageId, UUID batchId) {
        return new ImageAttempt(imageId, batchId, false, false, true, 0);
    }

    /**
     * @return true when this delivery must not touch the image or its batch
     */
    public boolean isSkipped() {
        return alreadyCompleted || inFlight;
    }
}
