package ai.gameadvisor.backend.repository;

import ai.gameadvisor.backend.model.entity.GameImage;
import ai.gameadvisor.backend.model.entity.ImageProcessingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Provides CRUD operations for GameImage entities.
 */
@Repository
public interface GameImageRepository extends JpaRepository<GameImage, UUID> {

    List<GameImage> findByBatchId(UUID batchId);

    /**
     * Loads an image and holds a row lock until the surrounding transaction ends.
     * Every processing state change of an image goes through this method.
     *
     * @param id the image ID
     * @return the locked image, if present
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM GameImage i WHERE i.id = :id")
    Optional<GameImage> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Returns the images of a batch in the given state, e.g. the failed ones before a retry.
     *
     * @param batchId the batch ID
     * @param status the processing status
     * @return matching images
     */
    List<GameImage> findByBatchIdAndProcessingStatus(UUID batchId, ImageProcessingStatus status);

    /**
     * Same as {@link #findByBatchIdAndProcessingStatus} but locks the returned rows.
     * Rows that changed state while waiting for the lock are re-checked and dropped.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM GameImage i WHERE i.batchId = :batchId AND i.processingStatus = :status")
    List<GameImage> findByBatchIdAndProcessingStatusForUpdate(@Param("batchId") UUID batchId,
                                                              @Param("status") ImageProcessingStatus status);

    /**
     * Returns images that have stayed in a state since before the given instant.
     * Used to find uploads whose job never made it onto the queue.
     *
     * @param status the processing status
     * @param createdBefore upper bound for the creation time
     * @return matching images
     */
    List<GameImage> findByProcessingStatusAndCreatedAtBefore(ImageProcessingStatus status, Instant createdBefore);

    /**
     * Returns images in a state whose last processing attempt ended before the given instant.
     *
     * @param status the processing status
     * @param completedBefore upper bound for the end of the last attempt
     * @return matching images
     */
    List<GameImage> findByProcessingStatusAndProcessingCompletedAtBefore(ImageProcessingStatus status,
                                                                         Instant completedBefore);

    /**
     * Returns images in a state whose current processing attempt started before the given instant.
     *
     * @param status the processing status
     * @param startedBefore upper bound for the start of the attempt
     * @return matching images
     */
    List<GameImage> findByProcessingStatusAndProcessingStartedAtBefore(ImageProcessingStatus status,
                                                                       Instant startedBefore);
}
