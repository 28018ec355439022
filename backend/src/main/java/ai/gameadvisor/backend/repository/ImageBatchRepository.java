package ai.gameadvisor.backend.repository;

import ai.gameadvisor.backend.model.entity.ImageBatch;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Provides CRUD operations for ImageBatch entities.
 */
@Repository
public interface ImageBatchRepository extends JpaRepository<ImageBatch, UUID> {

    /**
     * Loads a batch and holds a row lock ({@code SELECT ... FOR UPDATE}) until the
     * surrounding transaction ends. All counter updates go through this method.
     *
     * @param id the batch ID
     * @return the locked batch, if present
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM ImageBatch b WHERE b.id = :id")
    Optional<ImageBatch> findByIdForUpdate(@Param("id") UUID id);
}
