package ai.gameadvisor.backend.repository;

import ai.gameadvisor.backend.model.entity.GameVector;
import ai.gameadvisor.backend.model.entity.VectorPair;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage of extracted image content and its embeddings.
 */
public interface GameVectorRepository {

    /**
     * Stores the vector row of an image. An image has at most one row: saving again for
     * the same image replaces its contents and embeddings and keeps the existing id.
     * Assigns id and creation time when missing.
     *
     * @return the stored row
     */
    GameVector save(GameVector vector);

    Optional<GameVector> findByImageId(UUID imageId);

    /**
     * @return number of rows removed
     */
    int deleteByImageId(UUID imageId);

    /**
     * Ranks the rows of a game by cosine similarity on one pair's embedding.
     * Rows without an embedding for that pair are never returned.
     *
     * @param gameId the game to search in
     * @param queryEmbedding the query vector, already validated for dimension
     * @param pair the pair whose embedding is compared
     * @param limit maximum number of results
     * @param threshold minimum similarity in [0,1]
     * @return matches ordered by descending similarity, each carrying all three contents
     */
    List<GameVector> search(UUID gameId, float[] queryEmbedding, VectorPair pair, int limit, double threshold);

    /**
     * @return the dimension declared on the embedding columns, empty when the table is missing
     *         or the column is unconstrained
     */
    Optional<Integer> findEmbeddingDimensions();
}
