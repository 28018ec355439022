package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.entity.GameVector;
import ai.gameadvisor.backend.model.entity.VectorPair;
import ai.gameadvisor.backend.repository.GameVectorRepository;
import ai.gameadvisor.backend.service.exception.EmbeddingDimensionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Similarity search over the stored pairs of a game.
 * Inputs are validated before any query reaches the database.
 */
@Slf4j
@Service
public class VectorSearchService {

    public static final int DEFAULT_LIMIT = 5;
    public static final double DEFAULT_THRESHOLD = 0.7;

    private final GameVectorRepository vectorRepository;
    private final AiProcessingService aiProcessingService;
    private final ImageProcessingMetricsService metricsService;
    private final int dimensions;
    private final String defaultPair;

    public VectorSearchService(GameVectorRepository vectorRepository,
                               AiProcessingService aiProcessingService,
                               ImageProcessingMetricsService metricsService,
                               @Value("${app.vector.dimensions:1536}") int dimensions,
                               @Value("${app.vector.search.default-pair:ocr}") String defaultPair) {
        this.vectorRepository = vectorRepository;
        this.aiProcessingService = aiProcessingService;
        this.metricsService = metricsService;
        this.dimensions = dimensions;
        this.defaultPair = defaultPair;
    }

    /**
     * Ranks the game's rows by cosine similarity on the selected pair.
     *
     * @param gameId the game to search in
     * @param queryEmbedding query vector, must match the configured dimension
     * @param pair pair selector ({@code ocr}, {@code description} or {@code labels})
     * @param limit maximum number of results, must be positive
     * @param threshold minimum similarity in [0,1]
     * @return matches with similarity scores, best first
     */
    public List<GameVector> search(UUID gameId, float[] queryEmbedding, String pair, int limit, double threshold) {
        return search(gameId, queryEmbedding, VectorPair.fromValue(pair), limit, threshold);
    }

    public List<GameVector> search(UUID gameId, float[] queryEmbedding, VectorPair pair, int limit, double threshold) {
        if (gameId == null) {
            throw new IllegalArgumentException("gameId is required");
        }
        if (queryEmbedding == null) {
            throw new IllegalArgumentException("Query embedding is required");
        }
        if (queryEmbedding.length != dimensions) {
            throw new EmbeddingDimensionException(dimensions, queryEmbedding.length);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0 and 1");
        }

        metricsService.recordSearch(pair.getValue());
        List<GameVector> results = vectorRepository.search(gameId, queryEmbedding, pair, limit, threshold);
        log.debug("Search on {} for game {} matched {} rows (limit={}, threshold={})",
                pair.getValue(), gameId, results.size(), limit, threshold);
        return results;
    }

    /**
     * Embeds the query text and searches the default pair with default limit and threshold.
     */
    public List<GameVector> searchByText(UUID gameId, String queryText) {
        return searchByText(gameId, queryText, defaultPair, DEFAULT_LIMIT, DEFAULT_THRESHOLD);
    }

    public List<GameVector> searchByText(UUID gameId, String queryText, String pair, int limit, double threshold) {
        VectorPair selected = VectorPair.fromValue(pair);
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("Query text is required");
        }
        float[] embedding = aiProcessingService.embed(queryText);
        return search(gameId, embedding, selected, limit, threshold);
    }
}
