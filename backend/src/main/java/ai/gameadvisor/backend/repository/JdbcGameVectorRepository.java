package ai.gameadvisor.backend.repository;

import ai.gameadvisor.backend.model.entity.GameVector;
import ai.gameadvisor.backend.model.entity.VectorPair;
import ai.gameadvisor.backend.service.exception.VectorStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * pgvector-backed implementation of {@link GameVectorRepository}.
 * Embeddings travel as text literals cast to {@code vector}; the column names for a
 * pair come from {@link VectorPair}, never from caller input.
 */
@Slf4j
@Repository
public class JdbcGameVectorRepository implements GameVectorRepository {

    private static final String INSERT_SQL =
            "INSERT INTO game_vectors (id, game_id, image_id, page_number, created_at, " +
            "ocr_content, ocr_embedding, description_content, description_embedding, " +
            "labels_content, labels_embedding) VALUES (:id, :gameId, :imageId, :pageNumber, :createdAt, " +
            ":ocrContent, CAST(:ocrEmbedding AS vector), :descriptionContent, CAST(:descriptionEmbedding AS vector), " +
            ":labelsContent, CAST(:labelsEmbedding AS vector)) " +
            "ON CONFLICT (image_id) DO UPDATE SET game_id = EXCLUDED.game_id, page_number = EXCLUDED.page_number, " +
            "ocr_content = EXCLUDED.ocr_content, ocr_embedding = EXCLUDED.ocr_embedding, " +
            "description_content = EXCLUDED.description_content, description_embedding = EXCLUDED.description_embedding, " +
            "labels_content = EXCLUDED.labels_content, labels_embedding = EXCLUDED.labels_embedding " +
            "RETURNING id";

    private static final String SELECT_COLUMNS =
            "id, game_id, image_id, page_number, created_at, ocr_content, description_content, labels_content";

    private static final String FIND_BY_IMAGE_SQL =
            "SELECT " + SELECT_COLUMNS + ", CAST(ocr_embedding AS text) AS ocr_embedding, " +
            "CAST(description_embedding AS text) AS description_embedding, " +
            "CAST(labels_embedding AS text) AS labels_embedding " +
            "FROM game_vectors WHERE image_id = :imageId LIMIT 1";

    private static final String DELETE_BY_IMAGE_SQL = "DELETE FROM game_vectors WHERE image_id = :imageId";

    // pgvector stores the declared dimension as the column's type modifier
    private static final String EMBEDDING_DIMENSIONS_SQL =
            "SELECT atttypmod FROM pg_attribute " +
            "WHERE attrelid = CAST('game_vectors' AS regclass) AND attname = 'ocr_embedding' AND NOT attisdropped";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcGameVectorRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public GameVector save(GameVector vector) {
        if (vector.getId() == null) {
            vector.setId(UUID.randomUUID());
        }
        if (vector.getCreatedAt() == null) {
            vector.setCreatedAt(Instant.now());
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", vector.getId())
                .addValue("gameId", vector.getGameId())
                .addValue("imageId", vector.getImageId())
                .addValue("pageNumber", vector.getPageNumber())
                .addValue("createdAt", Timestamp.from(vector.getCreatedAt()))
                .addValue("ocrContent", vector.getOcrContent())
                .addValue("ocrEmbedding", PgVectors.toLiteral(vector.getOcrEmbedding()))
                .addValue("descriptionContent", vector.getDescriptionContent())
                .addValue("descriptionEmbedding", PgVectors.toLiteral(vector.getDescriptionEmbedding()))
                .addValue("labelsContent", vector.getLabelsContent())
                .addValue("labelsEmbedding", PgVectors.toLiteral(vector.getLabelsEmbedding()));

        try {
            // A redelivered job overwrites the row of its image and keeps the existing id
            UUID storedId = jdbcTemplate.queryForObject(INSERT_SQL, params, UUID.class);
            if (storedId != null && !storedId.equals(vector.getId())) {
                log.info("Replaced existing vector row {} for image {}", storedId, vector.getImageId());
                vector.setId(storedId);
            }
            log.debug("Stored vector row {} for image {}", vector.getId(), vector.getImageId());
            return vector;
        } catch (DataAccessException e) {
            log.error("Failed to store vectors for image {}: {}", vector.getImageId(), e.getMessage(), e);
            throw new VectorStoreException("Failed to store vectors for image " + vector.getImageId(), e);
        }
    }

    @Override
    public Optional<GameVector> findByImageId(UUID imageId) {
        try {
            List<GameVector> rows = jdbcTemplate.query(FIND_BY_IMAGE_SQL,
                    new MapSqlParameterSource("imageId", imageId), this::mapFullRow);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new VectorStoreException("Failed to load vectors for image " + imageId, e);
        }
    }

    @Override
    public int deleteByImageId(UUID imageId) {
        try {
            return jdbcTemplate.update(DELETE_BY_IMAGE_SQL, new MapSqlParameterSource("imageId", imageId));
        } catch (DataAccessException e) {
            throw new VectorStoreException("Failed to delete vectors for image " + imageId, e);
        }
    }

    @Override
    public Optional<Integer> findEmbeddingDimensions() {
        try {
            List<Integer> rows = jdbcTemplate.query(EMBEDDING_DIMENSIONS_SQL, new MapSqlParameterSource(),
                    (rs, rowNum) -> rs.getInt("atttypmod"));
            return rows.stream().filter(dimensions -> dimensions > 0).findFirst();
        } catch (DataAccessException e) {
            throw new VectorStoreException("Failed to read the embedding column definition", e);
        }
    }

    @Override
    public List<GameVector> search(UUID gameId, float[] queryEmbedding, VectorPair pair, int limit, double threshold) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("gameId", gameId)
                .addValue("query", PgVectors.toLiteral(queryEmbedding))
                .addValue("threshold", threshold)
                .addValue("limit", limit);

        try {
            List<GameVector> results = jdbcTemplate.query(buildSearchSql(pair), params, SEARCH_ROW_MAPPER);
            log.debug("Vector search on {} for game {} returned {} rows", pair.getValue(), gameId, results.size());
            return results;
        } catch (DataAccessException e) {
            log.error("Vector search on {} for game {} failed: {}", pair.getValue(), gameId, e.getMessage(), e);
            throw new VectorStoreException("Vector search failed for game " + gameId, e);
        }
    }

    /**
     * The threshold is compared against the same clamped score that is returned, so a
     * threshold of zero admits every defined match, opposite vectors included with score 0.
     * A zero vector yields a NaN distance in pgvector; such rows are excluded.
     */
    static String buildSearchSql(VectorPair pair) {
        String distance = pair.getEmbeddingColumn() + " <=> CAST(:query AS vector)";
        String score = "GREATEST(0, LEAST(1, 1 - (" + distance + ")))";
        return "SELECT " + SELECT_COLUMNS + ", " + score + " AS similarity_score " +
                "FROM game_vectors " +
                "WHERE game_id = :gameId " +
                "AND " + pair.getEmbeddingColumn() + " IS NOT NULL " +
                "AND (" + distance + ") <> CAST('NaN' AS float8) " +
                "AND " + score + " >= :threshold " +
                "ORDER BY " + distance + " " +
                "LIMIT :limit";
    }

    static double clampScore(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static final RowMapper<GameVector> SEARCH_ROW_MAPPER = (rs, rowNum) -> {
        GameVector vector = mapContent(rs);
        vector.setSimilarityScore(clampScore(rs.getDouble("similarity_score")));
        return vector;
    };

    private GameVector mapFullRow(ResultSet rs, int rowNum) throws SQLException {
        GameVector vector = mapContent(rs);
        vector.setOcrEmbedding(PgVectors.fromLiteral(rs.getString("ocr_embedding")));
        vector.setDescriptionEmbedding(PgVectors.fromLiteral(rs.getString("description_embedding")));
        vector.setLabelsEmbedding(PgVectors.fromLiteral(rs.getString("labels_embedding")));
        return vector;
    }

    private static GameVector mapContent(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return GameVector.builder()
                .id(rs.getObject("id", UUID.class))
                .gameId(rs.getObject("game_id", UUID.class))
                .imageId(rs.getObject("image_id", UUID.class))
                .pageNumber(rs.getInt("page_number"))
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .ocrContent(rs.getString("ocr_content"))
                .descriptionContent(rs.getString("description_content"))
                .labelsContent(rs.getString("labels_content"))
                .build();
    }
}
