package ai.gameadvisor.backend.integration;

import ai.gameadvisor.backend.model.entity.GameVector;
import ai.gameadvisor.backend.model.entity.VectorPair;
import ai.gameadvisor.backend.repository.JdbcGameVectorRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs vector storage and similarity search against PostgreSQL with pgvector.
 * Run with: -Dpgvector.integration.test=true
 */
@SpringBootTest(classes = JdbcGameVectorRepository.class)
@ImportAutoConfiguration({
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    SqlInitializationAutoConfiguration.class
})
@TestPropertySource(properties = {
    "spring.datasource.url=jdbc:postgresql://localhost:5432/gameadvisor_test",
    "spring.datasource.username=gameadvisor",
    "spring.datasource.password=gameadvisor",
    "spring.sql.init.mode=always"
})
@EnabledIfSystemProperty(named = "pgvector.integration.test", matches = "true")
class PgVectorIntegrationTest {

    private static final int DIMENSIONS = 1536;

    @Autowired
    private JdbcGameVectorRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Test
    void search_SameEmbedding_ShouldScoreOne() {
        // Given
        UUID gameId = UUID.randomUUID();
        UUID imageId = UUID.randomUUID();
        float[] embedding = unitVector(0);
        repository.save(GameVector.builder()
                .gameId(gameId)
                .imageId(imageId)
                .ocrContent("Each player draws five cards")
                .ocrEmbedding(embedding)
                .build());

        // When
        List<GameVector> results = repository.search(gameId, embedding, VectorPair.OCR, 5, 0.7);

        // Then
        assertThat(results).hasSize(1);
        assertThat(results.get(0).getImageId()).isEqualTo(imageId);
        assertThat(results.get(0).getOcrContent()).isEqualTo("Each player draws five cards");
        assertThat(results.get(0).getSimilarityScore()).isGreaterThan(0.99);

        repository.deleteByImageId(imageId);
    }

    @Test
    void search_RowWithoutSelectedPair_ShouldBeExcluded() {
        // Given
        UUID gameId = UUID.randomUUID();
        UUID withDescription = UUID.randomUUID();
        UUID ocrOnly = UUID.randomUUID();
        repository.save(GameVector.builder()
                .gameId(gameId)
                .imageId(withDescription)
                .descriptionContent("A hex board with resource tiles")
                .descriptionEmbedding(unitVector(1))
                .build());
        repository.save(GameVector.builder()
                .gameId(gameId)
                .imageId(ocrOnly)
                .ocrContent("Trading rules")
                .ocrEmbedding(unitVector(1))
                .build());

        // When
        List<GameVector> results = repository.search(gameId, unitVector(1), VectorPair.DESCRIPTION, 10, 0.0);

        // Then
        assertThat(results).extracting(GameVector::getImageId).containsExactly(withDescription);

        repository.deleteByImageId(withDescription);
        repository.deleteByImageId(ocrOnly);
    }

    @Test
    void search_OtherGame_ShouldNotMatch() {
        UUID imageId = UUID.randomUUID();
        repository.save(GameVector.builder()
                .gameId(UUID.randomUUID())
                .imageId(imageId)
                .labelsContent("{\"phase\":\"setup\"}")
                .labelsEmbedding(unitVector(2))
                .build());

        List<GameVector> results = repository.search(UUID.randomUUID(), unitVector(2), VectorPair.LABELS, 10, 0.0);

        assertThat(results).isEmpty();
        assertThat(repository.findByImageId(imageId)).isPresent();
        assertThat(repository.deleteByImageId(imageId)).isEqualTo(1);
    }

    @Test
    void save_SameImageTwice_ShouldKeepSingleRow() {
        // Given - a job whose vectors were written before its progress update failed
        UUID gameId = UUID.randomUUID();
        UUID imageId = UUID.randomUUID();
        GameVector first = repository.save(GameVector.builder()
                .gameId(gameId)
                .imageId(imageId)
                .ocrContent("Setup: shuffle the deck")
                .ocrEmbedding(unitVector(3))
                .build());

        // When - the redelivered job stores its result again
        GameVector second = repository.save(GameVector.builder()
                .gameId(gameId)
                .imageId(imageId)
                .ocrContent("Setup: shuffle the deck and deal five cards")
                .ocrEmbedding(unitVector(4))
                .build());

        // Then
        Integer rows = jdbcTemplate.queryForObject("SELECT count(*) FROM game_vectors WHERE image_id = :imageId",
                new MapSqlParameterSource("imageId", imageId), Integer.class);
        assertThat(rows).isEqualTo(1);
        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(repository.findByImageId(imageId))
                .get()
                .extracting(GameVector::getOcrContent)
                .isEqualTo("Setup: shuffle the deck and deal five cards");
        assertThat(repository.search(gameId, unitVector(4), VectorPair.OCR, 10, 0.9)).hasSize(1);

        repository.deleteByImageId(imageId);
    }

    @Test
    void search_OppositeEmbedding_ShouldOnlyPassZeroThresholdWithClampedScore() {
        // Given
        UUID gameId = UUID.randomUUID();
        UUID imageId = UUID.randomUUID();
        float[] opposite = unitVector(5);
        opposite[5] = -1.0f;
        repository.save(GameVector.builder()
                .gameId(gameId)
                .imageId(imageId)
                .ocrContent("Scoring happens at the end of the round")
                .ocrEmbedding(opposite)
                .build());

        // When
        List<GameVector> atZero = repository.search(gameId, unitVector(5), VectorPair.OCR, 10, 0.0);
        List<GameVector> aboveZero = repository.search(gameId, unitVector(5), VectorPair.OCR, 10, 0.01);

        // Then
        assertThat(atZero).hasSize(1);
        assertThat(atZero.get(0).getSimilarityScore()).isEqualTo(0.0);
        assertThat(aboveZero).isEmpty();

        repository.deleteByImageId(imageId);
    }

    @Test
    void search_ZeroEmbedding_ShouldNeverMatch() {
        UUID gameId = UUID.randomUUID();
        UUID imageId = UUID.randomUUID();
        repository.save(GameVector.builder()
                .gameId(gameId)
                .imageId(imageId)
                .labelsContent("{}")
                .labelsEmbedding(new float[DIMENSIONS])
                .build());

        List<GameVector> results = repository.search(gameId, unitVector(6), VectorPair.LABELS, 10, 0.0);

        assertThat(results).isEmpty();
        repository.deleteByImageId(imageId);
    }

    @Test
    void findEmbeddingDimensions_ShouldMatchConfiguredDefault() {
        assertThat(repository.findEmbeddingDimensions()).contains(DIMENSIONS);
    }

    private static float[] unitVector(int hot) {
        float[] vector = new float[DIMENSIONS];
        vector[hot] = 1.0f;
        return vector;
    }
}
