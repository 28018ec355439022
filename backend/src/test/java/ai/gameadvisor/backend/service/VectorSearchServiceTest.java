package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.entity.GameVector;
import ai.gameadvisor.backend.model.entity.VectorPair;
import ai.gameadvisor.backend.repository.GameVectorRepository;
import ai.gameadvisor.backend.service.exception.EmbeddingDimensionException;
import ai.gameadvisor.backend.service.exception.UnsupportedSearchPairException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VectorSearchService
 * Tests input validation and delegation to the vector repository
 */
@ExtendWith(MockitoExtension.class)
class VectorSearchServiceTest {

    @Mock
    private GameVectorRepository vectorRepository;

    @Mock
    private AiProcessingService aiProcessingService;

    @Mock
    private ImageProcessingMetricsService metricsService;

    private VectorSearchService service;
    private final UUID gameId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new VectorSearchService(vectorRepository, aiProcessingService, metricsService, 3, "ocr");
    }

    @Test
    void search_SelectedPair_ShouldReturnRowsWithAllContents() {
        // Given
        float[] query = {1f, 0f, 0f};
        GameVector match = GameVector.builder()
                .gameId(gameId)
                .imageId(UUID.randomUUID())
                .ocrContent("Setup: shuffle the deck")
                .descriptionContent("A card layout")
                .labelsContent("{\"phase\":\"setup\"}")
                .similarityScore(0.93)
                .build();
        when(vectorRepository.search(gameId, query, VectorPair.OCR, 5, 0.7)).thenReturn(List.of(match));

        // When
        List<GameVector> results = service.search(gameId, query, "ocr", 5, 0.7);

        // Then
        assertThat(results).hasSize(1);
        assertThat(results.get(0).getSimilarityScore()).isEqualTo(0.93);
        assertThat(results.get(0).getDescriptionContent()).isEqualTo("A card layout");
        assertThat(results.get(0).getLabelsContent()).contains("setup");
        verify(metricsService).recordSearch("ocr");
    }

    @Test
    void search_UnsupportedPair_ShouldFailBeforeQuerying() {
        assertThatThrownBy(() -> service.search(gameId, new float[]{1f, 0f, 0f}, "title", 5, 0.7))
                .isInstanceOf(UnsupportedSearchPairException.class);
        verifyNoInteractions(vectorRepository);
    }

    @Test
    void search_DimensionMismatch_ShouldFailWithoutPadding() {
        assertThatThrownBy(() -> service.search(gameId, new float[]{1f, 0f}, "ocr", 5, 0.7))
                .isInstanceOf(EmbeddingDimensionException.class);
        verifyNoInteractions(vectorRepository);
    }

    @Test
    void search_InvalidLimitOrThreshold_ShouldBeRejected() {
        float[] query = {1f, 0f, 0f};

        assertThatThrownBy(() -> service.search(gameId, query, VectorPair.OCR, 0, 0.7))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.search(gameId, query, VectorPair.OCR, 5, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(vectorRepository);
    }

    @Test
    void searchByText_ShouldEmbedQueryAndUseDefaults() {
        // Given
        float[] embedding = {0f, 1f, 0f};
        when(aiProcessingService.embed("how many cards per player?")).thenReturn(embedding);
        when(vectorRepository.search(eq(gameId), eq(embedding), eq(VectorPair.OCR), eq(5), eq(0.7)))
                .thenReturn(List.of());

        // When
        List<GameVector> results = service.searchByText(gameId, "how many cards per player?");

        // Then
        assertThat(results).isEmpty();
        verify(vectorRepository).search(gameId, embedding, VectorPair.OCR, 5, 0.7);
    }
}
