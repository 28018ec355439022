package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.AiProcessingResult;
import ai.gameadvisor.backend.model.entity.GameVector;
import ai.gameadvisor.backend.model.entity.VectorPair;
import ai.gameadvisor.backend.repository.GameVectorRepository;
import ai.gameadvisor.backend.service.exception.EmbeddingDimensionException;
import ai.gameadvisor.backend.service.exception.VectorStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Turns an extraction result into a stored vector row.
 */
@Slf4j
@Service
public class VectorStorageService {

    private final GameVectorRepository vectorRepository;
    private final int dimensions;

    public VectorStorageService(GameVectorRepository vectorRepository,
                                @Value("${app.vector.dimensions:1536}") int dimensions) {
        this.vectorRepository = vectorRepository;
        this.dimensions = dimensions;
    }

    /**
     * Compares the configured embedding length with the columns declared in the database.
     * A mismatch would make every insert fail, so startup is aborted instead.
     *
     * @throws IllegalStateException when the two disagree
     */
    @EventListener(ApplicationReadyEvent.class)
    public void verifySchemaDimensions() {
        Optional<Integer> columnDimensions;
        try {
            columnDimensions = vectorRepository.findEmbeddingDimensions();
        } catch (VectorStoreException e) {
            log.warn("Could not read embedding column definition, dimension check skipped: {}", e.getMessage());
            return;
        }

        if (columnDimensions.isEmpty()) {
            log.warn("Embedding columns have no declared dimension, expected {}", dimensions);
            return;
        }
        if (columnDimensions.get() != dimensions) {
            throw new IllegalStateException("app.vector.dimensions is " + dimensions
                    + " but game_vectors declares vector(" + columnDimensions.get() + ")");
        }
        log.info("Embedding dimensions verified: {}", dimensions);
    }

    /**
     * Stores every pair whose content is non-blank and whose embedding is present.
     *
     * @return the stored row, or empty when the result carried no usable pair
     * @throws EmbeddingDimensionException when an embedding has the wrong length
     */
    public Optional<GameVector> store(UUID gameId, UUID imageId, AiProcessingResult result) {
        GameVector vector = GameVector.builder()
                .gameId(gameId)
                .imageId(imageId)
                .build();

        if (hasText(result.getOcrContent()) && result.getOcrEmbedding() != null) {
            vector.setOcrContent(result.getOcrContent());
            vector.setOcrEmbedding(checkDimensions(result.getOcrEmbedding()));
        }
        if (hasText(result.getDescriptionContent()) && result.getDescriptionEmbedding() != null) {
            vector.setDescriptionContent(result.getDescriptionContent());
            vector.setDescriptionEmbedding(checkDimensions(result.getDescriptionEmbedding()));
        }
        if (hasText(result.getLabelsContent()) && result.getLabelsEmbedding() != null) {
            vector.setLabelsContent(result.getLabelsContent());
            vector.setLabelsEmbedding(checkDimensions(result.getLabelsEmbedding()));
        }

        if (!vector.hasAnyPair()) {
            log.info("No content extracted for image {}, skipping vector storage", imageId);
            return Optional.empty();
        }

        GameVector saved = vectorRepository.save(vector);
        log.info("Stored vectors for image {} of game {} (ocr={}, description={}, labels={})",
                imageId, gameId, saved.hasPair(VectorPair.OCR), saved.hasPair(VectorPair.DESCRIPTION),
                saved.hasPair(VectorPair.LABELS));
        return Optional.of(saved);
    }

    float[] checkDimensions(float[] embedding) {
        if (embedding.length != dimensions) {
            throw new EmbeddingDimensionException(dimensions, embedding.length);
        }
        return embedding;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
