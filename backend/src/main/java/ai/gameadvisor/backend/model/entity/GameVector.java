package ai.gameadvisor.backend.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Extracted content of one image, stored as three independent (content, embedding) pairs.
 * Rows are written with JDBC because the embedding columns use the pgvector {@code vector} type.
 * {@code similarityScore} is only populated on rows returned by a search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameVector {

    private UUID id;
    private UUID gameId;
    private UUID imageId;

    @Builder.Default
    private int pageNumber = 1;

    private Instant createdAt;

    private String ocrContent;
    private float[] ocrEmbedding;

    private String descriptionContent;
    private float[] descriptionEmbedding;

    private String labelsContent;
    private float[] labelsEmbedding;

    private Double similarityScore;

    public String getContent(VectorPair pair) {
        switch (pair) {
            case OCR:
                return ocrContent;
            case DESCRIPTION:
                return descriptionContent;
            case LABELS:
                return labelsContent;
            default:
                throw new IllegalArgumentException("Unknown pair " + pair);
        }
    }

    public float[] getEmbedding(VectorPair pair) {
        switch (pair) {
            case OCR:
                return ocrEmbedding;
            case DESCRIPTION:
                return descriptionEmbedding;
            case LABELS:
                return labelsEmbedding;
            default:
                throw new IllegalArgumentException("Unknown pair " + pair);
        }
    }

    public boolean hasPair(VectorPair pair) {
        String content = getContent(pair);
        return content != null && !content.isBlank() && getEmbedding(pair) != null;
    }

    public boolean hasAnyPair() {
        for (VectorPair pair : VectorPair.values()) {
            if (hasPair(pair)) {
                return true;
            }
        }
        return false;
    }
}
