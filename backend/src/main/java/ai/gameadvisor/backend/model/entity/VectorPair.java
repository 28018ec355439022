package ai.gameadvisor.backend.model.entity;

import ai.gameadvisor.backend.service.exception.UnsupportedSearchPairException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The three (content, embedding) pairs stored per image, each mapped to its columns
 * in {@code game_vectors}. Column names are constants so they can be spliced into SQL.
 */
public enum VectorPair {
    OCR("ocr", "ocr_content", "ocr_embedding"),
    DESCRIPTION("description", "description_content", "description_embedding"),
    LABELS("labels", "labels_content", "labels_embedding");

    private final String value;
    private final String contentColumn;
    private final String embeddingColumn;

    VectorPair(String value, String contentColumn, String embeddingColumn) {
        this.value = value;
        this.contentColumn = contentColumn;
        this.embeddingColumn = embeddingColumn;
    }

    public String getValue() {
        return value;
    }

    public String getContentColumn() {
        return contentColumn;
    }

    public String getEmbeddingColumn() {
        return embeddingColumn;
    }

    /**
     * Resolves a selector such as {@code "ocr"}.
     *
     * @throws UnsupportedSearchPairException for null or unknown selectors
     */
    public static VectorPair fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (VectorPair pair : values()) {
                if (pair.value.equals(normalized)) {
                    return pair;
                }
            }
        }
        String supported = Arrays.stream(values()).map(VectorPair::getValue).collect(Collectors.joining(", "));
        throw new UnsupportedSearchPairException(
                "Unsupported search pair '" + value + "', expected one of: " + supported);
    }
}
