package ai.gameadvisor.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the AI extraction service for one image: up to three (content, embedding) pairs.
 * Any pair may be absent when its extraction method is disabled or produced nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiProcessingResult {

    private String ocrContent;
    private float[] ocrEmbedding;

    private String descriptionContent;
    private float[] descriptionEmbedding;

    /**
     * Structured labels serialized as JSON text
     */
    private String labelsContent;
    private float[] labelsEmbedding;

    @Builder.Default
    private boolean success = true;

    private String errorMessage;

    public static AiProcessingResult failure(String errorMessage) {
        return AiProcessingResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public List<String> getExtractedTypes() {
        List<String> types = new ArrayList<>();
        if (hasText(ocrContent) && ocrEmbedding != null) {
            types.add("ocr");
        }
        if (hasText(descriptionContent) && descriptionEmbedding != null) {
            types.add("description");
        }
        if (hasText(labelsContent) && labelsEmbedding != null) {
            types.add("labels");
        }
        return types;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
