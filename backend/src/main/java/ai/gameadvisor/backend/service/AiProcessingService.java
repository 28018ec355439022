package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.AiProcessingResult;
import ai.gameadvisor.backend.model.dto.ConnectionCheck;

/**
 * Extraction of text, description and labels from an image, plus text embedding.
 */
public interface AiProcessingService {

    /**
     * @return the extraction result; {@code success=false} signals a failed extraction
     * @throws ai.gameadvisor.backend.service.exception.AiProcessingException when the service cannot be reached
     */
    AiProcessingResult process(byte[] imageContent, String filename);

    /**
     * Embeds a search query into the same space as the stored embeddings.
     */
    float[] embed(String text);

    ConnectionCheck testConnection();
}
