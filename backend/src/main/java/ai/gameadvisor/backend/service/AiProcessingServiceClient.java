package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.AiProcessingResult;
import ai.gameadvisor.backend.model.dto.ConnectionCheck;
import ai.gameadvisor.backend.service.exception.AiProcessingException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;
import java.util.List;

/**
 * HTTP client for the AI extraction service.
 *
 * <p>Endpoints: {@code POST /process} (image in, up to three content/embedding pairs out),
 * {@code POST /embeddings} (text in, one embedding out) and {@code GET /health}.
 */
@Service
public class AiProcessingServiceClient implements AiProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(AiProcessingServiceClient.class);

    private final RestTemplate restTemplate;
    private final String serviceUrl;
    private final boolean enableOcr;
    private final boolean enableDescription;
    private final boolean enableLabels;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public AiProcessingServiceClient(
            @Qualifier("aiServiceRestTemplate") RestTemplate restTemplate,
            @Value("${app.ai.service.url:http://localhost:8002}") String serviceUrl,
            @Value("${app.ai.processing.enable-ocr:true}") boolean enableOcr,
            @Value("${app.ai.processing.enable-description:true}") boolean enableDescription,
            @Value("${app.ai.processing.enable-labels:true}") boolean enableLabels) {
        this.restTemplate = restTemplate;
        this.serviceUrl = serviceUrl.endsWith("/") ? serviceUrl.substring(0, serviceUrl.length() - 1) : serviceUrl;
        this.enableOcr = enableOcr;
        this.enableDescription = enableDescription;
        this.enableLabels = enableLabels;
    }

    @Override
    public AiProcessingResult process(byte[] imageContent, String filename) {
        ProcessRequest request = new ProcessRequest();
        request.setImageBase64(Base64.getEncoder().encodeToString(imageContent));
        request.setFilename(filename);
        request.setEnableOcr(enableOcr);
        request.setEnableDescription(enableDescription);
        request.setEnableLabels(enableLabels);

        try {
            logger.debug("Sending {} ({} bytes) to AI service", filename, imageContent.length);
            ResponseEntity<ProcessResponse> response =
                    restTemplate.postForEntity(serviceUrl + "/process", jsonEntity(request), ProcessResponse.class);

            ProcessResponse body = response.getBody();
            if (body == null) {
                logger.warn("AI service returned an empty response for {}", filename);
                return AiProcessingResult.failure("Empty response from AI service");
            }
            if (!body.isSuccess()) {
                logger.warn("AI service could not process {}: {}", filename, body.getError());
                return AiProcessingResult.failure(body.getError() != null ? body.getError() : "AI processing failed");
            }
            return toResult(body);

        } catch (RestClientException e) {
            logger.error("Failed to communicate with AI service: {}", e.getMessage());
            throw new AiProcessingException("AI service request failed for " + filename, e);
        }
    }

    @Override
    public float[] embed(String text) {
        try {
            ResponseEntity<EmbeddingResponse> response = restTemplate.postForEntity(
                    serviceUrl + "/embeddings", jsonEntity(new EmbeddingRequest(text)), EmbeddingResponse.class);

            EmbeddingResponse body = response.getBody();
            if (body == null || body.getEmbedding() == null) {
                throw new AiProcessingException("AI service returned no embedding");
            }
            return toArray(body.getEmbedding());

        } catch (RestClientException e) {
            logger.error("Failed to embed query text: {}", e.getMessage());
            throw new AiProcessingException("AI service embedding request failed", e);
        }
    }

    @Override
    public ConnectionCheck testConnection() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(serviceUrl + "/health", String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                return new ConnectionCheck(true, "AI service reachable at " + serviceUrl);
            }
            return new ConnectionCheck(false, "AI service returned HTTP " + response.getStatusCode().value());
        } catch (RestClientException e) {
            logger.warn("AI service health check failed: {}", e.getMessage());
            return new ConnectionCheck(false, e.getMessage());
        }
    }

    private AiProcessingResult toResult(ProcessResponse body) {
        AiProcessingResult.AiProcessingResultBuilder result = AiProcessingResult.builder().success(true);
        if (body.getOcr() != null) {
            result.ocrContent(contentAsText(body.getOcr().getContent()))
                    .ocrEmbedding(toArray(body.getOcr().getEmbedding()));
        }
        if (body.getDescription() != null) {
            result.descriptionContent(contentAsText(body.getDescription().getContent()))
                    .descriptionEmbedding(toArray(body.getDescription().getEmbedding()));
        }
        if (body.getLabels() != null) {
            result.labelsContent(contentAsText(body.getLabels().getContent()))
                    .labelsEmbedding(toArray(body.getLabels().getEmbedding()));
        }
        return result.build();
    }

    private String contentAsText(JsonNode content) {
        if (content == null || content.isNull()) {
            return null;
        }
        if (content.isTextual()) {
            return content.asText();
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new AiProcessingException("Unreadable content in AI response", e);
        }
    }

    private static float[] toArray(List<Double> values) {
        if (values == null) {
            return null;
        }
        float[] array = new float[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i).floatValue();
        }
        return array;
    }

    private static <T> HttpEntity<T> jsonEntity(T body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    /**
     * Request model for image processing.
     */
    public static class ProcessRequest {
        @JsonProperty("image_base64")
        private String imageBase64;

        @JsonProperty("filename")
        private String filename;

        @JsonProperty("enable_ocr")
        private boolean enableOcr;

        @JsonProperty("enable_description")
        private boolean enableDescription;

        @JsonProperty("enable_labels")
        private boolean enableLabels;

        public String getImageBase64() { return imageBase64; }
        public void setImageBase64(String imageBase64) { this.imageBase64 = imageBase64; }

        public String getFilename() { return filename; }
        public void setFilename(String filename) { this.filename = filename; }

        public boolean isEnableOcr() { return enableOcr; }
        public void setEnableOcr(boolean enableOcr) { this.enableOcr = enableOcr; }

        public boolean isEnableDescription() { return enableDescription; }
        public void setEnableDescription(boolean enableDescription) { this.enableDescription = enableDescription; }

        public boolean isEnableLabels() { return enableLabels; }
        public void setEnableLabels(boolean enableLabels) { this.enableLabels = enableLabels; }
    }

    /**
     * Response model for image processing. Each extraction is optional.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProcessResponse {
        @JsonProperty("success")
        private boolean success = true;

        @JsonProperty("error")
        private String error;

        @JsonProperty("ocr")
        private Extraction ocr;

        @JsonProperty("description")
        private Extraction description;

        @JsonProperty("labels")
        private Extraction labels;

        public boolean isSuccess() { return success; }
        public void setSuccess(boolean success) { this.success = success; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }

        public Extraction getOcr() { return ocr; }
        public void setOcr(Extraction ocr) { this.ocr = ocr; }

        public Extraction getDescription() { return description; }
        public void setDescription(Extraction description) { this.description = description; }

        public Extraction getLabels() { return labels; }
        public void setLabels(Extraction labels) { this.labels = labels; }
    }

    /**
     * One extracted content with its embedding. Label content is a JSON object.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Extraction {
        @JsonProperty("content")
        private JsonNode content;

        @JsonProperty("embedding")
        private List<Double> embedding;

        public JsonNode getContent() { return content; }
        public void setContent(JsonNode content) { this.content = content; }

        public List<Double> getEmbedding() { return embedding; }
        public void setEmbedding(List<Double> embedding) { this.embedding = embedding; }
    }

    public static class EmbeddingRequest {
        @JsonProperty("text")
        private String text;

        public EmbeddingRequest() {
        }

        public EmbeddingRequest(String text) {
            this.text = text;
        }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        @JsonProperty("embedding")
        private List<Double> embedding;

        public List<Double> getEmbedding() { return embedding; }
        public void setEmbedding(List<Double> embedding) { this.embedding = embedding; }
    }
}
