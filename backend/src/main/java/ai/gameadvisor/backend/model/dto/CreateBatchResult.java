package ai.gameadvisor.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a batch upload. Expected failures are reported here, not thrown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBatchResult {

    private boolean success;

    private UUID batchId;

    private int uploadedImages;

    @Builder.Default
    private List<String> jobIds = new ArrayList<>();

    private String errorMessage;

    public static CreateBatchResult failure(String errorMessage) {
        return CreateBatchResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
