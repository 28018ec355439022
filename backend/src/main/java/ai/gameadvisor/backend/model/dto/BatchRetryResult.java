package ai.gameadvisor.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRetryResult {

    private boolean success;

    private UUID batchId;

    @Builder.Default
    private List<String> jobIds = new ArrayList<>();

    private String errorMessage;

    public static BatchRetryResult failure(UUID batchId, String errorMessage) {
        return BatchRetryResult.builder()
                .success(false)
                .batchId(batchId)
                .errorMessage(errorMessage)
                .build();
    }
}
