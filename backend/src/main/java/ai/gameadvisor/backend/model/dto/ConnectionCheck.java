package ai.gameadvisor.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ConnectionCheck {
    private boolean successful;
    private String message;
}
