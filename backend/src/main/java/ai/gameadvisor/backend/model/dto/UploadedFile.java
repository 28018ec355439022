package ai.gameadvisor.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One file of a multi-file upload as handed over by the web layer.
 */
@Data
@AllArgsConstructor
public class UploadedFile {
    private String filename;
    private byte[] content;
    private long size;
}
