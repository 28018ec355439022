package ai.gameadvisor.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Location of an uploaded object: the internal path used for downloads and the public URL.
 */
@Data
@AllArgsConstructor
public class StoredObject {
    private String path;
    private String url;
}
