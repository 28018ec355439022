package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.StoredObject;

import java.util.UUID;

/**
 * Storage for the raw image bytes.
 */
public interface ObjectStorageService {

    /**
     * @throws ai.gameadvisor.backend.service.exception.ObjectStorageException on write failure
     */
    StoredObject upload(UUID gameId, UUID imageId, byte[] content, String filename, String contentType);

    /**
     * @throws ai.gameadvisor.backend.service.exception.ObjectStorageException when the object is missing or unreadable
     */
    byte[] download(String path);

    /**
     * @return true when an object was removed
     */
    boolean delete(String path);
}
