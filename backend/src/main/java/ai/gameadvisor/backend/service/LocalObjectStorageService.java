package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.StoredObject;
import ai.gameadvisor.backend.service.exception.ObjectStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.UUID;

/**
 * Filesystem-backed object store. Objects live under {@code games/{gameId}/images/{imageId}{ext}}
 * relative to the configured root.
 */
@Slf4j
@Service
public class LocalObjectStorageService implements ObjectStorageService {

    private final Path root;
    private final String publicBaseUrl;

    public LocalObjectStorageService(
            @Value("${app.storage.local.root:./data/images}") String root,
            @Value("${app.storage.local.public-base-url:file://}") String publicBaseUrl) {
        this.root = Paths.get(root).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl;
    }

    @Override
    public StoredObject upload(UUID gameId, UUID imageId, byte[] content, String filename, String contentType) {
        String path = "games/" + gameId + "/images/" + imageId + extensionOf(filename);
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
            log.debug("Stored {} bytes ({}) at {}", content.length, contentType, path);
            return new StoredObject(path, buildUrl(path, target));
        } catch (IOException e) {
            log.error("Failed to store image {} for game {}: {}", imageId, gameId, e.getMessage(), e);
            throw new ObjectStorageException("Failed to store image " + imageId, e);
        }
    }

    @Override
    public byte[] download(String path) {
        try {
            return Files.readAllBytes(resolve(path));
        } catch (NoSuchFileException e) {
            throw new ObjectStorageException("Object not found: " + path, e);
        } catch (IOException e) {
            throw new ObjectStorageException("Failed to read object " + path, e);
        }
    }

    @Override
    public boolean delete(String path) {
        try {
            return Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            log.warn("Failed to delete object {}: {}", path, e.getMessage());
            return false;
        }
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new ObjectStorageException("Path escapes storage root: " + path);
        }
        return resolved;
    }

    private String buildUrl(String path, Path target) {
        if ("file://".equals(publicBaseUrl)) {
            return target.toUri().toString();
        }
        String base = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
        return base + path;
    }
}
