package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.entity.GameImage;
import ai.gameadvisor.backend.repository.GameImageRepository;
import ai.gameadvisor.backend.repository.GameVectorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Removes an image together with its vectors and stored bytes.
 */
@Slf4j
@Service
public class ImageDeletionService {

    private final GameImageRepository imageRepository;
    private final GameVectorRepository vectorRepository;
    private final ObjectStorageService storageService;

    public ImageDeletionService(GameImageRepository imageRepository,
                                GameVectorRepository vectorRepository,
                                ObjectStorageService storageService) {
        this.imageRepository = imageRepository;
        this.vectorRepository = vectorRepository;
        this.storageService = storageService;
    }

    /**
     * @return false when the image does not exist
     */
    @Transactional
    public boolean deleteImage(UUID imageId) {
        Optional<GameImage> found = imageRepository.findById(imageId);
        if (found.isEmpty()) {
            return false;
        }
        GameImage image = found.get();

        int vectors = vectorRepository.deleteByImageId(imageId);
        imageRepository.delete(image);

        if (image.getFilePath() != null && !storageService.delete(image.getFilePath())) {
            log.warn("Stored object {} of image {} was already gone", image.getFilePath(), imageId);
        }

        log.info("Deleted image {} of game {} with {} vector rows", imageId, image.getGameId(), vectors);
        return true;
    }
}
