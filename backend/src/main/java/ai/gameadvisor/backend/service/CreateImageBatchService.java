package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.CreateBatchResult;
import ai.gameadvisor.backend.model.dto.StoredObject;
import ai.gameadvisor.backend.model.dto.UploadedFile;
import ai.gameadvisor.backend.model.entity.GameImage;
import ai.gameadvisor.backend.model.entity.ImageBatch;
import ai.gameadvisor.backend.model.entity.ImageProcessingStatus;
import ai.gameadvisor.backend.repository.GameImageRepository;
import ai.gameadvisor.backend.repository.ImageBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Uploads a set of images as one batch and queues a processing job per image.
 *
 * <p>Files that cannot be stored are dropped from the batch and the total shrinks
 * accordingly. The final total is saved before any job is queued, so workers never see
 * a batch larger than the images it really holds. An image whose job could not be
 * queued stays UPLOADED and is picked up by {@link OrphanImageReconciler}.
 */
@Slf4j
@Service
public class CreateImageBatchService {

    private static final Map<String, String> CONTENT_TYPES = Map.of(
            ".jpg", "image/jpeg",
            ".jpeg", "image/jpeg",
            ".png", "image/png",
            ".webp", "image/webp",
            ".gif", "image/gif");

    private final ImageBatchRepository batchRepository;
    private final GameImageRepository imageRepository;
    private final ObjectStorageService storageService;
    private final QueueService queueService;
    private final ImageProcessingMetricsService metricsService;
    private final int maxRetries;

    public CreateImageBatchService(ImageBatchRepository batchRepository,
                                   GameImageRepository imageRepository,
                                   ObjectStorageService storageService,
                                   QueueService queueService,
                                   ImageProcessingMetricsService metricsService,
                                   @Value("${app.batch.max-retries:3}") int maxRetries) {
        this.batchRepository = batchRepository;
        this.imageRepository = imageRepository;
        this.storageService = storageService;
        this.queueService = queueService;
        this.metricsService = metricsService;
        this.maxRetries = maxRetries;
    }

    /**
     * @param gameId the game the images belong to
     * @param uploaderId the uploading user, may be null
     * @param files the uploaded files
     * @return the outcome; expected failures are reported, not thrown
     */
    public CreateBatchResult create(UUID gameId, UUID uploaderId, List<UploadedFile> files) {
        if (gameId == null) {
            return CreateBatchResult.failure("Game id is required");
        }
        if (files == null || files.isEmpty()) {
            return CreateBatchResult.failure("No images provided");
        }

        try {
            ImageBatch batch = ImageBatch.create(gameId, files.size(), maxRetries);
            batchRepository.save(batch);

            List<GameImage> storedImages = new ArrayList<>();
            for (UploadedFile file : files) {
                GameImage image = storeImage(batch, uploaderId, file);
                if (image != null) {
                    storedImages.add(image);
                } else {
                    batch.excludeImage();
                }
            }

            if (storedImages.isEmpty()) {
                batchRepository.deleteById(batch.getId());
                log.warn("No image of batch for game {} could be uploaded, batch discarded", gameId);
                return CreateBatchResult.failure("No image could be uploaded");
            }

            batchRepository.save(batch);

            List<String> jobIds = new ArrayList<>();
            for (GameImage image : storedImages) {
                try {
                    jobIds.add(queueService.enqueue(image.getId(), gameId, image.getFilePath(),
                            image.getOriginalFilename(), batch.getId()));
                } catch (RuntimeException e) {
                    log.error("Failed to queue image {} of batch {}, leaving it for reconciliation: {}",
                            image.getId(), batch.getId(), e.getMessage());
                }
            }

            metricsService.recordBatchCreated();
            log.info("Created batch {} for game {}: {} of {} files uploaded, {} jobs queued",
                    batch.getId(), gameId, storedImages.size(), files.size(), jobIds.size());

            return CreateBatchResult.builder()
                    .success(true)
                    .batchId(batch.getId())
                    .uploadedImages(storedImages.size())
                    .jobIds(jobIds)
                    .build();

        } catch (Exception e) {
            log.error("Failed to create image batch for game {}: {}", gameId, e.getMessage(), e);
            return CreateBatchResult.failure("Batch creation failed: " + e.getMessage());
        }
    }

    /**
     * @return the saved image, or null when the file could not be stored
     */
    private GameImage storeImage(ImageBatch batch, UUID uploaderId, UploadedFile file) {
        if (file.getContent() == null || file.getContent().length == 0) {
            log.warn("Skipping empty file {} in batch {}", file.getFilename(), batch.getId());
            return null;
        }

        UUID imageId = UUID.randomUUID();
        StoredObject stored = null;
        try {
            stored = storageService.upload(batch.getGameId(), imageId, file.getContent(),
                    file.getFilename(), contentTypeOf(file.getFilename()));

            GameImage image = new GameImage();
            image.setId(imageId);
            image.setGameId(batch.getGameId());
            image.setBatchId(batch.getId());
            image.setFilePath(stored.getPath());
            image.setBlobUrl(stored.getUrl());
            image.setOriginalFilename(file.getFilename());
            image.setFileSize(file.getSize());
            image.setUploadedBy(uploaderId);
            image.setProcessingStatus(ImageProcessingStatus.UPLOADED);
            image.setCreatedAt(Instant.now());
            return imageRepository.save(image);

        } catch (RuntimeException e) {
            log.error("Failed to upload {} for batch {}: {}", file.getFilename(), batch.getId(), e.getMessage());
            if (stored != null) {
                storageService.delete(stored.getPath());
            }
            return null;
        }
    }

    static String contentTypeOf(String filename) {
        if (filename == null) {
            return "application/octet-stream";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return "application/octet-stream";
        }
        return CONTENT_TYPES.getOrDefault(filename.substring(dot).toLowerCase(Locale.ROOT), "application/octet-stream");
    }
}
