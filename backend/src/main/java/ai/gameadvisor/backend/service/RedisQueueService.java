package ai.gameadvisor.backend.service;

import ai.gameadvisor.backend.model.dto.JobStatus;
import ai.gameadvisor.backend.model.dto.ProcessingJob;
import ai.gameadvisor.backend.service.exception.QueueConnectionException;
import ai.gameadvisor.backend.service.exception.QueueServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis implementation of {@link QueueService}.
 * Producers LPUSH job ids and consumers BRPOP them, so the list behaves as a FIFO.
 * Payload, status and error records are separate keys with a shared TTL.
 */
@Slf4j
@Service
public class RedisQueueService implements QueueService {

    // Redis key prefixes
    static final String QUEUE_KEY = "image_processing_queue";
    static final String JOB_DATA_PREFIX = "job_data:";
    static final String JOB_STATUS_PREFIX = "job_status:";
    static final String JOB_ERROR_PREFIX = "job_error:";
    static final String IMAGE_JOB_PREFIX = "image_job:";

    private final StringRedisTemplate redisTemplate;
    private final RedisConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;
    private final Duration jobTtl;
    private final Duration dequeueTimeout;
    private final int maxRetries;
    private final Duration processingLease;

    @Autowired
    public RedisQueueService(StringRedisTemplate redisTemplate,
                             RedisConnectionFactory connectionFactory,
                             @Value("${app.queue.job-ttl:PT24H}") Duration jobTtl,
                             @Value("${app.queue.dequeue-timeout:PT5S}") Duration dequeueTimeout,
                             @Value("${app.queue.max-retries:3}") int maxRetries,
                             @Value("${app.queue.processing-lease:PT15M}") Duration processingLease) {
        this.redisTemplate = redisTemplate;
        this.connectionFactory = connectionFactory;
        this.jobTtl = jobTtl;
        this.dequeueTimeout = dequeueTimeout;
        this.maxRetries = maxRetries;
        this.processingLease = processingLease;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.findAndRegisterModules(); // Support for Java 8 time types
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String enqueue(UUID imageId, UUID gameId, String blobPath, String filename, UUID batchId) {
        Instant now = Instant.now();
        String jobId = generateJobId(imageId, now);

        ProcessingJob job = ProcessingJob.builder()
                .jobId(jobId)
                .imageId(imageId)
                .gameId(gameId)
                .blobPath(blobPath)
                .filename(filename)
                .batchId(batchId)
                .retryCount(0)
                .maxRetries(maxRetries)
                .createdAt(now)
                .build();

        try {
            redisTemplate.opsForValue().set(JOB_DATA_PREFIX + jobId, serialize(job), jobTtl);
            redisTemplate.opsForValue().set(IMAGE_JOB_PREFIX + imageId, jobId, jobTtl);
            writeStatus(jobId, JobStatus.QUEUED);
            redisTemplate.opsForList().leftPush(QUEUE_KEY, jobId);

            log.info("Enqueued job {} for image {} (batch {})", jobId, imageId, batchId);
            return jobId;

        } catch (RedisConnectionFailureException e) {
            throw connectionLost("enqueue job for image " + imageId, e);
        } catch (QueueServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to enqueue job for image {}: {}", imageId, e.getMessage(), e);
            throw new QueueServiceException("Failed to enqueue job for image " + imageId, e);
        }
    }

    @Override
    public Optional<ProcessingJob> dequeue() {
        String jobId;
        try {
            jobId = redisTemplate.opsForList().rightPop(QUEUE_KEY, dequeueTimeout);
        } catch (RedisConnectionFailureException e) {
            throw connectionLost("dequeue", e);
        }

        if (jobId == null) {
            return Optional.empty();
        }

        String payload;
        try {
            payload = redisTemplate.opsForValue().get(JOB_DATA_PREFIX + jobId);
        } catch (RedisConnectionFailureException e) {
            throw connectionLost("load payload of job " + jobId, e);
        }

        if (payload == null) {
            log.warn("Dropping job {}: payload missing or expired", jobId);
            return Optional.empty();
        }

        ProcessingJob job = parse(jobId, payload);
        if (job == null) {
            markFailed(jobId, "Malformed job payload");
            return Optional.empty();
        }

        log.debug("Dequeued job {} for image {}", jobId, job.getImageId());
        return Optional.of(job);
    }

    @Override
    public void markProcessing(String jobId) {
        // expires unless the job finishes, so a dead worker does not hold the image forever
        try {
            redisTemplate.opsForValue().set(JOB_STATUS_PREFIX + jobId, JobStatus.PROCESSING.getValue(), processingLease);
            log.debug("Job {} is now {}", jobId, JobStatus.PROCESSING.getValue());
        } catch (RedisConnectionFailureException e) {
            throw connectionLost("update status of job " + jobId, e);
        }
    }

    @Override
    public void markCompleted(String jobId) {
        updateStatus(jobId, JobStatus.COMPLETED);
    }

    @Override
    public void markFailed(String jobId, String errorMessage) {
        try {
            writeStatus(jobId, JobStatus.FAILED);
            if (errorMessage != null) {
                redisTemplate.opsForValue().set(JOB_ERROR_PREFIX + jobId, errorMessage, jobTtl);
            }
            log.info("Marked job {} as failed: {}", jobId, errorMessage);
        } catch (RedisConnectionFailureException e) {
            throw connectionLost("mark job " + jobId + " failed", e);
        }
    }

    @Override
    public boolean retry(String jobId) {
        try {
            String payload = redisTemplate.opsForValue().get(JOB_DATA_PREFIX + jobId);
            if (payload == null) {
                log.warn("Cannot retry job {}: payload missing or expired", jobId);
                return false;
            }

            ProcessingJob job = parse(jobId, payload);
            if (job == null) {
                return false;
            }
            if (!job.canRetry()) {
                log.info("Job {} exhausted its retries ({}/{})", jobId, job.getRetryCount(), job.getMaxRetries());
                return false;
            }

            job.setRetryCount(job.getRetryCount() + 1);
            redisTemplate.opsForValue().set(JOB_DATA_PREFIX + jobId, serialize(job), jobTtl);
            writeStatus(jobId, JobStatus.RETRYING);
            redisTemplate.opsForList().leftPush(QUEUE_KEY, jobId);

            log.info("Re-queued job {} for image {} (attempt {}/{})",
                    jobId, job.getImageId(), job.getRetryCount(), job.getMaxRetries());
            return true;

        } catch (RedisConnectionFailureException e) {
            throw connectionLost("retry job " + jobId, e);
        }
    }

    @Override
    public Optional<JobStatus> getStatus(String jobId) {
        try {
            return JobStatus.fromValue(redisTemplate.opsForValue().get(JOB_STATUS_PREFIX + jobId));
        } catch (RedisConnectionFailureException e) {
            throw connectionLost("read status of job " + jobId, e);
        }
    }

    @Override
    public boolean hasPendingJob(UUID imageId) {
        try {
            String jobId = redisTemplate.opsForValue().get(IMAGE_JOB_PREFIX + imageId);
            if (jobId == null) {
                return false;
            }
            Optional<JobStatus> status = getStatus(jobId);
            if (status.isEmpty() || status.get().isTerminal()) {
                return false;
            }
            if (status.get() == JobStatus.PROCESSING) {
                return true;
            }
            // queued or retrying: the id must still be on the list, a popped job that was
            // never marked processing is lost
            Long position = redisTemplate.opsForList().indexOf(QUEUE_KEY, jobId);
            if (position == null) {
                log.warn("Job {} of image {} is {} but no longer queued", jobId, imageId, status.get().getValue());
                return false;
            }
            return true;
        } catch (RedisConnectionFailureException e) {
            throw connectionLost("look up job of image " + imageId, e);
        }
    }

    @Override
    public long queueLength() {
        try {
            Long size = redisTemplate.opsForList().size(QUEUE_KEY);
            return size != null ? size : 0L;
        } catch (RedisConnectionFailureException e) {
            throw connectionLost("read queue length", e);
        }
    }

    static String generateJobId(UUID imageId, Instant now) {
        return String.format(Locale.ROOT, "job_%s_%d.%06d",
                imageId, now.getEpochSecond(), now.getNano() / 1000);
    }

    private void updateStatus(String jobId, JobStatus status) {
        try {
            writeStatus(jobId, status);
            log.debug("Job {} is now {}", jobId, status.getValue());
        } catch (RedisConnectionFailureException e) {
            throw connectionLost("update status of job " + jobId, e);
        }
    }

    private void writeStatus(String jobId, JobStatus status) {
        redisTemplate.opsForValue().set(JOB_STATUS_PREFIX + jobId, status.getValue(), jobTtl);
    }

    private String serialize(ProcessingJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new QueueServiceException("Failed to serialize job " + job.getJobId(), e);
        }
    }

    /**
     * @return the parsed job, or null when the payload is unreadable or lacks required fields
     */
    private ProcessingJob parse(String jobId, String payload) {
        try {
            ProcessingJob job = objectMapper.readValue(payload, ProcessingJob.class);
            if (!job.isWellFormed()) {
                log.error("Job {} has a payload without required fields, dropping it", jobId);
                return null;
            }
            return job;
        } catch (JsonProcessingException e) {
            log.error("Job {} has an unreadable payload, dropping it: {}", jobId, e.getOriginalMessage());
            return null;
        }
    }

    private QueueConnectionException connectionLost(String operation, RedisConnectionFailureException e) {
        log.error("Redis connection lost during {}: {}", operation, e.getMessage());
        if (connectionFactory instanceof LettuceConnectionFactory) {
            try {
                ((LettuceConnectionFactory) connectionFactory).resetConnection();
            } catch (RuntimeException resetFailure) {
                log.warn("Failed to reset Redis connection: {}", resetFailure.getMessage());
            }
        }
        return new QueueConnectionException("Redis connection lost during " + operation, e);
    }
}
