package ai.gameadvisor.backend.model.dto;

import java.util.Optional;

/**
 * Status record kept next to each queued job under {@code job_status:<jobId>}.
 */
public enum JobStatus {
    QUEUED("queued"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    RETRYING("retrying");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static Optional<JobStatus> fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
