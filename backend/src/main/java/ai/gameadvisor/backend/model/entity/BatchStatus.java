package ai.gameadvisor.backend.model.entity;

/**
 * Lifecycle status of an {@link ImageBatch}.
 */
public enum BatchStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    RETRYING("retrying"),
    PARTIALLY_COMPLETED("partially_completed");

    private final String value;

    BatchStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == PARTIALLY_COMPLETED;
    }
}
