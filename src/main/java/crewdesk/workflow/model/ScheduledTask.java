package crewdesk.workflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable row of the durable task queue.
 * The payload is JSON text whose shape depends on {@link TaskType}.
 */
public final class ScheduledTask {
    private final String id;
    private final String tenantId;
    private final TaskType type;
    private final String dedupKey;
    private final Instant dueAt;
    private final String payload;
    private final TaskStatus status;
    private final int attempts;
    private final int maxAttempts;
    private final String lastError;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant claimedAt;
    private final Instant executedAt;

    private ScheduledTask(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tenantId = builder.tenantId;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.dedupKey = builder.dedupKey;
        this.dueAt = Objects.requireNonNull(builder.dueAt, "dueAt is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.lastError = builder.lastError;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.claimedAt = builder.claimedAt;
        this.executedAt = builder.executedAt;
    }

    public String id() {
        return id;
    }

    public String tenantId() {
        return tenantId;
    }

    public TaskType type() {
        return type;
    }

    public String dedupKey() {
        return dedupKey;
    }

    public Instant dueAt() {
        return dueAt;
    }

    public String payload() {
        return payload;
    }

    public TaskStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String lastError() {
        return lastError;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public Instant executedAt() {
        return executedAt;
    }

    /** Check if another attempt is allowed after the current one */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .type(type)
                .dedupKey(dedupKey)
                .dueAt(dueAt)
                .payload(payload)
                .status(status)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .lastError(lastError)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .claimedAt(claimedAt)
                .executedAt(executedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String tenantId;
        private TaskType type;
        private String dedupKey;
        private Instant dueAt;
        private String payload;
        private TaskStatus status = TaskStatus.PENDING;
        private int attempts = 0;
        private int maxAttempts = 3;
        private String lastError;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant claimedAt;
        private Instant executedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder dedupKey(String dedupKey) {
            this.dedupKey = dedupKey;
            return this;
        }

        public Builder dueAt(Instant dueAt) {
            this.dueAt = dueAt;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder executedAt(Instant executedAt) {
            this.executedAt = executedAt;
            return this;
        }

        public ScheduledTask build() {
            return new ScheduledTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduledTask task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduledTask{id='" + id + "', type=" + type + ", status=" + status
                + ", dedupKey='" + dedupKey + "', attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
