package warmpool.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one pool instance as read from the compute provider.
 * Never cached: every query re-derives it from the provider's labels.
 */
public final class PoolInstance {
    private final String id;
    private final InstanceStatus status;
    private final String privateIp;
    private final String publicIp;
    private final String subnetId;
    private final String tenantId;
    private final String tenantKey;
    private final String secretName;
    private final Instant launchedAt;

    private PoolInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.privateIp = builder.privateIp;
        this.publicIp = builder.publicIp;
        this.subnetId = builder.subnetId;
        this.tenantId = builder.tenantId;
        this.tenantKey = builder.tenantKey;
        this.secretName = builder.secretName;
        this.launchedAt = builder.launchedAt;
    }

    public String id() {
        return id;
    }

    public InstanceStatus status() {
        return status;
    }

    public String privateIp() {
        return privateIp;
    }

    public String publicIp() {
        return publicIp;
    }

    public String subnetId() {
        return subnetId;
    }

    /** Owning tenant, null unless assigned */
    public String tenantId() {
        return tenantId;
    }

    public String tenantKey() {
        return tenantKey;
    }

    public String secretName() {
        return secretName;
    }

    public Instant launchedAt() {
        return launchedAt;
    }

    public boolean isAvailable() {
        return status == InstanceStatus.AVAILABLE;
    }

    /** Counts toward the spare count (available + initializing) */
    public boolean isSpare() {
        return status != InstanceStatus.ASSIGNED;
    }

    public boolean isAssignedTo(String tenant) {
        return status == InstanceStatus.ASSIGNED && tenant != null && tenant.equals(tenantId);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .privateIp(privateIp)
                .publicIp(publicIp)
                .subnetId(subnetId)
                .tenantId(tenantId)
                .tenantKey(tenantKey)
                .secretName(secretName)
                .launchedAt(launchedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private InstanceStatus status = InstanceStatus.INITIALIZING;
        private String privateIp;
        private String publicIp;
        private String subnetId;
        private String tenantId;
        private String tenantKey;
        private String secretName;
        private Instant launchedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(InstanceStatus status) {
            this.status = status;
            return this;
        }

        public Builder privateIp(String privateIp) {
            this.privateIp = privateIp;
            return this;
        }

        public Builder publicIp(String publicIp) {
            this.publicIp = publicIp;
            return this;
        }

        public Builder subnetId(String subnetId) {
            this.subnetId = subnetId;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder tenantKey(String tenantKey) {
            this.tenantKey = tenantKey;
            return this;
        }

        public Builder secretName(String secretName) {
            this.secretName = secretName;
            return this;
        }

        public Builder launchedAt(Instant launchedAt) {
            this.launchedAt = launchedAt;
            return this;
        }

        public PoolInstance build() {
            return new PoolInstance(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PoolInstance other))
            return false;
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "PoolInstance{id='" + id + "', status=" + status
                + (tenantId == null ? "" : ", tenant=" + tenantId) + "}";
    }
}
