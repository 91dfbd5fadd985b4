package quarry.engine.model;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Filter and pagination options for job listing.
 * A parentId of {@value #ROOT} selects jobs without a parent.
 */
public final class JobFilter {

    public static final String ROOT = "root";
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;

    private final String parentId;
    private final String managerId;
    private final Set<JobStatus> statuses;
    private final String type;
    private final Instant createdAfter;
    private final Instant createdBefore;
    private final int limit;
    private final int offset;

    private JobFilter(Builder builder) {
        this.parentId = builder.parentId;
        this.managerId = builder.managerId;
        this.statuses = builder.statuses.isEmpty() ? Set.of() : EnumSet.copyOf(builder.statuses);
        this.type = builder.type;
        this.createdAfter = builder.createdAfter;
        this.createdBefore = builder.createdBefore;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public String parentId() {
        return parentId;
    }

    public boolean rootsOnly() {
        return ROOT.equals(parentId);
    }

    public String managerId() {
        return managerId;
    }

    public Set<JobStatus> statuses() {
        return statuses;
    }

    public String type() {
        return type;
    }

    public Instant createdAfter() {
        return createdAfter;
    }

    public Instant createdBefore() {
        return createdBefore;
    }

    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    public static JobFilter all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .parentId(parentId)
                .managerId(managerId)
                .type(type)
                .createdAfter(createdAfter)
                .createdBefore(createdBefore)
                .limit(limit)
                .offset(offset);
        b.statuses.addAll(statuses);
        return b;
    }

    public static final class Builder {
        private String parentId;
        private String managerId;
        private final Set<JobStatus> statuses = EnumSet.noneOf(JobStatus.class);
        private String type;
        private Instant createdAfter;
        private Instant createdBefore;
        private int limit = DEFAULT_LIMIT;
        private int offset;

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder rootsOnly() {
            this.parentId = ROOT;
            return this;
        }

        public Builder managerId(String managerId) {
            this.managerId = managerId;
            return this;
        }

        public Builder status(JobStatus status) {
            this.statuses.add(status);
            return this;
        }

        /** Single status or comma-separated OR set */
        public Builder statuses(String csv) {
            this.statuses.addAll(JobStatus.parseSet(csv));
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder createdAfter(Instant createdAfter) {
            this.createdAfter = createdAfter;
            return this;
        }

        public Builder createdBefore(Instant createdBefore) {
            this.createdBefore = createdBefore;
            return this;
        }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            this.limit = Math.min(limit, MAX_LIMIT);
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must not be negative");
            }
            this.offset = offset;
            return this;
        }

        public JobFilter build() {
            return new JobFilter(this);
        }
    }
}
