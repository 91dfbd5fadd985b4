package quarry.engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one unit of work.
 * Runtime data (status, counters, timestamps) lives in {@link JobState}.
 */
public final class Job {
    private final String id;
    private final String parentId;
    private final String managerId;
    private final String type;
    private final String name;
    private final Map<String, Object> config;
    private final int depth;
    private final Instant createdAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.parentId = builder.parentId;
        this.managerId = builder.managerId;
        this.name = builder.name != null ? builder.name : builder.type;
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(builder.config));
        this.depth = builder.depth;
        this.createdAt = builder.createdAt;
    }

    public String id() {
        return id;
    }

    public String parentId() {
        return parentId;
    }

    /** Root of the whole tree; null for the root itself */
    public String managerId() {
        return managerId;
    }

    public String type() {
        return type;
    }

    public String name() {
        return name;
    }

    public Map<String, Object> config() {
        return config;
    }

    public int depth() {
        return depth;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /** Id of the tree root: the manager id, or this job's id when it is the root */
    public String rootId() {
        return managerId != null ? managerId : id;
    }

    public String configString(String key) {
        Object value = config.get(key);
        return value != null ? value.toString() : null;
    }

    public int configInt(String key, int defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            return Integer.parseInt(s.trim());
        }
        return defaultValue;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .parentId(parentId)
                .managerId(managerId)
                .type(type)
                .name(name)
                .config(config)
                .depth(depth)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String parentId;
        private String managerId;
        private String type;
        private String name;
        private Map<String, Object> config = Map.of();
        private int depth;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder managerId(String managerId) {
            this.managerId = managerId;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config != null ? config : Map.of();
            return this;
        }

        public Builder depth(int depth) {
            this.depth = depth;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return id.equals(job.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", parentId='" + parentId + '\'' +
                ", depth=" + depth +
                '}';
    }
}
