package quarry.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Mutable runtime state of a job, read as an immutable snapshot.
 */
public final class JobState {
    private final String jobId;
    private final JobStatus status;
    private final JobProgress progress;
    private final Instant startedAt;
    private final Instant completedAt;
    private final String error;
    private final int resultCount;
    private final String result; // JSON
    private final Instant lastHeartbeat;
    private final boolean possiblyIncomplete;

    private JobState(Builder builder) {
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progress = builder.progress != null ? builder.progress : JobProgress.EMPTY;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.error = builder.error;
        this.resultCount = builder.resultCount;
        this.result = builder.result;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.possiblyIncomplete = builder.possiblyIncomplete;
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus status() {
        return status;
    }

    public JobProgress progress() {
        return progress;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public String error() {
        return error;
    }

    public int resultCount() {
        return resultCount;
    }

    public String result() {
        return result;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    /** Set when the completion probe force-completed the job after its max age */
    public boolean possiblyIncomplete() {
        return possiblyIncomplete;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static JobState pending(String jobId, Instant now) {
        return builder().jobId(jobId).status(JobStatus.PENDING).lastHeartbeat(now).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String jobId;
        private JobStatus status = JobStatus.PENDING;
        private JobProgress progress = JobProgress.EMPTY;
        private Instant startedAt;
        private Instant completedAt;
        private String error;
        private int resultCount;
        private String result;
        private Instant lastHeartbeat;
        private boolean possiblyIncomplete;

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder progress(JobProgress progress) {
            this.progress = progress;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder resultCount(int resultCount) {
            this.resultCount = resultCount;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder possiblyIncomplete(boolean possiblyIncomplete) {
            this.possiblyIncomplete = possiblyIncomplete;
            return this;
        }

        public JobState build() {
            return new JobState(this);
        }
    }

    @Override
    public String toString() {
        return "JobState{" +
                "jobId='" + jobId + '\'' +
                ", status=" + status +
                ", progress=" + progress.progressText() +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
