package quarry.engine.model;

/**
 * A lifecycle request that is not valid for the job's current state.
 */
public class JobStateException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        STILL_RUNNING,
        NOT_TERMINAL,
        ALREADY_TERMINAL,
        ALREADY_EXISTS
    }

    private final String jobId;
    private final Reason reason;

    public JobStateException(String jobId, Reason reason, String message) {
        super(message);
        this.jobId = jobId;
        this.reason = reason;
    }

    public static JobStateException notFound(String jobId) {
        return new JobStateException(jobId, Reason.NOT_FOUND, "Job not found: " + jobId);
    }

    public String jobId() {
        return jobId;
    }

    public Reason reason() {
        return reason;
    }
}
