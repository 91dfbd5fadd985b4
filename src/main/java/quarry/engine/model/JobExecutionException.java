package quarry.engine.model;

/**
 * Thrown by job handlers. Tagged retryable or terminal so the worker pool
 * knows whether to let the lease expire or to fail the job right away.
 */
public class JobExecutionException extends Exception {

    private final ErrorKind kind;

    public JobExecutionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public JobExecutionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static JobExecutionException retryable(String message, Throwable cause) {
        return new JobExecutionException(ErrorKind.TRANSIENT, message, cause);
    }

    public static JobExecutionException retryable(String message) {
        return new JobExecutionException(ErrorKind.TRANSIENT, message);
    }

    public static JobExecutionException invalid(String message) {
        return new JobExecutionException(ErrorKind.VALIDATION, message);
    }

    public static JobExecutionException fatal(String message, Throwable cause) {
        return new JobExecutionException(ErrorKind.FATAL, message, cause);
    }

    public static JobExecutionException cancelled(String jobId) {
        return new JobExecutionException(ErrorKind.CANCELLED, "Job " + jobId + " was cancelled");
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == ErrorKind.TRANSIENT;
    }
}
