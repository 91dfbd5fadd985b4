package quarry.engine.model;

/**
 * Invalid job definition, step config or execution request.
 * Raised before anything is executed.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
