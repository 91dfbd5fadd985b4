package quarry.engine.model;

/**
 * Failure categories and how the engine reacts to each.
 */
public enum ErrorKind {
    /** Network or storage blip; retried through queue redelivery with backoff */
    TRANSIENT,
    /** Bad config or missing dependency; fails fast, never retried */
    VALIDATION,
    /** Unrecoverable handler error; fails the job immediately */
    FATAL,
    /** Message exceeded its redelivery budget */
    DEAD_LETTERED,
    /** Handler ran past its deadline */
    TIMEOUT,
    /** Job or one of its ancestors was cancelled */
    CANCELLED
}
