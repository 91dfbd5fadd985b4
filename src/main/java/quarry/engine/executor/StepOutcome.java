package quarry.engine.executor;

/**
 * How a step action left its step.
 */
public enum StepOutcome {
    /** The work is done; the step can complete now */
    COMPLETED,
    /** Work jobs were spawned; the completion probe decides when the step is done */
    FANNED_OUT
}
