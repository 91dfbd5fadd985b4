package quarry.engine.executor;

/**
 * Final say of a step action before its step is marked completed.
 */
public record StepVerdict(boolean failed, String error) {

    private static final StepVerdict OK = new StepVerdict(false, null);

    public static StepVerdict ok() {
        return OK;
    }

    public static StepVerdict fail(String error) {
        return new StepVerdict(true, error);
    }
}
