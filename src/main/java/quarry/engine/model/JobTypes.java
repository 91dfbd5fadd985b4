package quarry.engine.model;

/**
 * Job and message type names used by the built-in handlers.
 */
public final class JobTypes {

    private JobTypes() {
    }

    public static final String MANAGER = "manager";
    public static final String STEP = "step";

    public static final String CRAWL_URL = "crawl_url";

    public static final String PLANNING = "orchestrator_planning";
    public static final String TOOL_EXECUTION = "tool_execution";
    public static final String WAIT = "orchestrator_wait";
    public static final String REVIEW = "orchestrator_review";

    /** Message-only type; the probe message carries no job of its own */
    public static final String COMPLETION_PROBE = "completion_probe";

    public static final int MANAGER_DEPTH = 0;
    public static final int STEP_DEPTH = 1;
    public static final int WORK_DEPTH = 2;
}
