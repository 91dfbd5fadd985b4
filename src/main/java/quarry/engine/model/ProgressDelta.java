package quarry.engine.model;

/**
 * A signed change applied atomically to a parent's progress counters.
 */
public record ProgressDelta(int total, int pending, int running, int completed, int failed, int cancelled) {

    public static final ProgressDelta NONE = new ProgressDelta(0, 0, 0, 0, 0, 0);

    /** A new child was created in PENDING */
    public static ProgressDelta childCreated() {
        return new ProgressDelta(1, 1, 0, 0, 0, 0);
    }

    /** A child moved from one status to another */
    public static ProgressDelta transition(JobStatus from, JobStatus to) {
        int[] d = new int[5];
        d[bucket(from)]--;
        d[bucket(to)]++;
        return new ProgressDelta(0, d[0], d[1], d[2], d[3], d[4]);
    }

    public boolean isZero() {
        return total == 0 && pending == 0 && running == 0 && completed == 0 && failed == 0 && cancelled == 0;
    }

    private static int bucket(JobStatus status) {
        return switch (status) {
            case PENDING -> 0;
            case RUNNING -> 1;
            case COMPLETED -> 2;
            case FAILED -> 3;
            case CANCELLED -> 4;
        };
    }
}
