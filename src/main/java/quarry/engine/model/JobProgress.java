package quarry.engine.model;

/**
 * Aggregated child counters of a parent job.
 */
public record JobProgress(int total, int pending, int running, int completed, int failed, int cancelled) {

    public static final JobProgress EMPTY = new JobProgress(0, 0, 0, 0, 0, 0);

    /** Children not yet in a terminal state */
    public int outstanding() {
        return pending + running;
    }

    public int finished() {
        return completed + failed + cancelled;
    }

    public String progressText() {
        return String.format("%d pending, %d running, %d completed, %d failed", pending, running, completed, failed);
    }
}
