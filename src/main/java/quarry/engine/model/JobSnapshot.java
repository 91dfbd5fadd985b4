package quarry.engine.model;

/**
 * A job together with its current state, as read in one query.
 */
public record JobSnapshot(Job job, JobState state) {

    public String id() {
        return job.id();
    }

    public JobStatus status() {
        return state.status();
    }
}
