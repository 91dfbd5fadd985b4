package quarry.engine.service;

import quarry.engine.model.Job;
import quarry.engine.model.JobStatus;

/**
 * Called after a job reached a terminal state. Listeners must be idempotent:
 * a redelivered message for an already finished job replays the call.
 */
@FunctionalInterface
public interface JobCompletionListener {

    void onFinished(Job job, JobStatus status);
}
