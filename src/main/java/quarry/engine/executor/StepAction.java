package quarry.engine.executor;

import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobStep;

/**
 * Implementation of one (step type, action) pair.
 */
public interface StepAction {

    /** Step type this action belongs to, e.g. "crawler" */
    String type();

    /** Action name, matching the step config's {@code action} */
    String action();

    /**
     * Run the step. Inline actions do their work and return COMPLETED;
     * fan-out actions spawn work jobs and return FANNED_OUT.
     */
    StepOutcome run(StepContext context) throws JobExecutionException;

    /**
     * Last check before the step is marked completed, after all its work jobs
     * finished. An action can turn the completion into a failure here.
     */
    default StepVerdict settle(Job step, JobStep definition) {
        return StepVerdict.ok();
    }
}
