package quarry.engine.executor;

import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobStep;
import quarry.engine.model.step.StepConfig;
import quarry.engine.worker.JobContext;
import quarry.engine.worker.JobSpawner;

/**
 * What a {@link StepAction} sees while it runs.
 */
public final class StepContext {

    private final Job step;
    private final JobStep definition;
    private final JobContext jobContext;
    private final JobSpawner spawner;

    public StepContext(Job step, JobStep definition, JobContext jobContext, JobSpawner spawner) {
        this.step = step;
        this.definition = definition;
        this.jobContext = jobContext;
        this.spawner = spawner;
    }

    public Job step() {
        return step;
    }

    public JobStep definition() {
        return definition;
    }

    public <T extends StepConfig> T config(Class<T> type) {
        return type.cast(definition.config());
    }

    public String managerId() {
        return step.rootId();
    }

    public JobSpawner spawner() {
        return spawner;
    }

    public void throwIfCancelled() throws JobExecutionException {
        jobContext.throwIfCancelled();
    }

    public boolean isCancelled() {
        return jobContext.isCancelled();
    }

    public void heartbeat() {
        jobContext.heartbeat();
    }

    public void info(String message) {
        jobContext.info(message);
    }
}
