package quarry.engine.executor;

import quarry.engine.model.JobExecutionException;
import quarry.engine.model.step.ReindexConfig;
import quarry.engine.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Inline step: rebuild the search index.
 */
public class ReindexStepAction implements StepAction {

    private static final Logger log = LoggerFactory.getLogger(ReindexStepAction.class);

    public static final String TYPE = "indexer";

    private final SearchIndex index;
    private final JobService jobService;

    public ReindexStepAction(SearchIndex index, JobService jobService) {
        this.index = index;
        this.jobService = jobService;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String action() {
        return ReindexConfig.ACTION;
    }

    @Override
    public StepOutcome run(StepContext context) throws JobExecutionException {
        ReindexConfig config = context.config(ReindexConfig.class);
        try {
            int documents = index.rebuild(config.index(), config.fullRebuild());
            jobService.recordResult(context.step().id(), null, documents);
            context.info("Rebuilt index " + config.index() + ": " + documents + " documents");
            log.info("Rebuilt index {} for {} ({} documents)", config.index(), context.managerId(), documents);
            return StepOutcome.COMPLETED;
        } catch (IOException e) {
            throw JobExecutionException.retryable("Index rebuild failed: " + e.getMessage(), e);
        }
    }
}
