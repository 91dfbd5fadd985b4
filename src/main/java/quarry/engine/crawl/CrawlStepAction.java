package quarry.engine.crawl;

import quarry.engine.executor.StepAction;
import quarry.engine.executor.StepContext;
import quarry.engine.executor.StepOutcome;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.step.CrawlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out step: one crawl job per seed URL.
 */
public class CrawlStepAction implements StepAction {

    private static final Logger log = LoggerFactory.getLogger(CrawlStepAction.class);

    public static final String TYPE = "crawler";

    private final CrawlFrontier frontier;

    public CrawlStepAction(CrawlFrontier frontier) {
        this.frontier = frontier;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String action() {
        return CrawlConfig.ACTION;
    }

    @Override
    public StepOutcome run(StepContext context) throws JobExecutionException {
        CrawlConfig config = context.config(CrawlConfig.class);
        int spawned = 0;
        for (String url : config.startUrls()) {
            context.throwIfCancelled();
            if (frontier.offer(context.step(), config, url, 0)) {
                spawned++;
            }
        }
        context.info("Queued " + spawned + " of " + config.startUrls().size() + " seed urls");
        log.info("Crawl step {} queued {} seeds", context.step().id(), spawned);
        return StepOutcome.FANNED_OUT;
    }
}
