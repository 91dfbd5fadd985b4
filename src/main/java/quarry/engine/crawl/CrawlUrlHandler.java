package quarry.engine.crawl;

import quarry.engine.executor.JobExecutor;
import quarry.engine.model.Job;
import quarry.engine.model.JobExecutionException;
import quarry.engine.model.JobTypes;
import quarry.engine.model.step.CrawlConfig;
import quarry.engine.model.step.StepConfig;
import quarry.engine.service.JobService;
import quarry.engine.util.Json;
import quarry.engine.worker.HandlerResult;
import quarry.engine.worker.JobContext;
import quarry.engine.worker.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches one URL, stores the page and offers its links to the frontier.
 * Settings come from the parent crawl step.
 */
public class CrawlUrlHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(CrawlUrlHandler.class);

    private final JobService jobService;
    private final JobExecutor executor;
    private final PageFetcher fetcher;
    private final DocumentSink sink;
    private final CrawlFrontier frontier;

    public CrawlUrlHandler(JobService jobService,
            JobExecutor executor,
            PageFetcher fetcher,
            DocumentSink sink,
            CrawlFrontier frontier) {
        this.jobService = jobService;
        this.executor = executor;
        this.fetcher = fetcher;
        this.sink = sink;
        this.frontier = frontier;
    }

    @Override
    public String type() {
        return JobTypes.CRAWL_URL;
    }

    @Override
    public HandlerResult handle(JobContext context) throws JobExecutionException {
        Job job = context.job();
        String url = job.configString(CrawlFrontier.URL);
        int depth = job.configInt(CrawlFrontier.CRAWL_DEPTH, 0);
        if (url == null || job.parentId() == null) {
            throw JobExecutionException.invalid("Crawl job " + job.id() + " has no url or parent step");
        }
        Job step = jobService.requireJob(job.parentId()).job();
        StepConfig stepConfig = executor.stepDefinitionOf(step).config();
        if (!(stepConfig instanceof CrawlConfig config)) {
            throw JobExecutionException.invalid("Parent " + step.id() + " is not a crawl step");
        }

        context.throwIfCancelled();
        FetchedPage page;
        try {
            page = fetcher.fetch(url);
            sink.save(job.id(), page);
        } catch (IOException e) {
            throw JobExecutionException.retryable("Fetch failed for " + url + ": " + e.getMessage(), e);
        }

        int queued = 0;
        if (config.followLinks() && depth < config.maxDepth()) {
            for (String link : page.links()) {
                context.throwIfCancelled();
                if (frontier.offer(step, config, link, depth + 1)) {
                    queued++;
                }
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("url", page.url());
        result.put("title", page.title());
        result.put("links", page.links().size());
        result.put("queued", queued);
        jobService.recordResult(job.id(), Json.write(result), 1);
        context.info("Fetched " + url + ": " + page.links().size() + " links, " + queued + " queued");
        log.debug("Crawled {} depth={} queued={}", url, depth, queued);
        return HandlerResult.complete();
    }
}
