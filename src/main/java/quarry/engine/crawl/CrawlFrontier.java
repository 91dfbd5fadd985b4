package quarry.engine.crawl;

import quarry.engine.model.Job;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobTypes;
import quarry.engine.model.step.CrawlConfig;
import quarry.engine.repository.DedupStore;
import quarry.engine.service.JobService;
import quarry.engine.util.JobIds;
import quarry.engine.worker.JobSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Turns URLs into crawl work jobs under a crawl step, at most once per URL.
 */
public class CrawlFrontier {

    private static final Logger log = LoggerFactory.getLogger(CrawlFrontier.class);

    static final String URL = "url";
    static final String CRAWL_DEPTH = "crawl_depth";

    private final DedupStore dedup;
    private final JobService jobService;
    private final JobSpawner spawner;

    public CrawlFrontier(DedupStore dedup, JobService jobService, JobSpawner spawner) {
        this.dedup = dedup;
        this.jobService = jobService;
        this.spawner = spawner;
    }

    /**
     * Spawn a crawl job for {@code url} unless it is filtered out, already
     * spawned, or the step's page budget is used up.
     *
     * @return true if a job was spawned
     */
    public boolean offer(Job step, CrawlConfig config, String url, int depth) {
        if (url == null || !config.accepts(url)) {
            return false;
        }
        String childId = JobIds.child(step.id(), url);

        Optional<JobSnapshot> existing = jobService.getJob(childId);
        if (existing.isPresent()) {
            // A handler re-run may find the job created but never queued
            if (existing.get().status() == JobStatus.PENDING) {
                spawner.enqueue(existing.get().job(), Duration.ZERO);
            }
            return false;
        }

        if (dedup.countSeen(step.id()) >= config.maxPages()) {
            log.debug("Crawl {} reached max_pages {}; skipping {}", step.id(), config.maxPages(), url);
            return false;
        }
        if (!dedup.markSeen(step.id(), url)) {
            log.debug("Recovering spawn of {} under {}", url, step.id());
        }

        Map<String, Object> childConfig = new LinkedHashMap<>();
        childConfig.put(URL, url);
        childConfig.put(CRAWL_DEPTH, depth);
        spawner.spawn(step, childId, JobTypes.CRAWL_URL, url, childConfig);
        return true;
    }
}
