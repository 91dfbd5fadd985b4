package quarry.engine.scheduler;

import quarry.engine.config.EngineConfig;
import quarry.engine.model.JobStateException;
import quarry.engine.repository.JobStore;
import quarry.engine.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Background task that deletes finished job trees past the retention age.
 *
 * Only terminal root jobs are considered. A tree with a descendant still
 * running is skipped and picked up by a later sweep.
 */
public class RetentionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionReaper.class);

    private static final int BATCH_SIZE = 500;

    private final JobStore jobStore;
    private final JobService jobService;
    private final EngineConfig config;

    public RetentionReaper(JobStore jobStore, JobService jobService, EngineConfig config) {
        this.jobStore = jobStore;
        this.jobService = jobService;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            sweep(false);
        } catch (Exception e) {
            log.error("Retention reaper error", e);
        }
    }

    /**
     * Find and delete expired job trees.
     *
     * @param dryRun report what would be deleted without deleting anything
     */
    public RetentionReport sweep(boolean dryRun) {
        Instant cutoff = Instant.now().minus(config.retentionAge());
        List<String> expired = jobStore.findExpiredRoots(cutoff, BATCH_SIZE);

        if (expired.isEmpty()) {
            log.debug("No expired jobs before {}", cutoff);
            return new RetentionReport(List.of(), dryRun, 0);
        }
        if (dryRun) {
            log.info("Retention dry run: {} root jobs older than {} would be deleted", expired.size(), cutoff);
            return new RetentionReport(expired, true, 0);
        }

        List<String> swept = new ArrayList<>();
        int deleted = 0;
        for (String rootId : expired) {
            try {
                deleted += jobService.deleteJob(rootId);
                swept.add(rootId);
            } catch (JobStateException e) {
                log.warn("Retention skipped {}: {}", rootId, e.getMessage());
            } catch (Exception e) {
                log.error("Failed to delete expired job {}", rootId, e);
            }
        }

        log.info("Retention reaper: {} roots, {} jobs deleted", swept.size(), deleted);
        return new RetentionReport(swept, false, deleted);
    }
}
