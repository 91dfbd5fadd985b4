package quarry.engine.scheduler;

import java.util.List;

/**
 * Outcome of one retention sweep.
 *
 * @param rootIds     expired root jobs found
 * @param dryRun      true if nothing was deleted
 * @param deletedJobs jobs removed, descendants included; 0 on a dry run
 */
public record RetentionReport(List<String> rootIds, boolean dryRun, int deletedJobs) {

    public RetentionReport {
        rootIds = List.copyOf(rootIds);
    }
}
