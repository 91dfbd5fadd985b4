package quarry.engine.model;

import java.util.Map;

/**
 * A root job with a status breakdown of all jobs beneath it, for grouped tree display.
 */
public record JobGroup(JobSnapshot root, ChildSummary children) {

    public record ChildSummary(int total, Map<JobStatus, Integer> byStatus) {

        public int count(JobStatus status) {
            return byStatus.getOrDefault(status, 0);
        }
    }
}
