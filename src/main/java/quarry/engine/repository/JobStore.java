package quarry.engine.repository;

import quarry.engine.model.Job;
import quarry.engine.model.JobFilter;
import quarry.engine.model.JobPage;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.model.ProgressDelta;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for jobs and their runtime state.
 * All counter and status changes are single atomic statements or
 * compare-and-swap updates; callers never read-then-write.
 */
public interface JobStore {

    /**
     * Create a job in PENDING state. If the job has a parent, the parent's
     * (and manager's) total/pending counters are incremented in the same
     * transaction and the parent heartbeat is touched.
     *
     * @param job the job to create
     * @return true if created, false if a job with this id already exists
     */
    boolean create(Job job);

    /**
     * Find a job with its state.
     *
     * @param jobId the job ID
     * @return the snapshot if found
     */
    Optional<JobSnapshot> find(String jobId);

    /**
     * List jobs matching the filter, newest first.
     *
     * @param filter filter and pagination options
     * @return one page plus the total match count
     */
    JobPage list(JobFilter filter);

    /**
     * Direct children of a job, oldest first.
     *
     * @param parentId the parent job ID
     * @return children with their state
     */
    List<JobSnapshot> listChildren(String parentId);

    /**
     * Ids of all descendants of a job (not including the job itself).
     *
     * @param jobId the subtree root
     * @return descendant ids, parents before children
     */
    List<String> listDescendantIds(String jobId);

    /**
     * Count all jobs under a manager by status.
     *
     * @param managerId the root job ID
     * @return counts per status (missing statuses have no entry)
     */
    Map<JobStatus, Integer> countByStatusUnder(String managerId);

    /**
     * Compare-and-swap a job's status. On success the parent's and manager's
     * progress counters are moved from the old bucket to the new one in the
     * same transaction.
     *
     * @param jobId the job ID
     * @param from  expected current status
     * @param to    new status; must be a legal edge from {@code from}
     * @param error error text for terminal failures, or null
     * @return true if this call performed the transition
     */
    boolean transition(String jobId, JobStatus from, JobStatus to, String error);

    /**
     * Atomically add a delta to a job's progress counters.
     *
     * @param jobId the job ID
     * @param delta signed counter changes
     */
    void incrementProgress(String jobId, ProgressDelta delta);

    /**
     * Set last_heartbeat to now.
     *
     * @param jobId the job ID
     */
    void touchHeartbeat(String jobId);

    /**
     * Store a handler result.
     *
     * @param jobId       the job ID
     * @param resultJson  JSON result, may be null
     * @param resultCount number of produced items
     */
    void recordResult(String jobId, String resultJson, int resultCount);

    /**
     * Flag a job as force-completed by the probe's max-age guard.
     *
     * @param jobId the job ID
     */
    void markPossiblyIncomplete(String jobId);

    /**
     * Delete a job and all its descendants, their logs and crawl dedup records.
     *
     * @param jobId the subtree root
     * @return number of jobs deleted
     */
    int deleteTree(String jobId);

    /**
     * Root jobs in a terminal state whose completion is older than the cutoff.
     *
     * @param cutoff completed_at upper bound
     * @param limit  maximum number of ids
     * @return root job ids
     */
    List<String> findExpiredRoots(Instant cutoff, int limit);
}
