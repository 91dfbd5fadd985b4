package quarry.engine.service;

import quarry.engine.event.EngineEvent;
import quarry.engine.event.EventPublisher;
import quarry.engine.model.Job;
import quarry.engine.model.JobFilter;
import quarry.engine.model.JobGroup;
import quarry.engine.model.JobLogEntry;
import quarry.engine.model.JobPage;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStateException;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobTreeNode;
import quarry.engine.model.ProgressDelta;
import quarry.engine.repository.JobLogStore;
import quarry.engine.repository.JobStore;
import quarry.engine.util.Errors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Job hierarchy manager: creates Manager→Step→Work trees, moves jobs through
 * their lifecycle, and exposes list/tree/log reads.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private static final int LOG_LIMIT = 1000;

    private final JobStore store;
    private final JobLogStore logs;
    private final EventPublisher events;
    private final List<JobCompletionListener> completionListeners = new CopyOnWriteArrayList<>();

    public JobService(JobStore store, JobLogStore logs, EventPublisher events) {
        this.store = store;
        this.logs = logs;
        this.events = events;
    }

    /**
     * Register a listener for terminal transitions. Called while wiring the engine.
     */
    public void addCompletionListener(JobCompletionListener listener) {
        completionListeners.add(listener);
    }

    // --- Creation ---

    /**
     * Create a job in PENDING state.
     *
     * @return true if created, false if it already existed (idempotent replay)
     */
    public boolean createJob(Job job) {
        if (job.parentId() != null && job.parentId().equals(job.id())) {
            throw new IllegalArgumentException("Job cannot be its own parent: " + job.id());
        }
        boolean created = store.create(job);
        if (created) {
            log.debug("Created job {} type={} parent={}", job.id(), job.type(), job.parentId());
            events.publish(EngineEvent.of(EngineEvent.Type.JOB_CREATED, job.id(),
                    Map.of("type", job.type(), "depth", job.depth())));
        }
        return created;
    }

    /**
     * Create a child under {@code parent}. The child inherits the tree root and
     * sits one level deeper.
     */
    public Job createChild(Job parent, String childId, String type, String name, Map<String, Object> config) {
        Job child = Job.builder()
                .id(childId)
                .parentId(parent.id())
                .managerId(parent.rootId())
                .type(type)
                .name(name)
                .config(config)
                .depth(parent.depth() + 1)
                .createdAt(Instant.now())
                .build();
        createJob(child);
        return child;
    }

    // --- Reads ---

    public Optional<JobSnapshot> getJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        return store.find(jobId);
    }

    public JobSnapshot requireJob(String jobId) {
        return getJob(jobId).orElseThrow(() -> JobStateException.notFound(jobId));
    }

    public JobPage listJobs(JobFilter filter) {
        return store.list(filter);
    }

    public List<JobSnapshot> listChildren(String parentId) {
        return store.listChildren(parentId);
    }

    /**
     * Root jobs matching the filter, each with a status summary of everything beneath it.
     */
    public List<JobGroup> listGrouped(JobFilter filter) {
        JobPage roots = store.list(filter.toBuilder().rootsOnly().build());
        List<JobGroup> groups = new ArrayList<>();
        for (JobSnapshot root : roots.items()) {
            Map<JobStatus, Integer> counts = store.countByStatusUnder(root.id());
            int total = counts.values().stream().mapToInt(Integer::intValue).sum();
            groups.add(new JobGroup(root, new JobGroup.ChildSummary(total, counts)));
        }
        return groups;
    }

    public JobTreeNode getTree(String jobId) {
        return buildTree(requireJob(jobId));
    }

    private JobTreeNode buildTree(JobSnapshot node) {
        List<JobTreeNode> children = new ArrayList<>();
        for (JobSnapshot child : store.listChildren(node.id())) {
            children.add(buildTree(child));
        }
        return new JobTreeNode(node, children);
    }

    // --- Lifecycle ---

    /**
     * Compare-and-swap a job's status. Parent counters move in the same transaction.
     *
     * @return true if this call performed the transition
     */
    public boolean updateStatus(String jobId, JobStatus from, JobStatus to, String error) {
        String text = error != null ? Errors.truncate(error) : null;
        if (to == JobStatus.FAILED && text == null) {
            text = "unknown error";
        }
        if (!store.transition(jobId, from, to, text)) {
            return false;
        }

        log.debug("Job {} {} -> {}", jobId, from, to);
        logs.append(jobId, to == JobStatus.FAILED ? JobLogEntry.Level.ERROR : JobLogEntry.Level.INFO,
                text != null ? "Status " + from + " -> " + to + ": " + text : "Status " + from + " -> " + to);
        events.publish(EngineEvent.of(EngineEvent.Type.JOB_STATUS_CHANGED, jobId,
                Map.of("from", from.name(), "to", to.name())));

        if (to.isTerminal()) {
            store.find(jobId).ifPresent(snapshot -> {
                publishParentProgress(snapshot.job());
                notifyFinished(snapshot.job(), to);
            });
        }
        return true;
    }

    public boolean start(String jobId) {
        return updateStatus(jobId, JobStatus.PENDING, JobStatus.RUNNING, null);
    }

    public boolean complete(String jobId) {
        return updateStatus(jobId, JobStatus.RUNNING, JobStatus.COMPLETED, null);
    }

    /**
     * Fail a job. A PENDING job is first moved to RUNNING so that only legal edges are used.
     *
     * @return true if this call failed the job
     */
    public boolean fail(String jobId, String error) {
        Optional<JobSnapshot> snapshot = store.find(jobId);
        if (snapshot.isEmpty() || snapshot.get().state().isTerminal()) {
            return false;
        }
        if (snapshot.get().status() == JobStatus.PENDING) {
            start(jobId);
        }
        boolean failed = updateStatus(jobId, JobStatus.RUNNING, JobStatus.FAILED, error);
        if (failed) {
            log.warn("Job {} failed: {}", jobId, Errors.truncate(error));
        }
        return failed;
    }

    /**
     * Cancel a job and every non-terminal job beneath it.
     *
     * @return true if the job itself was cancelled by this call; false if it was already terminal
     */
    public boolean cancel(String jobId) {
        JobSnapshot snapshot = requireJob(jobId);
        if (snapshot.state().isTerminal()) {
            log.warn("Cannot cancel job {} - already {}", jobId, snapshot.status());
            return false;
        }

        // Root first so that probes and handlers see the cancellation before children stop
        boolean cancelled = cancelOne(snapshot);
        int children = 0;
        for (String id : store.listDescendantIds(jobId)) {
            Optional<JobSnapshot> child = store.find(id);
            if (child.isPresent() && !child.get().state().isTerminal() && cancelOne(child.get())) {
                children++;
            }
        }
        log.info("Cancelled job {} ({} descendants)", jobId, children);
        return cancelled;
    }

    private boolean cancelOne(JobSnapshot snapshot) {
        if (snapshot.status() == JobStatus.PENDING) {
            start(snapshot.id());
        }
        return updateStatus(snapshot.id(), JobStatus.RUNNING, JobStatus.CANCELLED, "cancelled");
    }

    /**
     * Cooperative cancellation check: the job itself, its parent or its root was cancelled.
     */
    public boolean isCancelled(Job job) {
        if (statusOf(job.id()) == JobStatus.CANCELLED) {
            return true;
        }
        if (job.parentId() != null && statusOf(job.parentId()) == JobStatus.CANCELLED) {
            return true;
        }
        return job.managerId() != null && !job.managerId().equals(job.parentId())
                && statusOf(job.managerId()) == JobStatus.CANCELLED;
    }

    private JobStatus statusOf(String jobId) {
        return store.find(jobId).map(JobSnapshot::status).orElse(null);
    }

    /**
     * Re-run completion listeners for a job that is already terminal, after a
     * redelivered message found it finished.
     */
    public void replayFinished(JobSnapshot snapshot) {
        if (snapshot.state().isTerminal()) {
            notifyFinished(snapshot.job(), snapshot.status());
        }
    }

    private void notifyFinished(Job job, JobStatus status) {
        for (JobCompletionListener listener : completionListeners) {
            listener.onFinished(job, status);
        }
    }

    private void publishParentProgress(Job job) {
        if (job.parentId() == null) {
            return;
        }
        store.find(job.parentId()).ifPresent(parent -> events.publish(EngineEvent.of(
                EngineEvent.Type.JOB_PROGRESS, parent.id(),
                Map.of("progress_text", parent.state().progress().progressText(),
                        "total", parent.state().progress().total(),
                        "completed", parent.state().progress().completed(),
                        "failed", parent.state().progress().failed()))));
    }

    // --- Counters, heartbeat, results ---

    public void incrementProgress(String jobId, ProgressDelta delta) {
        store.incrementProgress(jobId, delta);
    }

    public void heartbeat(String jobId) {
        store.touchHeartbeat(jobId);
    }

    public void recordResult(String jobId, String resultJson, int resultCount) {
        store.recordResult(jobId, resultJson, resultCount);
    }

    public void markPossiblyIncomplete(String jobId) {
        store.markPossiblyIncomplete(jobId);
        logs.append(jobId, JobLogEntry.Level.WARN, "Completed by max-age guard; results may be incomplete");
    }

    // --- Logs ---

    public void log(String jobId, JobLogEntry.Level level, String message) {
        logs.append(jobId, level, message);
    }

    public List<JobLogEntry> getLogs(String jobId) {
        return logs.findByJob(jobId, LOG_LIMIT);
    }

    /**
     * Logs of a job and all its descendants, merged in time order.
     */
    public List<JobLogEntry> getAggregatedLogs(String jobId) {
        List<String> ids = new ArrayList<>();
        ids.add(jobId);
        ids.addAll(store.listDescendantIds(jobId));
        return logs.findByJobs(ids, LOG_LIMIT);
    }

    // --- Deletion ---

    /**
     * Delete a job with its descendants, logs and dedup records.
     *
     * @return number of jobs deleted
     * @throws JobStateException if the job or a descendant is still running
     */
    public int deleteJob(String jobId) {
        JobSnapshot snapshot = requireJob(jobId);
        if (snapshot.status() == JobStatus.RUNNING) {
            throw new JobStateException(jobId, JobStateException.Reason.STILL_RUNNING,
                    "Cannot delete running job: " + jobId);
        }
        for (String id : store.listDescendantIds(jobId)) {
            if (statusOf(id) == JobStatus.RUNNING) {
                throw new JobStateException(jobId, JobStateException.Reason.STILL_RUNNING,
                        "Cannot delete job " + jobId + ": descendant " + id + " is running");
            }
        }

        int deleted = store.deleteTree(jobId);
        log.info("Deleted job {} ({} jobs removed)", jobId, deleted);
        events.publish(EngineEvent.of(EngineEvent.Type.JOB_DELETED, jobId, Map.of("count", deleted)));
        return deleted;
    }
}
