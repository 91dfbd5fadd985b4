package quarry.engine.repository;

import quarry.engine.model.JobLogEntry;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for per-job log lines.
 */
public interface JobLogStore {

    void append(String jobId, JobLogEntry.Level level, String message);

    /**
     * Logs of one job, oldest first.
     */
    List<JobLogEntry> findByJob(String jobId, int limit);

    /**
     * Logs of several jobs merged in time order, oldest first.
     */
    List<JobLogEntry> findByJobs(Collection<String> jobIds, int limit);
}
