package quarry.engine.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of a job.
 *
 * Allowed edges: PENDING → RUNNING → {COMPLETED, FAILED, CANCELLED}.
 * Terminal states are never left; rerun/copy mint a new job id instead.
 */
public enum JobStatus {
    /** Created, not yet claimed by a worker */
    PENDING,
    /** Claimed by a worker or waiting on its subtree */
    RUNNING,
    /** Finished successfully (possibly with failed children) */
    COMPLETED,
    /** Finished with an error */
    FAILED,
    /** Stopped by an external request */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }

    /**
     * Parse a single status or a comma-separated OR set ("running,failed").
     * Blank input yields an empty set (no filter).
     */
    public static Set<JobStatus> parseSet(String csv) {
        Set<JobStatus> result = EnumSet.noneOf(JobStatus.class);
        if (csv == null || csv.isBlank()) {
            return result;
        }
        for (String part : csv.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                try {
                    result.add(JobStatus.valueOf(trimmed.toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown job status: " + trimmed, e);
                }
            }
        }
        return result;
    }
}
