package quarry.engine.model;

import java.util.List;

/**
 * One page of a job listing plus the total number of matches.
 */
public record JobPage(List<JobSnapshot> items, int totalCount, int limit, int offset) {

    public boolean hasMore() {
        return offset + items.size() < totalCount;
    }
}
