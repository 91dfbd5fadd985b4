package quarry.engine.model;

import java.util.List;

/**
 * A job and its children, recursively.
 */
public record JobTreeNode(JobSnapshot job, List<JobTreeNode> children) {

    /** Number of nodes in this subtree, including this one */
    public int size() {
        int n = 1;
        for (JobTreeNode child : children) {
            n += child.size();
        }
        return n;
    }
}
