package quarry.engine.repository;

/**
 * Record of URLs already scheduled by a crawl. The scope is the crawl step's
 * job id; records go away when the job tree is deleted.
 */
public interface DedupStore {

    /**
     * Record a URL within a scope.
     *
     * @return true if the URL was not seen before in this scope
     */
    boolean markSeen(String scopeId, String url);

    int countSeen(String scopeId);
}
