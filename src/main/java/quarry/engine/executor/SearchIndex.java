package quarry.engine.executor;

import java.io.IOException;

/**
 * Full-text index over crawled documents.
 */
public interface SearchIndex {

    /**
     * Rebuild an index.
     *
     * @return number of documents indexed
     * @throws IOException on a transient index failure; the step is retried
     */
    int rebuild(String index, boolean fullRebuild) throws IOException;
}
