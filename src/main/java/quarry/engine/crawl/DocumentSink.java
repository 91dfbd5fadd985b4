package quarry.engine.crawl;

import java.io.IOException;

/**
 * Stores crawled pages as documents.
 */
public interface DocumentSink {

    /**
     * Save a page. Saving the same url twice replaces the document.
     *
     * @param jobId the crawl job that fetched the page
     */
    void save(String jobId, FetchedPage page) throws IOException;
}
