package quarry.engine.crawl;

import java.io.IOException;

/**
 * Fetches and parses one page.
 */
public interface PageFetcher {

    /**
     * @throws IOException on network or parse failure; the fetch is retried
     */
    FetchedPage fetch(String url) throws IOException;
}
