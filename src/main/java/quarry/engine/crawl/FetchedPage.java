package quarry.engine.crawl;

import java.util.List;

/**
 * A fetched and parsed page.
 *
 * @param url     final url of the page
 * @param title   page title, may be empty
 * @param content extracted text content
 * @param links   absolute outgoing links
 */
public record FetchedPage(String url, String title, String content, List<String> links) {

    public FetchedPage {
        title = title != null ? title : "";
        content = content != null ? content : "";
        links = links != null ? List.copyOf(links) : List.of();
    }
}
