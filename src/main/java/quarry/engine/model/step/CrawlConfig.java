package quarry.engine.model.step;

import com.fasterxml.jackson.annotation.JsonProperty;
import quarry.engine.model.JobValidationException;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Crawl step: fan out one work job per seed URL, following discovered links
 * up to {@code max_depth}.
 */
public record CrawlConfig(
        @JsonProperty("start_urls") List<String> startUrls,
        @JsonProperty("include_patterns") List<String> includePatterns,
        @JsonProperty("exclude_patterns") List<String> excludePatterns,
        @JsonProperty("max_depth") Integer maxDepth,
        @JsonProperty("max_pages") Integer maxPages,
        @JsonProperty("follow_links") Boolean followLinks) implements StepConfig {

    public static final String ACTION = "crawl";

    public CrawlConfig {
        startUrls = startUrls != null ? List.copyOf(startUrls) : List.of();
        includePatterns = includePatterns != null ? List.copyOf(includePatterns) : List.of();
        excludePatterns = excludePatterns != null ? List.copyOf(excludePatterns) : List.of();
        maxDepth = maxDepth != null ? maxDepth : 2;
        maxPages = maxPages != null ? maxPages : 100;
        followLinks = followLinks != null ? followLinks : Boolean.TRUE;
    }

    @Override
    public String action() {
        return ACTION;
    }

    @Override
    public void validate() {
        if (startUrls.isEmpty()) {
            throw new JobValidationException("crawl: start_urls must not be empty");
        }
        for (String url : startUrls) {
            if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
                throw new JobValidationException("crawl: not an http(s) url: " + url);
            }
        }
        if (maxDepth < 0) {
            throw new JobValidationException("crawl: max_depth must be >= 0");
        }
        if (maxPages <= 0) {
            throw new JobValidationException("crawl: max_pages must be > 0");
        }
        try {
            includePatterns.forEach(Pattern::compile);
            excludePatterns.forEach(Pattern::compile);
        } catch (PatternSyntaxException e) {
            throw new JobValidationException("crawl: invalid pattern: " + e.getPattern(), e);
        }
    }

    /** True if the url passes the include/exclude filters */
    public boolean accepts(String url) {
        for (String exclude : excludePatterns) {
            if (Pattern.compile(exclude).matcher(url).find()) {
                return false;
            }
        }
        if (includePatterns.isEmpty()) {
            return true;
        }
        for (String include : includePatterns) {
            if (Pattern.compile(include).matcher(url).find()) {
                return true;
            }
        }
        return false;
    }
}
