package quarry.engine.config;

import quarry.engine.crawl.DocumentSink;
import quarry.engine.crawl.PageFetcher;
import quarry.engine.executor.SearchIndex;
import quarry.engine.orchestrator.LlmClient;
import quarry.engine.orchestrator.Tool;

import java.util.List;
import java.util.Objects;

/**
 * External systems the engine calls into.
 */
public record Collaborators(
        LlmClient llm,
        PageFetcher pageFetcher,
        DocumentSink documentSink,
        SearchIndex searchIndex,
        List<Tool> tools) {

    public Collaborators {
        Objects.requireNonNull(llm, "llm is required");
        Objects.requireNonNull(pageFetcher, "pageFetcher is required");
        Objects.requireNonNull(documentSink, "documentSink is required");
        Objects.requireNonNull(searchIndex, "searchIndex is required");
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
