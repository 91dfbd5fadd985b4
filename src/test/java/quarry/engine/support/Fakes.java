package quarry.engine.support;

import quarry.engine.config.Collaborators;
import quarry.engine.config.EngineConfig;
import quarry.engine.crawl.DocumentSink;
import quarry.engine.crawl.FetchedPage;
import quarry.engine.crawl.PageFetcher;
import quarry.engine.executor.SearchIndex;
import quarry.engine.orchestrator.ChatRequest;
import quarry.engine.orchestrator.ChatResponse;
import quarry.engine.orchestrator.LlmClient;
import quarry.engine.orchestrator.LlmException;
import quarry.engine.orchestrator.Tool;
import quarry.engine.orchestrator.ToolCall;
import quarry.engine.orchestrator.ToolSpec;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-ins for the engine's external systems.
 */
public final class Fakes {

    private Fakes() {
    }

    /** Fresh in-memory database with timings short enough for tests */
    public static EngineConfig config(String name) {
        return EngineConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:" + name + "-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withDatabasePoolSize(6)
                .withWorkerConcurrency(4)
                .withPollInterval(Duration.ofMillis(20))
                .withRetryBackoff(Duration.ofMillis(10))
                .withProbeDelay(Duration.ofMillis(50))
                .withProbeStaleness(Duration.ofMillis(150))
                .withToolWaitInterval(Duration.ofMillis(30))
                .withShutdownTimeout(Duration.ofSeconds(2));
    }

    public static Collaborators collaborators(Llm llm, Web web, Index index, Tool... tools) {
        return new Collaborators(llm, web, web, index, List.of(tools));
    }

    public static Collaborators collaborators() {
        return collaborators(new Llm(), new Web(), new Index(), new EchoTool("search"));
    }

    /**
     * Scripted model. Planning requests (tool use required) get the next queued
     * plan, or the default plan; other requests get the next queued review.
     */
    public static final class Llm implements LlmClient {

        private final ConcurrentLinkedQueue<List<ToolCall>> plans = new ConcurrentLinkedQueue<>();
        private final ConcurrentLinkedQueue<String> reviews = new ConcurrentLinkedQueue<>();
        private final List<ChatRequest> requests = new CopyOnWriteArrayList<>();
        private volatile List<ToolCall> defaultPlan = List.of(new ToolCall("c1", "search", Map.of("q", "quarry")));
        private volatile String defaultReview = "{\"goal_achieved\":true,\"confidence\":0.9,\"summary\":\"done\"}";
        private final AtomicInteger failuresLeft = new AtomicInteger();

        public Llm plan(ToolCall... calls) {
            plans.add(List.of(calls));
            return this;
        }

        public Llm defaultPlan(ToolCall... calls) {
            defaultPlan = List.of(calls);
            return this;
        }

        public Llm review(String json) {
            reviews.add(json);
            return this;
        }

        public Llm failNext(int times) {
            failuresLeft.set(times);
            return this;
        }

        public List<ChatRequest> requests() {
            return requests;
        }

        public long planningCalls() {
            return requests.stream().filter(ChatRequest::toolUseRequired).count();
        }

        @Override
        public ChatResponse chat(ChatRequest request) throws LlmException {
            requests.add(request);
            if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new LlmException("model overloaded", true);
            }
            if (request.toolUseRequired()) {
                List<ToolCall> plan = plans.poll();
                return new ChatResponse("", plan != null ? plan : defaultPlan);
            }
            String review = reviews.poll();
            return new ChatResponse(review != null ? review : defaultReview, List.of());
        }
    }

    /**
     * A small static web: url to outgoing links. Also records saved pages.
     */
    public static final class Web implements PageFetcher, DocumentSink {

        private final Map<String, List<String>> links = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
        private final Map<String, String> saved = new ConcurrentHashMap<>();
        private final AtomicInteger failuresLeft = new AtomicInteger();

        public Web page(String url, String... outgoing) {
            links.put(url, List.of(outgoing));
            return this;
        }

        public Web failNext(int times) {
            failuresLeft.set(times);
            return this;
        }

        public int fetchCount(String url) {
            AtomicInteger count = fetches.get(url);
            return count != null ? count.get() : 0;
        }

        /** Saved urls mapped to the crawl job that saved them */
        public Map<String, String> saved() {
            return Collections.unmodifiableMap(saved);
        }

        @Override
        public FetchedPage fetch(String url) throws IOException {
            fetches.computeIfAbsent(url, u -> new AtomicInteger()).incrementAndGet();
            if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IOException("connection reset");
            }
            List<String> outgoing = links.getOrDefault(url, List.of());
            return new FetchedPage(url, "Title of " + url, "Content of " + url, outgoing);
        }

        @Override
        public void save(String jobId, FetchedPage page) {
            saved.put(page.url(), jobId);
        }
    }

    public static final class Index implements SearchIndex {

        private final AtomicInteger rebuilds = new AtomicInteger();
        private final AtomicInteger failuresLeft = new AtomicInteger();
        private volatile int documents = 42;

        public Index failNext(int times) {
            failuresLeft.set(times);
            return this;
        }

        public Index alwaysFail() {
            failuresLeft.set(Integer.MAX_VALUE);
            return this;
        }

        public int rebuilds() {
            return rebuilds.get();
        }

        @Override
        public int rebuild(String index, boolean fullRebuild) throws IOException {
            if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IOException("index locked");
            }
            rebuilds.incrementAndGet();
            return documents;
        }
    }

    /** Returns its arguments back */
    public static final class EchoTool implements Tool {

        private final String name;
        private final List<Map<String, Object>> calls = new CopyOnWriteArrayList<>();

        public EchoTool(String name) {
            this.name = name;
        }

        public List<Map<String, Object>> calls() {
            return new ArrayList<>(calls);
        }

        @Override
        public ToolSpec spec() {
            return new ToolSpec(name, "Echo " + name, Map.of("type", "object"));
        }

        @Override
        public Object execute(Map<String, Object> arguments) {
            calls.add(arguments);
            return Map.of("tool", name, "echo", arguments);
        }
    }
}
