package quarry.engine.integration;

import quarry.engine.config.Dependencies;
import quarry.engine.crawl.CrawlStepAction;
import quarry.engine.event.EngineEvent;
import quarry.engine.executor.NotifyStepAction;
import quarry.engine.executor.ReindexStepAction;
import quarry.engine.model.JobDefinition;
import quarry.engine.model.JobFilter;
import quarry.engine.model.JobProgress;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobStep;
import quarry.engine.model.JobTreeNode;
import quarry.engine.model.JobTypes;
import quarry.engine.model.step.CrawlConfig;
import quarry.engine.model.step.NotifyConfig;
import quarry.engine.model.step.ReindexConfig;
import quarry.engine.service.JobService;
import quarry.engine.support.Fakes;
import quarry.engine.util.JobIds;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Crawl, reindex and announce, end to end on background workers.
 */
class CrawlPipelineTest {

    private static final String A = "https://example.com/a";
    private static final String B = "https://example.com/b";
    private static final String C = "https://example.com/c";
    private static final String D = "https://example.com/d";
    private static final String E = "https://example.com/e";

    private Fakes.Web web;
    private Fakes.Index index;
    private Dependencies deps;
    private JobService jobService;
    private final List<EngineEvent> notifications = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        // 1. Three seeds that all link to the same two pages; f sits one level too deep
        web = new Fakes.Web()
                .page(A, D, E)
                .page(B, D, E)
                .page(C, D, E)
                .page(D, "https://example.com/f");
        index = new Fakes.Index();
        deps = Dependencies.create(Fakes.config("test-pipeline"),
                Fakes.collaborators(new Fakes.Llm(), web, index, new Fakes.EchoTool("search")));
        jobService = deps.jobService();
        deps.events().subscribe(EngineEvent.Type.NOTIFICATION, notifications::add);

        // 2. Definitions
        deps.executor().saveDefinition(JobDefinition.of("announce", "notify",
                List.of(JobStep.of("announce", NotifyStepAction.TYPE, new NotifyConfig("ops", "site indexed")))));
        deps.executor().saveDefinition(JobDefinition.of("site", "crawl", List.of(
                        JobStep.of("crawl", CrawlStepAction.TYPE,
                                new CrawlConfig(List.of(A, B, C), null, null, 1, 100, true)),
                        JobStep.of("reindex", ReindexStepAction.TYPE, new ReindexConfig("documents", true))))
                .withPostJobs(List.of("announce")));

        deps.startWorkers();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private JobSnapshot awaitTerminal(String jobId) {
        await().atMost(Duration.ofSeconds(20))
                .pollInterval(Duration.ofMillis(50))
                .until(() -> jobService.getJob(jobId).map(s -> s.state().isTerminal()).orElse(false));
        return jobService.requireJob(jobId);
    }

    @Test
    void crawlReindexAndAnnounce() {
        String managerId = deps.executor().execute("site");
        String crawlStepId = JobIds.step(managerId, 0);
        String postId = managerId + "-post-0";

        JobSnapshot manager = awaitTerminal(managerId);
        JobSnapshot post = awaitTerminal(postId);

        // 1. Run and follow-up completed
        assertEquals(JobStatus.COMPLETED, manager.status());
        assertEquals(JobStatus.COMPLETED, post.status());

        // 2. Five distinct pages, each crawled once; depth 1 links are not followed
        List<JobSnapshot> crawled = jobService.listChildren(crawlStepId);
        assertEquals(5, crawled.size());
        assertTrue(crawled.stream().allMatch(s -> s.status() == JobStatus.COMPLETED));
        assertTrue(crawled.stream().allMatch(s -> JobTypes.CRAWL_URL.equals(s.job().type())));
        for (String url : List.of(A, B, C, D, E)) {
            assertEquals(1, web.fetchCount(url), "fetched once: " + url);
            assertEquals(JobIds.child(crawlStepId, url), web.saved().get(url));
        }
        assertEquals(0, web.fetchCount("https://example.com/f"));

        // 3. Index rebuilt once, after the crawl
        assertEquals(1, index.rebuilds());
        JobSnapshot crawlStep = jobService.requireJob(crawlStepId);
        JobSnapshot reindexStep = jobService.requireJob(JobIds.step(managerId, 1));
        assertFalse(reindexStep.state().startedAt().isBefore(crawlStep.state().completedAt()));

        // 4. Counters add up across the tree
        JobProgress progress = manager.state().progress();
        assertEquals(7, progress.total(), "two steps and five crawl jobs");
        assertEquals(progress.total(), progress.completed());
        assertEquals(0, progress.outstanding());

        // 5. Exactly one announcement
        assertEquals(1, notifications.size());
        assertEquals(2, jobService.listJobs(JobFilter.builder().rootsOnly().build()).totalCount());
    }

    @Test
    void treeAndAggregatedLogsCoverWholeRun() {
        String managerId = deps.executor().execute("site");
        awaitTerminal(managerId);

        JobTreeNode tree = jobService.getTree(managerId);
        assertEquals(managerId, tree.job().id());
        assertEquals(2, tree.children().size());
        assertEquals(8, tree.size(), "manager, two steps and five crawl jobs");
        JobTreeNode crawlNode = tree.children().stream()
                .filter(node -> node.job().id().equals(JobIds.step(managerId, 0)))
                .findFirst()
                .orElseThrow();
        assertEquals(5, crawlNode.children().size());

        String crawlJobId = JobIds.child(JobIds.step(managerId, 0), D);
        assertTrue(jobService.getAggregatedLogs(managerId).stream()
                .anyMatch(e -> e.jobId().equals(crawlJobId)), "descendant logs are included");
    }

    @Test
    void transientFetchFailureIsRetried() {
        web.failNext(1);

        String managerId = deps.executor().execute("site");
        JobSnapshot manager = awaitTerminal(managerId);

        assertEquals(JobStatus.COMPLETED, manager.status());
        assertEquals(5, jobService.listChildren(JobIds.step(managerId, 0)).size());
        assertEquals(6, List.of(A, B, C, D, E).stream().mapToInt(web::fetchCount).sum(),
                "one page fetched twice");
    }

    @Test
    void cancellingRunStopsEverything() {
        String managerId = deps.executor().execute("site");

        assertTrue(jobService.cancel(managerId));

        JobSnapshot manager = awaitTerminal(managerId);
        assertEquals(JobStatus.CANCELLED, manager.status());
        await().atMost(Duration.ofSeconds(5)).until(() ->
                jobService.listChildren(managerId).stream().allMatch(s -> s.state().isTerminal()));
        assertEquals(0, index.rebuilds());
        assertTrue(notifications.isEmpty());
        assertTrue(jobService.getJob(managerId + "-post-0").isEmpty(), "no follow-up after cancel");
    }
}
