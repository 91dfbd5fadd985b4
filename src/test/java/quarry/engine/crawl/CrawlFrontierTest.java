package quarry.engine.crawl;

import quarry.engine.event.EventBus;
import quarry.engine.model.Job;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobTypes;
import quarry.engine.model.step.CrawlConfig;
import quarry.engine.queue.JdbcMessageQueue;
import quarry.engine.queue.QueueMessage;
import quarry.engine.service.JobService;
import quarry.engine.store.Database;
import quarry.engine.store.JdbcDedupStore;
import quarry.engine.store.JdbcJobLogStore;
import quarry.engine.store.JdbcJobStore;
import quarry.engine.util.JobIds;
import quarry.engine.worker.JobSpawner;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CrawlFrontierTest {

    private Database db;
    private JobService jobService;
    private JdbcMessageQueue queue;
    private JdbcDedupStore dedup;
    private CrawlFrontier frontier;
    private Job step;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-frontier-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        jobService = new JobService(new JdbcJobStore(db), new JdbcJobLogStore(db), new EventBus());
        queue = new JdbcMessageQueue(db, Duration.ofSeconds(30));
        dedup = new JdbcDedupStore(db);
        frontier = new CrawlFrontier(dedup, jobService, new JobSpawner(jobService, queue));

        Job manager = Job.builder().id("m-1").type(JobTypes.MANAGER).createdAt(Instant.now()).build();
        jobService.createJob(manager);
        step = jobService.createChild(manager, JobIds.step("m-1", 0), JobTypes.STEP, "crawl", Map.of());
    }

    @AfterEach
    void tearDown() {
        if (db != null) {
            db.close();
        }
    }

    private static CrawlConfig config(List<String> include, List<String> exclude, int maxPages) {
        return new CrawlConfig(List.of("https://example.com/"), include, exclude, 2, maxPages, true);
    }

    @Test
    void offerSpawnsQueuedCrawlJob() {
        String url = "https://example.com/docs";

        assertTrue(frontier.offer(step, config(null, null, 10), url, 1));

        String childId = JobIds.child(step.id(), url);
        JobSnapshot child = jobService.requireJob(childId);
        assertEquals(JobTypes.CRAWL_URL, child.job().type());
        assertEquals(url, child.job().configString(CrawlFrontier.URL));
        assertEquals(1, child.job().configInt(CrawlFrontier.CRAWL_DEPTH, -1));
        assertEquals("m-1", child.job().managerId());
        assertTrue(queue.find(QueueMessage.jobIdMessage(childId)).isPresent());
        assertEquals(1, dedup.countSeen(step.id()));
    }

    @Test
    void sameUrlIsSpawnedOnce() {
        CrawlConfig config = config(null, null, 10);

        assertTrue(frontier.offer(step, config, "https://example.com/a", 0));
        assertFalse(frontier.offer(step, config, "https://example.com/a", 1), "reached again via another page");

        assertEquals(1, jobService.listChildren(step.id()).size());
        assertEquals(1, dedup.countSeen(step.id()));
    }

    @Test
    void patternsFilterUrls() {
        CrawlConfig config = config(List.of("/docs/"), List.of("\\.pdf$"), 10);

        assertTrue(frontier.offer(step, config, "https://example.com/docs/intro", 0));
        assertFalse(frontier.offer(step, config, "https://example.com/blog/post", 0), "not included");
        assertFalse(frontier.offer(step, config, "https://example.com/docs/manual.pdf", 0), "excluded wins");
        assertFalse(frontier.offer(step, config, null, 0));

        assertEquals(1, jobService.listChildren(step.id()).size());
    }

    @Test
    void pageBudgetCapsSpawns() {
        CrawlConfig config = config(null, null, 2);

        assertTrue(frontier.offer(step, config, "https://example.com/1", 0));
        assertTrue(frontier.offer(step, config, "https://example.com/2", 0));
        assertFalse(frontier.offer(step, config, "https://example.com/3", 0));

        assertEquals(2, jobService.listChildren(step.id()).size());
    }

    @Test
    void pendingJobWithLostMessageIsQueuedAgain() {
        String url = "https://example.com/a";
        CrawlConfig config = config(null, null, 10);
        frontier.offer(step, config, url, 0);
        String messageId = QueueMessage.jobIdMessage(JobIds.child(step.id(), url));

        // Message gone but the job never ran (crash between create and enqueue)
        queue.delete(queue.receive().orElseThrow());
        assertTrue(queue.find(messageId).isEmpty());

        assertFalse(frontier.offer(step, config, url, 0), "nothing new spawned");
        assertTrue(queue.find(messageId).isPresent(), "pending job is queued again");
    }

    @Test
    void dedupIsScopedToStep() {
        Job manager = jobService.requireJob("m-1").job();
        Job other = jobService.createChild(manager, JobIds.step("m-1", 1), JobTypes.STEP, "crawl again", Map.of());
        CrawlConfig config = config(null, null, 10);

        assertTrue(frontier.offer(step, config, "https://example.com/a", 0));
        assertTrue(frontier.offer(other, config, "https://example.com/a", 0), "another step crawls it again");
    }
}
