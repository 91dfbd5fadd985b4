package quarry.engine.store;

import quarry.engine.model.Job;
import quarry.engine.model.JobFilter;
import quarry.engine.model.JobLogEntry;
import quarry.engine.model.JobPage;
import quarry.engine.model.JobProgress;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStatus;
import quarry.engine.model.ProgressDelta;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {

    private Database db;
    private JdbcJobStore store;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-job-store-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        store = new JdbcJobStore(db);
    }

    @AfterEach
    void tearDown() {
        if (db != null) {
            db.close();
        }
    }

    private static Job root(String id) {
        return Job.builder().id(id).type("manager").name(id).depth(0).build();
    }

    private static Job child(String id, Job parent, String type) {
        return Job.builder()
                .id(id)
                .parentId(parent.id())
                .managerId(parent.rootId())
                .type(type)
                .depth(parent.depth() + 1)
                .config(Map.of("n", 1))
                .build();
    }

    @Test
    void createAndFind() {
        store.create(root("m-1"));

        Optional<JobSnapshot> found = store.find("m-1");
        assertTrue(found.isPresent());
        assertEquals(JobStatus.PENDING, found.get().status());
        assertEquals(JobProgress.EMPTY, found.get().state().progress());
        assertNotNull(found.get().state().lastHeartbeat(), "heartbeat is set on creation");
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    void createIsIdempotentByJobId() {
        assertTrue(store.create(root("m-1")));
        Job step = child("m-1-step-0", root("m-1"), "step");
        assertTrue(store.create(step));

        // Same ids again: no error, counters untouched
        assertFalse(store.create(root("m-1")));
        assertFalse(store.create(step));

        assertEquals(1, store.find("m-1").orElseThrow().state().progress().total(),
                "a replayed create must not count the child twice");
    }

    @Test
    void createChildRequiresExistingParent() {
        Job orphan = Job.builder().id("orphan").parentId("nope").managerId("nope").type("step").depth(1).build();

        assertThrows(IllegalArgumentException.class, () -> store.create(orphan));
        assertTrue(store.find("orphan").isEmpty(), "failed create must roll back the job row");
    }

    @Test
    void childCreationCountsOnParentAndManager() {
        // 1. Manager -> step -> two work jobs
        Job manager = root("m-1");
        Job step = child("m-1-step-0", manager, "step");
        store.create(manager);
        store.create(step);
        store.create(child("w-1", step, "crawl_url"));
        store.create(child("w-2", step, "crawl_url"));

        // 2. Step sees its direct children, manager sees the whole tree
        JobProgress stepProgress = store.find(step.id()).orElseThrow().state().progress();
        assertEquals(2, stepProgress.total());
        assertEquals(2, stepProgress.pending());

        JobProgress managerProgress = store.find(manager.id()).orElseThrow().state().progress();
        assertEquals(3, managerProgress.total(), "manager counts the step and both work jobs");
        assertEquals(3, managerProgress.outstanding());
    }

    @Test
    void transitionIsCompareAndSwap() {
        store.create(root("m-1"));

        assertTrue(store.transition("m-1", JobStatus.PENDING, JobStatus.RUNNING, null));
        assertFalse(store.transition("m-1", JobStatus.PENDING, JobStatus.RUNNING, null), "second start loses");

        assertTrue(store.transition("m-1", JobStatus.RUNNING, JobStatus.FAILED, "boom"));
        assertFalse(store.transition("m-1", JobStatus.RUNNING, JobStatus.COMPLETED, null), "terminal is final");

        JobSnapshot snapshot = store.find("m-1").orElseThrow();
        assertEquals(JobStatus.FAILED, snapshot.status());
        assertEquals("boom", snapshot.state().error());
        assertNotNull(snapshot.state().startedAt());
        assertNotNull(snapshot.state().completedAt());
    }

    @Test
    void illegalEdgeIsRejected() {
        store.create(root("m-1"));

        assertThrows(IllegalArgumentException.class,
                () -> store.transition("m-1", JobStatus.PENDING, JobStatus.COMPLETED, null));
    }

    @Test
    void transitionMovesParentCounters() {
        Job manager = root("m-1");
        Job step = child("m-1-step-0", manager, "step");
        store.create(manager);
        store.create(step);
        store.create(child("w-1", step, "crawl_url"));

        store.transition("w-1", JobStatus.PENDING, JobStatus.RUNNING, null);
        assertEquals(1, store.find(step.id()).orElseThrow().state().progress().running());

        store.transition("w-1", JobStatus.RUNNING, JobStatus.COMPLETED, null);
        JobProgress stepProgress = store.find(step.id()).orElseThrow().state().progress();
        assertEquals(0, stepProgress.running());
        assertEquals(1, stepProgress.completed());
        assertEquals(0, stepProgress.outstanding());

        JobProgress managerProgress = store.find(manager.id()).orElseThrow().state().progress();
        assertEquals(1, managerProgress.completed(), "grandchild completion reaches the manager");
        assertEquals(1, managerProgress.pending(), "the step itself is still pending");
    }

    @Test
    void concurrentSiblingFinishersLeaveExactCounters() throws Exception {
        // 1. One parent with N running children
        int n = 20;
        Job manager = root("m-1");
        Job step = child("m-1-step-0", manager, "step");
        store.create(manager);
        store.create(step);
        for (int i = 0; i < n; i++) {
            store.create(child("w-" + i, step, "crawl_url"));
            store.transition("w-" + i, JobStatus.PENDING, JobStatus.RUNNING, null);
        }

        // 2. Finish them all at once
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                String id = "w-" + i;
                JobStatus to = i % 4 == 0 ? JobStatus.FAILED : JobStatus.COMPLETED;
                results.add(pool.submit(() -> {
                    go.await();
                    return store.transition(id, JobStatus.RUNNING, to, to == JobStatus.FAILED ? "x" : null);
                }));
            }
            go.countDown();
            for (Future<Boolean> result : results) {
                assertTrue(result.get(10, TimeUnit.SECONDS), "every finisher wins its own CAS");
            }
        } finally {
            pool.shutdownNow();
        }

        // 3. No lost updates
        JobProgress progress = store.find(step.id()).orElseThrow().state().progress();
        assertEquals(n, progress.total());
        assertEquals(15, progress.completed());
        assertEquals(5, progress.failed());
        assertEquals(0, progress.outstanding());
        assertEquals(n, progress.finished());
    }

    @Test
    void incrementProgressAppliesSignedDelta() {
        store.create(root("m-1"));

        store.incrementProgress("m-1", new ProgressDelta(3, 3, 0, 0, 0, 0));
        store.incrementProgress("m-1", new ProgressDelta(0, -1, 0, 1, 0, 0));

        JobProgress progress = store.find("m-1").orElseThrow().state().progress();
        assertEquals(3, progress.total());
        assertEquals(2, progress.pending());
        assertEquals(1, progress.completed());
    }

    @Test
    void listFiltersByStatusParentAndType() {
        Job manager = root("m-1");
        store.create(manager);
        store.create(root("m-2"));
        Job step = child("m-1-step-0", manager, "step");
        store.create(step);
        store.create(child("w-1", step, "crawl_url"));
        store.create(child("w-2", step, "crawl_url"));
        store.transition("w-1", JobStatus.PENDING, JobStatus.RUNNING, null);
        store.transition("m-2", JobStatus.PENDING, JobStatus.RUNNING, null);
        store.transition("m-2", JobStatus.RUNNING, JobStatus.FAILED, "x");

        assertEquals(2, store.list(JobFilter.builder().rootsOnly().build()).totalCount());
        assertEquals(2, store.list(JobFilter.builder().parentId(step.id()).build()).totalCount());
        assertEquals(3, store.list(JobFilter.builder().managerId("m-1").build()).totalCount());
        assertEquals(2, store.list(JobFilter.builder().type("crawl_url").build()).totalCount());

        JobPage runningOrFailed = store.list(JobFilter.builder().statuses("running,failed").build());
        assertEquals(2, runningOrFailed.totalCount());
        assertTrue(runningOrFailed.items().stream().anyMatch(s -> s.id().equals("w-1")));
        assertTrue(runningOrFailed.items().stream().anyMatch(s -> s.id().equals("m-2")));
    }

    @Test
    void listPaginates() {
        for (int i = 0; i < 5; i++) {
            store.create(root("m-" + i));
        }

        JobPage first = store.list(JobFilter.builder().limit(2).build());
        assertEquals(2, first.items().size());
        assertEquals(5, first.totalCount());
        assertTrue(first.hasMore());

        JobPage last = store.list(JobFilter.builder().limit(2).offset(4).build());
        assertEquals(1, last.items().size());
        assertFalse(last.hasMore());
    }

    @Test
    void countByStatusUnderManager() {
        Job manager = root("m-1");
        store.create(manager);
        Job step = child("m-1-step-0", manager, "step");
        store.create(step);
        store.create(child("w-1", step, "crawl_url"));
        store.transition("w-1", JobStatus.PENDING, JobStatus.RUNNING, null);

        Map<JobStatus, Integer> counts = store.countByStatusUnder("m-1");
        assertEquals(Integer.valueOf(1), counts.get(JobStatus.PENDING));
        assertEquals(Integer.valueOf(1), counts.get(JobStatus.RUNNING));
        assertNull(counts.get(JobStatus.FAILED));
    }

    @Test
    void deleteTreeRemovesDescendantsLogsAndDedupRecords() {
        Job manager = root("m-1");
        Job step = child("m-1-step-0", manager, "step");
        store.create(manager);
        store.create(step);
        store.create(child("w-1", step, "crawl_url"));
        store.create(root("other"));

        JdbcJobLogStore logs = new JdbcJobLogStore(db);
        logs.append("w-1", JobLogEntry.Level.INFO, "fetched");
        JdbcDedupStore dedup = new JdbcDedupStore(db);
        dedup.markSeen(step.id(), "https://example.com/");

        assertEquals(List.of(step.id(), "w-1"), store.listDescendantIds("m-1"));
        assertEquals(3, store.deleteTree("m-1"));

        assertTrue(store.find("m-1").isEmpty());
        assertTrue(store.find("w-1").isEmpty());
        assertTrue(logs.findByJob("w-1", 10).isEmpty(), "logs go with the job");
        assertEquals(0, dedup.countSeen(step.id()), "dedup records go with the step");
        assertTrue(store.find("other").isPresent(), "unrelated trees are untouched");
    }

    @Test
    void findExpiredRootsOnlyReturnsFinishedRoots() {
        Job manager = root("m-1");
        store.create(manager);
        store.create(child("m-1-step-0", manager, "step"));
        store.create(root("m-running"));
        store.transition("m-1", JobStatus.PENDING, JobStatus.RUNNING, null);
        store.transition("m-1", JobStatus.RUNNING, JobStatus.COMPLETED, null);
        store.transition("m-running", JobStatus.PENDING, JobStatus.RUNNING, null);

        Instant later = Instant.now().plus(Duration.ofSeconds(1));
        assertEquals(List.of("m-1"), store.findExpiredRoots(later, 10));
        assertTrue(store.findExpiredRoots(Instant.now().minus(Duration.ofHours(1)), 10).isEmpty());
    }
}
