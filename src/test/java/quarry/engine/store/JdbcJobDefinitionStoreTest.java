package quarry.engine.store;

import quarry.engine.model.ErrorTolerance;
import quarry.engine.model.JobDefinition;
import quarry.engine.model.JobStep;
import quarry.engine.model.step.CrawlConfig;
import quarry.engine.model.step.NotifyConfig;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobDefinitionStoreTest {

    private static Database db;
    private static JdbcJobDefinitionStore store;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-definitions;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        store = new JdbcJobDefinitionStore(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanDefinitions() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_definitions");
            conn.commit();
        }
    }

    private static JobDefinition site() {
        JobStep crawl = JobStep.of("crawl", "crawler",
                        new CrawlConfig(List.of("https://example.com/"), List.of("/docs/"), null, 1, 50, true))
                .withOnError(JobStep.OnError.RETRY, 2, Duration.ofSeconds(3))
                .withTimeout(Duration.ofMinutes(10));
        return JobDefinition.of("site", "crawl", List.of(crawl))
                .withPostJobs(List.of("announce"))
                .withErrorTolerance(new ErrorTolerance(5, ErrorTolerance.FailureAction.MARK_WARNING));
    }

    @Test
    void saveAndFindKeepsEveryField() {
        store.save(site());

        JobDefinition found = store.findById("site").orElseThrow();
        assertEquals("site", found.name());
        assertEquals(List.of("announce"), found.postJobs());
        assertEquals(ErrorTolerance.FailureAction.MARK_WARNING, found.errorTolerance().failureAction());

        JobStep step = found.steps().get(0);
        assertEquals(JobStep.OnError.RETRY, step.onError());
        assertEquals(Duration.ofSeconds(3), step.backoff());
        assertEquals(Duration.ofMinutes(10), step.timeout());
        CrawlConfig config = assertInstanceOf(CrawlConfig.class, step.config());
        assertEquals(List.of("/docs/"), config.includePatterns());
        assertEquals(Integer.valueOf(50), config.maxPages());

        assertTrue(store.findById("missing").isEmpty());
    }

    @Test
    void saveReplacesExistingDefinition() {
        store.save(site());
        store.save(site().withEnabled(false));

        assertEquals(1, store.findAll().size());
        assertFalse(store.findById("site").orElseThrow().enabledFlag());
    }

    @Test
    void findAllIsOrderedByIdAndDeleteRemoves() {
        store.save(site());
        store.save(JobDefinition.of("announce", "notify",
                List.of(JobStep.of("announce", "notifier", new NotifyConfig("ops", "done")))));

        assertEquals(List.of("announce", "site"), store.findAll().stream().map(JobDefinition::id).toList());

        assertTrue(store.delete("announce"));
        assertFalse(store.delete("announce"));
        assertEquals(1, store.findAll().size());
    }
}
