package quarry.engine.executor;

import quarry.engine.config.EngineConfig;
import quarry.engine.crawl.CrawlStepAction;
import quarry.engine.model.JobDefinition;
import quarry.engine.model.JobStep;
import quarry.engine.model.JobValidationException;
import quarry.engine.model.step.CrawlConfig;
import quarry.engine.model.step.NotifyConfig;
import quarry.engine.model.step.OrchestrateConfig;
import quarry.engine.model.step.ReindexConfig;
import quarry.engine.orchestrator.OrchestrateStepAction;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionValidatorTest {

    private DefinitionValidator validator;

    @BeforeEach
    void setUp() {
        // Validation only resolves actions, it never runs them
        StepActionRegistry registry = new StepActionRegistry()
                .register(new CrawlStepAction(null))
                .register(new ReindexStepAction(null, null))
                .register(new NotifyStepAction(null))
                .register(new OrchestrateStepAction(null, EngineConfig.defaults()));
        validator = new DefinitionValidator(registry);
    }

    private static JobStep crawl(String name, String... urls) {
        return JobStep.of(name, CrawlStepAction.TYPE, new CrawlConfig(List.of(urls), null, null, 1, 10, true));
    }

    private static JobStep reindex(String name) {
        return JobStep.of(name, ReindexStepAction.TYPE, new ReindexConfig("documents", true));
    }

    private String messageOf(JobDefinition definition) {
        return assertThrows(JobValidationException.class, () -> validator.validate(definition)).getMessage();
    }

    @Test
    void validDefinitionPasses() {
        JobDefinition definition = JobDefinition.of("nightly", "crawl", List.of(
                crawl("crawl", "https://example.com/"),
                reindex("reindex").withDepends(List.of("crawl")),
                JobStep.of("announce", NotifyStepAction.TYPE, new NotifyConfig("ops", "done")),
                JobStep.of("research", OrchestrateStepAction.TYPE,
                        new OrchestrateConfig("summarise the site", List.of("search"), 2))));

        assertDoesNotThrow(() -> validator.validate(definition));
    }

    @Test
    void emptyDefinitionIsRejected() {
        String message = messageOf(JobDefinition.of("empty", "crawl", List.of()));
        assertTrue(message.contains("no steps"), message);
    }

    @Test
    void duplicateStepNamesAreRejected() {
        String message = messageOf(JobDefinition.of("dup", "crawl", List.of(reindex("x"), reindex("x"))));
        assertTrue(message.contains("Duplicate step name"), message);
    }

    @Test
    void actionMustMatchStepType() {
        JobStep mismatched = JobStep.of("x", CrawlStepAction.TYPE, new ReindexConfig("documents", true));

        String message = messageOf(JobDefinition.of("bad", "crawl", List.of(mismatched)));
        assertTrue(message.contains("no action reindex"), message);
    }

    @Test
    void dependenciesMustPointBackwards() {
        JobDefinition later = JobDefinition.of("later", "crawl", List.of(
                reindex("first").withDepends(List.of("second")),
                reindex("second")));
        assertTrue(messageOf(later).contains("unknown or later step"));

        JobDefinition self = JobDefinition.of("self", "crawl", List.of(reindex("only").withDepends(List.of("only"))));
        assertTrue(messageOf(self).contains("unknown or later step"));
    }

    @Test
    void definitionCannotChainToItself() {
        JobDefinition loop = JobDefinition.of("loop", "crawl", List.of(reindex("r"))).withPostJobs(List.of("loop"));

        assertTrue(messageOf(loop).contains("chains to itself"));
    }

    @Test
    void stepConfigIsValidated() {
        String message = messageOf(JobDefinition.of("ftp", "crawl", List.of(crawl("crawl", "ftp://example.com/"))));
        assertTrue(message.contains("not an http(s) url"), message);

        JobStep noGoal = JobStep.of("research", OrchestrateStepAction.TYPE, new OrchestrateConfig(" ", null, null));
        assertTrue(messageOf(JobDefinition.of("g", "research", List.of(noGoal))).contains("goal is required"));
    }

    @Test
    void maxAttemptsMustBePositive() {
        JobStep step = reindex("r").withOnError(JobStep.OnError.RETRY, 0, Duration.ofSeconds(1));

        assertTrue(messageOf(JobDefinition.of("r", "index", List.of(step))).contains("max_attempts"));
    }

    @Test
    void unknownActionInJsonIsReported() {
        String json = """
                {"id":"x","type":"crawl","steps":[
                  {"name":"s","type":"crawler","config":{"action":"teleport"}}
                ]}
                """;

        JobValidationException e = assertThrows(JobValidationException.class, () -> JobDefinition.fromJson(json));
        assertEquals("Unknown step action: teleport", e.getMessage());
    }

    @Test
    void definitionParsedFromJsonValidates() {
        String json = """
                {"id":"site","type":"crawl","post_jobs":["announce"],"steps":[
                  {"name":"crawl","type":"crawler","on_error":"retry","max_attempts":2,
                   "config":{"action":"crawl","start_urls":["https://example.com/"],"max_depth":1}}
                ]}
                """;

        JobDefinition definition = JobDefinition.fromJson(json);

        assertDoesNotThrow(() -> validator.validate(definition));
        JobStep step = definition.steps().get(0);
        assertEquals(JobStep.OnError.RETRY, step.onError());
        assertEquals(2, step.maxAttempts().intValue());
        assertEquals(100, ((CrawlConfig) step.config()).maxPages().intValue(), "default page budget");
        assertEquals(List.of("announce"), definition.postJobs());
        assertTrue(definition.enabledFlag());
    }
}
