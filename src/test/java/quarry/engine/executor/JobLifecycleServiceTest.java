package quarry.engine.executor;

import quarry.engine.config.Dependencies;
import quarry.engine.model.Job;
import quarry.engine.model.JobDefinition;
import quarry.engine.model.JobFilter;
import quarry.engine.model.JobSnapshot;
import quarry.engine.model.JobStateException;
import quarry.engine.model.JobStatus;
import quarry.engine.model.JobStep;
import quarry.engine.model.step.NotifyConfig;
import quarry.engine.queue.QueueMessage;
import quarry.engine.service.JobService;
import quarry.engine.support.Fakes;
import quarry.engine.util.JobIds;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobLifecycleServiceTest {

    private Dependencies deps;
    private JobService jobService;
    private JobLifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(Fakes.config("test-lifecycle"), Fakes.collaborators());
        jobService = deps.jobService();
        lifecycle = deps.lifecycle();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private void drain() {
        for (int i = 0; i < 100 && deps.workerPool().processNext(); i++) {
            // keep going
        }
    }

    private String runAnnouncement() {
        JobDefinition definition = JobDefinition.of("announce", "notify",
                List.of(JobStep.of("announce", NotifyStepAction.TYPE, new NotifyConfig("ops", "hello"))));
        String managerId = deps.executor().execute(definition);
        drain();
        return managerId;
    }

    private JobSnapshot job(String id) {
        return jobService.requireJob(id);
    }

    @Test
    void rerunRequiresFinishedJob() {
        Job job = Job.builder().id("standalone").type("crawl_url").createdAt(Instant.now()).build();
        jobService.createJob(job);

        JobStateException e = assertThrows(JobStateException.class, () -> lifecycle.rerun("standalone"));
        assertEquals(JobStateException.Reason.NOT_TERMINAL, e.reason());
    }

    @Test
    void rerunManagerExecutesDefinitionSnapshotUnderNewId() {
        String managerId = runAnnouncement();
        assertEquals(JobStatus.COMPLETED, job(managerId).status());

        String rerunId = lifecycle.rerun(managerId);

        assertNotEquals(managerId, rerunId);
        assertEquals("announce", job(rerunId).job().configString(JobExecutor.CONFIG_DEFINITION_ID));
        assertEquals(1, jobService.listChildren(rerunId).size(), "steps are created again");

        drain();
        assertEquals(JobStatus.COMPLETED, job(rerunId).status());
        assertEquals(JobStatus.COMPLETED, job(managerId).status(), "original run is untouched");
    }

    @Test
    void rerunOfStandaloneRootIsQueuedAsNewJob() {
        Job job = Job.builder().id("standalone").type("crawl_url").name("one page")
                .config(Map.of("url", "https://example.com/")).createdAt(Instant.now()).build();
        jobService.createJob(job);
        jobService.fail("standalone", "404");

        String rerunId = lifecycle.rerun("standalone");

        JobSnapshot rerun = job(rerunId);
        assertEquals(JobStatus.PENDING, rerun.status());
        assertEquals("https://example.com/", rerun.job().configString("url"));
        assertTrue(deps.queue().find(QueueMessage.jobIdMessage(rerunId)).isPresent());
    }

    @Test
    void onlyRootJobsCanBeRerun() {
        String managerId = runAnnouncement();

        assertThrows(IllegalArgumentException.class, () -> lifecycle.rerun(JobIds.step(managerId, 0)));
    }

    @Test
    void copyCreatesPendingUnqueuedJob() {
        String managerId = runAnnouncement();
        int queued = deps.queue().size();

        String copyId = lifecycle.copy(managerId);

        JobSnapshot copy = job(copyId);
        assertEquals(JobStatus.PENDING, copy.status());
        assertEquals("announce (Copy)", copy.job().name());
        assertEquals(job(managerId).job().config(), copy.job().config());
        assertEquals(queued, deps.queue().size(), "copy is not queued");
    }

    @Test
    void deleteRejectsRunningTree() {
        JobDefinition definition = JobDefinition.of("announce", "notify",
                List.of(JobStep.of("announce", NotifyStepAction.TYPE, new NotifyConfig("ops", "hello"))));
        String managerId = deps.executor().execute(definition);

        JobStateException e = assertThrows(JobStateException.class, () -> lifecycle.delete(managerId));
        assertEquals(JobStateException.Reason.STILL_RUNNING, e.reason());
        assertTrue(jobService.getJob(managerId).isPresent());
    }

    @Test
    void deleteRemovesWholeTree() {
        String managerId = runAnnouncement();
        String stepId = JobIds.step(managerId, 0);

        assertEquals(2, lifecycle.delete(managerId));

        assertTrue(jobService.getJob(managerId).isEmpty());
        assertTrue(jobService.getJob(stepId).isEmpty());
        assertTrue(jobService.getLogs(stepId).isEmpty());
        assertEquals(0, jobService.listJobs(JobFilter.all()).totalCount());
    }

    @Test
    void cancelStopsRunAndPendingSteps() {
        JobDefinition definition = JobDefinition.of("announce", "notify", List.of(
                JobStep.of("first", NotifyStepAction.TYPE, new NotifyConfig("ops", "1")),
                JobStep.of("second", NotifyStepAction.TYPE, new NotifyConfig("ops", "2"))));
        String managerId = deps.executor().execute(definition);

        assertTrue(lifecycle.cancel(managerId));
        assertFalse(lifecycle.cancel(managerId), "already terminal");

        assertEquals(JobStatus.CANCELLED, job(managerId).status());
        assertEquals(JobStatus.CANCELLED, job(JobIds.step(managerId, 0)).status());
        assertEquals(JobStatus.CANCELLED, job(JobIds.step(managerId, 1)).status());

        // The queued first step is dropped, not run
        drain();
        assertEquals(JobStatus.CANCELLED, job(JobIds.step(managerId, 0)).status());
    }

    @Test
    void copyOfChildJobIsIndependentRoot() {
        // 1. A running step with one outstanding crawl job
        Job manager = Job.builder().id("m-1").type("manager").name("site").createdAt(Instant.now()).build();
        jobService.createJob(manager);
        jobService.start("m-1");
        Job step = jobService.createChild(manager, JobIds.step("m-1", 0), "step", "crawl", Map.of());
        jobService.start(step.id());
        Job page = jobService.createChild(step, "w-1", "crawl_url", "page", Map.of("url", "https://example.com/"));

        String copyId = lifecycle.copy("w-1");

        // 2. The copy stands alone and the step's counters only see the original
        JobSnapshot copy = job(copyId);
        assertTrue(copy.job().isRoot());
        assertEquals(copyId, copy.job().rootId());
        assertEquals(0, copy.job().depth());
        assertEquals("https://example.com/", copy.job().configString("url"));
        assertEquals(1, job(step.id()).state().progress().outstanding());
        assertEquals(2, job("m-1").state().progress().total(), "step and original page only");

        // 3. Finishing the original leaves nothing outstanding under the step
        jobService.start(page.id());
        jobService.complete(page.id());
        assertEquals(0, job(step.id()).state().progress().outstanding());
        assertEquals(1, jobService.listChildren(step.id()).size());
    }
}
