package quarry.engine.config;

import quarry.engine.crawl.CrawlFrontier;
import quarry.engine.crawl.CrawlStepAction;
import quarry.engine.crawl.CrawlUrlHandler;
import quarry.engine.event.EventBus;
import quarry.engine.executor.JobExecutor;
import quarry.engine.executor.JobLifecycleService;
import quarry.engine.executor.NotifyStepAction;
import quarry.engine.executor.ReindexStepAction;
import quarry.engine.executor.StepActionRegistry;
import quarry.engine.executor.StepRunHandler;
import quarry.engine.orchestrator.OrchestrateStepAction;
import quarry.engine.orchestrator.Planner;
import quarry.engine.orchestrator.PlanningHandler;
import quarry.engine.orchestrator.ReviewHandler;
import quarry.engine.orchestrator.Reviewer;
import quarry.engine.orchestrator.ToolExecutionHandler;
import quarry.engine.orchestrator.ToolRegistry;
import quarry.engine.orchestrator.WaitHandler;
import quarry.engine.probe.CompletionProbeHandler;
import quarry.engine.probe.ProbeScheduler;
import quarry.engine.queue.JdbcMessageQueue;
import quarry.engine.queue.MessageQueue;
import quarry.engine.repository.DedupStore;
import quarry.engine.repository.JobDefinitionStore;
import quarry.engine.repository.JobLogStore;
import quarry.engine.repository.JobStore;
import quarry.engine.scheduler.RetentionReaper;
import quarry.engine.scheduler.Scheduler;
import quarry.engine.service.JobService;
import quarry.engine.store.Database;
import quarry.engine.store.JdbcDedupStore;
import quarry.engine.store.JdbcJobDefinitionStore;
import quarry.engine.store.JdbcJobLogStore;
import quarry.engine.store.JdbcJobStore;
import quarry.engine.worker.HandlerRegistry;
import quarry.engine.worker.JobSpawner;
import quarry.engine.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the whole engine.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv(), collaborators);
 * deps.startWorkers();
 * deps.startScheduler();
 * String managerId = deps.executor().execute("nightly-crawl");
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;

    // Stores
    private final JobStore jobStore;
    private final JobLogStore jobLogStore;
    private final JobDefinitionStore definitionStore;
    private final DedupStore dedupStore;

    // Services
    private final EventBus events;
    private final JobService jobService;
    private final MessageQueue queue;
    private final JobSpawner spawner;
    private final StepActionRegistry stepActions;
    private final HandlerRegistry handlers;
    private final ToolRegistry tools;
    private final ProbeScheduler probes;
    private final JobExecutor executor;
    private final JobLifecycleService lifecycle;
    private final WorkerPool workerPool;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(EngineConfig config, Collaborators collaborators) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Stores
        this.jobStore = new JdbcJobStore(database);
        this.jobLogStore = new JdbcJobLogStore(database);
        this.definitionStore = new JdbcJobDefinitionStore(database);
        this.dedupStore = new JdbcDedupStore(database);

        // Core services
        this.events = new EventBus();
        this.jobService = new JobService(jobStore, jobLogStore, events);
        this.queue = new JdbcMessageQueue(database, config);
        this.spawner = new JobSpawner(jobService, queue);
        this.tools = new ToolRegistry(collaborators.tools());

        // Step actions
        CrawlFrontier frontier = new CrawlFrontier(dedupStore, jobService, spawner);
        this.stepActions = new StepActionRegistry()
                .register(new CrawlStepAction(frontier))
                .register(new ReindexStepAction(collaborators.searchIndex(), jobService))
                .register(new NotifyStepAction(events))
                .register(new OrchestrateStepAction(jobService, config));

        // Executor and probe react to terminal transitions
        this.probes = new ProbeScheduler(jobService, queue, config);
        this.executor = new JobExecutor(jobService, definitionStore, queue, stepActions, events);
        jobService.addCompletionListener(probes);
        jobService.addCompletionListener(executor);
        this.lifecycle = new JobLifecycleService(jobService, executor, queue);

        // Message handlers
        this.handlers = new HandlerRegistry()
                .register(new StepRunHandler(jobService, executor, stepActions, probes, spawner, config))
                .register(new CompletionProbeHandler(jobService, executor, config))
                .register(new CrawlUrlHandler(jobService, executor, collaborators.pageFetcher(),
                        collaborators.documentSink(), frontier))
                .register(new PlanningHandler(jobService, new Planner(collaborators.llm(), tools), spawner, config))
                .register(new ToolExecutionHandler(jobService, tools))
                .register(new WaitHandler(jobService, spawner, config))
                .register(new ReviewHandler(jobService, new Reviewer(collaborators.llm()), spawner));

        this.workerPool = new WorkerPool(queue, jobService, handlers, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(EngineConfig config, Collaborators collaborators) {
        return new Dependencies(config, collaborators);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create(Collaborators collaborators) {
        return create(EngineConfig.fromEnv(), collaborators);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public JobDefinitionStore definitionStore() {
        return definitionStore;
    }

    public DedupStore dedupStore() {
        return dedupStore;
    }

    public EventBus events() {
        return events;
    }

    public JobService jobService() {
        return jobService;
    }

    public MessageQueue queue() {
        return queue;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public StepActionRegistry stepActions() {
        return stepActions;
    }

    public JobExecutor executor() {
        return executor;
    }

    public JobLifecycleService lifecycle() {
        return lifecycle;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(new RetentionReaper(jobStore, jobService, config), config);
        }
        return scheduler;
    }

    public void startWorkers() {
        workerPool.start();
    }

    /**
     * Start background maintenance (retention).
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop consumers first so nothing touches the database while it closes
        try {
            workerPool.stop(config.shutdownTimeout());
        } catch (Exception e) {
            log.warn("Error stopping worker pool: {}", e.getMessage());
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
