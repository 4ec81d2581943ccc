package harvester.coordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import harvester.coordinator.api.v1.HealthController;
import harvester.coordinator.api.v1.JobController;
import harvester.coordinator.extraction.ExtractionService;
import harvester.coordinator.extraction.HttpExtractionService;
import harvester.coordinator.queue.BatchQueue;
import harvester.coordinator.queue.DelayedBatchQueue;
import harvester.coordinator.repository.BatchRepository;
import harvester.coordinator.repository.JobRepository;
import harvester.coordinator.scheduler.ClaimReaper;
import harvester.coordinator.scheduler.Scheduler;
import harvester.coordinator.server.CoordinatorServer;
import harvester.coordinator.server.RouterHandler;
import harvester.coordinator.service.CompletionNotifier;
import harvester.coordinator.service.JobService;
import harvester.coordinator.service.Merger;
import harvester.coordinator.service.ResumeController;
import harvester.coordinator.split.Splitter;
import harvester.coordinator.store.Database;
import harvester.coordinator.store.FragmentStore;
import harvester.coordinator.store.JdbcBatchRepository;
import harvester.coordinator.store.JdbcJobRepository;
import harvester.coordinator.worker.BatchWorker;
import harvester.coordinator.worker.RetryPolicy;
import harvester.coordinator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ConfigLoader.load());
 * deps.resumeController().resumeAll(); // re-drive work left by a previous run
 * deps.startWorkers();
 * deps.startScheduler();
 * // ... serve ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final ObjectMapper mapper;
    private final Database database;
    private final JobRepository jobRepository;
    private final BatchRepository batchRepository;
    private final FragmentStore fragmentStore;
    private final BatchQueue queue;
    private final ExtractionService extractionService;

    // Services
    private final CompletionNotifier notifier;
    private final Merger merger;
    private final JobService jobService;
    private final ResumeController resumeController;

    private final WorkerPool workerPool;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, ExtractionService extractionService) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .findAndRegisterModules();

        // Infrastructure
        this.database = new Database(config);
        this.fragmentStore = new FragmentStore(config.dataDir(), mapper);
        this.queue = new DelayedBatchQueue();

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.batchRepository = new JdbcBatchRepository(database);

        // Services
        this.notifier = new CompletionNotifier(mapper, config.webhookTimeout());
        this.merger = new Merger(jobRepository, batchRepository, fragmentStore, mapper, notifier);
        this.jobService = new JobService(jobRepository, batchRepository, new Splitter(fragmentStore),
                fragmentStore, queue, merger, notifier);
        this.resumeController = new ResumeController(jobRepository, batchRepository, queue, merger);

        // Workers
        this.extractionService = extractionService != null ? extractionService : defaultExtraction(config, mapper);
        RetryPolicy retryPolicy = RetryPolicy.from(config);
        this.workerPool = new WorkerPool(config.workerCount(), "w" + ProcessHandle.current().pid(),
                workerId -> new BatchWorker(workerId, queue, batchRepository, fragmentStore,
                        this.extractionService, retryPolicy, jobService));

        // Controllers
        this.healthController = new HealthController(database, batchRepository, queue, workerPool, mapper);
        this.jobController = new JobController(jobService, resumeController, config, mapper);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config. Extraction goes to the
     * configured HTTP endpoint, if any.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, null);
    }

    /**
     * Create dependencies with an explicit extraction service.
     */
    public static Dependencies create(CoordinatorConfig config, ExtractionService extractionService) {
        return new Dependencies(config, extractionService);
    }

    private static ExtractionService defaultExtraction(CoordinatorConfig config, ObjectMapper mapper) {
        if (!config.hasExtractionUrl()) {
            return null;
        }
        return new HttpExtractionService(config.extractionUrl(), mapper, config.extractionTimeout());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public BatchRepository batchRepository() {
        return batchRepository;
    }

    public FragmentStore fragmentStore() {
        return fragmentStore;
    }

    public BatchQueue queue() {
        return queue;
    }

    public Merger merger() {
        return merger;
    }

    public JobService jobService() {
        return jobService;
    }

    public ResumeController resumeController() {
        return resumeController;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public boolean hasExtractionService() {
        return extractionService != null;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(jobController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    public CoordinatorServer server() {
        return new CoordinatorServer(config.serverHost(), config.serverPort(), routerHandler());
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            ClaimReaper reaper = new ClaimReaper(batchRepository, queue, jobService, config.claimStuckThreshold());
            scheduler = new Scheduler(reaper, config.claimReaperInterval());
        }
        return scheduler;
    }

    /**
     * Start the worker pool.
     *
     * @throws IllegalStateException if no extraction service is configured
     */
    public void startWorkers() {
        if (extractionService == null) {
            throw new IllegalStateException("No extraction service configured (set HARVESTER_EXTRACTION_URL)");
        }
        workerPool.start();
    }

    /**
     * Start the background scheduler for stuck-claim recovery.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            workerPool.stop();
        } catch (Exception e) {
            log.warn("Error stopping workers: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
