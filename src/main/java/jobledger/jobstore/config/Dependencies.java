package jobledger.jobstore.config;

import jobledger.jobstore.ledger.ExecutionLedger;
import jobledger.jobstore.repository.ExecutionRepository;
import jobledger.jobstore.repository.JobRecordRepository;
import jobledger.jobstore.serializer.JobSerializer;
import jobledger.jobstore.serializer.JsonJobSerializer;
import jobledger.jobstore.service.JdbcJobStore;
import jobledger.jobstore.service.JobStore;
import jobledger.jobstore.service.MemoryJobStore;
import jobledger.jobstore.store.Database;
import jobledger.jobstore.store.JdbcExecutionRepository;
import jobledger.jobstore.store.JdbcJobRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates, wires and owns the job store and everything under it.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(JobStoreConfig.fromEnv());
 * deps.start();
 * JobStore store = deps.jobStore();
 * scheduler.addListener(store.eventListener());
 * // ... run the scheduler ...
 * deps.close(); // shuts the store down and closes the pool
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final JobStoreConfig config;
    private final Database database;
    private final JobRecordRepository jobRecordRepository;
    private final ExecutionRepository executionRepository;
    private final JobSerializer serializer;
    private final ExecutionLedger executionLedger;
    private final JobStore jobStore;

    private volatile boolean started = false;

    private Dependencies(JobStoreConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRecordRepository = new JdbcJobRecordRepository(database);
        this.executionRepository = new JdbcExecutionRepository(database);

        // Services
        this.serializer = new JsonJobSerializer();
        this.executionLedger = new ExecutionLedger(executionRepository);
        this.jobStore = switch (config.backend()) {
            case JDBC -> new JdbcJobStore(jobRecordRepository, serializer, executionLedger);
            case MEMORY -> new MemoryJobStore(executionLedger);
        };

        log.info("Dependencies initialized successfully: {}", jobStore);
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(JobStoreConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(JobStoreConfig.fromEnv());
    }

    /**
     * Mark the store as in service. Call once the scheduler is wired to
     * {@link JobStore#eventListener()}.
     */
    public void start() {
        if (started) {
            log.warn("Job store already started");
            return;
        }
        started = true;
        log.info("Starting job store...");
    }

    public boolean isStarted() {
        return started;
    }

    // Getters
    public JobStoreConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRecordRepository jobRecordRepository() {
        return jobRecordRepository;
    }

    public ExecutionRepository executionRepository() {
        return executionRepository;
    }

    public JobSerializer serializer() {
        return serializer;
    }

    public ExecutionLedger executionLedger() {
        return executionLedger;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    @Override
    public void close() {
        log.info("Stopping job store...");

        // Shut the store down first
        try {
            jobStore.shutdown();
        } catch (Exception e) {
            log.warn("Error shutting down job store: {}", e.getMessage());
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        started = false;
        log.info("Job store shut down successfully!");
    }
}
