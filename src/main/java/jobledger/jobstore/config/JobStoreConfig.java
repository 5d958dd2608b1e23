package jobledger.jobstore.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Configuration holder for the job store.
 * All settings have sensible defaults.
 */
public final class JobStoreConfig {

    /** Where job records live. The execution ledger is always relational. */
    public enum Backend {
        JDBC,
        MEMORY
    }

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/jobledger;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;
    private Duration connectionTimeout = Duration.ofSeconds(5);

    // Store settings
    private Backend backend = Backend.JDBC;

    private JobStoreConfig() {
    }

    public static JobStoreConfig defaults() {
        return new JobStoreConfig();
    }

    public static JobStoreConfig fromEnv() {
        JobStoreConfig config = new JobStoreConfig();

        String dbUrl = System.getenv("JOBLEDGER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("JOBLEDGER_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String backend = System.getenv("JOBLEDGER_BACKEND");
        if (backend != null && !backend.isBlank()) {
            config.backend = parseBackend(backend);
        }

        return config;
    }

    static Backend parseBackend(String value) {
        try {
            return Backend.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job store backend: '" + value + "' (expected jdbc or memory)", e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration connectionTimeout() {
        return connectionTimeout;
    }

    public Backend backend() {
        return backend;
    }

    // Fluent setters for testing/customization
    public JobStoreConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public JobStoreConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public JobStoreConfig withConnectionTimeout(Duration timeout) {
        this.connectionTimeout = timeout;
        return this;
    }

    public JobStoreConfig withBackend(Backend backend) {
        this.backend = backend;
        return this;
    }

    @Override
    public String toString() {
        return "JobStoreConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", poolSize=" + databasePoolSize +
                ", backend=" + backend +
                '}';
    }
}
