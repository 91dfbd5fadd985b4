package quarry.engine.config;

import java.time.Duration;

/**
 * Configuration holder for the job engine.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/quarry;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Queue settings
    private Duration leaseDuration = Duration.ofMinutes(2);
    private int maxReceives = 5;
    private Duration retryBackoff = Duration.ofSeconds(2);
    private Duration maxRetryBackoff = Duration.ofMinutes(1);

    // Worker pool settings
    private int workerConcurrency = 4;
    private Duration pollInterval = Duration.ofMillis(500);
    private Duration jobTimeout = Duration.ofMinutes(10);
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    // Completion probe settings
    private Duration probeDelay = Duration.ofSeconds(2);
    private Duration probeStaleness = Duration.ofSeconds(5);
    private Duration probeMaxAge = Duration.ofMinutes(30);

    // Orchestrator settings
    private Duration toolWaitInterval = Duration.ofSeconds(3);
    private Duration toolWaitMax = Duration.ofMinutes(10);
    private int maxReviewRounds = 2;

    // Retention settings
    private Duration retentionAge = Duration.ofDays(7);
    private Duration retentionInterval = Duration.ofHours(1);

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        // Override from environment variables
        String dbUrl = System.getenv("QUARRY_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("QUARRY_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String workers = System.getenv("QUARRY_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.workerConcurrency = Integer.parseInt(workers.trim());
        }

        String maxReceives = System.getenv("QUARRY_MAX_RECEIVES");
        if (maxReceives != null && !maxReceives.isBlank()) {
            config.maxReceives = Integer.parseInt(maxReceives.trim());
        }

        String leaseSeconds = System.getenv("QUARRY_LEASE_SECONDS");
        if (leaseSeconds != null && !leaseSeconds.isBlank()) {
            config.leaseDuration = Duration.ofSeconds(Long.parseLong(leaseSeconds.trim()));
        }

        String timeoutMinutes = System.getenv("QUARRY_JOB_TIMEOUT_MINUTES");
        if (timeoutMinutes != null && !timeoutMinutes.isBlank()) {
            config.jobTimeout = Duration.ofMinutes(Long.parseLong(timeoutMinutes.trim()));
        }

        String retentionDays = System.getenv("QUARRY_RETENTION_DAYS");
        if (retentionDays != null && !retentionDays.isBlank()) {
            config.retentionAge = Duration.ofDays(Long.parseLong(retentionDays.trim()));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration leaseDuration() {
        return leaseDuration;
    }

    public int maxReceives() {
        return maxReceives;
    }

    public Duration retryBackoff() {
        return retryBackoff;
    }

    public Duration maxRetryBackoff() {
        return maxRetryBackoff;
    }

    public int workerConcurrency() {
        return workerConcurrency;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration jobTimeout() {
        return jobTimeout;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration probeDelay() {
        return probeDelay;
    }

    public Duration probeStaleness() {
        return probeStaleness;
    }

    public Duration probeMaxAge() {
        return probeMaxAge;
    }

    public Duration toolWaitInterval() {
        return toolWaitInterval;
    }

    public Duration toolWaitMax() {
        return toolWaitMax;
    }

    public int maxReviewRounds() {
        return maxReviewRounds;
    }

    public Duration retentionAge() {
        return retentionAge;
    }

    public Duration retentionInterval() {
        return retentionInterval;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public EngineConfig withLeaseDuration(Duration lease) {
        this.leaseDuration = lease;
        return this;
    }

    public EngineConfig withMaxReceives(int maxReceives) {
        this.maxReceives = maxReceives;
        return this;
    }

    public EngineConfig withRetryBackoff(Duration backoff) {
        this.retryBackoff = backoff;
        return this;
    }

    public EngineConfig withWorkerConcurrency(int workers) {
        this.workerConcurrency = workers;
        return this;
    }

    public EngineConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public EngineConfig withJobTimeout(Duration timeout) {
        this.jobTimeout = timeout;
        return this;
    }

    public EngineConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public EngineConfig withProbeDelay(Duration delay) {
        this.probeDelay = delay;
        return this;
    }

    public EngineConfig withProbeStaleness(Duration staleness) {
        this.probeStaleness = staleness;
        return this;
    }

    public EngineConfig withProbeMaxAge(Duration maxAge) {
        this.probeMaxAge = maxAge;
        return this;
    }

    public EngineConfig withToolWaitInterval(Duration interval) {
        this.toolWaitInterval = interval;
        return this;
    }

    public EngineConfig withToolWaitMax(Duration max) {
        this.toolWaitMax = max;
        return this;
    }

    public EngineConfig withMaxReviewRounds(int rounds) {
        this.maxReviewRounds = rounds;
        return this;
    }

    public EngineConfig withRetentionAge(Duration age) {
        this.retentionAge = age;
        return this;
    }

    public EngineConfig withRetentionInterval(Duration interval) {
        this.retentionInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", workers=" + workerConcurrency +
                ", lease=" + leaseDuration +
                ", maxReceives=" + maxReceives +
                ", probeStaleness=" + probeStaleness +
                '}';
    }
}
