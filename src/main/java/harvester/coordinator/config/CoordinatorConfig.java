package harvester.coordinator.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the batch coordinator.
 * All settings have sensible defaults; {@link ConfigLoader} layers an INI file
 * and environment variables on top.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/harvester;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Pipeline settings
    private Path dataDir = Path.of("data");
    private int defaultBatchSize = 10_000;
    private int defaultMaxRetries = 2;

    // Retry backoff: delay = min(base * attempt, cap)
    private Duration retryBaseDelay = Duration.ofSeconds(10);
    private Duration retryMaxDelay = Duration.ofMinutes(5);

    // Worker settings
    private int workerCount = 4;
    private Duration claimStuckThreshold = Duration.ofMinutes(30);
    private Duration claimReaperInterval = Duration.ofMinutes(1);

    // Extraction service
    private String extractionUrl = null;
    private Duration extractionTimeout = Duration.ofMinutes(10);

    // Completion webhooks
    private Duration webhookTimeout = Duration.ofSeconds(10);

    CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return ConfigLoader.applyEnv(new CoordinatorConfig(), System.getenv());
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Path dataDir() {
        return dataDir;
    }

    public int defaultBatchSize() {
        return defaultBatchSize;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public int workerCount() {
        return workerCount;
    }

    public Duration claimStuckThreshold() {
        return claimStuckThreshold;
    }

    public Duration claimReaperInterval() {
        return claimReaperInterval;
    }

    public String extractionUrl() {
        return extractionUrl;
    }

    public boolean hasExtractionUrl() {
        return extractionUrl != null && !extractionUrl.isBlank();
    }

    public Duration extractionTimeout() {
        return extractionTimeout;
    }

    public Duration webhookTimeout() {
        return webhookTimeout;
    }

    // Fluent setters for loading/testing
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withDataDir(Path dataDir) {
        this.dataDir = dataDir;
        return this;
    }

    public CoordinatorConfig withBatchSize(int batchSize) {
        this.defaultBatchSize = batchSize;
        return this;
    }

    public CoordinatorConfig withMaxRetries(int maxRetries) {
        this.defaultMaxRetries = maxRetries;
        return this;
    }

    public CoordinatorConfig withRetryBackoff(Duration base, Duration max) {
        this.retryBaseDelay = base;
        this.retryMaxDelay = max;
        return this;
    }

    public CoordinatorConfig withWorkerCount(int workers) {
        this.workerCount = workers;
        return this;
    }

    public CoordinatorConfig withClaimStuckThreshold(Duration threshold) {
        this.claimStuckThreshold = threshold;
        return this;
    }

    public CoordinatorConfig withClaimReaperInterval(Duration interval) {
        this.claimReaperInterval = interval;
        return this;
    }

    public CoordinatorConfig withExtractionUrl(String url) {
        this.extractionUrl = url;
        return this;
    }

    public CoordinatorConfig withExtractionTimeout(Duration timeout) {
        this.extractionTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withWebhookTimeout(Duration timeout) {
        this.webhookTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", dataDir=" + dataDir +
                ", batchSize=" + defaultBatchSize +
                ", maxRetries=" + defaultMaxRetries +
                ", workers=" + workerCount +
                ", extractionUrlSet=" + hasExtractionUrl() +
                '}';
    }
}
