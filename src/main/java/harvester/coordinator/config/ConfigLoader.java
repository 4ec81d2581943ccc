package harvester.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Builds a {@link CoordinatorConfig} from defaults, an optional INI file and
 * environment variables, in that order of precedence (later wins).
 *
 * Supported sections: [database], [server], [pipeline], [worker].
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_CONFIG_FILE = "HARVESTER_CONFIG";

    private ConfigLoader() {
    }

    /**
     * Load config using the file named by HARVESTER_CONFIG, if any, then the environment.
     */
    public static CoordinatorConfig load() {
        Map<String, String> env = System.getenv();
        CoordinatorConfig config = CoordinatorConfig.defaults();
        String file = env.get(ENV_CONFIG_FILE);
        if (file != null && !file.isBlank()) {
            applyIni(config, new File(file));
        }
        return applyEnv(config, env);
    }

    /**
     * Overlay values from an INI file. Missing keys keep their current value.
     *
     * @throws IllegalArgumentException if the file cannot be read or a value is malformed
     */
    public static CoordinatorConfig applyIni(CoordinatorConfig config, File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file: " + file, e);
        }

        Profile.Section db = ini.get("database");
        Profile.Section server = ini.get("server");
        Profile.Section pipeline = ini.get("pipeline");
        Profile.Section worker = ini.get("worker");

        // database
        String url = opt(db, "url");
        if (url != null) config.withDatabaseUrl(url);
        String pool = opt(db, "pool_size");
        if (pool != null) config.withDatabasePoolSize(Integer.parseInt(pool));

        // server
        String host = opt(server, "host");
        if (host != null) config.withServerHost(host);
        String port = opt(server, "port");
        if (port != null) config.withServerPort(Integer.parseInt(port));

        // pipeline
        String dataDir = opt(pipeline, "data_dir");
        if (dataDir != null) config.withDataDir(Path.of(dataDir));
        String batchSize = opt(pipeline, "batch_size");
        if (batchSize != null) config.withBatchSize(Integer.parseInt(batchSize));
        String maxRetries = opt(pipeline, "max_retries");
        if (maxRetries != null) config.withMaxRetries(Integer.parseInt(maxRetries));
        String base = opt(pipeline, "retry_base_seconds");
        String cap = opt(pipeline, "retry_max_seconds");
        if (base != null || cap != null) {
            config.withRetryBackoff(
                    base != null ? Duration.ofSeconds(Long.parseLong(base)) : config.retryBaseDelay(),
                    cap != null ? Duration.ofSeconds(Long.parseLong(cap)) : config.retryMaxDelay());
        }
        String extractionUrl = opt(pipeline, "extraction_url");
        if (extractionUrl != null) config.withExtractionUrl(extractionUrl);
        String webhookTimeout = opt(pipeline, "webhook_timeout_seconds");
        if (webhookTimeout != null) config.withWebhookTimeout(Duration.ofSeconds(Long.parseLong(webhookTimeout)));

        // worker
        String count = opt(worker, "count");
        if (count != null) config.withWorkerCount(Integer.parseInt(count));
        String stuck = opt(worker, "claim_stuck_minutes");
        if (stuck != null) config.withClaimStuckThreshold(Duration.ofMinutes(Long.parseLong(stuck)));
        String extractionTimeout = opt(worker, "extraction_timeout_seconds");
        if (extractionTimeout != null) {
            config.withExtractionTimeout(Duration.ofSeconds(Long.parseLong(extractionTimeout)));
        }

        log.info("Loaded config file {}", file);
        return config;
    }

    /**
     * Overlay values from environment variables.
     */
    public static CoordinatorConfig applyEnv(CoordinatorConfig config, Map<String, String> env) {
        String dbUrl = env.get("HARVESTER_DB_URL");
        if (notBlank(dbUrl)) {
            config.withDatabaseUrl(dbUrl);
        }

        String port = env.get("HARVESTER_PORT");
        if (notBlank(port)) {
            config.withServerPort(Integer.parseInt(port));
        }

        String dataDir = env.get("HARVESTER_DATA_DIR");
        if (notBlank(dataDir)) {
            config.withDataDir(Path.of(dataDir));
        }

        String batchSize = env.get("HARVESTER_BATCH_SIZE");
        if (notBlank(batchSize)) {
            config.withBatchSize(Integer.parseInt(batchSize));
        }

        String maxRetries = env.get("HARVESTER_MAX_RETRIES");
        if (notBlank(maxRetries)) {
            config.withMaxRetries(Integer.parseInt(maxRetries));
        }

        String workers = env.get("HARVESTER_WORKERS");
        if (notBlank(workers)) {
            config.withWorkerCount(Integer.parseInt(workers));
        }

        String extractionUrl = env.get("HARVESTER_EXTRACTION_URL");
        if (notBlank(extractionUrl)) {
            config.withExtractionUrl(extractionUrl);
        }

        return config;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) {
            return null;
        }
        String v = s.get(key);
        return notBlank(v) ? v.trim() : null;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
