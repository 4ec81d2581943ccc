package harvester.coordinator.api.v1;

import com.fasterxml.jackson.databind.ObjectMapper;
import harvester.coordinator.api.Controller;
import harvester.coordinator.api.v1.dto.HealthResponse;
import harvester.coordinator.model.BatchStatus;
import harvester.coordinator.queue.BatchQueue;
import harvester.coordinator.repository.BatchRepository;
import harvester.coordinator.store.Database;
import harvester.coordinator.worker.WorkerPool;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final BatchRepository batchRepository;
    private final BatchQueue queue;
    private final WorkerPool workerPool;
    private final ObjectMapper mapper;

    public HealthController(Database database, BatchRepository batchRepository, BatchQueue queue,
            WorkerPool workerPool, ObjectMapper mapper) {
        this.database = database;
        this.batchRepository = batchRepository;
        this.queue = queue;
        this.workerPool = workerPool;
        this.mapper = mapper;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unhealthy("connection failed");
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    workerPool.isRunning() ? workerPool.size() : 0,
                    queue.size(),
                    batchRepository.countByStatus(BatchStatus.PENDING),
                    batchRepository.countByStatus(BatchStatus.CLAIMED));

            return ControllerResponse.json(mapper.writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                return unhealthy(e.getMessage());
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private ControllerResponse unhealthy(String reason) throws Exception {
        return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                mapper.writeValueAsString(HealthResponse.unhealthy(reason)));
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
