package harvester.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import harvester.coordinator.api.Controller;
import harvester.coordinator.api.v1.dto.BatchResponse;
import harvester.coordinator.api.v1.dto.CreateJobRequest;
import harvester.coordinator.api.v1.dto.JobResponse;
import harvester.coordinator.config.CoordinatorConfig;
import harvester.coordinator.error.ValidationException;
import harvester.coordinator.model.Job;
import harvester.coordinator.service.JobService;
import harvester.coordinator.service.ResumeController;
import harvester.coordinator.split.InputSource;
import harvester.coordinator.split.LineInputSource;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for Job management (public API).
 *
 * POST /api/v1/jobs - Submit a job
 * GET /api/v1/jobs - List jobs (?owner=, ?limit=)
 * GET /api/v1/jobs/{jobId} - Job status with batch counters
 * GET /api/v1/jobs/{jobId}/batches - Batches in index order
 * POST /api/v1/jobs/{jobId}/resume - Re-enqueue outstanding batches
 * POST /api/v1/jobs/{jobId}/cancel - Cancel a running job
 * POST /api/v1/jobs/{jobId}/batches/{index}/rerun - Re-run one slice as a new job
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_BATCHES_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/batches$");
    private static final Pattern JOB_RESUME_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/resume$");
    private static final Pattern JOB_CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");
    private static final Pattern BATCH_RERUN_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/batches/(\\d+)/rerun$");

    private static final String JOB_NOT_FOUND = "{\"success\":false,\"error\":\"job not found\"}";

    private final JobService jobService;
    private final ResumeController resumeController;
    private final CoordinatorConfig config;
    private final ObjectMapper mapper;

    public JobController(JobService jobService, ResumeController resumeController, CoordinatorConfig config,
            ObjectMapper mapper) {
        this.jobService = jobService;
        this.resumeController = resumeController;
        this.config = config;
        this.mapper = mapper;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches()
                    || JOB_RESUME_PATTERN.matcher(path).matches()
                    || JOB_CANCEL_PATTERN.matcher(path).matches()
                    || BATCH_RERUN_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches()
                    || JOB_BY_ID_PATTERN.matcher(path).matches()
                    || JOB_BATCHES_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handlePost(req, path);
            }
            return handleGet(req, path);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handlePost(FullHttpRequest req, String path) throws Exception {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return handleCreateJob(req);
        }

        Matcher m = JOB_RESUME_PATTERN.matcher(path);
        if (m.matches()) {
            return handleResume(m.group(1));
        }

        m = JOB_CANCEL_PATTERN.matcher(path);
        if (m.matches()) {
            return handleCancel(m.group(1));
        }

        m = BATCH_RERUN_PATTERN.matcher(path);
        if (m.matches()) {
            return handleRerun(m.group(1), Integer.parseInt(m.group(2)));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    private ControllerResponse handleGet(FullHttpRequest req, String path) throws Exception {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return handleListJobs(req);
        }

        Matcher m = JOB_BATCHES_PATTERN.matcher(path);
        if (m.matches()) {
            return handleGetBatches(m.group(1));
        }

        m = JOB_BY_ID_PATTERN.matcher(path);
        if (m.matches()) {
            return handleGetJob(m.group(1));
        }

        return ControllerResponse.notFound("unknown job endpoint");
    }

    /**
     * POST /api/v1/jobs - Submit a job
     */
    private ControllerResponse handleCreateJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateJobRequest request;
        try {
            request = mapper.readValue(body, CreateJobRequest.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed request body: " + e.getOriginalMessage());
        }
        request.validate();

        int batchSize = request.batchSizeOr(config.defaultBatchSize());
        int maxRetries = request.maxRetriesOr(config.defaultMaxRetries());

        Job job;
        if (request.hasInlineTargets()) {
            try (InputSource input = InputSource.of("inline", request.targets())) {
                job = jobService.submit(request.owner(), input, batchSize, maxRetries, request.webhookUrl());
            }
        } else {
            try (InputSource input = LineInputSource.open(Path.of(request.inputPath()))) {
                job = jobService.submit(request.owner(), input, batchSize, maxRetries, request.webhookUrl());
            } catch (IOException e) {
                throw new ValidationException("cannot read inputPath: " + request.inputPath());
            }
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("jobId", job.id());
        response.put("totalBatches", job.totalBatches());
        response.put("totalRows", job.totalRows());

        return ControllerResponse.json(HttpResponseStatus.CREATED, mapper.writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs - List jobs, most recent first
     */
    private ControllerResponse handleListJobs(FullHttpRequest req) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        String owner = firstParam(query, "owner");
        String limit = firstParam(query, "limit");

        List<Job> jobs;
        if (owner != null) {
            jobs = jobService.findByOwner(owner);
        } else if (limit != null) {
            jobs = jobService.findRecent(parsePositive(limit, "limit"));
        } else {
            jobs = jobService.findAll();
        }

        List<JobResponse> items = jobs.stream().map(JobResponse::from).toList();
        return ControllerResponse.json(mapper.writeValueAsString(Map.of("jobs", items, "count", items.size())));
    }

    /**
     * GET /api/v1/jobs/{jobId} - Job status
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<Job> jobOpt = jobService.findById(jobId);
        if (jobOpt.isEmpty()) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND, JOB_NOT_FOUND);
        }

        JobResponse response = JobResponse.from(jobOpt.get(), jobService.counts(jobId));
        return ControllerResponse.json(mapper.writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{jobId}/batches - Batches of a job
     */
    private ControllerResponse handleGetBatches(String jobId) throws Exception {
        if (jobService.findById(jobId).isEmpty()) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND, JOB_NOT_FOUND);
        }

        List<BatchResponse> batches = jobService.getBatches(jobId).stream()
                .map(BatchResponse::from)
                .toList();
        return ControllerResponse.json(mapper.writeValueAsString(Map.of("jobId", jobId, "batches", batches)));
    }

    /**
     * POST /api/v1/jobs/{jobId}/resume
     */
    private ControllerResponse handleResume(String jobId) throws Exception {
        if (jobService.findById(jobId).isEmpty()) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND, JOB_NOT_FOUND);
        }

        int enqueued = resumeController.resume(jobId);
        Job job = jobService.findById(jobId).orElseThrow();
        return ControllerResponse.json(mapper.writeValueAsString(Map.of(
                "jobId", jobId,
                "status", job.status().name(),
                "enqueued", enqueued)));
    }

    /**
     * POST /api/v1/jobs/{jobId}/cancel
     */
    private ControllerResponse handleCancel(String jobId) throws Exception {
        Optional<Job> jobOpt = jobService.findById(jobId);
        if (jobOpt.isEmpty()) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND, JOB_NOT_FOUND);
        }
        if (!jobService.cancel(jobId)) {
            Job job = jobService.findById(jobId).orElse(jobOpt.get());
            return ControllerResponse.conflict("job is already " + job.status());
        }
        return ControllerResponse.json(mapper.writeValueAsString(Map.of(
                "success", true,
                "jobId", jobId,
                "status", "CANCELLED")));
    }

    /**
     * POST /api/v1/jobs/{jobId}/batches/{index}/rerun
     */
    private ControllerResponse handleRerun(String jobId, int batchIndex) throws Exception {
        Optional<Job> rerun = jobService.rerunFailedSlice(jobId, batchIndex, config.defaultMaxRetries());
        if (rerun.isEmpty()) {
            return ControllerResponse.notFound("job or batch not found");
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("sourceJobId", jobId);
        response.put("batchIndex", batchIndex);
        response.put("jobId", rerun.get().id());
        return ControllerResponse.json(HttpResponseStatus.CREATED, mapper.writeValueAsString(response));
    }

    private static String firstParam(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static int parsePositive(String value, String name) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be a positive integer");
        }
        if (parsed <= 0) {
            throw new ValidationException(name + " must be a positive integer");
        }
        return parsed;
    }
}
