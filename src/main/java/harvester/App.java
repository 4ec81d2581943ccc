package harvester;

import harvester.coordinator.config.ConfigLoader;
import harvester.coordinator.config.CoordinatorConfig;
import harvester.coordinator.config.Dependencies;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobCounts;
import harvester.coordinator.server.CoordinatorServer;
import harvester.coordinator.split.LineInputSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point.
 *
 * <pre>
 * harvester [serve]                 run the HTTP API, workers and scheduler
 * harvester submit &lt;file&gt; [owner]   submit a target list; runs it here if an extraction URL is set
 * harvester list                    list jobs
 * harvester show &lt;jobId&gt;            job status and batch counters
 * harvester resume &lt;jobId&gt;          finish a job in this process
 * harvester cancel &lt;jobId&gt;          cancel a job
 * harvester clean [days]            delete batch fragments of jobs finished more than days ago (default 30)
 * </pre>
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final int DEFAULT_CLEAN_DAYS = 30;

    private final Dependencies deps;
    private final PrintStream out;

    App(Dependencies deps, PrintStream out) {
        this.deps = deps;
        this.out = out;
    }

    public static void main(String[] args) {
        CoordinatorConfig config = ConfigLoader.load();
        int exitCode;
        try (Dependencies deps = Dependencies.create(config)) {
            exitCode = new App(deps, System.out).run(args);
        } catch (Exception e) {
            log.error("Fatal error", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    int run(String[] args) throws Exception {
        String command = args.length == 0 ? "serve" : args[0];
        List<String> rest = Arrays.asList(args).subList(Math.min(1, args.length), args.length);

        switch (command) {
            case "serve":
                serve();
                return 0;
            case "submit":
                requireArgs(rest, 1, "submit <file> [owner]");
                return submit(Path.of(rest.get(0)), rest.size() > 1 ? rest.get(1) : null);
            case "list":
                list();
                return 0;
            case "show":
                requireArgs(rest, 1, "show <jobId>");
                return show(rest.get(0));
            case "resume":
                requireArgs(rest, 1, "resume <jobId>");
                return resume(rest.get(0));
            case "cancel":
                requireArgs(rest, 1, "cancel <jobId>");
                return deps.jobService().cancel(rest.get(0)) ? 0 : 1;
            case "clean":
                return clean(rest.isEmpty() ? DEFAULT_CLEAN_DAYS : parseDays(rest.get(0)));
            default:
                out.println("Unknown command: " + command);
                out.println("Commands: serve, submit, list, show, resume, cancel, clean");
                return 2;
        }
    }

    private void serve() throws InterruptedException {
        int resumed = deps.resumeController().resumeAll();
        log.info("Startup resume enqueued {} batches", resumed);

        if (deps.hasExtractionService()) {
            deps.startWorkers();
        } else {
            log.warn("No extraction service configured; jobs are accepted but not processed");
        }
        deps.startScheduler();

        CoordinatorServer server = deps.server();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "harvester-shutdown"));
        server.start();
        server.awaitTermination();
    }

    private int submit(Path file, String owner) throws IOException, InterruptedException {
        CoordinatorConfig config = deps.config();
        Job job;
        try (LineInputSource input = LineInputSource.open(file)) {
            job = deps.jobService().submit(owner, input, config.defaultBatchSize(), config.defaultMaxRetries(), null);
        }
        out.println("Submitted " + job.id() + ": " + job.totalRows() + " rows in " + job.totalBatches() + " batches");

        if (!deps.hasExtractionService()) {
            out.println("No extraction service configured; the job will run when 'serve' starts");
            return 0;
        }
        return runToCompletion(job.id());
    }

    private int resume(String jobId) throws InterruptedException {
        if (deps.jobService().findById(jobId).isEmpty()) {
            out.println("Job not found: " + jobId);
            return 1;
        }
        int enqueued = deps.resumeController().resume(jobId);
        out.println("Re-enqueued " + enqueued + " batches of " + jobId);
        if (enqueued == 0 || !deps.hasExtractionService()) {
            return show(jobId);
        }
        return runToCompletion(jobId);
    }

    private int runToCompletion(String jobId) throws InterruptedException {
        deps.startWorkers();
        deps.startScheduler();
        while (true) {
            Optional<Job> job = deps.jobService().findById(jobId);
            if (job.isEmpty() || job.get().isTerminal()) {
                break;
            }
            Thread.sleep(1000);
        }
        return show(jobId);
    }

    private void list() {
        for (Job job : deps.jobService().findAll()) {
            out.printf("%s  %-9s  %6d batches  %8d rows  %s%n",
                    job.id(), job.status(), job.totalBatches(), job.totalRows(),
                    job.owner() != null ? job.owner() : "-");
        }
    }

    private int show(String jobId) {
        Optional<Job> jobOpt = deps.jobService().findById(jobId);
        if (jobOpt.isEmpty()) {
            out.println("Job not found: " + jobId);
            return 1;
        }
        Job job = jobOpt.get();
        JobCounts counts = deps.jobService().counts(jobId);
        out.println("Job:       " + job.id());
        out.println("Status:    " + job.status());
        out.println("Owner:     " + (job.owner() != null ? job.owner() : "-"));
        out.println("Batches:   " + counts.completed() + "/" + job.totalBatches() + " completed, "
                + counts.pending() + " pending, " + counts.claimed() + " claimed, " + counts.failed() + " failed");
        if (job.finalArtifactRef() != null) {
            out.println("Result:    " + job.finalArtifactRef());
        }
        if (job.errorMessage() != null) {
            out.println("Error:     " + job.errorMessage());
        }
        if (job.failedBatchIndex() != null) {
            out.println("Failed at: batch " + job.failedBatchIndex());
        }
        return switch (job.status()) {
            case FAILED, CANCELLED -> 1;
            default -> 0;
        };
    }

    private int clean(int days) {
        int cleaned = deps.jobService().cleanFinishedJobs(Duration.ofDays(days));
        out.println("Removed fragments of " + cleaned + " jobs finished more than " + days + " days ago");
        return 0;
    }

    private static int parseDays(String value) {
        try {
            int days = Integer.parseInt(value);
            if (days >= 0) {
                return days;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Usage: harvester clean [days]", e);
        }
        throw new IllegalArgumentException("Usage: harvester clean [days]");
    }

    private static void requireArgs(List<String> args, int count, String usage) {
        if (args.size() < count) {
            throw new IllegalArgumentException("Usage: harvester " + usage);
        }
    }
}
