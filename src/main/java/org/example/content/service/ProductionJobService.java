package org.example.content.service;

import org.example.content.model.OverallStatus;
import org.example.content.model.ProgressSummary;
import org.example.content.service.pipeline.PipelineOrchestrator;
import org.example.content.service.pipeline.PipelineOrchestratorFactory;
import org.example.content.service.pipeline.SeedParameters;
import org.example.content.service.pipeline.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs production pipelines in the background, at most one active job per entity.
 */
@Service
public class ProductionJobService {

    private static final Logger log = LoggerFactory.getLogger(ProductionJobService.class);

    public enum JobState {
        QUEUED,
        RUNNING,
        PAUSED,
        COMPLETED,
        EMPTY,
        FAILED
    }

    public record ProductionJobStatus(
            String jobId,
            String entityId,
            String recordId,
            JobState state,
            boolean pauseRequested,
            Instant createdAt,
            Instant startedAt,
            Instant completedAt,
            String message,
            String error,
            List<WorkItem> results,
            ProgressSummary progress
    ) {
    }

    private final PipelineOrchestratorFactory orchestratorFactory;
    private final Clock clock;
    private final ConcurrentHashMap<String, ProductionJob> jobs = new ConcurrentHashMap<>();
    private final ExecutorService executorService;

    public ProductionJobService(
            PipelineOrchestratorFactory orchestratorFactory,
            Clock clock,
            @Value("${production.jobs.max-concurrent:2}") int maxConcurrentJobs) {
        this.orchestratorFactory = orchestratorFactory;
        this.clock = clock;
        this.executorService = Executors.newFixedThreadPool(
                Math.max(1, maxConcurrentJobs),
                new ProductionJobThreadFactory());
    }

    /**
     * Creates the progress record and queues the run.
     *
     * @throws IllegalStateException if the entity already has a job that is not finished
     * @throws org.example.content.service.pipeline.PipelineException if the progress record cannot be created
     */
    public synchronized ProductionJobStatus startProduction(String entityId, SeedParameters seed) {
        Optional<ProductionJob> active = jobs.values().stream()
                .filter(job -> job.entityId.equals(entityId) && !isTerminalState(job.state))
                .findFirst();
        if (active.isPresent()) {
            throw new IllegalStateException("Production " + entityId + " already has active job " + active.get().jobId);
        }

        PipelineOrchestrator orchestrator = orchestratorFactory.create(entityId);
        ProductionJob job = new ProductionJob(UUID.randomUUID().toString(), entityId, orchestrator, clock.instant());
        jobs.put(job.jobId, job);
        log.info("Queued production job {} for {} (record {})", job.jobId, entityId, orchestrator.getRecordId());
        submitJob(job, () -> orchestrator.run(seed));
        return toStatus(job);
    }

    public Optional<ProductionJobStatus> getJobStatus(String jobId) {
        ProductionJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        return Optional.of(toStatus(job));
    }

    /**
     * The run stops before its next stage; the job turns {@link JobState#PAUSED} once it does.
     */
    public Optional<ProductionJobStatus> pauseJob(String jobId) {
        ProductionJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        if (isTerminalState(job.state) || job.state == JobState.PAUSED) {
            return Optional.of(toStatus(job));
        }
        job.orchestrator.requestPause();
        job.message = "Pause requested";
        return Optional.of(toStatus(job));
    }

    /**
     * @throws IllegalStateException if the job is not paused
     */
    public synchronized Optional<ProductionJobStatus> resumeJob(String jobId) {
        ProductionJob job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        if (job.state != JobState.PAUSED) {
            throw new IllegalStateException("Job " + jobId + " is not paused (state " + job.state + ")");
        }
        job.state = JobState.QUEUED;
        job.message = "Resume queued";
        log.info("Resuming production job {} for {}", jobId, job.entityId);
        submitJob(job, () -> job.orchestrator.resume(null));
        return Optional.of(toStatus(job));
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    private void submitJob(ProductionJob job, Supplier<List<WorkItem>> work) {
        executorService.submit(() -> runJob(job, work));
    }

    private void runJob(ProductionJob job, Supplier<List<WorkItem>> work) {
        job.state = JobState.RUNNING;
        if (job.startedAt == null) {
            job.startedAt = clock.instant();
        }
        job.message = "Job running";

        try {
            List<WorkItem> results = work.get();
            job.results = results == null ? List.of() : results;
            OverallStatus status = job.orchestrator.getProgressSummary().overallStatus();

            if (status == OverallStatus.PAUSED) {
                job.state = JobState.PAUSED;
                job.message = "Paused before " + job.orchestrator.getProgressSummary().pausedFromStage();
                log.info("Production job {} paused", job.jobId);
                return;
            }

            job.completedAt = clock.instant();
            if (job.results.isEmpty()) {
                job.state = JobState.EMPTY;
                job.message = "No items passed the quality gate";
                log.info("Production job {} finished without accepted items", job.jobId);
                return;
            }
            job.state = JobState.COMPLETED;
            job.message = "Production completed with " + job.results.size() + " accepted items";
            log.info("Production job {} completed with {} items", job.jobId, job.results.size());
        } catch (Exception ex) {
            markFailed(job, safeErrorMessage(ex));
            log.error("Production job {} for {} failed", job.jobId, job.entityId, ex);
        }
    }

    private void markFailed(ProductionJob job, String errorMessage) {
        job.state = JobState.FAILED;
        job.completedAt = clock.instant();
        job.error = firstNonBlank(errorMessage, "Production failed");
        job.message = "Production failed";
    }

    private boolean isTerminalState(JobState state) {
        return state == JobState.COMPLETED || state == JobState.EMPTY || state == JobState.FAILED;
    }

    private String safeErrorMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    private String firstNonBlank(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private ProductionJobStatus toStatus(ProductionJob job) {
        return new ProductionJobStatus(
                job.jobId,
                job.entityId,
                job.orchestrator.getRecordId(),
                job.state,
                job.orchestrator.isPauseRequested(),
                job.createdAt,
                job.startedAt,
                job.completedAt,
                job.message,
                job.error,
                job.results,
                job.orchestrator.getProgressSummary()
        );
    }

    private static final class ProductionJob {
        private final String jobId;
        private final String entityId;
        private final PipelineOrchestrator orchestrator;
        private final Instant createdAt;

        private volatile JobState state;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile String message;
        private volatile String error;
        private volatile List<WorkItem> results = List.of();

        private ProductionJob(String jobId, String entityId, PipelineOrchestrator orchestrator, Instant createdAt) {
            this.jobId = jobId;
            this.entityId = entityId;
            this.orchestrator = orchestrator;
            this.createdAt = createdAt;
            this.state = JobState.QUEUED;
            this.message = "Job queued";
        }
    }

    private static final class ProductionJobThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "production-job-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
