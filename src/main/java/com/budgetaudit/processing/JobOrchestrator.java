package com.budgetaudit.processing;

import com.budgetaudit.observability.MetricsServiceInterface;
import com.budgetaudit.observability.TracingServiceInterface;
import com.budgetaudit.processing.ai.AiExtractionClient;
import com.budgetaudit.processing.ai.AiExtractionResult;
import com.budgetaudit.processing.merge.MergeEngine;
import com.budgetaudit.processing.rules.RuleEngine;
import com.budgetaudit.processing.rules.RuleEvaluationReport;
import com.budgetaudit.processing.rules.RuleSetRegistry;
import com.budgetaudit.processing.rules.RuleStatus;
import com.budgetaudit.shared.dto.JobStatusResponse;
import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.Issue;
import com.budgetaudit.shared.model.Job;
import com.budgetaudit.shared.model.JobStatus;
import com.budgetaudit.shared.model.MergedResult;
import com.budgetaudit.shared.model.RuleSet;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Owns audit jobs. A job runs on the job executor; inside it the rule engine and the AI detector run
 * concurrently on the detector executor and are joined with a barrier before the merge.
 *
 * <p>One detector failing degrades the job; both failing, an unusable document or a cancellation
 * ends it in {@code error}. Callers only ever see immutable {@link Job} snapshots.
 */
@Service
public class JobOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(JobOrchestrator.class);

    public static final String RULE_DETECTOR = "rule";
    public static final String AI_DETECTOR = "ai";
    static final String CANCELLED = "cancelled";

    private final Map<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final RuleSetRegistry ruleSetRegistry;
    private final RuleEngine ruleEngine;
    private final AiExtractionClient aiExtractionClient;
    private final MergeEngine mergeEngine;
    private final ExecutorService jobExecutor;
    private final ExecutorService detectorExecutor;
    private final MetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;

    @Autowired
    public JobOrchestrator(RuleSetRegistry ruleSetRegistry,
                           RuleEngine ruleEngine,
                           AiExtractionClient aiExtractionClient,
                           MergeEngine mergeEngine,
                           @Qualifier("jobExecutor") ExecutorService jobExecutor,
                           @Qualifier("detectorExecutor") ExecutorService detectorExecutor,
                           MetricsServiceInterface metricsService,
                           TracingServiceInterface tracingService) {
        this.ruleSetRegistry = ruleSetRegistry;
        this.ruleEngine = ruleEngine;
        this.aiExtractionClient = aiExtractionClient;
        this.mergeEngine = mergeEngine;
        this.jobExecutor = jobExecutor;
        this.detectorExecutor = detectorExecutor;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Submits a document, auditing it against the rule set its cover page points to.
     *
     * @return the new job id; the job starts in {@code queued}
     */
    public String submit(Document document) {
        RuleSet ruleSet = document != null && document.isUsable()
                ? ruleSetRegistry.select(document)
                : ruleSetRegistry.defaultRuleSet();
        return submit(document, ruleSet);
    }

    public String submit(Document document, RuleSet ruleSet) {
        String jobId = UUID.randomUUID().toString();
        JobRecord record = new JobRecord(jobId, document != null ? document.getId() : null,
                ruleSet != null ? ruleSet.toString() : null, Instant.now());
        jobs.put(jobId, record);
        logger.info("Job {} queued for document {} with rule set {}", jobId,
                document != null ? document.getId() : null, ruleSet);
        record.setTask(jobExecutor.submit(() -> run(record, document, ruleSet)));
        return jobId;
    }

    void run(JobRecord record, Document document, RuleSet ruleSet) {
        MDC.put("jobId", record.getId());
        long startedAt = System.currentTimeMillis();
        Span span = tracingService.spanBuilder("audit.job")
                .setAttribute("job_id", record.getId())
                .setAttribute("rule_set", String.valueOf(ruleSet))
                .startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (!record.start()) {
                logger.info("Job {} ended before it started, skipping", record.getId());
                return;
            }
            logger.info("Processing job {}", record.getId());
            process(record, document, ruleSet);
            span.setStatus(StatusCode.OK);
        } catch (ExtractionUnavailableException e) {
            logger.error("Job {} failed: {}", record.getId(), e.getMessage());
            failJob(record, "ExtractionUnavailable: " + e.getMessage(), "extraction_unavailable");
            markSpanError(span, e);
        } catch (CancellationException e) {
            logger.info("Job {} stopped after cancellation", record.getId());
            failJob(record, CANCELLED, CANCELLED);
        } catch (RuntimeException e) {
            logger.error("Job {} failed unexpectedly", record.getId(), e);
            failJob(record, e.getClass().getSimpleName() + ": " + e.getMessage(), "internal");
            markSpanError(span, e);
        } finally {
            metricsService.recordJobDuration(System.currentTimeMillis() - startedAt);
            span.end();
            MDC.remove("jobId");
        }
    }

    private void process(JobRecord record, Document document, RuleSet ruleSet) {
        if (document == null || !document.isUsable()) {
            throw new ExtractionUnavailableException("document has no usable text");
        }
        if (ruleSet == null) {
            throw new ExtractionUnavailableException("no rule set available");
        }
        record.completeStage(JobStage.EXTRACTION_HANDOFF);

        String jobId = record.getId();
        CancellationToken token = record.getCancellationToken();
        CompletableFuture<RuleEvaluationReport> ruleFuture = CompletableFuture
                .supplyAsync(withJobId(jobId, () -> ruleEngine.evaluate(document, ruleSet)), detectorExecutor)
                .whenComplete((report, error) -> record.completeStage(JobStage.RULE_EVALUATION));
        CompletableFuture<AiExtractionResult> aiFuture = CompletableFuture
                .supplyAsync(withJobId(jobId, () -> aiExtractionClient.extract(document, ruleSet, token)), detectorExecutor)
                .whenComplete((result, error) -> record.completeStage(JobStage.AI_EXTRACTION));

        // Barrier: the merge starts only once both detectors have finished, successfully or not.
        CompletableFuture.allOf(ruleFuture, aiFuture).handle((ignored, error) -> null).join();
        token.throwIfCancelled();

        DetectorOutcome<RuleEvaluationReport> rule = outcomeOf(ruleFuture);
        DetectorOutcome<AiExtractionResult> ai = outcomeOf(aiFuture);
        if (ai.error instanceof CancellationException) {
            throw (CancellationException) ai.error;
        }
        if (rule.failed() && ai.failed()) {
            String message = "Both detectors failed: rule=" + describe(rule.error) + "; ai=" + describe(ai.error);
            logger.error("Job {}: {}", jobId, message);
            failJob(record, message, "all_detectors_failed");
            return;
        }

        List<Issue> ruleFindings = new ArrayList<>();
        List<Issue> aiFindings = new ArrayList<>();
        if (rule.failed()) {
            degrade(record, RULE_DETECTOR, rule.error);
        } else {
            ruleFindings.addAll(rule.value.getFindings());
            record.putMetadata(RULE_DETECTOR, ruleMetadata(rule.value));
        }
        if (ai.failed()) {
            degrade(record, AI_DETECTOR, ai.error);
        } else {
            aiFindings.addAll(ai.value.getFindings());
            record.putMetadata(AI_DETECTOR, ai.value.getMetadata().toMap());
        }

        MergedResult merged = tracingService.trace("audit.merge", () -> mergeEngine.merge(ruleFindings, aiFindings));
        record.putMetadata("ruleSet", ruleSet.toString());
        if (record.complete(merged)) {
            metricsService.recordJobSuccess();
            logger.info("Job {} done: {}", jobId, merged.getTotals());
        }
    }

    private void degrade(JobRecord record, String detector, Throwable error) {
        logger.warn("Job {}: {} detector failed, continuing with the other: {}", record.getId(), detector, describe(error));
        record.recordDetectorFailure(detector, describe(error));
        metricsService.recordDetectorDegraded(detector);
    }

    private void failJob(JobRecord record, String message, String errorType) {
        if (record.fail(message)) {
            metricsService.recordJobFailure(errorType);
        }
    }

    private static Map<String, Object> ruleMetadata(RuleEvaluationReport report) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("findings", report.getFindings().size());
        for (RuleStatus status : RuleStatus.values()) {
            metadata.put(status.name().toLowerCase(), report.count(status));
        }
        return metadata;
    }

    private static <T> DetectorOutcome<T> outcomeOf(CompletableFuture<T> future) {
        try {
            return new DetectorOutcome<>(future.join(), null);
        } catch (CompletionException e) {
            return new DetectorOutcome<>(null, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            return new DetectorOutcome<>(null, e);
        }
    }

    private static <T> Supplier<T> withJobId(String jobId, Supplier<T> operation) {
        return () -> {
            MDC.put("jobId", jobId);
            try {
                return operation.get();
            } finally {
                MDC.remove("jobId");
            }
        };
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        return error.getClass().getSimpleName() + (error.getMessage() != null ? ": " + error.getMessage() : "");
    }

    private static void markSpanError(Span span, Exception e) {
        span.setStatus(StatusCode.ERROR);
        span.recordException(e);
    }

    public JobStatusResponse getStatus(String jobId) {
        JobRecord record = find(jobId);
        Job job = record.snapshot();
        String message;
        if (job.getStatus() == JobStatus.ERROR) {
            message = job.getError();
        } else if (job.getStatus() == JobStatus.DONE) {
            message = job.getDegradedDetectors().isEmpty()
                    ? "Audit complete"
                    : "Audit complete with degraded detectors: " + String.join(", ", job.getDegradedDetectors());
        } else if (job.getStatus() == JobStatus.PROCESSING) {
            message = "Audit in progress";
        } else {
            message = "Waiting to start";
        }
        JobStatusResponse response = new JobStatusResponse(jobId, job.getStatus().getKey(), message);
        response.setProgress(new JobStatusResponse.ProgressInfo(record.stageLabel(), job.getProgress()));
        response.setDegradedDetectors(job.getDegradedDetectors());
        return response;
    }

    public Job getJob(String jobId) {
        return find(jobId).snapshot();
    }

    public List<Job> listJobs() {
        List<Job> snapshots = new ArrayList<>();
        for (JobRecord record : jobs.values()) {
            snapshots.add(record.snapshot());
        }
        snapshots.sort((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()));
        return snapshots;
    }

    /**
     * @return the result once the job is done, empty while it is still running
     * @throws JobFailedException if the job ended in error
     */
    public Optional<MergedResult> getResult(String jobId) {
        Job job = find(jobId).snapshot();
        if (job.getStatus() == JobStatus.ERROR) {
            throw new JobFailedException(jobId, job.getError());
        }
        return Optional.ofNullable(job.getResult());
    }

    /**
     * Blocks until the job ends or the timeout elapses.
     *
     * @return the result, or empty if the job is still running after {@code timeout}
     * @throws JobFailedException   if the job ended in error
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public Optional<MergedResult> awaitResult(String jobId, Duration timeout) throws InterruptedException {
        JobRecord record = find(jobId);
        try {
            return Optional.of(record.getCompletion().get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof JobFailedException) {
                throw (JobFailedException) e.getCause();
            }
            throw new JobFailedException(jobId, describe(e.getCause()));
        }
    }

    /**
     * Ends the job in {@code error} ("cancelled") and interrupts its in-flight provider calls.
     *
     * @return true if this call ended the job, false if it had already ended
     */
    public boolean cancel(String jobId) {
        JobRecord record = find(jobId);
        boolean cancelled = record.fail(CANCELLED);
        if (cancelled) {
            metricsService.recordJobFailure(CANCELLED);
            logger.info("Job {} cancelled", jobId);
        }
        record.getCancellationToken().cancel();
        Future<?> task = record.getTask();
        if (task != null) {
            // A queued job never starts; a running one observes the token.
            task.cancel(false);
        }
        return cancelled;
    }

    /**
     * Cancels the job if still running and forgets it.
     */
    public void delete(String jobId) {
        cancel(jobId);
        jobs.remove(jobId);
        logger.info("Job {} deleted", jobId);
    }

    private JobRecord find(String jobId) {
        JobRecord record = jobId != null ? jobs.get(jobId) : null;
        if (record == null) {
            throw new JobNotFoundException(jobId);
        }
        return record;
    }

    private static class DetectorOutcome<T> {
        private final T value;
        private final Throwable error;

        DetectorOutcome(T value, Throwable error) {
            this.value = value;
            this.error = error;
        }

        boolean failed() {
            return error != null;
        }
    }
}
