package com.budgetaudit.processing.ai;

import com.budgetaudit.observability.MetricsServiceInterface;
import com.budgetaudit.processing.CancellationToken;
import com.budgetaudit.processing.rules.ComparisonStatementEvaluator;
import com.budgetaudit.processing.rules.ComparisonStatementEvaluator.StatementContext;
import com.budgetaudit.processing.rules.RuleEngine;
import com.budgetaudit.processing.rules.SectionSlicer;
import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;
import com.budgetaudit.shared.model.ComparisonStatement;
import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.Issue;
import com.budgetaudit.shared.model.IssueSource;
import com.budgetaudit.shared.model.RuleDefinition;
import com.budgetaudit.shared.model.RuleSet;
import com.budgetaudit.shared.model.RuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * AI detector. For every cross-check rule that names an {@code ai_task}, slices the rule's section,
 * sends it window by window through the {@link ProviderChain}, keeps only hits whose spans are
 * grounded in the text, and evaluates them exactly like the rule side does.
 */
@Service
public class AiExtractionClient {

    private static final Logger logger = LoggerFactory.getLogger(AiExtractionClient.class);
    static final int DEDUP_DISTANCE = 50;

    private final ProviderChain providerChain;
    private final SlidingWindowChunker chunker;
    private final HitSpanValidator validator;
    private final NoiseFilter noiseFilter;
    private final ExecutorService windowExecutor;
    private final MetricsServiceInterface metricsService;
    private final ComparisonStatementEvaluator evaluator = new ComparisonStatementEvaluator();
    private final boolean enabled;
    private final int maxWindows;
    private final int windowConcurrency;
    private final double modelConfidence;
    private final double fallbackConfidence;

    @Autowired
    public AiExtractionClient(ProviderChain providerChain,
                              SlidingWindowChunker chunker,
                              HitSpanValidator validator,
                              NoiseFilter noiseFilter,
                              @Qualifier("windowExecutor") ExecutorService windowExecutor,
                              MetricsServiceInterface metricsService,
                              @Value("${budgetaudit.ai.enabled:true}") boolean enabled,
                              @Value("${budgetaudit.ai.max-windows:3}") int maxWindows,
                              @Value("${budgetaudit.ai.window-concurrency:2}") int windowConcurrency,
                              @Value("${budgetaudit.ai.model-confidence:0.85}") double modelConfidence,
                              @Value("${budgetaudit.ai.fallback-confidence:0.6}") double fallbackConfidence) {
        this.providerChain = providerChain;
        this.chunker = chunker;
        this.validator = validator;
        this.noiseFilter = noiseFilter;
        this.windowExecutor = windowExecutor;
        this.metricsService = metricsService;
        this.enabled = enabled;
        this.maxWindows = maxWindows;
        this.windowConcurrency = Math.max(1, windowConcurrency);
        this.modelConfidence = modelConfidence;
        this.fallbackConfidence = fallbackConfidence;
    }

    /**
     * @throws CancellationException if the token is cancelled while windows are in flight
     */
    public AiExtractionResult extract(Document document, RuleSet ruleSet, CancellationToken token) {
        if (!enabled) {
            logger.info("AI extraction disabled, skipping document {}", document.getId());
            return AiExtractionResult.disabled();
        }
        long startedAt = System.currentTimeMillis();
        List<Issue> findings = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        List<ProviderCallStat> stats = new ArrayList<>();
        int tokensUsed = 0;
        int windows = 0;
        int validationFailures = 0;

        for (RuleDefinition rule : ruleSet.getRules()) {
            if (rule.getType() != RuleType.TEXT_NUMBER_CROSS_CHECK || rule.getAiTask() == null) {
                continue;
            }
            token.throwIfCancelled();
            Optional<SectionSlicer.Section> section = SectionSlicer.slice(document.getFullText(),
                    rule.getSectionStart(), rule.getSectionEnd());
            if (section.isEmpty()) {
                logger.info("Rule {}: section not found, no AI task {}", rule.getId(), rule.getAiTask());
                continue;
            }

            TaskOutcome outcome = runTask(document, rule, section.get(), token);
            for (Issue issue : outcome.findings) {
                if (seenIds.add(issue.getId())) {
                    findings.add(issue);
                } else {
                    logger.warn("Task {} produced duplicate finding {}, keeping the first", rule.getAiTask(), issue.getId());
                }
            }
            stats.addAll(outcome.stats);
            tokensUsed += outcome.tokensUsed;
            windows += outcome.windows;
            validationFailures += outcome.validationFailures;
            metricsService.recordValidationFailures(outcome.validationFailures, rule.getAiTask());
        }

        List<Issue> kept = noiseFilter.filter(findings);
        long elapsedMs = System.currentTimeMillis() - startedAt;
        logger.info("AI extraction for document {}: {} findings, {} windows, {} hits rejected, {} tokens in {}ms",
                document.getId(), kept.size(), windows, validationFailures, tokensUsed, elapsedMs);
        return new AiExtractionResult(kept,
                new ExtractionMetadata(false, tokensUsed, elapsedMs, windows, validationFailures, stats));
    }

    private TaskOutcome runTask(Document document, RuleDefinition rule, SectionSlicer.Section section,
                                CancellationToken token) {
        String task = rule.getAiTask();
        String docHash = sha1(section.getText());
        List<TextWindow> windows = chunker.split(section.getText(), maxWindows);
        Semaphore permits = new Semaphore(windowConcurrency);

        List<CompletableFuture<WindowOutcome>> futures = new ArrayList<>();
        for (TextWindow window : windows) {
            ExtractRequest request = new ExtractRequest(task, window.getText(), docHash, maxWindows);
            futures.add(CompletableFuture.supplyAsync(() -> callWindow(window, request, permits, token), windowExecutor));
        }

        TaskOutcome outcome = new TaskOutcome();
        outcome.windows = windows.size();
        List<Candidate> candidates = new ArrayList<>();
        // Joined in window order so that ties in dedup go to the earlier window.
        for (CompletableFuture<WindowOutcome> future : futures) {
            WindowOutcome result = join(future);
            ChainResult served = result.served;
            double confidence = served.isDegraded() ? fallbackConfidence : modelConfidence;
            HitSpanValidator.ValidationResult validation = validator.validate(served.getResponse().getHits(), result.window.getText());
            outcome.validationFailures += validation.getRejectedCount();
            for (ComparisonStatement statement : validation.getAccepted()) {
                addCandidate(candidates, new Candidate(statement.shift(result.window.getStart()), confidence));
            }
            int tokens = tokensOf(served.getResponse(), result.window);
            outcome.tokensUsed += tokens;
            metricsService.recordTokens(tokens, served.getModelId(), task);
            outcome.stats.add(new ProviderCallStat(task, result.window.getIndex(), served.getServedBy(),
                    served.getModelId(), served.isFellBack(), served.getLatencyMs(),
                    served.getResponse().getMeta() != null && served.getResponse().getMeta().isCached()));
        }

        StatementContext context = new StatementContext(document, section.getStart(), section.getHeading());
        int anchorAt = RuleEngine.reasonAnchorPosition(section.getText(), rule.getReasonAnchor());
        for (Candidate candidate : candidates) {
            ComparisonStatement statement = candidate.statement;
            outcome.findings.addAll(evaluator.evaluate(statement, rule, IssueSource.AI, context,
                    candidate.confidence, statement.getStart() >= anchorAt));
        }
        logger.debug("Task {}: {} windows, {} statements kept, {} rejected", task, windows.size(),
                candidates.size(), outcome.validationFailures);
        return outcome;
    }

    private WindowOutcome callWindow(TextWindow window, ExtractRequest request, Semaphore permits, CancellationToken token) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted waiting for a window slot");
        }
        try {
            token.throwIfCancelled();
            logger.debug("Window {} [{}, {}) of task {}", window.getIndex(), window.getStart(), window.getEnd(), request.getTask());
            return new WindowOutcome(window, providerChain.extract(request, token));
        } finally {
            permits.release();
        }
    }

    private static WindowOutcome join(CompletableFuture<WindowOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }

    /**
     * Keeps one candidate per statement: the same statement span, or the same normalized texts within
     * {@link #DEDUP_DISTANCE} chars. The higher confidence wins; on a tie the one already kept stays.
     */
    static void addCandidate(List<Candidate> candidates, Candidate candidate) {
        for (int i = 0; i < candidates.size(); i++) {
            Candidate existing = candidates.get(i);
            boolean sameSpan = existing.statement.getStmtStart() == candidate.statement.getStmtStart()
                    && existing.statement.getStmtEnd() == candidate.statement.getStmtEnd();
            boolean sameTexts = existing.key.equals(candidate.key)
                    && Math.abs(existing.statement.getStmtStart() - candidate.statement.getStmtStart()) <= DEDUP_DISTANCE;
            if (sameSpan || sameTexts) {
                if (candidate.confidence > existing.confidence) {
                    candidates.set(i, candidate);
                }
                return;
            }
        }
        candidates.add(candidate);
    }

    private static int tokensOf(ExtractResponse response, TextWindow window) {
        if (response.getMeta() != null && response.getMeta().getTokensUsed() != null) {
            return response.getMeta().getTokensUsed();
        }
        return (int) Math.round(window.getText().length() * 1.5);
    }

    static String sha1(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    static class Candidate {
        private final ComparisonStatement statement;
        private final double confidence;
        private final String key;

        Candidate(ComparisonStatement statement, double confidence) {
            this.statement = statement;
            this.confidence = confidence;
            this.key = normalize(statement.getBudgetText()) + "|" + normalize(statement.getFinalText())
                    + "|" + normalize(statement.getStmtText());
        }

        ComparisonStatement getStatement() {
            return statement;
        }

        double getConfidence() {
            return confidence;
        }

        private static String normalize(String text) {
            return text == null ? "" : text.replaceAll("[\\s,，]", "");
        }
    }

    private static class WindowOutcome {
        private final TextWindow window;
        private final ChainResult served;

        WindowOutcome(TextWindow window, ChainResult served) {
            this.window = window;
            this.served = served;
        }
    }

    private static class TaskOutcome {
        private final List<Issue> findings = new ArrayList<>();
        private final List<ProviderCallStat> stats = new ArrayList<>();
        private int tokensUsed;
        private int windows;
        private int validationFailures;
    }
}
