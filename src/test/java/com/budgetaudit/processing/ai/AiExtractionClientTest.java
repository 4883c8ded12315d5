package com.budgetaudit.processing.ai;

import com.budgetaudit.TestRuleSets;
import com.budgetaudit.observability.MetricsServiceInterface;
import com.budgetaudit.processing.CancellationToken;
import com.budgetaudit.processing.rules.ComparisonStatementEvaluator;
import com.budgetaudit.shared.dto.ExtractHit;
import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;
import com.budgetaudit.shared.model.ComparisonStatement;
import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.Issue;
import com.budgetaudit.shared.model.IssueSource;
import com.budgetaudit.shared.model.RuleSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AiExtractionClient.
 * Tests windowing, span validation, confidence by serving tier and statement deduplication.
 */
@ExtendWith(MockitoExtension.class)
class AiExtractionClientTest {

    private static final String TASK = "R33110_pairs_v1";

    private static final String RULES = String.join("\n",
            "name: 测试决算",
            "version: \"1\"",
            "rules:",
            "  - id: T-110",
            "    type: text_number_cross_check",
            "    category: budget-vs-final",
            "    severity: medium",
            "    section_start: '^三、一般公共预算财政拨款支出决算情况'",
            "    section_end: '^四、'",
            "    ai_task: " + TASK);

    private static final String SECTION = String.join("\n",
            "三、一般公共预算财政拨款支出决算情况",
            "1、教育支出。年初预算为100.00万元，支出决算为120.00万元，决算数小于预算数。主要原因：项目调整。",
            "四、其他说明");

    @Mock
    private ProviderChain providerChain;

    @Mock
    private MetricsServiceInterface metricsService;

    private ExecutorService windowExecutor;
    private RuleSet ruleSet;
    private Document document;

    @BeforeEach
    void setUp() {
        windowExecutor = Executors.newFixedThreadPool(2);
        ruleSet = TestRuleSets.parse(RULES);
        document = Document.ofPages("doc-ai", "目录", SECTION);
    }

    @AfterEach
    void tearDown() {
        windowExecutor.shutdownNow();
    }

    @Test
    void testDisabledClientSkipsProviders() {
        // Given
        AiExtractionClient client = client(false);

        // When
        AiExtractionResult result = client.extract(document, ruleSet, new CancellationToken());

        // Then
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getMetadata().isDisabled()).isTrue();
        verifyNoInteractions(providerChain);
    }

    @Test
    void testModelHitsBecomeAiFindings() {
        // Given: the model reports the wrongly stated relation
        when(providerChain.extract(any(ExtractRequest.class), any(CancellationToken.class)))
                .thenAnswer(invocation -> served(invocation.getArgument(0), ProviderTier.PRIMARY, "glm-4.5-flash",
                        new ExtractResponse.Meta("glm-4.5-flash", false, 321)));

        // When
        AiExtractionResult result = client(true).extract(document, ruleSet, new CancellationToken());

        // Then
        assertThat(result.getFindings()).hasSize(1);
        Issue issue = result.getFindings().get(0);
        assertThat(issue.getSource()).isEqualTo(IssueSource.AI);
        assertThat(issue.getRuleId()).isEqualTo("T-110");
        assertThat(issue.getTags()).contains(ComparisonStatementEvaluator.TAG_MISMATCH);
        assertThat(issue.getConfidence()).isEqualTo(0.85);
        assertThat(issue.getLocation().getPage()).isEqualTo(2);

        ExtractionMetadata metadata = result.getMetadata();
        assertThat(metadata.isDisabled()).isFalse();
        assertThat(metadata.getWindows()).isEqualTo(1);
        assertThat(metadata.getTokensUsed()).isEqualTo(321);
        assertThat(metadata.getValidationFailures()).isZero();
        assertThat(metadata.getProviderStats()).hasSize(1);
        assertThat(metadata.getProviderStats().get(0).getTier()).isEqualTo(ProviderTier.PRIMARY);
        assertThat(metadata.isFellBack()).isFalse();
        verify(metricsService).recordTokens(321, "glm-4.5-flash", TASK);
        verify(metricsService).recordValidationFailures(0, TASK);
    }

    @Test
    void testFindingQuotingExtractionArtifactIsDropped() {
        // Given: the quoted reason is a table-recognition artifact, not a disclosure
        Document noisy = Document.ofPages("doc-noise", "目录", String.join("\n",
                "三、一般公共预算财政拨款支出决算情况",
                "1、教育支出。年初预算为100.00万元，支出决算为120.00万元，决算数小于预算数。收入决算表出现多次。",
                "四、其他说明"));
        when(providerChain.extract(any(ExtractRequest.class), any(CancellationToken.class)))
                .thenAnswer(invocation -> {
                    String window = ((ExtractRequest) invocation.getArgument(0)).getSectionText();
                    ExtractHit hit = HitSpanValidatorTest.hit(window, "100.00", "120.00", "决算数小于预算数", "收入决算表出现多次");
                    return result(new ExtractResponse(new ArrayList<>(List.of(hit)), null), ProviderTier.PRIMARY, "glm-4.5-flash");
                });

        // When
        AiExtractionResult result = client(true).extract(noisy, ruleSet, new CancellationToken());

        // Then
        assertThat(result.getMetadata().getValidationFailures()).isZero();
        assertThat(result.getFindings()).isEmpty();
    }

    @Test
    void testRegexFallbackUsesLowerConfidence() {
        // Given: every model tier failed, the regex fallback answered without usage data
        when(providerChain.extract(any(ExtractRequest.class), any(CancellationToken.class)))
                .thenAnswer(invocation -> served(invocation.getArgument(0), ProviderTier.REGEX_FALLBACK, "regex", null));

        // When
        AiExtractionResult result = client(true).extract(document, ruleSet, new CancellationToken());

        // Then
        assertThat(result.getFindings()).hasSize(1);
        assertThat(result.getFindings().get(0).getConfidence()).isEqualTo(0.6);
        assertThat(result.getMetadata().getTokensUsed()).isPositive();
        assertThat(result.getMetadata().isFellBack()).isTrue();
    }

    @Test
    void testUngroundedHitsAreRejectedAndCounted() {
        // Given: the final amount span points at the budget amount
        when(providerChain.extract(any(ExtractRequest.class), any(CancellationToken.class)))
                .thenAnswer(invocation -> {
                    ExtractRequest request = invocation.getArgument(0);
                    ExtractHit hit = statedHit(request.getSectionText());
                    hit.setFinalSpan(hit.getBudgetSpan());
                    return result(new ExtractResponse(new ArrayList<>(List.of(hit)),
                            new ExtractResponse.Meta("glm-4.5-flash", false, 100)), ProviderTier.PRIMARY, "glm-4.5-flash");
                });

        // When
        AiExtractionResult result = client(true).extract(document, ruleSet, new CancellationToken());

        // Then
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getMetadata().getValidationFailures()).isEqualTo(1);
        verify(metricsService).recordValidationFailures(1, TASK);
    }

    @Test
    void testMissingSectionMakesNoCalls() {
        Document withoutSection = Document.ofPages("doc-none", "一、部门主要职责", "二、收入支出决算总表");

        AiExtractionResult result = client(true).extract(withoutSection, ruleSet, new CancellationToken());

        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getMetadata().getWindows()).isZero();
        verifyNoInteractions(providerChain);
    }

    @Test
    void testCancelledTokenStopsExtraction() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> client(true).extract(document, ruleSet, token))
                .isInstanceOf(CancellationException.class);
        verifyNoInteractions(providerChain);
    }

    @Test
    void testDuplicateStatementsKeepHigherConfidence() {
        // Given: the same statement seen by two overlapping windows
        List<AiExtractionClient.Candidate> candidates = new ArrayList<>();
        ComparisonStatement first = statement(40);
        ComparisonStatement overlapCopy = statement(70);
        ComparisonStatement farAway = statement(400);

        // When
        AiExtractionClient.addCandidate(candidates, new AiExtractionClient.Candidate(first, 0.6));
        AiExtractionClient.addCandidate(candidates, new AiExtractionClient.Candidate(overlapCopy, 0.85));
        AiExtractionClient.addCandidate(candidates, new AiExtractionClient.Candidate(farAway, 0.85));

        // Then
        assertThat(candidates).hasSize(2);
        assertThat(candidates.get(0).getStatement().getStmtStart()).isEqualTo(70);
        assertThat(candidates.get(0).getConfidence()).isEqualTo(0.85);
        assertThat(candidates.get(1).getStatement().getStmtStart()).isEqualTo(400);
    }

    @Test
    void testHitsOnSameStatementYieldOneFinding() {
        // Given: the model reports one statement twice, once with the amount shortened
        when(providerChain.extract(any(ExtractRequest.class), any(CancellationToken.class)))
                .thenAnswer(invocation -> {
                    ExtractRequest request = invocation.getArgument(0);
                    String window = request.getSectionText();
                    ExtractHit full = statedHit(window);
                    ExtractHit shortened = HitSpanValidatorTest.hit(window, "100", "120.00", "决算数小于预算数", "主要原因：项目调整");
                    return result(new ExtractResponse(new ArrayList<>(List.of(full, shortened)),
                            new ExtractResponse.Meta("glm-4.5-flash", false, 200)), ProviderTier.PRIMARY, "glm-4.5-flash");
                });

        // When
        AiExtractionResult result = client(true).extract(document, ruleSet, new CancellationToken());

        // Then
        assertThat(result.getMetadata().getValidationFailures()).isZero();
        assertThat(result.getFindings()).hasSize(1);
        assertThat(result.getFindings()).extracting(Issue::getId).doesNotHaveDuplicates();
        assertThat(result.getFindings().get(0).getEvidence().get(0).getText()).isEqualTo("100.00");
    }

    @Test
    void testSameStatementSpanIsDeduplicatedAcrossTexts() {
        List<AiExtractionClient.Candidate> candidates = new ArrayList<>();
        ComparisonStatement full = statement(70);
        ComparisonStatement shortened = new ComparisonStatement("100", 40, 43,
                "120.00", 55, 61, "决算数小于预算数", 70, 78, null, null, null, "教育支出", "clip");

        AiExtractionClient.addCandidate(candidates, new AiExtractionClient.Candidate(full, 0.85));
        AiExtractionClient.addCandidate(candidates, new AiExtractionClient.Candidate(shortened, 0.85));

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).getStatement().getBudgetText()).isEqualTo("100.00");
    }

    @Test
    void testSectionHashIsStable() {
        assertThat(AiExtractionClient.sha1("abc")).isEqualTo("a9993e364706816aba3e25717850c26c9cd0d89d");
    }

    private AiExtractionClient client(boolean enabled) {
        return new AiExtractionClient(providerChain, new SlidingWindowChunker(), new HitSpanValidator(), new NoiseFilter(),
                windowExecutor, metricsService, enabled, 3, 2, 0.85, 0.6);
    }

    private static ChainResult served(ExtractRequest request, ProviderTier tier, String model, ExtractResponse.Meta meta) {
        ExtractHit hit = statedHit(request.getSectionText());
        return result(new ExtractResponse(new ArrayList<>(List.of(hit)), meta), tier, model);
    }

    private static ChainResult result(ExtractResponse response, ProviderTier tier, String model) {
        return new ChainResult(response, tier, model, tier != ProviderTier.PRIMARY, 12L, Collections.emptyList());
    }

    private static ExtractHit statedHit(String window) {
        return HitSpanValidatorTest.hit(window, "100.00", "120.00", "决算数小于预算数", "主要原因：项目调整");
    }

    private static ComparisonStatement statement(int stmtStart) {
        return new ComparisonStatement("100.00", stmtStart - 30, stmtStart - 24,
                "120.00", stmtStart - 15, stmtStart - 9,
                "决算数小于预算数", stmtStart, stmtStart + 8,
                null, null, null, "教育支出", "clip");
    }
}
