package com.budgetaudit.processing.rules;

import com.budgetaudit.processing.matching.TableAliasMatcher;
import com.budgetaudit.processing.matching.TableMatch;
import com.budgetaudit.processing.rules.ComparisonStatementEvaluator.StatementContext;
import com.budgetaudit.shared.model.ComparisonStatement;
import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.Evidence;
import com.budgetaudit.shared.model.Issue;
import com.budgetaudit.shared.model.IssueKind;
import com.budgetaudit.shared.model.IssueLocation;
import com.budgetaudit.shared.model.IssueSource;
import com.budgetaudit.shared.model.OperandDefinition;
import com.budgetaudit.shared.model.RuleDefinition;
import com.budgetaudit.shared.model.RuleSet;
import com.budgetaudit.shared.model.Severity;
import com.budgetaudit.shared.model.TableSpec;
import com.budgetaudit.shared.model.Tolerance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates a rule set against a document. Pure computation: no I/O, no blocking.
 *
 * <p>Every rule ends as PASS, VIOLATION, SKIPPED (missing operand, table or section; logged, not a
 * failure) or ERROR (unexpected exception; logged, other rules still run).
 */
@Service
public class RuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(RuleEngine.class);

    static final double RULE_CONFIDENCE = 0.9;

    private final TableAliasMatcher matcher;
    private final OperandResolver operandResolver;
    private final ComparisonStatementScanner scanner;
    private final ComparisonStatementEvaluator statementEvaluator;
    private final double lowConfidenceThreshold;

    @Autowired
    public RuleEngine(TableAliasMatcher matcher,
                      @Value("${budgetaudit.rules.low-confidence-threshold:0.6}") double lowConfidenceThreshold) {
        this.matcher = matcher;
        this.operandResolver = new OperandResolver(matcher);
        this.scanner = new ComparisonStatementScanner();
        this.statementEvaluator = new ComparisonStatementEvaluator();
        this.lowConfidenceThreshold = lowConfidenceThreshold;
    }

    public RuleEvaluationReport evaluate(Document document, RuleSet ruleSet) {
        long start = System.currentTimeMillis();
        Map<String, TableMatch> located = matcher.locate(document, ruleSet.getTables());
        List<Issue> findings = new ArrayList<>();
        List<RuleOutcome> outcomes = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (RuleDefinition rule : ruleSet.getRules()) {
            List<Issue> produced;
            try {
                produced = evaluateRule(document, ruleSet, rule, located);
            } catch (RuleEvaluationSkippedException e) {
                logger.info("Rule {} skipped: {}", rule.getId(), e.getMessage());
                outcomes.add(new RuleOutcome(rule.getId(), RuleStatus.SKIPPED, 0, e.getMessage()));
                continue;
            } catch (RuntimeException e) {
                logger.error("Rule {} failed: {}", rule.getId(), e.getMessage(), e);
                outcomes.add(new RuleOutcome(rule.getId(), RuleStatus.ERROR, 0, e.getMessage()));
                continue;
            }

            int added = 0;
            for (Issue issue : produced) {
                if (seenIds.add(issue.getId())) {
                    findings.add(issue);
                    added++;
                } else {
                    logger.warn("Rule {} produced duplicate finding {}, keeping the first", rule.getId(), issue.getId());
                }
            }
            outcomes.add(new RuleOutcome(rule.getId(), added > 0 ? RuleStatus.VIOLATION : RuleStatus.PASS, added, null));
        }

        logger.info("Evaluated {} rules of {} in {}ms: {} findings, {} skipped, {} errors",
                ruleSet.getRules().size(), ruleSet, System.currentTimeMillis() - start, findings.size(),
                outcomes.stream().filter(o -> o.getStatus() == RuleStatus.SKIPPED).count(),
                outcomes.stream().filter(o -> o.getStatus() == RuleStatus.ERROR).count());
        return new RuleEvaluationReport(findings, outcomes);
    }

    private List<Issue> evaluateRule(Document document, RuleSet ruleSet, RuleDefinition rule,
                                     Map<String, TableMatch> located) {
        if (rule.getType() == null) {
            throw new RuleEvaluationSkippedException("rule has no type");
        }
        switch (rule.getType()) {
            case TABLE_PRESENCE:
                return evaluateTablePresence(ruleSet, rule, located);
            case NUMERIC_CONSISTENCY:
                return evaluateNumeric(document, ruleSet, rule, located);
            case TEXT_NUMBER_CROSS_CHECK:
                return evaluateCrossCheck(document, rule);
            default:
                throw new RuleEvaluationSkippedException("unsupported rule type " + rule.getType());
        }
    }

    private List<Issue> evaluateTablePresence(RuleSet ruleSet, RuleDefinition rule, Map<String, TableMatch> located) {
        List<TableSpec> targets = new ArrayList<>();
        if (rule.getTable() != null) {
            TableSpec spec = ruleSet.findTable(rule.getTable())
                    .orElseThrow(() -> new RuleEvaluationSkippedException("unknown table " + rule.getTable()));
            targets.add(spec);
        } else {
            for (TableSpec spec : ruleSet.getTables()) {
                if (spec.isRequired()) {
                    targets.add(spec);
                }
            }
        }

        double threshold = rule.getLowConfidenceThreshold() != null ? rule.getLowConfidenceThreshold() : lowConfidenceThreshold;
        List<Issue> issues = new ArrayList<>();
        for (TableSpec spec : targets) {
            TableMatch match = located.get(spec.getCanonicalName());
            Map<String, String> values = new LinkedHashMap<>();
            values.put("table", spec.getCanonicalName());

            if (match == null || !match.isMatched()) {
                IssueLocation location = IssueLocation.table(1, spec.getCanonicalName());
                issues.add(Issue.builder()
                        .id(Issue.stableId(IssueSource.RULE, rule.getId(), location, "missing:" + spec.getCanonicalName()))
                        .source(IssueSource.RULE)
                        .ruleId(rule.getId())
                        .category(rule.getCategory())
                        .kind(IssueKind.STRUCTURAL)
                        .severity(spec.getSeverity())
                        .title("缺少" + spec.getCanonicalName())
                        .message(rule.renderMessage(values, "未找到必备表格：" + spec.getCanonicalName()))
                        .suggestion("按模板补充“" + spec.getCanonicalName() + "”，确需空表的应公开空表并说明")
                        .location(location)
                        .confidence(RULE_CONFIDENCE)
                        .tag("table-missing")
                        .build());
            } else if (match.getConfidence() < threshold) {
                int page = match.getPage() != null ? match.getPage() : 1;
                IssueLocation location = IssueLocation.table(page, spec.getCanonicalName());
                issues.add(Issue.builder()
                        .id(Issue.stableId(IssueSource.RULE, rule.getId(), location, "weak:" + spec.getCanonicalName()))
                        .source(IssueSource.RULE)
                        .ruleId(rule.getId())
                        .category(rule.getCategory())
                        .kind(IssueKind.STRUCTURAL)
                        .severity(spec.getSeverity().lower())
                        .title(spec.getCanonicalName() + "标题不规范")
                        .message(String.format("“%s”仅以%s方式匹配，置信度%.2f，请核对表名是否规范",
                                spec.getCanonicalName(), match.getMethod(), match.getConfidence()))
                        .location(location)
                        .confidence(match.getConfidence())
                        .tag("low-confidence-match")
                        .build());
            }
        }
        return issues;
    }

    private List<Issue> evaluateNumeric(Document document, RuleSet ruleSet, RuleDefinition rule,
                                        Map<String, TableMatch> located) {
        OperandDefinition leftDef = rule.getLeft();
        OperandDefinition rightDef = rule.getRight();
        if (leftDef == null || rightDef == null) {
            throw new RuleEvaluationSkippedException("numeric rule without both operands");
        }
        OperandResolver.ResolvedOperand left = operandResolver.resolve(document, leftDef, specOf(ruleSet, leftDef), located);
        OperandResolver.ResolvedOperand right = operandResolver.resolve(document, rightDef, specOf(ruleSet, rightDef), located);

        double a = left.getValue();
        double b = right.getValue();
        Tolerance tolerance = rule.getTolerance();
        if (NumericTolerance.consistencyCheck(a, b, tolerance.getRelative(), tolerance.getAbsolute())) {
            return new ArrayList<>();
        }

        String table = leftDef.getTable() != null ? leftDef.getTable() : rightDef.getTable();
        IssueLocation location = new IssueLocation(left.getPage(), null, table, null, null);
        Map<String, String> values = new LinkedHashMap<>();
        values.put("left", format(a));
        values.put("right", format(b));
        values.put("leftLabel", leftDef.getLabel());
        values.put("rightLabel", rightDef.getLabel());
        values.put("difference", format(a - b));

        Issue.Builder builder = Issue.builder()
                .source(IssueSource.RULE)
                .ruleId(rule.getId())
                .category(rule.getCategory())
                .kind(IssueKind.NUMERIC)
                .location(location)
                .confidence(left.isFromCells() && right.isFromCells() ? 0.95 : RULE_CONFIDENCE)
                .evidence(Evidence.of(left.getPage(), leftDef.getLabel() + "=" + format(a)))
                .evidence(Evidence.of(right.getPage(), rightDef.getLabel() + "=" + format(b)))
                .metric("left", a)
                .metric("right", b)
                .metric("difference", a - b);

        double parityBand = Math.max(tolerance.getParityRelative(), tolerance.getRelative());
        if (NumericTolerance.consistencyCheck(a, b, parityBand, tolerance.getAbsolute())) {
            return singleton(builder
                    .id(Issue.stableId(IssueSource.RULE, rule.getId(), location, "parity"))
                    .severity(Severity.LOW)
                    .title("基本持平：" + leftDef.getLabel() + "与" + rightDef.getLabel())
                    .message(String.format("%s（%s）与%s（%s）基本持平，差额%s，请核对是否存在尾差",
                            leftDef.getLabel(), format(a), rightDef.getLabel(), format(b), format(a - b)))
                    .tag("basic-parity")
                    .build());
        }
        return singleton(builder
                .id(Issue.stableId(IssueSource.RULE, rule.getId(), location, "mismatch"))
                .severity(rule.getSeverity())
                .title(leftDef.getLabel() + "与" + rightDef.getLabel() + "不一致")
                .message(rule.renderMessage(values, String.format("%s（%s）与%s（%s）不一致，差额%s",
                        leftDef.getLabel(), format(a), rightDef.getLabel(), format(b), format(a - b))))
                .suggestion("核对两处数据的取数口径并修正")
                .tag("numeric-mismatch")
                .build());
    }

    private List<Issue> evaluateCrossCheck(Document document, RuleDefinition rule) {
        SectionSlicer.Section section = SectionSlicer.slice(document.getFullText(), rule.getSectionStart(), rule.getSectionEnd())
                .orElseThrow(() -> new RuleEvaluationSkippedException("section not found"));
        int reasonWindow = rule.getReasonWindow() != null ? rule.getReasonWindow() : ComparisonStatementScanner.DEFAULT_REASON_WINDOW;
        List<ComparisonStatement> statements = scanner.scan(section.getText(), reasonWindow);
        if (statements.isEmpty()) {
            throw new RuleEvaluationSkippedException("no comparison statements in section");
        }

        StatementContext context = new StatementContext(document, section.getStart(), section.getHeading());
        int anchorAt = reasonAnchorPosition(section.getText(), rule.getReasonAnchor());
        List<Issue> issues = new ArrayList<>();
        for (ComparisonStatement statement : statements) {
            boolean reasonRequired = statement.getStart() >= anchorAt;
            issues.addAll(statementEvaluator.evaluate(statement, rule, IssueSource.RULE, context, RULE_CONFIDENCE, reasonRequired));
        }
        return issues;
    }

    /**
     * Offset from which statements need a reason: 0 without an anchor, past the end when the anchor is absent.
     */
    public static int reasonAnchorPosition(String sectionText, String anchor) {
        if (anchor == null || anchor.isBlank()) {
            return 0;
        }
        int index = sectionText.indexOf(anchor);
        return index >= 0 ? index : Integer.MAX_VALUE;
    }

    private static TableSpec specOf(RuleSet ruleSet, OperandDefinition operand) {
        if (operand.getTable() == null) {
            return null;
        }
        Optional<TableSpec> spec = ruleSet.findTable(operand.getTable());
        return spec.orElse(null);
    }

    private static List<Issue> singleton(Issue issue) {
        List<Issue> issues = new ArrayList<>();
        issues.add(issue);
        return issues;
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }
}
