package com.budgetaudit.processing.rules;

import com.budgetaudit.processing.rules.NumericTolerance.Relation;
import com.budgetaudit.shared.model.ComparisonStatement;
import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.Evidence;
import com.budgetaudit.shared.model.Issue;
import com.budgetaudit.shared.model.IssueKind;
import com.budgetaudit.shared.model.IssueLocation;
import com.budgetaudit.shared.model.IssueSource;
import com.budgetaudit.shared.model.RuleDefinition;
import com.budgetaudit.shared.model.Severity;
import com.budgetaudit.util.AmountParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a comparison statement into findings. Used for statements from the regex scanner (rule side)
 * and for validated AI hits, so both detectors describe the same problem with the same rule id,
 * category and location.
 *
 * <ul>
 *   <li>stated relation differs from the computed one: numeric violation;</li>
 *   <li>大于/小于 without a reason: separate narrative violation;</li>
 *   <li>基本持平 wording: low-severity wording finding.</li>
 * </ul>
 */
public class ComparisonStatementEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonStatementEvaluator.class);

    public static final String TAG_MISMATCH = "text-number-mismatch";
    public static final String TAG_MISSING_REASON = "missing-reason";
    public static final String TAG_PARITY_WORDING = "basic-parity-wording";

    /**
     * @param statement     offsets relative to the section
     * @param context       where the section sits in the document
     * @param reasonRequired whether a 大于/小于 statement at this position must carry a reason
     */
    public List<Issue> evaluate(ComparisonStatement statement, RuleDefinition rule, IssueSource source,
                                StatementContext context, double confidence, boolean reasonRequired) {
        List<Issue> issues = new ArrayList<>();
        Double budget = AmountParser.parse(statement.getBudgetText());
        Double actual = AmountParser.parse(statement.getFinalText());
        if (budget == null || actual == null) {
            logger.debug("Statement at {} has no readable amounts, ignoring", statement.getStmtStart());
            return issues;
        }

        int page = context.pageOf(statement.getStmtStart());
        IssueLocation location = IssueLocation.section(page, context.getSectionName());
        double tolerance = NumericTolerance.dynamicTolerance(budget, actual);
        Relation computed = NumericTolerance.relation(budget, actual, tolerance);
        Relation stated = statedRelation(statement.getStmtText());
        String item = statement.getItemTitle() != null ? statement.getItemTitle() : context.getSectionName();

        Map<String, String> values = new LinkedHashMap<>();
        values.put("item", item);
        values.put("budget", statement.getBudgetText());
        values.put("final", statement.getFinalText());
        values.put("statement", statement.getStmtText());
        values.put("expected", describe(computed));

        if (stated != computed) {
            issues.add(base(statement, rule, source, page, location, confidence)
                    .id(Issue.stableId(source, rule.getId(), location, "mismatch@" + statement.getStmtStart()))
                    .severity(rule.getSeverity())
                    .kind(IssueKind.NUMERIC)
                    .title("决算与预算比较表述不一致")
                    .message(rule.renderMessage(values, String.format("%s：预算数%s、决算数%s，应表述为“%s”，实际为“%s”",
                            item, statement.getBudgetText(), statement.getFinalText(), describe(computed), statement.getStmtText())))
                    .suggestion("核对预算数与决算数，按实际大小关系修正比较表述")
                    .tag(TAG_MISMATCH)
                    .metric("budget", budget)
                    .metric("final", actual)
                    .metric("difference", actual - budget)
                    .build());
        }

        if (stated != Relation.EQUAL && reasonRequired && !statement.hasReason()) {
            issues.add(base(statement, rule, source, page, location, confidence)
                    .id(Issue.stableId(source, rule.getId(), location, "reason@" + statement.getStmtStart()))
                    .severity(rule.getSeverity())
                    .kind(IssueKind.NARRATIVE)
                    .title("未说明决算数与预算数差异原因")
                    .message(String.format("%s：%s，但未说明主要原因", item, statement.getStmtText()))
                    .suggestion("补充“主要原因：……”，说明决算数与预算数的差异原因")
                    .tag(TAG_MISSING_REASON)
                    .build());
        }

        if (statement.getStmtText().contains("基本持平")) {
            issues.add(base(statement, rule, source, page, location, confidence)
                    .id(Issue.stableId(source, rule.getId(), location, "parity@" + statement.getStmtStart()))
                    .severity(Severity.LOW)
                    .kind(IssueKind.NARRATIVE)
                    .title("“基本持平”表述不规范")
                    .message(String.format("%s：使用“基本持平”表述，应明确决算数大于、小于或等于预算数", item))
                    .suggestion("改为“决算数大于/小于/等于预算数”并说明原因")
                    .tag(TAG_PARITY_WORDING)
                    .build());
        }
        return issues;
    }

    private static Issue.Builder base(ComparisonStatement statement, RuleDefinition rule, IssueSource source,
                                      int page, IssueLocation location, double confidence) {
        Issue.Builder builder = Issue.builder()
                .source(source)
                .ruleId(rule.getId())
                .category(rule.getCategory())
                .location(location)
                .confidence(confidence)
                .evidence(Evidence.ofSpan(page, statement.getBudgetText(), statement.getBudgetStart(), statement.getBudgetEnd()))
                .evidence(Evidence.ofSpan(page, statement.getFinalText(), statement.getFinalStart(), statement.getFinalEnd()))
                .evidence(Evidence.ofSpan(page, statement.getStmtText(), statement.getStmtStart(), statement.getStmtEnd()));
        if (statement.hasReason() && statement.getReasonStart() != null && statement.getReasonEnd() != null) {
            builder.evidence(Evidence.ofSpan(page, statement.getReasonText(), statement.getReasonStart(), statement.getReasonEnd()));
        }
        return builder;
    }

    static Relation statedRelation(String stmtText) {
        if (stmtText.contains("大于")) {
            return Relation.GREATER;
        }
        if (stmtText.contains("小于")) {
            return Relation.LESS;
        }
        return Relation.EQUAL;
    }

    private static String describe(Relation relation) {
        switch (relation) {
            case GREATER:
                return "决算数大于预算数";
            case LESS:
                return "决算数小于预算数";
            default:
                return "决算数等于预算数";
        }
    }

    /**
     * Position of a section in the document: maps section offsets to pages.
     */
    public static class StatementContext {
        private final Document document;
        private final int sectionOffset;
        private final String sectionName;

        public StatementContext(Document document, int sectionOffset, String sectionName) {
            this.document = document;
            this.sectionOffset = sectionOffset;
            this.sectionName = sectionName;
        }

        public int pageOf(int sectionRelativeOffset) {
            return document.pageForOffset(sectionOffset + sectionRelativeOffset);
        }

        public String getSectionName() {
            return sectionName;
        }
    }
}
