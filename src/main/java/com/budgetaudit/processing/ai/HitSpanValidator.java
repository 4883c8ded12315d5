package com.budgetaudit.processing.ai;

import com.budgetaudit.shared.dto.ExtractHit;
import com.budgetaudit.shared.model.ComparisonStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Grounds extraction hits in the source window: every claimed span must slice the window to exactly
 * the claimed text. A hit with any ungrounded span is discarded whole.
 */
@Service
public class HitSpanValidator {

    private static final Logger logger = LoggerFactory.getLogger(HitSpanValidator.class);

    /**
     * @param hits       hits as returned by a provider
     * @param windowText the text the provider was given
     * @return accepted statements (offsets relative to the window) and the violations found
     */
    public ValidationResult validate(List<ExtractHit> hits, String windowText) {
        ValidationResult result = new ValidationResult();
        if (hits == null) {
            return result;
        }
        for (ExtractHit hit : hits) {
            String violation = firstViolation(hit, windowText);
            if (violation != null) {
                result.addViolation(violation);
                continue;
            }
            result.addAccepted(toStatement(hit, windowText));
        }
        if (!result.getViolations().isEmpty()) {
            logger.debug("Discarded {} of {} hits: {}", result.getViolations().size(), hits.size(), result.getViolations());
        }
        return result;
    }

    private static String firstViolation(ExtractHit hit, String windowText) {
        String violation = checkSpan("budget", hit.getBudgetText(), hit.getBudgetSpan(), windowText);
        if (violation == null) {
            violation = checkSpan("final", hit.getFinalText(), hit.getFinalSpan(), windowText);
        }
        if (violation == null) {
            violation = checkSpan("stmt", hit.getStmtText(), hit.getStmtSpan(), windowText);
        }
        if (violation == null && hasText(hit.getReasonText())) {
            violation = checkSpan("reason", hit.getReasonText(), hit.getReasonSpan(), windowText);
        }
        return violation;
    }

    static String checkSpan(String field, String claimed, List<Integer> span, String windowText) {
        if (!hasText(claimed)) {
            return field + " text missing";
        }
        if (span == null || span.size() != 2 || span.get(0) == null || span.get(1) == null) {
            return field + " span missing for '" + claimed + "'";
        }
        int start = span.get(0);
        int end = span.get(1);
        if (start < 0 || end <= start || end > windowText.length()) {
            return field + " span [" + start + "," + end + ") out of range";
        }
        String actual = windowText.substring(start, end);
        if (!actual.equals(claimed)) {
            return field + " span [" + start + "," + end + ") is '" + actual + "', claimed '" + claimed + "'";
        }
        return null;
    }

    private static ComparisonStatement toStatement(ExtractHit hit, String windowText) {
        boolean withReason = hasText(hit.getReasonText());
        return new ComparisonStatement(
                hit.getBudgetText(), hit.getBudgetSpan().get(0), hit.getBudgetSpan().get(1),
                hit.getFinalText(), hit.getFinalSpan().get(0), hit.getFinalSpan().get(1),
                hit.getStmtText(), hit.getStmtSpan().get(0), hit.getStmtSpan().get(1),
                withReason ? hit.getReasonText() : null,
                withReason ? hit.getReasonSpan().get(0) : null,
                withReason ? hit.getReasonSpan().get(1) : null,
                hit.getItemTitle(),
                hit.getClip() != null ? hit.getClip() : clip(hit, windowText));
    }

    private static String clip(ExtractHit hit, String windowText) {
        int from = Math.max(0, Math.min(hit.getBudgetSpan().get(0), hit.getFinalSpan().get(0)) - 20);
        int to = Math.min(windowText.length(), Math.max(hit.getStmtSpan().get(1), hit.getFinalSpan().get(1)) + 20);
        return windowText.substring(from, Math.min(to, from + 120));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * Validation result: statements that passed and one violation per discarded hit.
     */
    public static class ValidationResult {
        private final List<ComparisonStatement> accepted = new ArrayList<>();
        private final List<String> violations = new ArrayList<>();

        public List<ComparisonStatement> getAccepted() {
            return accepted;
        }

        public List<String> getViolations() {
            return violations;
        }

        public int getRejectedCount() {
            return violations.size();
        }

        void addAccepted(ComparisonStatement statement) {
            accepted.add(statement);
        }

        void addViolation(String violation) {
            violations.add(violation);
        }
    }
}
