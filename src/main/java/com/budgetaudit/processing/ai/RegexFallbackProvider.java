package com.budgetaudit.processing.ai;

import com.budgetaudit.processing.rules.ComparisonStatementScanner;
import com.budgetaudit.shared.dto.ExtractHit;
import com.budgetaudit.shared.dto.ExtractRequest;
import com.budgetaudit.shared.dto.ExtractResponse;
import com.budgetaudit.shared.model.ComparisonStatement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Last resort of the chain: answers with the statements the deterministic scanner finds in the window.
 * Never fails, so a job keeps running when every hosted model is down.
 */
public class RegexFallbackProvider implements AiProvider {

    public static final String MODEL_ID = "regex-fallback";

    private final ComparisonStatementScanner scanner = new ComparisonStatementScanner();

    @Override
    public String getName() {
        return "regex";
    }

    @Override
    public String getModelId() {
        return MODEL_ID;
    }

    @Override
    public ExtractResponse extract(ExtractRequest request) {
        String text = request.getSectionText() != null ? request.getSectionText() : "";
        List<ExtractHit> hits = new ArrayList<>();
        for (ComparisonStatement statement : scanner.scan(text, ComparisonStatementScanner.DEFAULT_REASON_WINDOW)) {
            hits.add(toHit(statement));
        }
        return new ExtractResponse(hits, new ExtractResponse.Meta(MODEL_ID, false, 0));
    }

    private static ExtractHit toHit(ComparisonStatement statement) {
        ExtractHit hit = new ExtractHit();
        hit.setBudgetText(statement.getBudgetText());
        hit.setBudgetSpan(Arrays.asList(statement.getBudgetStart(), statement.getBudgetEnd()));
        hit.setFinalText(statement.getFinalText());
        hit.setFinalSpan(Arrays.asList(statement.getFinalStart(), statement.getFinalEnd()));
        hit.setStmtText(statement.getStmtText());
        hit.setStmtSpan(Arrays.asList(statement.getStmtStart(), statement.getStmtEnd()));
        if (statement.hasReason()) {
            hit.setReasonText(statement.getReasonText());
            hit.setReasonSpan(Arrays.asList(statement.getReasonStart(), statement.getReasonEnd()));
        }
        hit.setItemTitle(statement.getItemTitle());
        hit.setClip(statement.getClip());
        return hit;
    }
}
