package com.budgetaudit.shared.model;

/**
 * A "budget X ... final Y ... final is greater than budget" statement found in an explanatory section,
 * by the regex scanner or by an AI provider. Offsets are {@code [start,end)} into the section text;
 * reason fields are null when no reason was given.
 */
public class ComparisonStatement {
    private final String budgetText;
    private final int budgetStart;
    private final int budgetEnd;
    private final String finalText;
    private final int finalStart;
    private final int finalEnd;
    private final String stmtText;
    private final int stmtStart;
    private final int stmtEnd;
    private final String reasonText;
    private final Integer reasonStart;
    private final Integer reasonEnd;
    private final String itemTitle;
    private final String clip;

    public ComparisonStatement(String budgetText, int budgetStart, int budgetEnd,
                               String finalText, int finalStart, int finalEnd,
                               String stmtText, int stmtStart, int stmtEnd,
                               String reasonText, Integer reasonStart, Integer reasonEnd,
                               String itemTitle, String clip) {
        this.budgetText = budgetText;
        this.budgetStart = budgetStart;
        this.budgetEnd = budgetEnd;
        this.finalText = finalText;
        this.finalStart = finalStart;
        this.finalEnd = finalEnd;
        this.stmtText = stmtText;
        this.stmtStart = stmtStart;
        this.stmtEnd = stmtEnd;
        this.reasonText = reasonText;
        this.reasonStart = reasonStart;
        this.reasonEnd = reasonEnd;
        this.itemTitle = itemTitle;
        this.clip = clip;
    }

    /**
     * Same statement with every offset moved by {@code delta}.
     */
    public ComparisonStatement shift(int delta) {
        return new ComparisonStatement(budgetText, budgetStart + delta, budgetEnd + delta,
                finalText, finalStart + delta, finalEnd + delta,
                stmtText, stmtStart + delta, stmtEnd + delta,
                reasonText, reasonStart != null ? reasonStart + delta : null, reasonEnd != null ? reasonEnd + delta : null,
                itemTitle, clip);
    }

    public boolean hasReason() {
        return reasonText != null && !reasonText.isBlank();
    }

    public int getStart() {
        return Math.min(budgetStart, Math.min(finalStart, stmtStart));
    }

    public String getBudgetText() {
        return budgetText;
    }

    public int getBudgetStart() {
        return budgetStart;
    }

    public int getBudgetEnd() {
        return budgetEnd;
    }

    public String getFinalText() {
        return finalText;
    }

    public int getFinalStart() {
        return finalStart;
    }

    public int getFinalEnd() {
        return finalEnd;
    }

    public String getStmtText() {
        return stmtText;
    }

    public int getStmtStart() {
        return stmtStart;
    }

    public int getStmtEnd() {
        return stmtEnd;
    }

    public String getReasonText() {
        return reasonText;
    }

    public Integer getReasonStart() {
        return reasonStart;
    }

    public Integer getReasonEnd() {
        return reasonEnd;
    }

    public String getItemTitle() {
        return itemTitle;
    }

    public String getClip() {
        return clip;
    }
}
