package com.budgetaudit.processing.matching;

import com.budgetaudit.shared.model.TableSpec;

/**
 * Result of matching text against table specs. An unmatched result may still name the spec it was
 * looking for (see {@link TableAliasMatcher#locate}).
 */
public class TableMatch {
    private final TableSpec spec;
    private final double rawScore;
    private final double confidence;
    private final MatchMethod method;
    private final Integer page;
    private final boolean matched;

    public TableMatch(TableSpec spec, double rawScore, double confidence, MatchMethod method, Integer page, boolean matched) {
        this.spec = spec;
        this.rawScore = rawScore;
        this.confidence = confidence;
        this.method = method;
        this.page = page;
        this.matched = matched;
    }

    public static TableMatch unmatched() {
        return new TableMatch(null, 0.0, 0.0, MatchMethod.NONE, null, false);
    }

    public static TableMatch unmatched(TableSpec spec) {
        return new TableMatch(spec, 0.0, 0.0, MatchMethod.NONE, null, false);
    }

    public TableSpec getSpec() {
        return spec;
    }

    public double getRawScore() {
        return rawScore;
    }

    public double getConfidence() {
        return confidence;
    }

    public MatchMethod getMethod() {
        return method;
    }

    public Integer getPage() {
        return page;
    }

    public boolean isMatched() {
        return matched;
    }

    @Override
    public String toString() {
        return matched
                ? "TableMatch{" + spec + ", " + method + ", raw=" + rawScore + ", confidence=" + confidence + ", page=" + page + "}"
                : "TableMatch{unmatched" + (spec != null ? " " + spec : "") + "}";
    }
}
