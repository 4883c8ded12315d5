package com.budgetaudit.shared.model;

import java.util.Objects;

/**
 * A quoted piece of source text backing an issue. Spans are {@code [start,end)} offsets into the section text.
 */
public class Evidence {
    private final int page;
    private final String text;
    private final Integer spanStart;
    private final Integer spanEnd;
    private final String screenshotRef;

    public Evidence(int page, String text, Integer spanStart, Integer spanEnd, String screenshotRef) {
        this.page = page;
        this.text = text;
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.screenshotRef = screenshotRef;
    }

    public static Evidence of(int page, String text) {
        return new Evidence(page, text, null, null, null);
    }

    public static Evidence ofSpan(int page, String text, int start, int end) {
        return new Evidence(page, text, start, end, null);
    }

    public int getPage() {
        return page;
    }

    public String getText() {
        return text;
    }

    public Integer getSpanStart() {
        return spanStart;
    }

    public Integer getSpanEnd() {
        return spanEnd;
    }

    public String getScreenshotRef() {
        return screenshotRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Evidence evidence = (Evidence) o;
        return page == evidence.page
                && Objects.equals(text, evidence.text)
                && Objects.equals(spanStart, evidence.spanStart)
                && Objects.equals(spanEnd, evidence.spanEnd)
                && Objects.equals(screenshotRef, evidence.screenshotRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(page, text, spanStart, spanEnd, screenshotRef);
    }
}
