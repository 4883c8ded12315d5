package com.budgetaudit.processing.ai;

/**
 * A slice {@code [start, end)} of a section, sent to the providers as one request.
 */
public class TextWindow {
    private final int index;
    private final int start;
    private final int end;
    private final String text;

    public TextWindow(int index, int start, int end, String text) {
        this.index = index;
        this.start = start;
        this.end = end;
        this.text = text;
    }

    public int getIndex() {
        return index;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getText() {
        return text;
    }
}
