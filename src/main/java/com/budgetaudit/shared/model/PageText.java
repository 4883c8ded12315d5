package com.budgetaudit.shared.model;

/**
 * Text of one page, numbered from 1.
 */
public class PageText {
    private final int pageNumber;
    private final String text;

    public PageText(int pageNumber, String text) {
        this.pageNumber = pageNumber;
        this.text = text != null ? text : "";
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public String getText() {
        return text;
    }
}
