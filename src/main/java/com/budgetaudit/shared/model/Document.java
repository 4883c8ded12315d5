package com.budgetaudit.shared.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalized document handed over by the extraction collaborator: page-indexed text plus optional
 * table regions. Immutable; the full text joins pages with a newline and keeps the page boundaries.
 */
public class Document {
    private final String id;
    private final List<PageText> pages;
    private final List<ExtractedTable> tables;
    private final String fullText;
    private final int[] pageStarts;

    public Document(String id, List<PageText> pages, List<ExtractedTable> tables) {
        this.id = id;
        this.pages = pages != null ? Collections.unmodifiableList(new ArrayList<>(pages)) : Collections.emptyList();
        this.tables = tables != null ? Collections.unmodifiableList(new ArrayList<>(tables)) : Collections.emptyList();

        StringBuilder sb = new StringBuilder();
        this.pageStarts = new int[this.pages.size()];
        for (int i = 0; i < this.pages.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            pageStarts[i] = sb.length();
            sb.append(this.pages.get(i).getText());
        }
        this.fullText = sb.toString();
    }

    public static Document ofPages(String id, String... pageTexts) {
        List<PageText> pages = new ArrayList<>();
        for (int i = 0; i < pageTexts.length; i++) {
            pages.add(new PageText(i + 1, pageTexts[i]));
        }
        return new Document(id, pages, null);
    }

    public String getId() {
        return id;
    }

    public List<PageText> getPages() {
        return pages;
    }

    public List<ExtractedTable> getTables() {
        return tables;
    }

    public String getFullText() {
        return fullText;
    }

    /**
     * Page number holding the given offset of {@link #getFullText()}; 1 for an empty document.
     */
    public int pageForOffset(int offset) {
        if (pages.isEmpty()) {
            return 1;
        }
        int index = 0;
        for (int i = 0; i < pageStarts.length; i++) {
            if (pageStarts[i] <= offset) {
                index = i;
            } else {
                break;
            }
        }
        return pages.get(index).getPageNumber();
    }

    public String getCoverText(int maxChars) {
        return fullText.length() <= maxChars ? fullText : fullText.substring(0, maxChars);
    }

    /**
     * A document is usable when it has at least one page with non-blank text.
     */
    public boolean isUsable() {
        for (PageText page : pages) {
            if (!page.getText().isBlank()) {
                return true;
            }
        }
        return false;
    }
}
