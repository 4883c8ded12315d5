package com.budgetaudit.shared.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A table region found by the extraction collaborator. The first row is treated as the header.
 */
public class ExtractedTable {
    private final int page;
    private final String title;
    private final List<List<String>> rows;

    public ExtractedTable(int page, String title, List<List<String>> rows) {
        this.page = page;
        this.title = title;
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public int getPage() {
        return page;
    }

    public String getTitle() {
        return title;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public List<String> getHeader() {
        return rows.isEmpty() ? Collections.emptyList() : rows.get(0);
    }

    public String cell(int row, int col) {
        if (row < 0 || row >= rows.size()) {
            return null;
        }
        List<String> cells = rows.get(row);
        return col >= 0 && col < cells.size() ? cells.get(col) : null;
    }
}
