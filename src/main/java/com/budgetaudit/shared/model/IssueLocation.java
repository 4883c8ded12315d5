package com.budgetaudit.shared.model;

import java.util.Objects;

/**
 * Where an issue sits in the document. Only the page is mandatory.
 */
public class IssueLocation {
    private final int page;
    private final String section;
    private final String table;
    private final Integer row;
    private final Integer col;

    public IssueLocation(int page, String section, String table, Integer row, Integer col) {
        this.page = page;
        this.section = section;
        this.table = table;
        this.row = row;
        this.col = col;
    }

    public static IssueLocation page(int page) {
        return new IssueLocation(page, null, null, null, null);
    }

    public static IssueLocation section(int page, String section) {
        return new IssueLocation(page, section, null, null, null);
    }

    public static IssueLocation table(int page, String table) {
        return new IssueLocation(page, null, table, null, null);
    }

    /**
     * Same page, and the same table when both name one.
     */
    public boolean overlaps(IssueLocation other) {
        if (other == null || page != other.page) {
            return false;
        }
        return table == null || other.table == null || table.equals(other.table);
    }

    public int getPage() {
        return page;
    }

    public String getSection() {
        return section;
    }

    public String getTable() {
        return table;
    }

    public Integer getRow() {
        return row;
    }

    public Integer getCol() {
        return col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IssueLocation that = (IssueLocation) o;
        return page == that.page
                && Objects.equals(section, that.section)
                && Objects.equals(table, that.table)
                && Objects.equals(row, that.row)
                && Objects.equals(col, that.col);
    }

    @Override
    public int hashCode() {
        return Objects.hash(page, section, table, row, col);
    }
}
