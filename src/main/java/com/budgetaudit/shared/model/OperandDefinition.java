package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Where to read one side of a numeric comparison: a cell addressed by table, row label and column
 * header (or index), with keywords for a proximity scan of the text when no structured cell is found.
 */
public class OperandDefinition {
    private final String label;
    private final String table;
    private final String row;
    private final String column;
    private final Integer columnIndex;
    private final List<String> keywords;

    @JsonCreator
    public OperandDefinition(@JsonProperty("label") String label,
                             @JsonProperty("table") String table,
                             @JsonProperty("row") String row,
                             @JsonProperty("column") String column,
                             @JsonProperty("column_index") Integer columnIndex,
                             @JsonProperty("keywords") List<String> keywords) {
        this.label = label;
        this.table = table;
        this.row = row;
        this.column = column;
        this.columnIndex = columnIndex;
        this.keywords = keywords != null ? Collections.unmodifiableList(new ArrayList<>(keywords)) : Collections.emptyList();
    }

    public String getLabel() {
        return label != null ? label : (row != null ? row : String.join("/", keywords));
    }

    public String getTable() {
        return table;
    }

    public String getRow() {
        return row;
    }

    public String getColumn() {
        return column;
    }

    public Integer getColumnIndex() {
        return columnIndex;
    }

    public List<String> getKeywords() {
        return keywords;
    }
}
