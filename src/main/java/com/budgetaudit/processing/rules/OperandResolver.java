package com.budgetaudit.processing.rules;

import com.budgetaudit.processing.matching.TableAliasMatcher;
import com.budgetaudit.processing.matching.TableMatch;
import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.ExtractedTable;
import com.budgetaudit.shared.model.OperandDefinition;
import com.budgetaudit.shared.model.PageText;
import com.budgetaudit.shared.model.TableSpec;
import com.budgetaudit.util.AmountParser;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads the value of a numeric operand: first from the structured cells of the owning table, then by
 * scanning the text for the first number after a keyword.
 */
class OperandResolver {

    static final int PROXIMITY_CHARS = 60;

    private final TableAliasMatcher matcher;

    OperandResolver(TableAliasMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @throws RuleEvaluationSkippedException when neither the cells nor the text yield a value
     */
    ResolvedOperand resolve(Document document, OperandDefinition operand, TableSpec spec,
                            Map<String, TableMatch> located) {
        if (spec != null && operand.getRow() != null) {
            for (ExtractedTable table : document.getTables()) {
                if (table.getTitle() == null
                        || !matcher.match(table.getTitle(), Collections.singletonList(spec)).isMatched()) {
                    continue;
                }
                Double value = readCell(table, operand);
                if (value != null) {
                    return new ResolvedOperand(value, table.getPage(), true);
                }
            }
        }

        Integer tablePage = null;
        if (spec != null) {
            TableMatch match = located.get(spec.getCanonicalName());
            if (match != null && match.isMatched()) {
                tablePage = match.getPage();
            }
        }
        for (String keyword : operand.getKeywords()) {
            if (tablePage != null) {
                ResolvedOperand onPage = scanPage(document, tablePage, keyword);
                if (onPage != null) {
                    return onPage;
                }
            }
            for (PageText page : document.getPages()) {
                ResolvedOperand found = scanPage(document, page.getPageNumber(), keyword);
                if (found != null) {
                    return found;
                }
            }
        }
        throw new RuleEvaluationSkippedException("operand '" + operand.getLabel() + "' not found");
    }

    private static Double readCell(ExtractedTable table, OperandDefinition operand) {
        List<List<String>> rows = table.getRows();
        int column = columnIndex(table, operand);
        String wantedRow = TableAliasMatcher.normalize(operand.getRow());
        for (int r = 1; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row.isEmpty() || !TableAliasMatcher.normalize(row.get(0)).contains(wantedRow)) {
                continue;
            }
            if (column >= 0) {
                return AmountParser.parse(table.cell(r, column));
            }
            for (int c = row.size() - 1; c > 0; c--) {
                Double value = AmountParser.parse(row.get(c));
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private static int columnIndex(ExtractedTable table, OperandDefinition operand) {
        if (operand.getColumnIndex() != null) {
            return operand.getColumnIndex();
        }
        if (operand.getColumn() == null) {
            return -1;
        }
        String wanted = TableAliasMatcher.normalize(operand.getColumn());
        List<String> header = table.getHeader();
        for (int c = 0; c < header.size(); c++) {
            if (TableAliasMatcher.normalize(header.get(c)).contains(wanted)) {
                return c;
            }
        }
        return -1;
    }

    private static ResolvedOperand scanPage(Document document, int pageNumber, String keyword) {
        for (PageText page : document.getPages()) {
            if (page.getPageNumber() != pageNumber) {
                continue;
            }
            String text = page.getText();
            int index = text.indexOf(keyword);
            while (index >= 0) {
                Double value = AmountParser.firstNumberAfter(text, index + keyword.length(), PROXIMITY_CHARS);
                if (value != null) {
                    return new ResolvedOperand(value, pageNumber, false);
                }
                index = text.indexOf(keyword, index + keyword.length());
            }
        }
        return null;
    }

    static class ResolvedOperand {
        private final double value;
        private final int page;
        private final boolean fromCells;

        ResolvedOperand(double value, int page, boolean fromCells) {
            this.value = value;
            this.page = page;
            this.fromCells = fromCells;
        }

        double getValue() {
            return value;
        }

        int getPage() {
            return page;
        }

        boolean isFromCells() {
            return fromCells;
        }
    }
}
