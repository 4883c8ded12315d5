package com.budgetaudit.processing.rules;

import com.budgetaudit.shared.model.ComparisonStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComparisonStatementScannerTest {

    private ComparisonStatementScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new ComparisonStatementScanner();
    }

    @Test
    void testBudgetFirstStatementWithReason() {
        // Given
        String text = "1、教育支出。年初预算为100.00万元，支出决算为120.00万元，决算数大于预算数。主要原因：新增项目。";

        // When
        List<ComparisonStatement> statements = scanner.scan(text, ComparisonStatementScanner.DEFAULT_REASON_WINDOW);

        // Then: spans slice the text to exactly the captured values
        assertThat(statements).hasSize(1);
        ComparisonStatement statement = statements.get(0);
        assertThat(statement.getBudgetText()).isEqualTo("100.00");
        assertThat(text.substring(statement.getBudgetStart(), statement.getBudgetEnd())).isEqualTo("100.00");
        assertThat(text.substring(statement.getFinalStart(), statement.getFinalEnd())).isEqualTo("120.00");
        assertThat(text.substring(statement.getStmtStart(), statement.getStmtEnd())).isEqualTo("决算数大于预算数");
        assertThat(statement.getReasonText()).isEqualTo("主要原因：新增项目");
        assertThat(statement.getItemTitle()).isEqualTo("1、教育支出");
    }

    @Test
    void testFinalFirstStatement() {
        String text = "决算数为80.00万元，年初预算数为90.00万元，决算数小于预算数。";

        List<ComparisonStatement> statements = scanner.scan(text, ComparisonStatementScanner.DEFAULT_REASON_WINDOW);

        assertThat(statements).hasSize(1);
        assertThat(statements.get(0).getBudgetText()).isEqualTo("90.00");
        assertThat(statements.get(0).getFinalText()).isEqualTo("80.00");
        assertThat(statements.get(0).hasReason()).isFalse();
    }

    @Test
    void testYearOnYearComparisonIgnored() {
        String text = "年初预算为100.00万元，比上年决算为90.00万元，决算数大于预算数。";

        assertThat(scanner.scan(text, ComparisonStatementScanner.DEFAULT_REASON_WINDOW)).isEmpty();
    }

    @Test
    void testReasonMustPrecedeNextItem() {
        // Given: the only reason belongs to item 2
        String text = "1、年初预算为10.00万元，决算为20.00万元，决算数大于预算数。\n"
                + "2、年初预算为30.00万元，决算为30.00万元，决算数等于预算数。主要原因：无变化。";

        // When
        List<ComparisonStatement> statements = scanner.scan(text, ComparisonStatementScanner.DEFAULT_REASON_WINDOW);

        // Then
        assertThat(statements).hasSize(2);
        assertThat(statements.get(0).hasReason()).isFalse();
        assertThat(statements.get(1).hasReason()).isTrue();
    }
}
