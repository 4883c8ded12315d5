package com.budgetaudit.processing.matching;

import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.ExtractedTable;
import com.budgetaudit.shared.model.PageText;
import com.budgetaudit.shared.model.Severity;
import com.budgetaudit.shared.model.TableSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for TableAliasMatcher.
 * Tests exact/alias/fuzzy scoring, cover-page signals and document-wide location.
 */
class TableAliasMatcherTest {

    private TableAliasMatcher matcher;
    private List<TableSpec> specs;

    @BeforeEach
    void setUp() {
        matcher = new TableAliasMatcher();
        specs = Arrays.asList(
                new TableSpec("收入决算表", Arrays.asList("决算收入表", "收入决算明细表"), true, "收入", Severity.HIGH, "部门"),
                new TableSpec("支出决算表", Arrays.asList("决算支出表"), true, "支出", Severity.HIGH, "部门"));
    }

    @Test
    void testExactNameWins() {
        // When: Region carries the canonical name with spacing and brackets
        TableMatch match = matcher.match("表二  收 入 决 算 表（一）", specs);

        // Then
        assertThat(match.isMatched()).isTrue();
        assertThat(match.getSpec().getCanonicalName()).isEqualTo("收入决算表");
        assertThat(match.getMethod()).isEqualTo(MatchMethod.EXACT);
        assertThat(match.getConfidence()).isEqualTo(1.0);
    }

    @Test
    void testAliasScoresBelowExact() {
        TableMatch match = matcher.match("决算支出表", specs);

        assertThat(match.getMethod()).isEqualTo(MatchMethod.ALIAS);
        assertThat(match.getSpec().getCanonicalName()).isEqualTo("支出决算表");
        assertThat(match.getConfidence()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    void testFuzzyMatchWhenBigramsCovered() {
        // Given: every bigram of the name is on the line, but never contiguously
        TableMatch match = matcher.match("收入决算（本年）决算表", Collections.singletonList(specs.get(0)));

        // Then
        assertThat(match.isMatched()).isTrue();
        assertThat(match.getMethod()).isEqualTo(MatchMethod.FUZZY);
        assertThat(match.getConfidence()).isCloseTo(1.0 / 3.0, within(1e-9));
    }

    @Test
    void testUnrelatedRegionIsUnmatched() {
        TableMatch match = matcher.match("三公经费支出情况说明", specs);

        assertThat(match.isMatched()).isFalse();
        assertThat(match.getMethod()).isEqualTo(MatchMethod.NONE);
    }

    @Test
    void testCoverScopeAddsBonus() {
        // When: cover names the department scope next to 决算
        TableMatch plain = matcher.match("决算支出表", null, specs);
        TableMatch boosted = matcher.match("决算支出表", "某某局2023年度部门决算", specs);

        // Then
        assertThat(boosted.getRawScore()).isCloseTo(plain.getRawScore() + 0.5, within(1e-9));
    }

    @Test
    void testMixedScopeCoverCancelsBonus() {
        TableMatch mixed = matcher.match("决算支出表", "部门决算 单位决算", specs);

        assertThat(mixed.getRawScore()).isCloseTo(TableAliasMatcher.ALIAS_SCORE, within(1e-9));
    }

    @Test
    void testLocateFindsTitleSplitAcrossPages() {
        // Given: "收入" ends page 1 and "决算表" opens page 2
        Document document = Document.ofPages("doc-split", "附表一 收入", "决算表\n项目 金额", "其他内容");

        // When
        Map<String, TableMatch> located = matcher.locate(document, specs);

        // Then
        TableMatch income = located.get("收入决算表");
        assertThat(income.isMatched()).isTrue();
        assertThat(income.getPage()).isEqualTo(1);
        assertThat(located.get("支出决算表").isMatched()).isFalse();
    }

    @Test
    void testLocateUsesStructuredTableTitles() {
        // Given: page 3 has no text, only a structured table titled 支出决算表
        List<PageText> pages = Arrays.asList(new PageText(1, "封面"), new PageText(2, "目录"), new PageText(3, ""));
        ExtractedTable table = new ExtractedTable(3, "支出决算表",
                Collections.singletonList(Arrays.asList("项目", "金额")));
        Document document = new Document("doc-tables", pages, Collections.singletonList(table));

        // When
        Map<String, TableMatch> located = matcher.locate(document, specs);

        // Then
        assertThat(located).containsOnlyKeys("收入决算表", "支出决算表");
        assertThat(located.get("支出决算表").getPage()).isEqualTo(3);
        assertThat(located.get("收入决算表").isMatched()).isFalse();
    }

    @Test
    void testNormalizeDropsSpacingAndBrackets() {
        assertThat(TableAliasMatcher.normalize("收 入 决 算 表（一）")).isEqualTo("收入决算表一");
        assertThat(TableAliasMatcher.normalize(null)).isEmpty();
    }
}
