package com.budgetaudit.processing.matching;

import com.budgetaudit.TestRuleSets;
import com.budgetaudit.shared.model.Document;
import com.budgetaudit.shared.model.RuleSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateDetectorTest {

    private TemplateDetector detector;
    private List<RuleSet> candidates;

    @BeforeEach
    void setUp() {
        detector = new TemplateDetector();
        candidates = Arrays.asList(TestRuleSets.department(), TestRuleSets.unit());
    }

    @Test
    void testDepartmentCoverIsDetermined() {
        // Given: cover of a department final-account report
        Document document = Document.ofPages("doc-dept", "某某局2023年度部门决算\n部门决算情况说明", "正文");

        // When
        TemplateDetection detection = detector.detect(document, candidates);

        // Then
        assertThat(detection.isDetermined()).isTrue();
        assertThat(detection.getRuleSet().getName()).isEqualTo("部门决算");
        assertThat(detection.getConfidence()).isGreaterThanOrEqualTo(0.6);
    }

    @Test
    void testUnitCoverIsDetermined() {
        Document document = Document.ofPages("doc-unit", "某某中心2023年度单位决算\n单位基本情况");

        TemplateDetection detection = detector.detect(document, candidates);

        assertThat(detection.isDetermined()).isTrue();
        assertThat(detection.getRuleSet().getName()).isEqualTo("单位决算");
    }

    @Test
    void testMixedScopeCoverIsAmbiguous() {
        // Given: cover naming both scopes equally
        Document document = Document.ofPages("doc-mixed", "部门决算 单位决算");

        // When
        TemplateDetection detection = detector.detect(document, candidates);

        // Then
        assertThat(detection.isDetermined()).isFalse();
        assertThat(detection.getMargin()).isZero();
    }

    @Test
    void testCoverWithoutSignalsIsNotDetermined() {
        Document document = Document.ofPages("doc-blank", "工作总结");

        TemplateDetection detection = detector.detect(document, candidates);

        assertThat(detection.isDetermined()).isFalse();
        assertThat(detection.getRuleSet()).isNull();
    }
}
