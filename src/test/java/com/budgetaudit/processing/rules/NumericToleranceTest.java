package com.budgetaudit.processing.rules;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NumericToleranceTest {

    @Test
    void testAbsoluteToleranceBoundsTheCheck() {
        // 100 vs 100.04: inside an absolute band of 0.05, outside one of 0.01
        assertThat(NumericTolerance.consistencyCheck(100.0, 100.04, 0.0, 0.05)).isTrue();
        assertThat(NumericTolerance.consistencyCheck(100.0, 100.04, 0.0, 0.01)).isFalse();
    }

    @Test
    void testRelativeToleranceScalesWithLargerOperand() {
        // 0.1% of 10000 is 10
        assertThat(NumericTolerance.consistencyCheck(10000.0, 10009.0, 0.001, 0.0)).isTrue();
        assertThat(NumericTolerance.consistencyCheck(10000.0, 10011.0, 0.001, 0.0)).isFalse();
    }

    @Test
    void testCheckIsSymmetric() {
        assertThat(NumericTolerance.consistencyCheck(-5.0, 5.0, 0.0, 10.0))
                .isEqualTo(NumericTolerance.consistencyCheck(5.0, -5.0, 0.0, 10.0));
    }

    @Test
    void testDynamicToleranceTiers() {
        assertThat(NumericTolerance.dynamicTolerance(50.0, 60.0)).isEqualTo(1.0);
        assertThat(NumericTolerance.dynamicTolerance(1000.0, 2000.0)).isCloseTo(10.0, within(1e-9));
        assertThat(NumericTolerance.dynamicTolerance(100000.0, 50.0)).isCloseTo(300.0, within(1e-9));
    }

    @Test
    void testRelation() {
        assertThat(NumericTolerance.relation(100.0, 120.0, 1.0)).isEqualTo(NumericTolerance.Relation.GREATER);
        assertThat(NumericTolerance.relation(100.0, 80.0, 1.0)).isEqualTo(NumericTolerance.Relation.LESS);
        assertThat(NumericTolerance.relation(100.0, 100.5, 1.0)).isEqualTo(NumericTolerance.Relation.EQUAL);
    }
}
