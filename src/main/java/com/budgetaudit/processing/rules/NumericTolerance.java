package com.budgetaudit.processing.rules;

/**
 * Tolerance arithmetic shared by the numeric rules and the comparison-statement checks.
 */
public final class NumericTolerance {

    private NumericTolerance() {
        // Utility class
    }

    /**
     * True iff {@code |a-b| <= max(relTol*max(|a|,|b|), absTol)}.
     */
    public static boolean consistencyCheck(double a, double b, double relTol, double absTol) {
        double bound = Math.max(relTol * Math.max(Math.abs(a), Math.abs(b)), absTol);
        return Math.abs(a - b) <= bound;
    }

    /**
     * Tolerance for amounts quoted in prose, which are often rounded: 1.0 below 100,
     * 0.5% (at least 1) below 10000, 0.3% (at least 1) above.
     */
    public static double dynamicTolerance(double a, double b) {
        double max = Math.max(Math.abs(a), Math.abs(b));
        if (max < 100) {
            return 1.0;
        }
        if (max < 10000) {
            return Math.max(1.0, max * 0.005);
        }
        return Math.max(1.0, max * 0.003);
    }

    /**
     * Relation of {@code actual} to {@code reference} once the tolerance is applied.
     */
    public static Relation relation(double reference, double actual, double tolerance) {
        if (Math.abs(actual - reference) <= tolerance) {
            return Relation.EQUAL;
        }
        return actual > reference ? Relation.GREATER : Relation.LESS;
    }

    public enum Relation {
        GREATER,
        LESS,
        EQUAL
    }
}
