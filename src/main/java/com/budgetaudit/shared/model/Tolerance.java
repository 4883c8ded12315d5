package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Numeric comparison band. {@code relative} and {@code absolute} bound a pass; {@code parityRelative}
 * bounds the wider "basically equal" (基本持平) band that yields a warning instead of a violation.
 */
public class Tolerance {
    private static final double DEFAULT_RELATIVE = 0.0;
    private static final double DEFAULT_ABSOLUTE = 0.05;

    public static final Tolerance DEFAULT = new Tolerance(0.0, 0.05, 0.01);

    private final double relative;
    private final double absolute;
    private final double parityRelative;

    @JsonCreator
    public Tolerance(@JsonProperty("relative") Double relative,
                     @JsonProperty("absolute") Double absolute,
                     @JsonProperty("parity_relative") Double parityRelative) {
        this.relative = relative != null ? relative : DEFAULT_RELATIVE;
        this.absolute = absolute != null ? absolute : DEFAULT_ABSOLUTE;
        this.parityRelative = parityRelative != null ? parityRelative : 0.0;
    }

    public double getRelative() {
        return relative;
    }

    public double getAbsolute() {
        return absolute;
    }

    public double getParityRelative() {
        return parityRelative;
    }
}
