package com.budgetaudit;

import com.budgetaudit.processing.rules.RuleSetParser;
import com.budgetaudit.shared.model.RuleSet;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Test utility for loading the bundled rule sets and parsing inline ones.
 */
public class TestRuleSets {

    public static final String DEPARTMENT = "rules/department-final-v1.yaml";
    public static final String UNIT = "rules/unit-final-v1.yaml";

    private static final RuleSetParser PARSER = new RuleSetParser();

    public static RuleSet department() {
        return parse(read(DEPARTMENT));
    }

    public static RuleSet unit() {
        return parse(read(UNIT));
    }

    public static RuleSet parse(String content) {
        return PARSER.parse(content);
    }

    /**
     * Reads a classpath resource as UTF-8 text.
     */
    public static String read(String resource) {
        try (InputStream in = TestRuleSets.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
