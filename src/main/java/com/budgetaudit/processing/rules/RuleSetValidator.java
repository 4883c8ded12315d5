package com.budgetaudit.processing.rules;

import com.budgetaudit.shared.model.OperandDefinition;
import com.budgetaudit.shared.model.RuleDefinition;
import com.budgetaudit.shared.model.RuleSet;
import com.budgetaudit.shared.model.TableSpec;
import com.budgetaudit.shared.model.Tolerance;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class RuleSetValidator {

    public List<String> validate(RuleSet ruleSet) {
        List<String> errors = new ArrayList<>();
        if (ruleSet == null) {
            errors.add("Rule set is empty");
            return errors;
        }
        if (ruleSet.getName() == null || ruleSet.getName().isBlank()) {
            errors.add("name is required");
        }
        if (ruleSet.getVersion() == null || ruleSet.getVersion().isBlank()) {
            errors.add("version is required");
        }

        Set<String> tableNames = new HashSet<>();
        for (TableSpec table : ruleSet.getTables()) {
            if (table.getCanonicalName() == null || table.getCanonicalName().isBlank()) {
                errors.add("table.name is required");
            } else if (!tableNames.add(table.getCanonicalName())) {
                errors.add("duplicate table " + table.getCanonicalName());
            }
        }

        Set<String> ruleIds = new HashSet<>();
        for (RuleDefinition rule : ruleSet.getRules()) {
            String id = rule.getId();
            if (id == null || id.isBlank()) {
                errors.add("rule.id is required");
                id = "?";
            } else if (!ruleIds.add(id)) {
                errors.add("duplicate rule id " + id);
            }
            if (rule.getType() == null) {
                errors.add("rule " + id + ": type is required");
                continue;
            }
            switch (rule.getType()) {
                case TABLE_PRESENCE:
                    if (rule.getTable() != null && !tableNames.contains(rule.getTable())) {
                        errors.add("rule " + id + ": unknown table " + rule.getTable());
                    }
                    break;
                case NUMERIC_CONSISTENCY:
                    validateOperand(id, "left", rule.getLeft(), tableNames, errors);
                    validateOperand(id, "right", rule.getRight(), tableNames, errors);
                    validateTolerance(id, rule.getTolerance(), errors);
                    break;
                case TEXT_NUMBER_CROSS_CHECK:
                    validateRegex(id, "section_start", rule.getSectionStart(), errors);
                    validateRegex(id, "section_end", rule.getSectionEnd(), errors);
                    if (rule.getReasonWindow() != null && rule.getReasonWindow() <= 0) {
                        errors.add("rule " + id + ": reason_window must be positive");
                    }
                    break;
                default:
                    break;
            }
        }
        return errors;
    }

    private static void validateOperand(String id, String side, OperandDefinition operand, Set<String> tables,
                                        List<String> errors) {
        if (operand == null) {
            errors.add("rule " + id + ": " + side + " operand is required");
            return;
        }
        if (operand.getTable() != null && !tables.contains(operand.getTable())) {
            errors.add("rule " + id + ": " + side + " refers to unknown table " + operand.getTable());
        }
        if (operand.getRow() == null && operand.getKeywords().isEmpty()) {
            errors.add("rule " + id + ": " + side + " needs a row or keywords");
        }
    }

    private static void validateTolerance(String id, Tolerance tolerance, List<String> errors) {
        if (tolerance.getRelative() < 0 || tolerance.getAbsolute() < 0 || tolerance.getParityRelative() < 0) {
            errors.add("rule " + id + ": tolerance must not be negative");
        }
    }

    private static void validateRegex(String id, String field, String regex, List<String> errors) {
        if (regex == null) {
            return;
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            errors.add("rule " + id + ": " + field + " is not a valid pattern (" + e.getDescription() + ")");
        }
    }
}
