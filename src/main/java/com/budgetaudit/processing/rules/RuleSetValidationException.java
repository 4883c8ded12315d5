package com.budgetaudit.processing.rules;

import java.util.Collections;
import java.util.List;

public class RuleSetValidationException extends RuntimeException {

    private final List<String> errors;

    public RuleSetValidationException(List<String> errors) {
        super("Invalid rule set: " + String.join("; ", errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    public RuleSetValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = Collections.singletonList(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
