package com.budgetaudit.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RuleType {
    @JsonProperty("table_presence")
    TABLE_PRESENCE,
    @JsonProperty("numeric_consistency")
    NUMERIC_CONSISTENCY,
    @JsonProperty("text_number_cross_check")
    TEXT_NUMBER_CROSS_CHECK
}
