package com.budgetaudit.processing.matching;

public enum MatchMethod {
    EXACT,
    ALIAS,
    FUZZY,
    NONE
}
