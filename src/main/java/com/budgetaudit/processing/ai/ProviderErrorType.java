package com.budgetaudit.processing.ai;

public enum ProviderErrorType {
    TIMEOUT,
    NETWORK,
    RATE_LIMIT,
    SERVER,
    AUTH,
    INVALID_REQUEST,
    PARSE,
    CANCELLED
}
