package com.budgetaudit.processing.ai;

/**
 * Failure of a single provider call. Only network-level errors are transient (worth one immediate
 * re-attempt on the same tier); everything else moves the chain to the next tier.
 */
public class ProviderException extends RuntimeException {

    private final ProviderErrorType errorType;
    private final Integer statusCode;

    public ProviderException(String message, ProviderErrorType errorType, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }

    public ProviderException(String message, ProviderErrorType errorType) {
        this(message, errorType, null, null);
    }

    /**
     * Classifies an HTTP error status the way OpenAI-compatible endpoints use them.
     */
    public static ProviderException fromStatus(int status, String message, Throwable cause) {
        ProviderErrorType type;
        if (status == 401 || status == 403) {
            type = ProviderErrorType.AUTH;
        } else if (status == 408) {
            type = ProviderErrorType.TIMEOUT;
        } else if (status == 429) {
            type = ProviderErrorType.RATE_LIMIT;
        } else if (status >= 500) {
            type = ProviderErrorType.SERVER;
        } else {
            type = ProviderErrorType.INVALID_REQUEST;
        }
        return new ProviderException(message, type, status, cause);
    }

    public ProviderErrorType getErrorType() {
        return errorType;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return errorType == ProviderErrorType.NETWORK;
    }
}
