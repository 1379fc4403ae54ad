package com.llmfactory.common.errors;

/**
 * A provider call failed. Never retried.
 */
public class ProviderInvocationError extends LlmFactoryError {

    private final int statusCode;

    public ProviderInvocationError(String message) {
        this(message, -1, null);
    }

    public ProviderInvocationError(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ProviderInvocationError(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, or -1 when the call never got a response. */
    public int getStatusCode() {
        return statusCode;
    }
}
