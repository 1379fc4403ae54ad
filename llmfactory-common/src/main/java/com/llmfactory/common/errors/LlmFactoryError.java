package com.llmfactory.common.errors;

/**
 * Base type for every error raised by the factory.
 */
public class LlmFactoryError extends RuntimeException {

    public LlmFactoryError(String message) {
        super(message);
    }

    public LlmFactoryError(String message, Throwable cause) {
        super(message, cause);
    }
}
