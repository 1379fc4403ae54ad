package com.llmfactory.common.errors;

/**
 * An object, parameter or secret store could not be reached or refused the
 * request.
 */
public class StoreAccessError extends LlmFactoryError {

    public StoreAccessError(String message) {
        super(message);
    }

    public StoreAccessError(String message, Throwable cause) {
        super(message, cause);
    }
}
