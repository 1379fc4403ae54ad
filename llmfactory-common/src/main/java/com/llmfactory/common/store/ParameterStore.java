package com.llmfactory.common.store;

import java.util.Optional;

/**
 * Named-parameter lookup used to resolve remote locations indirectly.
 */
@FunctionalInterface
public interface ParameterStore {

    /**
     * Look up a parameter value.
     *
     * @return the value, or empty when the parameter does not exist
     * @throws com.llmfactory.common.errors.StoreAccessError when the store cannot be queried
     */
    Optional<String> getParameter(String name);
}
