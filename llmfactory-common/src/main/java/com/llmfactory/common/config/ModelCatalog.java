package com.llmfactory.common.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of validated model definitions keyed by model name.
 * A catalog is replaced as a whole on reload, never edited in place.
 */
public final class ModelCatalog {

    private final String sourceId;
    private final Map<String, ModelDefinition> models;

    public ModelCatalog(String sourceId, Map<String, ModelDefinition> models) {
        this.sourceId = sourceId;
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    public static ModelCatalog empty(String sourceId) {
        return new ModelCatalog(sourceId, Map.of());
    }

    /** Source path the catalog was loaded for. */
    public String getSourceId() {
        return sourceId;
    }

    public Optional<ModelDefinition> find(String modelName) {
        return Optional.ofNullable(models.get(modelName));
    }

    public boolean contains(String modelName) {
        return models.containsKey(modelName);
    }

    public Set<String> modelNames() {
        return models.keySet();
    }

    public Map<String, ModelDefinition> asMap() {
        return models;
    }

    public int size() {
        return models.size();
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }

    @Override
    public String toString() {
        return "ModelCatalog{sourceId=" + sourceId + ", models=" + models.keySet() + "}";
    }
}
