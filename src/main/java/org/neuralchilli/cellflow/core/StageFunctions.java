package org.neuralchilli.cellflow.core;

import org.neuralchilli.cellflow.domain.LoadedModel;
import org.neuralchilli.cellflow.domain.StageName;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The stage functions a graph is built from, keyed by stage.
 * Assembled explicitly and handed to the graph builder; nothing registers
 * itself.
 */
public final class StageFunctions {

    private final Map<StageName, StageFunction> functions;
    private final ModelProvider models;

    private StageFunctions(Map<StageName, StageFunction> functions, ModelProvider models) {
        this.functions = Collections.unmodifiableMap(new EnumMap<>(functions));
        this.models = models;
    }

    /**
     * Function backing {@code stage}.
     *
     * @throws InvalidTaskException if none was provided
     */
    public StageFunction functionFor(StageName stage) {
        StageFunction function = functions.get(stage);
        if (function == null) {
            throw new InvalidTaskException("No stage function registered for stage '" + stage.id() + "'");
        }
        return function;
    }

    /**
     * Model for a channel of a model-backed stage, or null if the stage loads
     * none.
     */
    public LoadedModel modelFor(StageName stage, int channel) {
        return models.modelFor(stage, channel);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the in-memory model a stage uses for one channel.
     */
    @FunctionalInterface
    public interface ModelProvider {

        LoadedModel modelFor(StageName stage, int channel);

        static ModelProvider none() {
            return (stage, channel) -> null;
        }
    }

    public static class Builder {
        private final Map<StageName, StageFunction> functions = new EnumMap<>(StageName.class);
        private ModelProvider models = ModelProvider.none();

        public Builder stage(StageName stage, StageFunction function) {
            if (stage == null || function == null) {
                throw new IllegalArgumentException("Stage and function cannot be null");
            }
            functions.put(stage, function);
            return this;
        }

        /**
         * Use the same function for every stage.
         */
        public Builder allStages(StageFunction function) {
            for (StageName stage : StageName.values()) {
                stage(stage, function);
            }
            return this;
        }

        public Builder models(ModelProvider models) {
            this.models = models != null ? models : ModelProvider.none();
            return this;
        }

        public StageFunctions build() {
            return new StageFunctions(functions, models);
        }
    }
}
