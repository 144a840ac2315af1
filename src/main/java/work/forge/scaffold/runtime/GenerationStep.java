package work.forge.scaffold.runtime;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import work.forge.scaffold.config.ConfigurationFacade;

/**
 * Descriptor of one conditionally activated unit of artifact synthesis. Steps are plain data:
 * metadata plus an activation predicate and an action closure.
 */
public record GenerationStep(
    String id,
    StepCategory category,
    int priority,
    Set<String> requires,
    ActivationPredicate activation,
    StepAction action,
    String description
) {
    public GenerationStep {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id is required");
        }
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(activation, "activation");
        Objects.requireNonNull(action, "action");
        requires = requires == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(requires));
        description = description == null ? "" : description;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public boolean isActive(ConfigurationFacade config) {
        return activation.test(config);
    }

    public static final class Builder {
        private final String id;
        private StepCategory category = StepCategory.BASE;
        private int priority;
        private final Set<String> requires = new LinkedHashSet<>();
        private ActivationPredicate activation = ActivationPredicate.always();
        private StepAction action;
        private String description;

        private Builder(String id) {
            this.id = id;
        }

        public Builder category(StepCategory category) {
            this.category = category;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder requires(String... stepIds) {
            Collections.addAll(requires, stepIds);
            return this;
        }

        public Builder activeWhen(ActivationPredicate activation) {
            this.activation = activation;
            return this;
        }

        public Builder action(StepAction action) {
            this.action = action;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public GenerationStep build() {
            return new GenerationStep(id, category, priority, requires, activation, action, description);
        }
    }
}
