package work.forge.scaffold.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only collection of generation steps. Built once at startup and handed to the resolver
 * by reference; registration order is the final tie-break of every plan.
 */
public final class GeneratorRegistry {
    private final List<GenerationStep> steps = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();

    public GeneratorRegistry register(GenerationStep step) {
        if (indexById.containsKey(step.id())) {
            throw new DuplicateStepException(step.id());
        }
        indexById.put(step.id(), steps.size());
        steps.add(step);
        return this;
    }

    public List<GenerationStep> all() {
        return Collections.unmodifiableList(steps);
    }

    public Optional<GenerationStep> get(String id) {
        Integer index = indexById.get(id);
        return index == null ? Optional.empty() : Optional.of(steps.get(index));
    }

    public boolean contains(String id) {
        return indexById.containsKey(id);
    }

    public int size() {
        return steps.size();
    }

    /**
     * Registration position of {@code id}, or {@code -1} when unknown.
     */
    public int registrationIndex(String id) {
        return indexById.getOrDefault(id, -1);
    }

    /**
     * Checks that every declared dependency names another registered step. Activity is a planning
     * concern and is not looked at here.
     */
    public GeneratorRegistry validate() {
        for (GenerationStep step : steps) {
            for (String dependency : step.requires()) {
                if (dependency.equals(step.id())) {
                    throw new UnsatisfiedDependencyException(step.id(), dependency, UnsatisfiedDependencyException.Reason.SELF);
                }
                if (!indexById.containsKey(dependency)) {
                    throw new UnsatisfiedDependencyException(
                        step.id(),
                        dependency,
                        UnsatisfiedDependencyException.Reason.NOT_REGISTERED
                    );
                }
            }
        }
        return this;
    }
}
