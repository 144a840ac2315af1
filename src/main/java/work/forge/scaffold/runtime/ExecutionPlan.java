package work.forge.scaffold.runtime;

import java.util.List;
import java.util.Set;

/**
 * Dependency-respecting, deterministic order of the active steps for one configuration.
 */
public record ExecutionPlan(List<GenerationStep> steps) {
    public ExecutionPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public List<String> ids() {
        return steps.stream().map(GenerationStep::id).toList();
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public boolean contains(String stepId) {
        return indexOf(stepId) >= 0;
    }

    public int indexOf(String stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(stepId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Keeps only the steps of the given categories, in plan order. Dependencies outside the
     * selection are assumed to have been applied by an earlier full run.
     */
    public ExecutionPlan restrictTo(Set<StepCategory> categories) {
        return new ExecutionPlan(steps.stream().filter(step -> categories.contains(step.category())).toList());
    }
}
