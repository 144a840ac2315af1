package work.forge.scaffold.runtime;

import work.forge.scaffold.shared.GenerationException;

public final class DuplicateStepException extends GenerationException {
    private final String stepId;

    public DuplicateStepException(String stepId) {
        super("duplicate_step", "Generation step already registered: " + stepId);
        this.stepId = stepId;
    }

    public String stepId() {
        return stepId;
    }
}
