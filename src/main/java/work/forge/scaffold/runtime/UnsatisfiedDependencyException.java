package work.forge.scaffold.runtime;

import work.forge.scaffold.shared.GenerationException;

/**
 * A step requires another step that is either not registered or not active for the
 * configuration being planned.
 */
public final class UnsatisfiedDependencyException extends GenerationException {
    public enum Reason {
        NOT_REGISTERED,
        INACTIVE,
        SELF
    }

    private final String stepId;
    private final String dependencyId;
    private final Reason reason;

    public UnsatisfiedDependencyException(String stepId, String dependencyId, Reason reason) {
        super("unsatisfied_dependency", describe(stepId, dependencyId, reason));
        this.stepId = stepId;
        this.dependencyId = dependencyId;
        this.reason = reason;
    }

    public String stepId() {
        return stepId;
    }

    public String dependencyId() {
        return dependencyId;
    }

    public Reason reason() {
        return reason;
    }

    private static String describe(String stepId, String dependencyId, Reason reason) {
        return switch (reason) {
            case NOT_REGISTERED -> "Step '%s' requires unknown step '%s'".formatted(stepId, dependencyId);
            case INACTIVE -> "Step '%s' requires step '%s', which is not active for this configuration"
                .formatted(stepId, dependencyId);
            case SELF -> "Step '%s' cannot require itself".formatted(stepId);
        };
    }
}
