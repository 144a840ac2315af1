package work.forge.scaffold.runtime;

import work.forge.scaffold.shared.ErrorMaps;
import work.forge.scaffold.shared.GenerationException;

/**
 * Unexpected failure inside a step action. The remaining plan was aborted; artifacts written
 * before the failure are left in place.
 */
public final class StepExecutionException extends GenerationException {
    private final String stepId;
    private final transient ExecutionReport report;

    public StepExecutionException(String stepId, Throwable cause, ExecutionReport report) {
        super("step_failed", "Step '" + stepId + "' failed: " + ErrorMaps.messageOf(cause), cause);
        this.stepId = stepId;
        this.report = report;
    }

    public String stepId() {
        return stepId;
    }

    /** Report of everything that ran up to and including the failing step. */
    public ExecutionReport report() {
        return report;
    }
}
