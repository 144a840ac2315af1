package work.forge.scaffold.runtime;

public enum StepStatus {
    SUCCEEDED,
    SKIPPED,
    FAILED
}
