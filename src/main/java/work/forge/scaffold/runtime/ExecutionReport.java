package work.forge.scaffold.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-step outcomes of one execution plus the overall status. Usable by the CLI and by
 * embedding applications.
 */
public record ExecutionReport(
    Status status,
    List<StepOutcome> outcomes,
    List<String> notRun,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ExecutionReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        notRun = notRun == null ? List.of() : List.copyOf(notRun);
    }

    /**
     * Derives the status from the outcomes: any failed step makes the run partial.
     */
    public static ExecutionReport completed(List<StepOutcome> outcomes, Instant startedAt) {
        boolean anyFailed = outcomes.stream().anyMatch(outcome -> outcome.status() == StepStatus.FAILED);
        return new ExecutionReport(anyFailed ? Status.PARTIAL : Status.SUCCESS, outcomes, List.of(), startedAt, Instant.now());
    }

    public static ExecutionReport aborted(List<StepOutcome> outcomes, List<String> notRun, Instant startedAt) {
        return new ExecutionReport(Status.FAILURE, outcomes, notRun, startedAt, Instant.now());
    }

    public static ExecutionReport cancelled(List<StepOutcome> outcomes, List<String> notRun, Instant startedAt) {
        return new ExecutionReport(Status.CANCELLED, outcomes, notRun, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public List<String> succeeded() {
        return idsWith(StepStatus.SUCCEEDED);
    }

    public List<String> skipped() {
        return idsWith(StepStatus.SKIPPED);
    }

    public List<String> failed() {
        return idsWith(StepStatus.FAILED);
    }

    public Optional<StepOutcome> outcome(String stepId) {
        return outcomes.stream().filter(outcome -> outcome.stepId().equals(stepId)).findFirst();
    }

    public List<String> artifacts() {
        var all = new ArrayList<String>();
        outcomes.forEach(outcome -> all.addAll(outcome.artifacts()));
        return all;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("succeeded", succeeded());
        serializable.put("skipped", skipped());
        serializable.put("failed", failed());
        if (!notRun.isEmpty()) {
            serializable.put("notRun", notRun);
        }
        serializable.put("steps", outcomes.stream().map(StepOutcome::toSerializableMap).toList());
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize report: " + ex.getOriginalMessage(), ex);
        }
    }

    private List<String> idsWith(StepStatus wanted) {
        return outcomes.stream()
            .filter(outcome -> outcome.status() == wanted)
            .map(StepOutcome::stepId)
            .toList();
    }

    public enum Status {
        SUCCESS(0),
        PARTIAL(1),
        FAILURE(1),
        CANCELLED(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
