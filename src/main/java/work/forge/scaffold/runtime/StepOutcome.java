package work.forge.scaffold.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.forge.scaffold.shared.ErrorMaps;

/**
 * Result of running (or not running) one step of a plan.
 */
public record StepOutcome(
    String stepId,
    StepCategory category,
    StepStatus status,
    Optional<String> detail,
    Optional<Map<String, Object>> error,
    List<String> artifacts,
    Duration duration
) {
    public StepOutcome {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(error, "error");
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static StepOutcome succeeded(GenerationStep step, List<String> artifacts, Duration duration) {
        return new StepOutcome(step.id(), step.category(), StepStatus.SUCCEEDED, Optional.empty(), Optional.empty(), artifacts, duration);
    }

    public static StepOutcome skipped(GenerationStep step, String reason, List<String> artifacts, Duration duration) {
        return new StepOutcome(step.id(), step.category(), StepStatus.SKIPPED, Optional.ofNullable(reason), Optional.empty(), artifacts, duration);
    }

    public static StepOutcome failed(GenerationStep step, Throwable error, List<String> artifacts, Duration duration) {
        return new StepOutcome(
            step.id(),
            step.category(),
            StepStatus.FAILED,
            Optional.of(ErrorMaps.messageOf(error)),
            Optional.of(ErrorMaps.normalize(error)),
            artifacts,
            duration
        );
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("step", stepId);
        map.put("category", category.name().toLowerCase(Locale.ROOT));
        map.put("status", status.name().toLowerCase(Locale.ROOT));
        detail.ifPresent(value -> map.put("detail", value));
        error.ifPresent(value -> map.put("error", value));
        map.put("artifacts", artifacts);
        map.put("durationMs", duration.toMillis());
        return map;
    }
}
