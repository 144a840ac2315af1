package work.forge.scaffold.runtime;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.io.ArtifactConflictException;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.io.TrackingArtifactWriter;

/**
 * Runs an {@link ExecutionPlan} step by step against an {@link ArtifactWriter}.
 *
 * <p>An {@link ArtifactConflictException} fails only the step that raised it: steps requiring it
 * (directly or through another blocked step) are skipped, independent steps still run. Any other
 * exception aborts the rest of the plan and surfaces as a {@link StepExecutionException}; what was
 * already written stays on disk.
 */
public final class ExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final CancellationToken cancellationToken;

    public ExecutionEngine() {
        this(new CancellationToken());
    }

    public ExecutionEngine(CancellationToken cancellationToken) {
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken");
    }

    public ExecutionReport execute(ExecutionPlan plan, ConfigurationFacade config, ArtifactWriter writer) {
        Instant started = Instant.now();
        List<GenerationStep> steps = plan.steps();
        List<StepOutcome> outcomes = new ArrayList<>(steps.size());
        Set<String> unavailable = new HashSet<>();

        for (int index = 0; index < steps.size(); index++) {
            GenerationStep step = steps.get(index);
            if (cancellationToken.isCancelled()) {
                List<String> remaining = idsFrom(steps, index);
                log.warn("Generation cancelled before step '{}', {} step(s) not run", step.id(), remaining.size());
                return ExecutionReport.cancelled(outcomes, remaining, started);
            }

            String blocker = firstUnavailable(step, unavailable);
            if (blocker != null) {
                log.info("Skipping '{}': blocked by failed dependency '{}'", step.id(), blocker);
                unavailable.add(step.id());
                outcomes.add(StepOutcome.skipped(step, "blocked by failed dependency: " + blocker, List.of(), Duration.ZERO));
                continue;
            }

            var tracking = new TrackingArtifactWriter(writer);
            long begin = System.nanoTime();
            try {
                ActionResult result = step.action().apply(config, tracking);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - begin);
                if (result != null && result.skipped()) {
                    log.debug("Step '{}' skipped: {}", step.id(), result.reason());
                    outcomes.add(StepOutcome.skipped(step, result.reason(), tracking.written(), elapsed));
                } else {
                    log.debug("Step '{}' wrote {}", step.id(), tracking.written());
                    outcomes.add(StepOutcome.succeeded(step, tracking.written(), elapsed));
                }
            } catch (ArtifactConflictException ex) {
                log.warn("Step '{}' failed: {}", step.id(), ex.getMessage());
                unavailable.add(step.id());
                outcomes.add(StepOutcome.failed(step, ex, tracking.written(), Duration.ofNanos(System.nanoTime() - begin)));
            } catch (Exception ex) {
                log.error("Step '{}' aborted generation: {}", step.id(), ex.getMessage());
                outcomes.add(StepOutcome.failed(step, ex, tracking.written(), Duration.ofNanos(System.nanoTime() - begin)));
                var report = ExecutionReport.aborted(outcomes, idsFrom(steps, index + 1), started);
                throw new StepExecutionException(step.id(), ex, report);
            }
        }
        ExecutionReport report = ExecutionReport.completed(outcomes, started);
        log.info(
            "Generation finished: {} succeeded, {} skipped, {} failed",
            report.succeeded().size(),
            report.skipped().size(),
            report.failed().size()
        );
        return report;
    }

    private static String firstUnavailable(GenerationStep step, Set<String> unavailable) {
        for (String dependency : step.requires()) {
            if (unavailable.contains(dependency)) {
                return dependency;
            }
        }
        return null;
    }

    private static List<String> idsFrom(List<GenerationStep> steps, int fromIndex) {
        return steps.subList(fromIndex, steps.size()).stream().map(GenerationStep::id).toList();
    }
}
