package work.forge.scaffold.cli;

import java.io.PrintWriter;
import java.util.Locale;
import work.forge.scaffold.runtime.ExecutionReport;
import work.forge.scaffold.runtime.StepOutcome;

final class ReportPrinter {
    private ReportPrinter() {}

    static void print(ExecutionReport report, PrintWriter out, boolean json) {
        if (json) {
            out.println(report.toPrettyJson());
            return;
        }
        for (StepOutcome outcome : report.outcomes()) {
            switch (outcome.status()) {
                case SUCCEEDED -> out.println("  ok    " + outcome.stepId());
                case SKIPPED -> out.println("  skip  " + outcome.stepId() + outcome.detail().map(d -> " (" + d + ")").orElse(""));
                case FAILED -> out.println("  FAIL  " + outcome.stepId() + ": " + outcome.detail().orElse("failed"));
            }
        }
        for (String stepId : report.notRun()) {
            out.println("  --    " + stepId + " (not run)");
        }
        out.printf(
            "%s: %d succeeded, %d skipped, %d failed, %d artifact(s)%n",
            report.status().name().toLowerCase(Locale.ROOT),
            report.succeeded().size(),
            report.skipped().size(),
            report.failed().size(),
            report.artifacts().size()
        );
    }
}
