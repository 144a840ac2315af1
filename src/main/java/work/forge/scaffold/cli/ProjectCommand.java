package work.forge.scaffold.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.forge.scaffold.api.ForgeGenerator;
import work.forge.scaffold.api.GenerateOptions;
import work.forge.scaffold.config.ProjectConfiguration;
import work.forge.scaffold.runtime.ExecutionReport;
import work.forge.scaffold.runtime.StepExecutionException;

/**
 * Shared plumbing for subcommands that run the generator against a project directory.
 */
abstract class ProjectCommand implements Callable<Integer> {
    @CommandLine.Mixin
    CommonOptions common = new CommonOptions();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public final Integer call() throws Exception {
        // before any logger is created
        common.logLevel().apply();
        return run();
    }

    abstract int run() throws Exception;

    int generate(ProjectConfiguration config, Path projectRoot, GenerateOptions options) {
        ExecutionReport report;
        try {
            report = new ForgeGenerator().generate(config, projectRoot, options);
        } catch (StepExecutionException ex) {
            // show what ran before the abort, the error handler prints the cause
            ReportPrinter.print(ex.report(), spec.commandLine().getOut(), common.json);
            throw ex;
        }
        ReportPrinter.print(report, spec.commandLine().getOut(), common.json);
        return report.status().exitCode();
    }
}
