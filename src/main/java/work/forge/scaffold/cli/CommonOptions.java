package work.forge.scaffold.cli;

import picocli.CommandLine;
import work.forge.scaffold.api.LogLevel;

/**
 * Options every subcommand accepts.
 */
final class CommonOptions {
    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--json",
        description = "Print the execution report as JSON."
    )
    boolean json;

    LogLevel logLevel() {
        return LogLevel.from(logLevelRaw);
    }
}
