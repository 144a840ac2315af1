package work.forge.scaffold.cli;

import picocli.CommandLine;
import work.forge.scaffold.shared.ErrorMaps;

/**
 * Keeps CLI failures to one line; the stack trace only shows with {@code -Dforge.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(ErrorMaps.messageOf(ex)));
        if (Boolean.getBoolean("forge.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
