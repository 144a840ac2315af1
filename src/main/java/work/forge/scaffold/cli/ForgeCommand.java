package work.forge.scaffold.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "forge",
    description = "Scaffold FastAPI projects from a feature configuration.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        InitCommand.class,
        GenerateCommand.class,
        PlanCommand.class,
        DockerCommand.class
    }
)
final class ForgeCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
