package work.forge.scaffold.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.forge.scaffold.api.GenerateOptions;
import work.forge.scaffold.config.ConfigurationLoader;

@CommandLine.Command(
    name = "generate",
    description = "Regenerate a project from its .forge/config.json.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class GenerateCommand extends ProjectCommand {
    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = ".", description = "Project directory.")
    private Path path;

    @CommandLine.Option(names = "--force", description = "Overwrite existing files.")
    private boolean force;

    @CommandLine.Option(names = "--dry-run", description = "Render into memory without touching the directory.")
    private boolean dryRun;

    @Override
    int run() {
        var config = ConfigurationLoader.load(path);
        var options = GenerateOptions.builder()
            .overwrite(force)
            .dryRun(dryRun)
            .build();
        return generate(config, path, options);
    }
}
