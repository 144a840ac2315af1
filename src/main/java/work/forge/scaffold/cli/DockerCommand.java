package work.forge.scaffold.cli;

import java.nio.file.Path;
import java.util.Set;
import picocli.CommandLine;
import work.forge.scaffold.api.GenerateOptions;
import work.forge.scaffold.config.ConfigurationLoader;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.runtime.StepCategory;

@CommandLine.Command(
    name = "docker",
    description = "Generate only the Docker files of an existing project.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class DockerCommand extends ProjectCommand {
    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = ".", description = "Project directory.")
    private Path path;

    @Override
    int run() {
        var config = ConfigurationLoader.load(path);
        if (!config.isEnabled(Feature.DOCKER)) {
            var err = spec.commandLine().getErr();
            err.println("Docker is not enabled for this project.");
            err.println("Set \"docker\": true under features in " + ConfigurationLoader.configPath(path));
            return 1;
        }
        var options = GenerateOptions.builder()
            .overwrite(true)
            .categories(Set.of(StepCategory.DEPLOYMENT))
            .build();
        return generate(config, path, options);
    }
}
