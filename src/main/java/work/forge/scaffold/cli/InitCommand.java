package work.forge.scaffold.cli;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import picocli.CommandLine;
import work.forge.scaffold.api.GenerateOptions;
import work.forge.scaffold.config.AuthMode;
import work.forge.scaffold.config.AuthSettings;
import work.forge.scaffold.config.ConfigMetadata;
import work.forge.scaffold.config.ConfigurationException;
import work.forge.scaffold.config.ConfigurationLoader;
import work.forge.scaffold.config.DatabaseKind;
import work.forge.scaffold.config.MigrationTool;
import work.forge.scaffold.config.OrmKind;
import work.forge.scaffold.config.ProjectConfiguration;

/**
 * Creates {@code <dir>/<name>}, records its configuration and generates the project. Options
 * default to PostgreSQL with SQLAlchemy and Alembic, complete auth and every toggle on.
 */
@CommandLine.Command(
    name = "init",
    description = "Create a new project.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class InitCommand extends ProjectCommand {
    static final String DEFAULT_NAME = "forge-project";

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = DEFAULT_NAME, description = "Project name.")
    private String name;

    @CommandLine.Option(names = "--dir", defaultValue = ".", description = "Parent directory of the project.")
    private Path directory;

    @CommandLine.Option(names = "--database", defaultValue = "postgresql", description = "postgresql, mysql or none.")
    private String database;

    @CommandLine.Option(names = "--orm", defaultValue = "SQLAlchemy", description = "SQLAlchemy or SQLModel.")
    private String orm;

    @CommandLine.Option(names = "--migration", negatable = true, defaultValue = "true", fallbackValue = "true",
        description = "Generate Alembic migrations.")
    private boolean migration;

    @CommandLine.Option(names = "--auth", defaultValue = "complete", description = "none, basic or complete.")
    private String auth;

    @CommandLine.Option(names = "--refresh-token", negatable = true,
        description = "Issue refresh tokens. Follows --auth when omitted: complete only.")
    private Boolean refreshToken;

    @CommandLine.Option(names = "--cors", negatable = true, defaultValue = "true", fallbackValue = "true")
    private boolean cors;

    @CommandLine.Option(names = "--dev-tools", negatable = true, defaultValue = "true", fallbackValue = "true")
    private boolean devTools;

    @CommandLine.Option(names = "--testing", negatable = true, defaultValue = "true", fallbackValue = "true")
    private boolean testing;

    @CommandLine.Option(names = "--docker", negatable = true, defaultValue = "true", fallbackValue = "true")
    private boolean docker;

    @CommandLine.Option(names = "--force", description = "Replace an existing configuration and files.")
    private boolean force;

    @Override
    int run() {
        var projectRoot = directory.resolve(name).normalize();
        if (ConfigurationLoader.exists(projectRoot) && !force) {
            throw new ConfigurationException(
                "Configuration already exists: " + ConfigurationLoader.configPath(projectRoot) + " (use --force)"
            );
        }
        var config = buildConfiguration();
        ConfigurationLoader.save(projectRoot, config);
        spec.commandLine().getOut().println("Created " + projectRoot);
        var options = GenerateOptions.builder()
            .overwrite(force)
            .build();
        return generate(config, projectRoot, options);
    }

    ProjectConfiguration buildConfiguration() {
        var builder = ProjectConfiguration.builder(name)
            .cors(cors)
            .devTools(devTools)
            .testing(testing)
            .docker(docker)
            .metadata(ConfigMetadata.of(Instant.now().truncatedTo(ChronoUnit.SECONDS).toString(), VersionProvider.version()));

        boolean hasDatabase = !"none".equalsIgnoreCase(database.trim());
        if (hasDatabase) {
            builder.database(
                DatabaseKind.fromLabel(database),
                OrmKind.fromLabel(orm),
                migration ? MigrationTool.ALEMBIC : null
            );
        }

        // auth needs a user table
        AuthMode mode = hasDatabase ? AuthMode.from(auth) : AuthMode.NONE;
        AuthSettings settings = AuthSettings.forMode(mode);
        if (refreshToken != null && mode != AuthMode.NONE) {
            settings = new AuthSettings(mode, refreshToken, settings.features());
        }
        return builder.auth(settings).build();
    }
}
