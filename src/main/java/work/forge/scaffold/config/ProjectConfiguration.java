package work.forge.scaffold.config;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable, validated snapshot of the user's feature selection. Loaded once per invocation and
 * passed unchanged through planning and execution.
 */
public record ProjectConfiguration(
    String projectName,
    Optional<DatabaseSelection> database,
    AuthSettings auth,
    boolean cors,
    boolean devTools,
    boolean testing,
    boolean docker,
    ConfigMetadata metadata
) implements ConfigurationFacade {
    private static final Pattern PROJECT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    public ProjectConfiguration {
        if (projectName == null || projectName.isBlank()) {
            throw new ConfigurationException("Missing required field in config: project_name");
        }
        if (!PROJECT_NAME.matcher(projectName).matches()) {
            throw new ConfigurationException("Invalid project name: " + projectName);
        }
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(metadata, "metadata");
    }

    public static Builder builder(String projectName) {
        return new Builder().projectName(projectName);
    }

    @Override
    public Optional<DatabaseKind> databaseKind() {
        return database.map(DatabaseSelection::kind);
    }

    @Override
    public Optional<OrmKind> orm() {
        return database.map(DatabaseSelection::orm);
    }

    @Override
    public Optional<MigrationTool> migrationTool() {
        return database.flatMap(DatabaseSelection::migrationTool);
    }

    @Override
    public AuthMode authMode() {
        return auth.mode();
    }

    @Override
    public boolean isEnabled(Feature feature) {
        return switch (feature) {
            case DATABASE -> database.isPresent();
            case MIGRATION -> migrationTool().isPresent();
            case AUTH -> auth.mode().enabled();
            case REFRESH_TOKEN -> auth.refreshToken();
            case CORS -> cors;
            case DEV_TOOLS -> devTools;
            case TESTING -> testing;
            case DOCKER -> docker;
        };
    }

    public Builder toBuilder() {
        return new Builder()
            .projectName(projectName)
            .database(database.orElse(null))
            .auth(auth)
            .cors(cors)
            .devTools(devTools)
            .testing(testing)
            .docker(docker)
            .metadata(metadata);
    }

    public static final class Builder {
        private String projectName;
        private DatabaseSelection database;
        private AuthSettings auth = AuthSettings.none();
        private boolean cors;
        private boolean devTools;
        private boolean testing;
        private boolean docker;
        private ConfigMetadata metadata = ConfigMetadata.empty();

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder database(DatabaseSelection database) {
            this.database = database;
            return this;
        }

        public Builder database(DatabaseKind kind, OrmKind orm, MigrationTool migrationTool) {
            this.database = DatabaseSelection.of(kind, orm, migrationTool);
            return this;
        }

        public Builder auth(AuthSettings auth) {
            this.auth = auth;
            return this;
        }

        public Builder auth(AuthMode mode) {
            this.auth = AuthSettings.forMode(mode);
            return this;
        }

        public Builder cors(boolean cors) {
            this.cors = cors;
            return this;
        }

        public Builder devTools(boolean devTools) {
            this.devTools = devTools;
            return this;
        }

        public Builder testing(boolean testing) {
            this.testing = testing;
            return this;
        }

        public Builder docker(boolean docker) {
            this.docker = docker;
            return this;
        }

        public Builder metadata(ConfigMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public ProjectConfiguration build() {
            return new ProjectConfiguration(
                projectName,
                Optional.ofNullable(database),
                auth,
                cors,
                devTools,
                testing,
                docker,
                metadata
            );
        }
    }
}
