package work.forge.scaffold.config;

import java.util.Optional;

/**
 * Read-only query surface used by step activation predicates and step actions.
 * Implementations must not change between the start of planning and the end of execution.
 */
public interface ConfigurationFacade {
    String projectName();

    Optional<DatabaseKind> databaseKind();

    Optional<OrmKind> orm();

    Optional<MigrationTool> migrationTool();

    AuthMode authMode();

    boolean isEnabled(Feature feature);

    /**
     * Name-based lookup: {@code "auth"} answers the {@link AuthMode}, every other feature a
     * {@link Boolean}.
     */
    default Object getFeature(String name) {
        Feature feature = Feature.fromKey(name);
        if (feature == Feature.AUTH) {
            return authMode();
        }
        return isEnabled(feature);
    }
}
