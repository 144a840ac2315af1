package work.forge.scaffold.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Persistence choice: database engine, ORM and optional migration tool.
 */
public record DatabaseSelection(DatabaseKind kind, OrmKind orm, Optional<MigrationTool> migrationTool) {
    public DatabaseSelection {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(orm, "orm");
        Objects.requireNonNull(migrationTool, "migrationTool");
    }

    public static DatabaseSelection of(DatabaseKind kind, OrmKind orm, MigrationTool migrationTool) {
        return new DatabaseSelection(kind, orm, Optional.ofNullable(migrationTool));
    }
}
