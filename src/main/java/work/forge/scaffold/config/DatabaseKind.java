package work.forge.scaffold.config;

import java.util.Locale;

/**
 * Relational databases a generated service can target.
 */
public enum DatabaseKind {
    POSTGRESQL("PostgreSQL", "postgresql", 5432),
    MYSQL("MySQL", "mysql", 3306);

    private final String label;
    private final String moduleName;
    private final int defaultPort;

    DatabaseKind(String label, String moduleName, int defaultPort) {
        this.label = label;
        this.moduleName = moduleName;
        this.defaultPort = defaultPort;
    }

    public String label() {
        return label;
    }

    /** Python module name of the generated connection manager. */
    public String moduleName() {
        return moduleName;
    }

    public int defaultPort() {
        return defaultPort;
    }

    public static DatabaseKind fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Database type is required when a database is configured");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DatabaseKind kind : values()) {
            if (kind.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new ConfigurationException("Unsupported database type: " + value);
    }
}
