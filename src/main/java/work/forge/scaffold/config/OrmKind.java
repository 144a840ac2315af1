package work.forge.scaffold.config;

import java.util.Locale;

/**
 * ORM flavours the persistence and model steps can emit.
 */
public enum OrmKind {
    SQLMODEL("SQLModel"),
    SQLALCHEMY("SQLAlchemy");

    private final String label;

    OrmKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static OrmKind fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("ORM is required when a database is configured");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (OrmKind kind : values()) {
            if (kind.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new ConfigurationException("Unsupported ORM: " + value);
    }
}
