package work.forge.scaffold.config;

import java.util.Locale;

public enum MigrationTool {
    ALEMBIC("Alembic");

    private final String label;

    MigrationTool(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MigrationTool fromLabel(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (MigrationTool tool : values()) {
            if (tool.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return tool;
            }
        }
        throw new ConfigurationException("Unsupported migration tool: " + value);
    }
}
