package work.forge.scaffold.config;

import java.util.Locale;

/**
 * Named feature switches queried by activation predicates.
 */
public enum Feature {
    DATABASE("database"),
    MIGRATION("migration"),
    AUTH("auth"),
    REFRESH_TOKEN("refresh_token"),
    CORS("cors"),
    DEV_TOOLS("dev_tools"),
    TESTING("testing"),
    DOCKER("docker");

    private final String key;

    Feature(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Feature fromKey(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (Feature feature : values()) {
                if (feature.key.equals(normalized)) {
                    return feature;
                }
            }
        }
        throw new ConfigurationException("Unknown feature: " + value);
    }
}
