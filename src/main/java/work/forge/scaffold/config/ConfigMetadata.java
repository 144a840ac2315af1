package work.forge.scaffold.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Creation metadata stored next to the feature selection. Timestamps are kept verbatim since
 * older configs were written with zone-less local times.
 */
public record ConfigMetadata(Optional<String> createdAt, Optional<String> forgeVersion) {
    public ConfigMetadata {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(forgeVersion, "forgeVersion");
    }

    public static ConfigMetadata empty() {
        return new ConfigMetadata(Optional.empty(), Optional.empty());
    }

    public static ConfigMetadata of(String createdAt, String forgeVersion) {
        return new ConfigMetadata(Optional.ofNullable(createdAt), Optional.ofNullable(forgeVersion));
    }
}
