package work.forge.scaffold.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the persisted {@code .forge/config.json} record. The JSON schema is owned by
 * the wizard; this class only maps it onto {@link ProjectConfiguration} and validates it once.
 */
public final class ConfigurationLoader {
    public static final String CONFIG_DIRECTORY = ".forge";
    public static final String CONFIG_FILE = "config.json";

    private static final ObjectMapper JSON = new ObjectMapper();

    private ConfigurationLoader() {}

    public static Path configPath(Path projectPath) {
        return projectPath.resolve(CONFIG_DIRECTORY).resolve(CONFIG_FILE);
    }

    public static boolean exists(Path projectPath) {
        return Files.isRegularFile(configPath(projectPath));
    }

    public static ProjectConfiguration load(Path projectPath) {
        Path file = configPath(projectPath);
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException(
                "Configuration file not found: " + file + ". Run 'forge init' first to create the configuration."
            );
        }
        try {
            return fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read configuration: " + file, ex);
        }
    }

    public static ProjectConfiguration fromJson(String json) {
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Configuration is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration must be a JSON object");
        }
        for (String field : List.of("project_name", "features")) {
            if (!root.hasNonNull(field)) {
                throw new ConfigurationException("Missing required field in config: " + field);
            }
        }
        JsonNode features = root.get("features");
        if (!features.isObject()) {
            throw new ConfigurationException("Field 'features' must be an object");
        }

        var builder = ProjectConfiguration.builder(root.get("project_name").asText())
            .database(parseDatabase(root.get("database")))
            .auth(parseAuth(features.get("auth")))
            .cors(features.path("cors").asBoolean(false))
            .devTools(features.path("dev_tools").asBoolean(false))
            .testing(features.path("testing").asBoolean(false))
            .docker(features.path("docker").asBoolean(false))
            .metadata(parseMetadata(root.get("metadata")));
        return builder.build();
    }

    public static Path save(Path projectPath, ProjectConfiguration configuration) {
        Path file = configPath(projectPath);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, toJson(configuration), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to save configuration: " + file, ex);
        }
        return file;
    }

    /**
     * Serializes in wizard order: project name, database, features, metadata.
     */
    public static String toJson(ProjectConfiguration configuration) {
        ObjectNode root = JSON.createObjectNode();
        root.put("project_name", configuration.projectName());
        configuration.database().ifPresent(db -> {
            ObjectNode database = root.putObject("database");
            database.put("type", db.kind().label());
            database.put("orm", db.orm().label());
            if (db.migrationTool().isPresent()) {
                database.put("migration_tool", db.migrationTool().get().label());
            } else {
                database.putNull("migration_tool");
            }
        });

        ObjectNode features = root.putObject("features");
        ObjectNode auth = features.putObject("auth");
        auth.put("type", configuration.auth().mode().key());
        auth.put("refresh_token", configuration.auth().refreshToken());
        var authFeatures = auth.putArray("features");
        configuration.auth().features().forEach(authFeatures::add);
        features.put("cors", configuration.cors());
        features.put("dev_tools", configuration.devTools());
        features.put("testing", configuration.testing());
        features.put("docker", configuration.docker());

        ObjectNode metadata = root.putObject("metadata");
        configuration.metadata().createdAt().ifPresent(value -> metadata.put("created_at", value));
        configuration.metadata().forgeVersion().ifPresent(value -> metadata.put("forge_version", value));
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(root) + System.lineSeparator();
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Unable to serialize configuration: " + ex.getOriginalMessage(), ex);
        }
    }

    private static DatabaseSelection parseDatabase(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Field 'database' must be an object");
        }
        DatabaseKind kind = DatabaseKind.fromLabel(textOrNull(node, "type"));
        OrmKind orm = OrmKind.fromLabel(textOrNull(node, "orm"));
        String migration = textOrNull(node, "migration_tool");
        return new DatabaseSelection(
            kind,
            orm,
            migration == null ? Optional.empty() : Optional.of(MigrationTool.fromLabel(migration))
        );
    }

    private static AuthSettings parseAuth(JsonNode node) {
        if (node == null || node.isNull()) {
            return AuthSettings.none();
        }
        AuthMode mode = AuthMode.from(textOrNull(node, "type"));
        boolean refreshToken = node.path("refresh_token").asBoolean(mode == AuthMode.COMPLETE);
        List<String> labels = new ArrayList<>();
        JsonNode features = node.get("features");
        if (features != null && features.isArray()) {
            features.forEach(item -> labels.add(item.asText()));
        }
        return new AuthSettings(mode, refreshToken, labels);
    }

    private static ConfigMetadata parseMetadata(JsonNode node) {
        if (node == null || !node.isObject()) {
            return ConfigMetadata.empty();
        }
        return ConfigMetadata.of(textOrNull(node, "created_at"), textOrNull(node, "forge_version"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
