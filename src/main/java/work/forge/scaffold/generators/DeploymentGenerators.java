package work.forge.scaffold.generators;

import static work.forge.scaffold.generators.GeneratorSupport.baseValues;
import static work.forge.scaffold.generators.GeneratorSupport.emit;
import static work.forge.scaffold.generators.GeneratorSupport.enabled;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.config.DatabaseKind;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepCategory;

/**
 * Dockerfile, docker-compose.yml and .dockerignore. The compose file is assembled as a tree and
 * rendered through the YAML mapper so it is always well formed.
 */
public final class DeploymentGenerators {
    private static final ObjectMapper YAML = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    );

    private DeploymentGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(GenerationStep.builder("dockerfile")
            .category(StepCategory.DEPLOYMENT)
            .priority(100)
            .requires("main", "pyproject")
            .activeWhen(enabled(Feature.DOCKER))
            .action(DeploymentGenerators::dockerfile)
            .description("Generate Dockerfile")
            .build());
        registry.register(GenerationStep.builder("docker-compose")
            .category(StepCategory.DEPLOYMENT)
            .priority(101)
            .requires("dockerfile")
            .activeWhen(enabled(Feature.DOCKER))
            .action(DeploymentGenerators::compose)
            .description("Generate docker-compose.yml")
            .build());
        registry.register(GenerationStep.builder("dockerignore")
            .category(StepCategory.DEPLOYMENT)
            .priority(102)
            .activeWhen(enabled(Feature.DOCKER))
            .action((config, writer) -> emit(writer, ".dockerignore", "deployment/dockerignore.tmpl", config))
            .description("Generate .dockerignore")
            .build());
        return registry;
    }

    private static ActionResult dockerfile(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        boolean migrations = config.isEnabled(Feature.MIGRATION);
        Map<String, String> values = baseValues(config);
        values.put("migration_copy", migrations ? "COPY alembic.ini ./\nCOPY alembic ./alembic\n" : "");
        values.put("command", migrations
            ? "[\"sh\", \"-c\", \"alembic upgrade head && uvicorn app.main:app --host 0.0.0.0 --port 8000\"]"
            : "[\"uvicorn\", \"app.main:app\", \"--host\", \"0.0.0.0\", \"--port\", \"8000\"]");
        return emit(writer, "Dockerfile", "deployment/Dockerfile.tmpl", values);
    }

    private static ActionResult compose(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        writer.write("docker-compose.yml", YAML.writeValueAsString(composeModel(config)));
        return ActionResult.done();
    }

    static Map<String, Object> composeModel(ConfigurationFacade config) {
        String slug = baseValues(config).get("project_slug");
        String network = slug + "_network";

        Map<String, Object> app = new LinkedHashMap<>();
        app.put("build", ".");
        app.put("container_name", slug + "_app");
        app.put("ports", List.of("8000:8000"));
        app.put("env_file", List.of(".env"));

        Map<String, Object> services = new LinkedHashMap<>();
        services.put("app", app);

        Map<String, Object> compose = new LinkedHashMap<>();
        compose.put("services", services);

        if (config.databaseKind().isPresent()) {
            DatabaseKind kind = config.databaseKind().get();
            Map<String, String> db = ConfigGenerators.databaseValues(config, kind);
            app.put("environment", Map.of(
                "DATABASE_URL",
                db.get("db_scheme") + "://" + db.get("db_user") + ":password@db:" + kind.defaultPort() + "/" + slug
            ));
            app.put("depends_on", Map.of("db", Map.of("condition", "service_healthy")));
            services.put("db", databaseService(kind, slug, network));
            compose.put("volumes", Map.of("db_data", Map.of()));
        }
        app.put("networks", List.of(network));
        compose.put("networks", Map.of(network, Map.of("driver", "bridge")));
        return compose;
    }

    private static Map<String, Object> databaseService(DatabaseKind kind, String slug, String network) {
        Map<String, Object> service = new LinkedHashMap<>();
        Map<String, Object> environment = new LinkedHashMap<>();
        Map<String, Object> healthcheck = new LinkedHashMap<>();
        if (kind == DatabaseKind.POSTGRESQL) {
            service.put("image", "postgres:16-alpine");
            environment.put("POSTGRES_USER", "postgres");
            environment.put("POSTGRES_PASSWORD", "password");
            environment.put("POSTGRES_DB", slug);
            healthcheck.put("test", List.of("CMD-SHELL", "pg_isready -U postgres"));
        } else {
            service.put("image", "mysql:8.0");
            environment.put("MYSQL_ROOT_PASSWORD", "password");
            environment.put("MYSQL_DATABASE", slug);
            healthcheck.put("test", List.of("CMD", "mysqladmin", "ping", "-h", "localhost"));
        }
        healthcheck.put("interval", "10s");
        healthcheck.put("timeout", "5s");
        healthcheck.put("retries", 5);

        service.put("container_name", slug + "_db");
        service.put("environment", environment);
        service.put("ports", List.of(kind.defaultPort() + ":" + kind.defaultPort()));
        service.put("volumes", List.of("db_data:" + (kind == DatabaseKind.POSTGRESQL ? "/var/lib/postgresql/data" : "/var/lib/mysql")));
        service.put("healthcheck", healthcheck);
        service.put("networks", List.of(network));
        return service;
    }
}
