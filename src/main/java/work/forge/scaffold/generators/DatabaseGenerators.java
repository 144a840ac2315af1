package work.forge.scaffold.generators;

import static work.forge.scaffold.generators.GeneratorSupport.COMPLETE_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.HAS_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.HAS_DATABASE;
import static work.forge.scaffold.generators.GeneratorSupport.baseValues;
import static work.forge.scaffold.generators.GeneratorSupport.emit;
import static work.forge.scaffold.generators.GeneratorSupport.enabled;

import java.io.IOException;
import java.util.Map;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.config.DatabaseKind;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.config.OrmKind;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepCategory;

/**
 * Connection management, per-engine helpers and Alembic migration scaffolding.
 */
public final class DatabaseGenerators {
    static final String ALEMBIC_ENV = "alembic/env.py";

    private DatabaseGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(GenerationStep.builder("database-connection")
            .category(StepCategory.DATABASE)
            .priority(30)
            .requires("config-database", "logger-manager")
            .activeWhen(HAS_DATABASE)
            .action(DatabaseGenerators::connection)
            .description("Generate the async engine, session factory and declarative base")
            .build());
        registry.register(manager("database-postgresql", DatabaseKind.POSTGRESQL));
        registry.register(manager("database-mysql", DatabaseKind.MYSQL));
        registry.register(GenerationStep.builder("database-dependencies")
            .category(StepCategory.DATABASE)
            .priority(32)
            .requires("database-connection")
            .activeWhen(HAS_DATABASE)
            .action(DatabaseGenerators::dependencies)
            .description("Generate the session dependency used by authenticated routes")
            .build());
        registry.register(GenerationStep.builder("alembic")
            .category(StepCategory.MIGRATION)
            .priority(35)
            .requires("database-connection")
            .activeWhen(enabled(Feature.MIGRATION))
            .action(DatabaseGenerators::alembic)
            .description("Generate Alembic configuration and environment")
            .build());
        return registry;
    }

    private static GenerationStep manager(String id, DatabaseKind kind) {
        String path = "app/core/database/" + kind.moduleName() + "_manager.py";
        return GenerationStep.builder(id)
            .category(StepCategory.DATABASE)
            .priority(31)
            .requires("database-connection")
            .activeWhen(config -> config.databaseKind().orElse(null) == kind)
            .action((config, writer) -> {
                Map<String, String> values = ConfigGenerators.databaseValues(config, kind);
                values.put("db_class", kind == DatabaseKind.POSTGRESQL ? "PostgreSQL" : "MySQL");
                values.put("version_query", kind == DatabaseKind.POSTGRESQL ? "SHOW server_version" : "SELECT VERSION()");
                return emit(writer, path, "database/manager.py.tmpl", values);
            })
            .description("Generate " + kind.label() + " health and diagnostics helpers")
            .build();
    }

    private static ActionResult connection(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        emit(writer, "app/core/database/connection.py", "database/connection.py.tmpl", config);
        String base = config.orm().orElse(OrmKind.SQLALCHEMY) == OrmKind.SQLMODEL
            ? "database/base_sqlmodel.py.tmpl"
            : "database/base_sqlalchemy.py.tmpl";
        return emit(writer, "app/core/database/base.py", base, config);
    }

    private static ActionResult dependencies(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        // only route handlers behind auth take a session
        if (!HAS_AUTH.test(config)) {
            return ActionResult.skipped("no authenticated routes");
        }
        return emit(writer, "app/core/database/dependencies.py", "database/dependencies.py.tmpl", config);
    }

    private static ActionResult alembic(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        if (writer.exists(ALEMBIC_ENV)) {
            return ActionResult.skipped("already initialized");
        }
        Map<String, String> values = baseValues(config);
        StringBuilder models = new StringBuilder();
        if (HAS_AUTH.test(config)) {
            models.append("import app.models.user  # noqa: F401\n");
        }
        if (COMPLETE_AUTH.test(config)) {
            models.append("import app.models.token  # noqa: F401\n");
        }
        values.put("model_imports", models.toString());
        emit(writer, "alembic.ini", "migration/alembic.ini.tmpl", values);
        emit(writer, ALEMBIC_ENV, "migration/env.py.tmpl", values);
        emit(writer, "alembic/script.py.mako", "migration/script.py.mako.tmpl", values);
        writer.createDirectories("alembic/versions");
        writer.writeIfAbsent("alembic/versions/.gitkeep", "");
        return ActionResult.done();
    }
}
