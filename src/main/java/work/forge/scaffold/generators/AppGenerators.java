package work.forge.scaffold.generators;

import static work.forge.scaffold.generators.GeneratorSupport.HAS_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.HAS_DATABASE;
import static work.forge.scaffold.generators.GeneratorSupport.baseValues;
import static work.forge.scaffold.generators.GeneratorSupport.emit;

import java.io.IOException;
import java.util.Map;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepCategory;

/**
 * Logger manager and the FastAPI entry point. {@code main} wires whatever the other groups
 * produced, so its imports follow the configuration rather than the plan.
 */
public final class AppGenerators {
    private AppGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(GenerationStep.builder("logger-manager")
            .category(StepCategory.APP)
            .priority(23)
            .requires("config-logger")
            .action((config, writer) -> emit(writer, "app/core/logger.py", "app/logger_manager.py.tmpl", config))
            .description("Generate the logger manager (app/core/logger.py)")
            .build());
        registry.register(GenerationStep.builder("main")
            .category(StepCategory.APP)
            .priority(90)
            .requires("config-settings", "logger-manager")
            .action(AppGenerators::main)
            .description("Generate the FastAPI application entry point")
            .build());
        return registry;
    }

    private static ActionResult main(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        boolean database = HAS_DATABASE.test(config);
        boolean cors = config.isEnabled(Feature.CORS);
        boolean auth = HAS_AUTH.test(config);

        StringBuilder appImports = new StringBuilder();
        if (database) {
            appImports.append("from app.core.database import db_manager\n");
        }
        if (auth) {
            appImports.append("from app.routers.v1 import api_router\n");
        }

        Map<String, String> values = baseValues(config);
        values.put("imports", cors ? "from fastapi.middleware.cors import CORSMiddleware\n" : "");
        values.put("app_imports", appImports.toString());
        values.put("startup", database ? "    await db_manager.connect()\n" : "");
        values.put("shutdown", database ? "    await db_manager.disconnect()\n" : "");
        values.put("middleware", cors ? Templates.load("app/cors_middleware.py.tmpl") : "");
        values.put("routers", auth ? "\napp.include_router(api_router)\n" : "");
        return emit(writer, "app/main.py", "app/main.py.tmpl", values);
    }
}
