package work.forge.scaffold.generators;

import static work.forge.scaffold.generators.GeneratorSupport.COMPLETE_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.HAS_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.HAS_DATABASE;
import static work.forge.scaffold.generators.GeneratorSupport.baseValues;
import static work.forge.scaffold.generators.GeneratorSupport.emit;
import static work.forge.scaffold.generators.GeneratorSupport.enabled;
import static work.forge.scaffold.generators.GeneratorSupport.settingsModules;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.config.DatabaseKind;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.generators.GeneratorSupport.SettingsModule;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.ActivationPredicate;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepCategory;

/**
 * Settings modules under {@code app/core/config}.
 */
public final class ConfigGenerators {
    private static final String MODULES = "app/core/config/modules/";

    private ConfigGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(GenerationStep.builder("config-base")
            .category(StepCategory.CONFIG)
            .priority(20)
            .requires("structure")
            .action((config, writer) -> emit(writer, "app/core/config/base.py", "config/base.py.tmpl", config))
            .description("Generate the shared settings base class")
            .build());
        registry.register(module("config-app", 21, "app", ActivationPredicate.always()));
        registry.register(module("config-logger", 22, "logger", ActivationPredicate.always()));
        registry.register(module("config-cors", 24, "cors", enabled(Feature.CORS)));
        registry.register(GenerationStep.builder("config-database")
            .category(StepCategory.CONFIG)
            .priority(25)
            .requires("config-base")
            .activeWhen(HAS_DATABASE)
            .action(ConfigGenerators::database)
            .description("Generate the database settings module")
            .build());
        registry.register(module("config-jwt", 26, "jwt", HAS_AUTH));
        registry.register(module("config-email", 27, "email", COMPLETE_AUTH));
        registry.register(GenerationStep.builder("config-settings")
            .category(StepCategory.CONFIG)
            .priority(28)
            .requires("config-app", "config-logger")
            .action(ConfigGenerators::settings)
            .description("Generate the aggregated settings object")
            .build());
        return registry;
    }

    private static GenerationStep module(String id, int priority, String name, ActivationPredicate when) {
        String path = MODULES + name + ".py";
        String template = "config/" + name + ".py.tmpl";
        return GenerationStep.builder(id)
            .category(StepCategory.CONFIG)
            .priority(priority)
            .requires("config-base")
            .activeWhen(when)
            .action((config, writer) -> emit(writer, path, template, config))
            .description("Generate " + path)
            .build();
    }

    private static ActionResult database(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        DatabaseKind kind = config.databaseKind()
            .orElseThrow(() -> new IllegalStateException("Database settings requested without a database"));
        Map<String, String> values = databaseValues(config, kind);
        return emit(writer, MODULES + "database.py", "config/database.py.tmpl", values);
    }

    static Map<String, String> databaseValues(ConfigurationFacade config, DatabaseKind kind) {
        Map<String, String> values = baseValues(config);
        values.put("db_label", kind.label());
        values.put("db_module", kind.moduleName());
        values.put("db_scheme", kind == DatabaseKind.POSTGRESQL ? "postgresql+asyncpg" : "mysql+aiomysql");
        values.put("db_user", kind == DatabaseKind.POSTGRESQL ? "postgres" : "root");
        values.put("db_port", String.valueOf(kind.defaultPort()));
        return values;
    }

    private static ActionResult settings(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        List<String> imports = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        for (SettingsModule module : settingsModules(config)) {
            imports.add("    " + module.className() + ",");
            fields.add("        self." + module.attribute() + " = " + module.className() + "()");
        }
        Map<String, String> values = baseValues(config);
        values.put("module_imports", String.join("\n", imports));
        values.put("module_fields", String.join("\n", fields));
        return emit(writer, "app/core/config/settings.py", "config/settings.py.tmpl", values);
    }
}
