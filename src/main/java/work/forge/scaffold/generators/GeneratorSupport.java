package work.forge.scaffold.generators;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.forge.scaffold.config.AuthMode;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.ActivationPredicate;

/**
 * Predicates and emit helpers shared by the step groups.
 */
final class GeneratorSupport {
    static final ActivationPredicate HAS_DATABASE = config -> config.isEnabled(Feature.DATABASE);
    static final ActivationPredicate HAS_AUTH = config -> config.authMode().enabled();
    static final ActivationPredicate COMPLETE_AUTH = config -> config.authMode() == AuthMode.COMPLETE;

    private GeneratorSupport() {}

    /** Complete auth always pairs access tokens with refresh tokens. */
    static final ActivationPredicate REFRESH_TOKENS = config -> config.isEnabled(Feature.REFRESH_TOKEN);

    static ActivationPredicate enabled(Feature feature) {
        return config -> config.isEnabled(feature);
    }

    /**
     * Placeholder values every template may use.
     */
    static Map<String, String> baseValues(ConfigurationFacade config) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("project_name", config.projectName());
        values.put("project_slug", config.projectName().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_"));
        values.put("auth_mode", config.authMode().key());
        return values;
    }

    static ActionResult emit(ArtifactWriter writer, String path, String template, Map<String, String> values) throws IOException {
        writer.write(path, Templates.render(template, values));
        return ActionResult.done();
    }

    static ActionResult emit(ArtifactWriter writer, String path, String template, ConfigurationFacade config) throws IOException {
        return emit(writer, path, template, baseValues(config));
    }

    /**
     * Settings modules present for the configuration, in the order the aggregated settings object
     * declares them.
     */
    static List<SettingsModule> settingsModules(ConfigurationFacade config) {
        List<SettingsModule> modules = new ArrayList<>();
        modules.add(new SettingsModule("app", "app", "AppSettings"));
        modules.add(new SettingsModule("logger", "logging", "LoggingSettings"));
        if (config.isEnabled(Feature.DATABASE)) {
            modules.add(new SettingsModule("database", "database", "DatabaseSettings"));
        }
        if (config.authMode().enabled()) {
            modules.add(new SettingsModule("jwt", "jwt", "JWTSettings"));
        }
        if (config.authMode() == AuthMode.COMPLETE) {
            modules.add(new SettingsModule("email", "email", "EmailSettings"));
        }
        if (config.isEnabled(Feature.CORS)) {
            modules.add(new SettingsModule("cors", "cors", "CORSSettings"));
        }
        return modules;
    }

    record SettingsModule(String file, String attribute, String className) {}
}
