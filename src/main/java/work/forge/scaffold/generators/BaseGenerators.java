package work.forge.scaffold.generators;

import static work.forge.scaffold.generators.GeneratorSupport.baseValues;
import static work.forge.scaffold.generators.GeneratorSupport.emit;
import static work.forge.scaffold.generators.GeneratorSupport.settingsModules;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.forge.scaffold.config.AuthMode;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.config.DatabaseKind;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.config.OrmKind;
import work.forge.scaffold.generators.GeneratorSupport.SettingsModule;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepCategory;

/**
 * Project skeleton and top-level project files: directory layout, pyproject, README,
 * .gitignore, .env and the shared response helpers.
 */
public final class BaseGenerators {
    private BaseGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(GenerationStep.builder("structure")
            .category(StepCategory.BASE)
            .priority(0)
            .action(BaseGenerators::structure)
            .description("Create the package layout and __init__ modules")
            .build());
        registry.register(GenerationStep.builder("pyproject")
            .category(StepCategory.BASE)
            .priority(10)
            .requires("structure")
            .action(BaseGenerators::pyproject)
            .description("Generate pyproject.toml with the selected dependencies")
            .build());
        registry.register(GenerationStep.builder("readme")
            .category(StepCategory.DOCS)
            .priority(11)
            .action(BaseGenerators::readme)
            .description("Generate README.md")
            .build());
        registry.register(GenerationStep.builder("gitignore")
            .category(StepCategory.BASE)
            .priority(12)
            .action((config, writer) -> emit(writer, ".gitignore", "base/gitignore.tmpl", config))
            .description("Generate .gitignore")
            .build());
        registry.register(GenerationStep.builder("env")
            .category(StepCategory.CONFIG)
            .priority(13)
            .action(BaseGenerators::env)
            .description("Generate .env and .env.example")
            .build());
        registry.register(GenerationStep.builder("response-utils")
            .category(StepCategory.BASE)
            .priority(15)
            .requires("structure")
            .action((config, writer) -> emit(writer, "app/utils/response.py", "base/response.py.tmpl", config))
            .description("Generate unified API response helpers (app/utils/response.py)")
            .build());
        return registry;
    }

    private static ActionResult structure(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        List<String> directories = new ArrayList<>(List.of(
            "app",
            "app/core",
            "app/core/config",
            "app/core/config/modules",
            "app/decorators",
            "app/schemas",
            "app/utils",
            "script"
        ));
        List<String> packages = new ArrayList<>(List.of("app", "app/core", "app/decorators", "app/schemas", "app/utils"));
        if (config.isEnabled(Feature.DATABASE)) {
            directories.addAll(List.of("app/core/database", "app/crud", "app/models"));
            packages.addAll(List.of("app/crud", "app/models"));
        }
        if (config.authMode().enabled()) {
            directories.addAll(List.of("app/services", "app/routers", "app/routers/v1"));
            packages.addAll(List.of("app/services", "app/routers"));
        }
        if (config.isEnabled(Feature.MIGRATION)) {
            directories.add("alembic");
        }
        if (config.isEnabled(Feature.TESTING)) {
            directories.addAll(List.of("tests", "tests/api", "tests/unit"));
            packages.addAll(List.of("tests", "tests/api", "tests/unit"));
        }

        for (String directory : directories) {
            writer.createDirectories(directory);
        }
        for (String pkg : packages) {
            writer.writeIfAbsent(pkg + "/__init__.py", "");
        }

        emit(writer, "app/core/config/__init__.py", "structure/config_init.py.tmpl", config);
        writer.write("app/core/config/modules/__init__.py", configModulesInit(config));
        if (config.databaseKind().isPresent()) {
            DatabaseKind kind = config.databaseKind().get();
            Map<String, String> values = baseValues(config);
            values.put("db_module", kind.moduleName());
            values.put("db_manager", kind.moduleName() + "_manager");
            emit(writer, "app/core/database/__init__.py", "structure/database_init.py.tmpl", values);
        }
        return ActionResult.done();
    }

    private static String configModulesInit(ConfigurationFacade config) {
        List<SettingsModule> modules = settingsModules(config);
        StringBuilder builder = new StringBuilder("\"\"\"Configuration modules\"\"\"\n");
        for (SettingsModule module : modules) {
            builder.append("from .").append(module.file()).append(" import ").append(module.className()).append('\n');
        }
        builder.append("\n__all__ = [\n");
        for (SettingsModule module : modules) {
            builder.append("    \"").append(module.className()).append("\",\n");
        }
        builder.append("]\n");
        return builder.toString();
    }

    private static ActionResult pyproject(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        List<String> dependencies = new ArrayList<>(List.of(
            "fastapi>=0.110.0",
            "uvicorn[standard]>=0.29.0",
            "pydantic>=2.6.0",
            "pydantic-settings>=2.2.0",
            "python-dotenv>=1.0.0"
        ));
        config.databaseKind().ifPresent(kind -> {
            dependencies.add("sqlalchemy[asyncio]>=2.0.0");
            if (config.orm().orElse(null) == OrmKind.SQLMODEL) {
                dependencies.add("sqlmodel>=0.0.16");
            }
            if (kind == DatabaseKind.POSTGRESQL) {
                dependencies.add("asyncpg>=0.29.0");
                dependencies.add("psycopg2-binary>=2.9.9");
            } else {
                dependencies.add("aiomysql>=0.2.0");
                dependencies.add("pymysql>=1.1.0");
            }
        });
        if (config.isEnabled(Feature.MIGRATION)) {
            dependencies.add("alembic>=1.13.0");
        }
        if (config.authMode().enabled()) {
            dependencies.add("python-jose[cryptography]>=3.3.0");
            dependencies.add("passlib[bcrypt]>=1.7.4");
            dependencies.add("python-multipart>=0.0.9");
            dependencies.add("email-validator>=2.1.0");
        }
        if (config.authMode() == AuthMode.COMPLETE) {
            dependencies.add("aiosmtplib>=3.0.0");
            dependencies.add("jinja2>=3.1.0");
        }

        List<String> devDependencies = new ArrayList<>();
        if (config.isEnabled(Feature.DEV_TOOLS)) {
            devDependencies.add("black>=24.0.0");
            devDependencies.add("ruff>=0.3.0");
        }
        if (config.isEnabled(Feature.TESTING)) {
            devDependencies.add("pytest>=8.0.0");
            devDependencies.add("pytest-asyncio>=0.23.0");
            devDependencies.add("httpx>=0.27.0");
            if (config.isEnabled(Feature.DATABASE)) {
                devDependencies.add("aiosqlite>=0.20.0");
            }
        }

        StringBuilder extras = new StringBuilder();
        if (!devDependencies.isEmpty()) {
            extras.append("\n[project.optional-dependencies]\ndev = [\n")
                .append(tomlList(devDependencies))
                .append("\n]\n");
        }
        if (config.isEnabled(Feature.DEV_TOOLS)) {
            extras.append('\n').append(Templates.load("base/pyproject-tools.toml.tmpl"));
        }
        if (config.isEnabled(Feature.TESTING)) {
            extras.append('\n').append(Templates.load("base/pyproject-pytest.toml.tmpl"));
        }

        Map<String, String> values = baseValues(config);
        values.put("dependencies", tomlList(dependencies));
        values.put("extras", extras.toString());
        return emit(writer, "pyproject.toml", "base/pyproject.toml.tmpl", values);
    }

    private static String tomlList(List<String> items) {
        List<String> quoted = new ArrayList<>(items.size());
        for (String item : items) {
            quoted.add("    \"" + item + "\",");
        }
        return String.join("\n", quoted);
    }

    private static ActionResult readme(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        List<String> features = new ArrayList<>();
        features.add("- FastAPI application with structured settings and logging");
        config.databaseKind().ifPresent(kind -> features.add(
            "- " + kind.label() + " via " + config.orm().map(OrmKind::label).orElse("SQLAlchemy")
        ));
        config.migrationTool().ifPresent(tool -> features.add("- Database migrations with " + tool.label()));
        if (config.authMode() == AuthMode.BASIC) {
            features.add("- JWT authentication (login and register)");
        } else if (config.authMode() == AuthMode.COMPLETE) {
            features.add("- JWT authentication with refresh tokens, email verification and password reset");
        }
        if (config.isEnabled(Feature.CORS)) {
            features.add("- CORS middleware");
        }
        if (config.isEnabled(Feature.DEV_TOOLS)) {
            features.add("- Black and Ruff for formatting and linting");
        }
        if (config.isEnabled(Feature.TESTING)) {
            features.add("- pytest test suite");
        }
        if (config.isEnabled(Feature.DOCKER)) {
            features.add("- Dockerfile and docker-compose setup");
        }

        Map<String, String> values = baseValues(config);
        values.put("feature_lines", String.join("\n", features));
        values.put("docker_section", config.isEnabled(Feature.DOCKER) ? Templates.load("docs/readme-docker.md.tmpl") : "");
        return emit(writer, "README.md", "docs/README.md.tmpl", values);
    }

    private static ActionResult env(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        Map<String, String> values = baseValues(config);
        StringBuilder content = new StringBuilder(Templates.render("env/app.env.tmpl", values));
        config.databaseKind().ifPresent(kind -> content.append('\n')
            .append(Templates.render("env/database.env.tmpl", ConfigGenerators.databaseValues(config, kind))));
        if (config.authMode().enabled()) {
            content.append('\n').append(Templates.render("env/jwt.env.tmpl", values));
        }
        if (config.authMode() == AuthMode.COMPLETE) {
            content.append('\n').append(Templates.render("env/email.env.tmpl", values));
        }
        if (config.isEnabled(Feature.CORS)) {
            content.append('\n').append(Templates.render("env/cors.env.tmpl", values));
        }
        writer.write(".env", content.toString());
        writer.write(".env.example", content.toString());
        return ActionResult.done();
    }
}
