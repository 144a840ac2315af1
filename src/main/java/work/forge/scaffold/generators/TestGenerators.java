package work.forge.scaffold.generators;

import static work.forge.scaffold.generators.GeneratorSupport.HAS_AUTH;
import static work.forge.scaffold.generators.GeneratorSupport.HAS_DATABASE;
import static work.forge.scaffold.generators.GeneratorSupport.baseValues;
import static work.forge.scaffold.generators.GeneratorSupport.emit;
import static work.forge.scaffold.generators.GeneratorSupport.enabled;

import java.io.IOException;
import java.util.Map;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.ActivationPredicate;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepCategory;

/**
 * pytest scaffolding for the generated project.
 */
public final class TestGenerators {
    private static final ActivationPredicate TESTING = enabled(Feature.TESTING);

    private TestGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register(GenerationStep.builder("conftest")
            .category(StepCategory.TEST)
            .priority(110)
            .requires("main")
            .activeWhen(TESTING)
            .action(TestGenerators::conftest)
            .description("Generate tests/conftest.py")
            .build());
        registry.register(GenerationStep.builder("test-main")
            .category(StepCategory.TEST)
            .priority(111)
            .requires("conftest")
            .activeWhen(TESTING)
            .action((config, writer) -> emit(writer, "tests/test_main.py", "tests/test_main.py.tmpl", config))
            .description("Generate application smoke tests")
            .build());
        registry.register(GenerationStep.builder("test-auth")
            .category(StepCategory.TEST)
            .priority(112)
            .requires("conftest", "auth-router")
            .activeWhen(TESTING.and(HAS_AUTH))
            .action((config, writer) -> emit(writer, "tests/api/test_auth.py", "tests/test_auth.py.tmpl", config))
            .description("Generate authentication tests")
            .build());
        registry.register(GenerationStep.builder("test-users")
            .category(StepCategory.TEST)
            .priority(113)
            .requires("conftest", "user-router")
            .activeWhen(TESTING.and(HAS_AUTH))
            .action((config, writer) -> emit(writer, "tests/api/test_users.py", "tests/test_users.py.tmpl", config))
            .description("Generate user endpoint tests")
            .build());
        return registry;
    }

    private static ActionResult conftest(ConfigurationFacade config, ArtifactWriter writer) throws IOException {
        boolean database = HAS_DATABASE.test(config);
        Map<String, String> values = baseValues(config);
        values.put("db_imports", database
            ? "from sqlalchemy.ext.asyncio import async_sessionmaker, create_async_engine\n\n"
                + "from app.core.database import get_db\n"
                + "from app.core.database.base import Base\n"
            : "");
        values.put("db_fixtures", database ? Templates.load("tests/conftest_database.py.tmpl") : "");
        return emit(writer, "tests/conftest.py", "tests/conftest.py.tmpl", values);
    }
}
