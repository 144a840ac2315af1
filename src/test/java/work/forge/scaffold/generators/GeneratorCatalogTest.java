package work.forge.scaffold.generators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.forge.scaffold.support.ForgeTestSupport.defaults;
import static work.forge.scaffold.support.ForgeTestSupport.minimal;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import work.forge.scaffold.config.AuthMode;
import work.forge.scaffold.config.DatabaseKind;
import work.forge.scaffold.config.MigrationTool;
import work.forge.scaffold.config.OrmKind;
import work.forge.scaffold.config.ProjectConfiguration;
import work.forge.scaffold.io.InMemoryArtifactWriter;
import work.forge.scaffold.runtime.DependencyResolver;
import work.forge.scaffold.runtime.ExecutionEngine;
import work.forge.scaffold.runtime.ExecutionPlan;
import work.forge.scaffold.runtime.ExecutionReport;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepCategory;
import work.forge.scaffold.runtime.StepStatus;
import work.forge.scaffold.runtime.UnsatisfiedDependencyException;

class GeneratorCatalogTest {
    private static final Pattern UNFILLED = Pattern.compile("\\{\\{[a-z][a-z0-9_]*\\}\\}");

    private final GeneratorRegistry registry = GeneratorCatalog.create();

    @Test
    void registersEveryStepOnce() {
        assertEquals(42, registry.size());
    }

    @Test
    void apiOnlyProjectHasNoDatabaseOrAuthSteps() {
        var plan = DependencyResolver.resolve(registry, minimal("edge"));

        assertEquals(
            List.of(
                "structure", "pyproject", "readme", "gitignore", "env", "response-utils",
                "config-base", "config-app", "config-logger", "logger-manager", "config-settings", "main"
            ),
            plan.ids()
        );
    }

    @Test
    void apiOnlyProjectWithDockerAddsDeploymentSteps() {
        var config = minimal("edge").toBuilder().docker(true).build();
        var plan = DependencyResolver.resolve(registry, config);

        assertTrue(plan.contains("dockerfile"));
        assertTrue(plan.indexOf("main") < plan.indexOf("dockerfile"));
        assertFalse(plan.contains("database-connection"));
        assertFalse(plan.contains("security"));
    }

    @Test
    void completeAuthOrdersPersistenceAuthRoutesDeployment() {
        var plan = DependencyResolver.resolve(registry, defaults("shop"));

        assertEquals(41, plan.size());
        assertTrue(plan.indexOf("database-connection") < plan.indexOf("security"));
        assertTrue(plan.indexOf("auth-service") < plan.indexOf("auth-router"));
        assertTrue(plan.indexOf("api-v1") < plan.indexOf("main"));
        assertTrue(plan.indexOf("main") < plan.indexOf("dockerfile"));
        assertTrue(plan.contains("email-service"));
        assertTrue(plan.contains("email-template"));
        assertTrue(plan.contains("database-postgresql"));
        assertFalse(plan.contains("database-mysql"));
        assertRequirementsPrecede(plan);
        assertCategoryPrecedes(plan, StepCategory.DATABASE, StepCategory.AUTH);
        assertCategoryPrecedes(plan, StepCategory.AUTH, StepCategory.ROUTER);
        assertCategoryPrecedes(plan, StepCategory.ROUTER, StepCategory.DEPLOYMENT);
    }

    @Test
    void databaseWithoutAuthSkipsSessionDependency() {
        var config = ProjectConfiguration.builder("catalog")
            .database(DatabaseKind.POSTGRESQL, OrmKind.SQLALCHEMY, MigrationTool.ALEMBIC)
            .build();
        var writer = new InMemoryArtifactWriter();

        var report = new ExecutionEngine().execute(DependencyResolver.resolve(registry, config), config, writer);

        assertEquals(ExecutionReport.Status.SUCCESS, report.status());
        var outcome = report.outcome("database-dependencies").orElseThrow();
        assertEquals(StepStatus.SKIPPED, outcome.status());
        assertEquals("no authenticated routes", outcome.detail().orElseThrow());
        assertTrue(report.succeeded().contains("alembic"));
        assertFalse(writer.content("app/core/database/dependencies.py").isPresent());
        assertTrue(writer.content("app/core/database/connection.py").isPresent());
    }

    @Test
    void existingAlembicEnvironmentIsLeftAlone() {
        var config = defaults("shop-api");
        var writer = new InMemoryArtifactWriter();
        writer.write("alembic/env.py", "# tuned by hand");

        var report = new ExecutionEngine().execute(DependencyResolver.resolve(registry, config), config, writer);

        assertEquals(ExecutionReport.Status.SUCCESS, report.status());
        var outcome = report.outcome("alembic").orElseThrow();
        assertEquals(StepStatus.SKIPPED, outcome.status());
        assertEquals("already initialized", outcome.detail().orElseThrow());
        assertEquals("# tuned by hand", writer.content("alembic/env.py").orElseThrow());
        assertFalse(writer.content("alembic.ini").isPresent());
        assertEquals(StepStatus.SUCCEEDED, report.outcome("security").orElseThrow().status());
        assertTrue(writer.content("app/core/database/dependencies.py").isPresent());
    }

    @Test
    void authWithoutDatabaseCannotBePlanned() {
        var config = ProjectConfiguration.builder("broken").auth(AuthMode.COMPLETE).build();

        var ex = assertThrows(UnsatisfiedDependencyException.class, () -> DependencyResolver.resolve(registry, config));
        assertEquals("security", ex.stepId());
        assertEquals("database-dependencies", ex.dependencyId());
        assertEquals(UnsatisfiedDependencyException.Reason.INACTIVE, ex.reason());
    }

    @Test
    void basicAuthOnMySqlLeavesOutTokenFlows() {
        var config = ProjectConfiguration.builder("blog")
            .database(DatabaseKind.MYSQL, OrmKind.SQLMODEL, null)
            .auth(AuthMode.BASIC)
            .testing(true)
            .build();

        var plan = DependencyResolver.resolve(registry, config);

        assertTrue(plan.contains("database-mysql"));
        assertTrue(plan.contains("test-auth"));
        assertFalse(plan.contains("alembic"));
        assertFalse(plan.contains("token-crud"));
        assertFalse(plan.contains("email-service"));
        assertRequirementsPrecede(plan);
    }

    @Test
    void generatedFilesHaveNoUnfilledPlaceholders() {
        for (ProjectConfiguration config : List.of(
            minimal("edge"),
            defaults("shop-api"),
            ProjectConfiguration.builder("blog")
                .database(DatabaseKind.MYSQL, OrmKind.SQLMODEL, null)
                .auth(AuthMode.BASIC)
                .cors(true)
                .testing(true)
                .docker(true)
                .build()
        )) {
            var writer = new InMemoryArtifactWriter();
            var report = new ExecutionEngine().execute(DependencyResolver.resolve(registry, config), config, writer);

            assertEquals(ExecutionReport.Status.SUCCESS, report.status(), config.projectName());
            for (Map.Entry<String, String> file : writer.files().entrySet()) {
                assertFalse(UNFILLED.matcher(file.getValue()).find(), file.getKey() + " of " + config.projectName());
            }
        }
    }

    @Test
    void completeAuthProjectLayout() {
        var config = defaults("shop-api");
        var writer = new InMemoryArtifactWriter();
        new ExecutionEngine().execute(DependencyResolver.resolve(registry, config), config, writer);

        for (String path : List.of(
            "app/__init__.py",
            "app/main.py",
            "app/core/config/settings.py",
            "app/core/database/postgresql_manager.py",
            "app/models/token.py",
            "app/services/email.py",
            "app/templates/email/verification.html",
            "app/routers/v1/__init__.py",
            "alembic/env.py",
            "tests/api/test_users.py",
            "docker-compose.yml",
            ".env.example"
        )) {
            assertTrue(writer.content(path).isPresent(), path);
        }
        var main = writer.content("app/main.py").orElseThrow();
        assertTrue(main.contains("app.include_router(api_router)"));
        assertTrue(main.contains("CORSMiddleware"));
        assertTrue(writer.content("app/core/security.py").orElseThrow().contains("def create_refresh_token"));
        assertTrue(writer.content("app/templates/email/verification.html").orElseThrow().contains("{{ token }}"));
        assertTrue(writer.content("app/core/config/modules/__init__.py").orElseThrow().contains("from .email import EmailSettings"));
    }

    @Test
    void apiOnlyMainHasNoRouterOrDatabaseWiring() {
        var config = minimal("edge");
        var writer = new InMemoryArtifactWriter();
        new ExecutionEngine().execute(DependencyResolver.resolve(registry, config), config, writer);

        var main = writer.content("app/main.py").orElseThrow();
        assertFalse(main.contains("api_router"));
        assertFalse(main.contains("db_manager"));
        assertFalse(writer.content("app/core/database/__init__.py").isPresent());
    }

    private static void assertCategoryPrecedes(ExecutionPlan plan, StepCategory earlier, StepCategory later) {
        int lastEarlier = -1;
        int firstLater = Integer.MAX_VALUE;
        for (int index = 0; index < plan.size(); index++) {
            StepCategory category = plan.steps().get(index).category();
            if (category == earlier) {
                lastEarlier = index;
            } else if (category == later && firstLater == Integer.MAX_VALUE) {
                firstLater = index;
            }
        }
        assertTrue(lastEarlier >= 0, "no " + earlier + " step");
        assertTrue(firstLater < Integer.MAX_VALUE, "no " + later + " step");
        assertTrue(lastEarlier < firstLater, earlier + " before " + later);
    }

    private static void assertRequirementsPrecede(ExecutionPlan plan) {
        for (GenerationStep step : plan.steps()) {
            for (String dependency : step.requires()) {
                assertTrue(plan.indexOf(dependency) < plan.indexOf(step.id()), dependency + " before " + step.id());
            }
        }
    }
}
