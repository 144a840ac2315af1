package work.forge.scaffold.support;

import work.forge.scaffold.config.AuthMode;
import work.forge.scaffold.config.DatabaseKind;
import work.forge.scaffold.config.MigrationTool;
import work.forge.scaffold.config.OrmKind;
import work.forge.scaffold.config.ProjectConfiguration;
import work.forge.scaffold.runtime.ActionResult;
import work.forge.scaffold.runtime.GenerationStep;
import work.forge.scaffold.runtime.StepCategory;

/**
 * Configuration fixtures and throwaway steps shared by the test suites.
 */
public final class ForgeTestSupport {
    private ForgeTestSupport() {}

    /** No database, no auth, every toggle off. */
    public static ProjectConfiguration minimal(String name) {
        return ProjectConfiguration.builder(name).build();
    }

    /** What {@code forge init} produces without options. */
    public static ProjectConfiguration defaults(String name) {
        return ProjectConfiguration.builder(name)
            .database(DatabaseKind.POSTGRESQL, OrmKind.SQLALCHEMY, MigrationTool.ALEMBIC)
            .auth(AuthMode.COMPLETE)
            .cors(true)
            .devTools(true)
            .testing(true)
            .docker(true)
            .build();
    }

    /** Step writing {@code <id>.txt} containing its id. */
    public static GenerationStep step(String id, int priority, String... requires) {
        return GenerationStep.builder(id)
            .category(StepCategory.BASE)
            .priority(priority)
            .requires(requires)
            .action((config, writer) -> {
                writer.write(id + ".txt", id);
                return ActionResult.done();
            })
            .build();
    }
}
