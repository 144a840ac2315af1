package work.forge.scaffold.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.forge.scaffold.support.ForgeTestSupport.minimal;
import static work.forge.scaffold.support.ForgeTestSupport.step;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.forge.scaffold.config.Feature;
import work.forge.scaffold.runtime.UnsatisfiedDependencyException.Reason;

class DependencyResolverTest {
    @Test
    void ordersByPriorityThenRegistration() {
        var registry = new GeneratorRegistry()
            .register(step("c", 5))
            .register(step("a", 1))
            .register(step("b", 1));

        var plan = DependencyResolver.resolve(registry, minimal("demo"));
        assertEquals(List.of("a", "b", "c"), plan.ids());
    }

    @Test
    void dependenciesWinOverPriority() {
        var registry = new GeneratorRegistry()
            .register(step("app", 0, "settings"))
            .register(step("settings", 50))
            .register(step("readme", 10));

        var plan = DependencyResolver.resolve(registry, minimal("demo"));
        assertEquals(List.of("readme", "settings", "app"), plan.ids());
    }

    @Test
    void sameInputsGiveSamePlan() {
        var registry = new GeneratorRegistry()
            .register(step("x", 3))
            .register(step("y", 3, "x"))
            .register(step("z", 1))
            .register(step("w", 2, "z"));

        var first = DependencyResolver.resolve(registry, minimal("demo"));
        for (int i = 0; i < 10; i++) {
            assertEquals(first.ids(), DependencyResolver.resolve(registry, minimal("demo")).ids());
        }
    }

    @Test
    void inactiveStepsAreLeftOut() {
        var registry = new GeneratorRegistry()
            .register(step("always", 0))
            .register(GenerationStep.builder("docker-only")
                .activeWhen(cfg -> cfg.isEnabled(Feature.DOCKER))
                .action((cfg, writer) -> ActionResult.done())
                .build());

        var plan = DependencyResolver.resolve(registry, minimal("demo"));
        assertEquals(List.of("always"), plan.ids());
        assertFalse(plan.contains("docker-only"));
    }

    @Test
    void requiringAnInactiveStepFails() {
        var registry = new GeneratorRegistry()
            .register(GenerationStep.builder("db")
                .activeWhen(cfg -> cfg.isEnabled(Feature.DATABASE))
                .action((cfg, writer) -> ActionResult.done())
                .build())
            .register(step("auth", 1, "db"));

        var ex = assertThrows(
            UnsatisfiedDependencyException.class,
            () -> DependencyResolver.resolve(registry, minimal("demo"))
        );
        assertEquals("auth", ex.stepId());
        assertEquals("db", ex.dependencyId());
        assertEquals(Reason.INACTIVE, ex.reason());
    }

    @Test
    void requiringAnUnknownStepFails() {
        var registry = new GeneratorRegistry().register(step("a", 0, "ghost"));

        var ex = assertThrows(
            UnsatisfiedDependencyException.class,
            () -> DependencyResolver.resolve(registry, minimal("demo"))
        );
        assertEquals(Reason.NOT_REGISTERED, ex.reason());
    }

    @Test
    void reportsCycleMembers() {
        var registry = new GeneratorRegistry()
            .register(step("root", 0))
            .register(step("a", 1, "b"))
            .register(step("b", 2, "a"))
            .register(step("downstream", 3, "a"));

        var ex = assertThrows(
            CyclicDependencyException.class,
            () -> DependencyResolver.resolve(registry, minimal("demo"))
        );
        assertEquals("cyclic_dependency", ex.code());
        assertEquals(List.of("a", "b", "a"), ex.cycle());
        assertTrue(ex.getMessage().contains("a -> b -> a"));
    }

    @Test
    void everyDependencyPrecedesItsDependent() {
        var registry = new GeneratorRegistry()
            .register(step("e", 0, "d"))
            .register(step("d", 0, "b", "c"))
            .register(step("c", 9, "a"))
            .register(step("b", 1, "a"))
            .register(step("a", 7));

        var plan = DependencyResolver.resolve(registry, minimal("demo"));
        for (GenerationStep step : plan.steps()) {
            for (String dependency : step.requires()) {
                assertTrue(plan.indexOf(dependency) < plan.indexOf(step.id()), dependency + " before " + step.id());
            }
        }
        assertEquals(List.of("a", "b", "c", "d", "e"), plan.ids());
    }

    @Test
    void restrictToKeepsPlanOrder() {
        var registry = new GeneratorRegistry()
            .register(step("base", 0))
            .register(GenerationStep.builder("docs")
                .category(StepCategory.DOCS)
                .priority(1)
                .action((cfg, writer) -> ActionResult.done())
                .build());

        var plan = DependencyResolver.resolve(registry, minimal("demo"))
            .restrictTo(Set.of(StepCategory.DOCS));
        assertEquals(List.of("docs"), plan.ids());
    }
}
