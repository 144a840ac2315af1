package work.forge.scaffold.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.forge.scaffold.support.ForgeTestSupport.step;

import org.junit.jupiter.api.Test;

class GeneratorRegistryTest {
    @Test
    void keepsRegistrationOrder() {
        var registry = new GeneratorRegistry()
            .register(step("b", 0))
            .register(step("a", 0))
            .register(step("c", 0));

        assertEquals(3, registry.size());
        assertEquals("b", registry.all().get(0).id());
        assertEquals(0, registry.registrationIndex("b"));
        assertEquals(2, registry.registrationIndex("c"));
        assertEquals(-1, registry.registrationIndex("missing"));
        assertTrue(registry.get("a").isPresent());
        assertFalse(registry.contains("missing"));
    }

    @Test
    void rejectsDuplicateIds() {
        var registry = new GeneratorRegistry().register(step("a", 0));

        var ex = assertThrows(DuplicateStepException.class, () -> registry.register(step("a", 5)));
        assertEquals("a", ex.stepId());
        assertEquals("duplicate_step", ex.code());
        assertEquals(1, registry.size());
    }

    @Test
    void allowsForwardReferencesUntilValidated() {
        var registry = new GeneratorRegistry()
            .register(step("late", 1, "early"))
            .register(step("early", 0));

        assertEquals(registry, registry.validate());
    }

    @Test
    void validateRejectsUnknownDependency() {
        var registry = new GeneratorRegistry().register(step("a", 0, "ghost"));

        var ex = assertThrows(UnsatisfiedDependencyException.class, registry::validate);
        assertEquals("a", ex.stepId());
        assertEquals("ghost", ex.dependencyId());
        assertEquals(UnsatisfiedDependencyException.Reason.NOT_REGISTERED, ex.reason());
    }

    @Test
    void validateRejectsSelfRequirement() {
        var registry = new GeneratorRegistry().register(step("a", 0)).register(step("loop", 1, "a", "loop"));

        var ex = assertThrows(UnsatisfiedDependencyException.class, registry::validate);
        assertEquals("loop", ex.stepId());
        assertEquals("loop", ex.dependencyId());
        assertEquals(UnsatisfiedDependencyException.Reason.SELF, ex.reason());
    }

    @Test
    void registryListIsReadOnly() {
        var registry = new GeneratorRegistry().register(step("a", 0));
        assertThrows(UnsupportedOperationException.class, () -> registry.all().add(step("b", 0)));
    }
}
