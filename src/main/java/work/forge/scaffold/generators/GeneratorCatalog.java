package work.forge.scaffold.generators;

import work.forge.scaffold.runtime.GeneratorRegistry;

/**
 * Shared catalogue bootstrap so the CLI, the embedding API and tests plan against the same steps.
 */
public final class GeneratorCatalog {
    private GeneratorCatalog() {}

    public static GeneratorRegistry create() {
        var registry = new GeneratorRegistry();
        BaseGenerators.register(registry);
        ConfigGenerators.register(registry);
        AppGenerators.register(registry);
        DatabaseGenerators.register(registry);
        AuthGenerators.register(registry);
        RouterGenerators.register(registry);
        DeploymentGenerators.register(registry);
        TestGenerators.register(registry);
        return registry.validate();
    }
}
