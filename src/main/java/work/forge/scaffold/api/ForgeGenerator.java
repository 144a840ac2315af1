package work.forge.scaffold.api;

import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.generators.GeneratorCatalog;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.io.FileSystemArtifactWriter;
import work.forge.scaffold.io.InMemoryArtifactWriter;
import work.forge.scaffold.runtime.DependencyResolver;
import work.forge.scaffold.runtime.ExecutionEngine;
import work.forge.scaffold.runtime.ExecutionPlan;
import work.forge.scaffold.runtime.ExecutionReport;
import work.forge.scaffold.runtime.GeneratorRegistry;
import work.forge.scaffold.runtime.StepExecutionException;

/**
 * Public entry point for embedding the generator.
 *
 * <p>Planning failures ({@code CyclicDependencyException}, {@code UnsatisfiedDependencyException})
 * propagate before anything is written. Artifact conflicts are folded into the returned report;
 * any other step failure aborts the run with a {@link StepExecutionException} whose report lists
 * what was already written.
 */
public final class ForgeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ForgeGenerator.class);

    private final GeneratorRegistry registry;

    public ForgeGenerator() {
        this(GeneratorCatalog.create());
    }

    public ForgeGenerator(GeneratorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public GeneratorRegistry registry() {
        return registry;
    }

    public ExecutionPlan plan(ConfigurationFacade config) {
        return DependencyResolver.resolve(registry, config);
    }

    public ExecutionReport generate(ConfigurationFacade config, Path destinationRoot, GenerateOptions options) {
        ArtifactWriter writer = options.dryRun()
            ? new InMemoryArtifactWriter(options.overwrite())
            : new FileSystemArtifactWriter(destinationRoot, options.overwrite());
        return generate(config, writer, options);
    }

    /**
     * Runs against a caller-supplied writer; the writer's own overwrite policy applies.
     *
     * @throws StepExecutionException when a step fails for a reason other than a conflict
     */
    public ExecutionReport generate(ConfigurationFacade config, ArtifactWriter writer, GenerateOptions options) {
        var plan = plan(config);
        if (!options.categories().isEmpty()) {
            plan = plan.restrictTo(options.categories());
        }
        log.info("Generating '{}' with {} step(s)", config.projectName(), plan.size());
        return new ExecutionEngine(options.cancellationToken()).execute(plan, config, writer);
    }
}
