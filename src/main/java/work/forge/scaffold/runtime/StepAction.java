package work.forge.scaffold.runtime;

import work.forge.scaffold.config.ConfigurationFacade;
import work.forge.scaffold.io.ArtifactWriter;

/**
 * Emits the artifacts of one generation step. All writes go through {@code writer}.
 */
@FunctionalInterface
public interface StepAction {
    ActionResult apply(ConfigurationFacade config, ArtifactWriter writer) throws Exception;
}
