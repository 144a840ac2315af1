package work.forge.scaffold.runtime;

import work.forge.scaffold.config.ConfigurationFacade;

/**
 * Pure predicate deciding whether a step takes part in a plan.
 */
@FunctionalInterface
public interface ActivationPredicate {
    boolean test(ConfigurationFacade config);

    default ActivationPredicate and(ActivationPredicate other) {
        return config -> test(config) && other.test(config);
    }

    static ActivationPredicate always() {
        return config -> true;
    }
}
