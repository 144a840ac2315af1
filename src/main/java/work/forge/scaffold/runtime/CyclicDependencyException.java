package work.forge.scaffold.runtime;

import java.util.List;
import work.forge.scaffold.shared.GenerationException;

public final class CyclicDependencyException extends GenerationException {
    private final List<String> cycle;

    /**
     * @param cycle step ids along the cycle, first id repeated at the end
     */
    public CyclicDependencyException(List<String> cycle) {
        super("cyclic_dependency", "Cyclic step dependency: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
