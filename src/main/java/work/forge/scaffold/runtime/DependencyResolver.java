package work.forge.scaffold.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import work.forge.scaffold.config.ConfigurationFacade;

/**
 * Turns a registry and a configuration into an {@link ExecutionPlan}. Pure: evaluates
 * activation predicates and dependency metadata only, never the writer.
 *
 * <p>Ordering is a topological sort where every ready step is picked by
 * {@code (priority, registration order)}, so the same configuration always yields the same plan.
 */
public final class DependencyResolver {
    private DependencyResolver() {}

    public static ExecutionPlan resolve(GeneratorRegistry registry, ConfigurationFacade config) {
        var active = new LinkedHashMap<String, GenerationStep>();
        for (GenerationStep step : registry.all()) {
            if (step.isActive(config)) {
                active.put(step.id(), step);
            }
        }
        validateDependencies(registry, active);

        var dependents = new HashMap<String, List<GenerationStep>>();
        var pending = new HashMap<String, Integer>();
        for (GenerationStep step : active.values()) {
            pending.put(step.id(), step.requires().size());
            for (String dependency : step.requires()) {
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(step);
            }
        }

        Comparator<GenerationStep> order = Comparator
            .comparingInt(GenerationStep::priority)
            .thenComparingInt(step -> registry.registrationIndex(step.id()));
        var ready = new PriorityQueue<>(order);
        for (GenerationStep step : active.values()) {
            if (step.requires().isEmpty()) {
                ready.add(step);
            }
        }

        var ordered = new ArrayList<GenerationStep>(active.size());
        while (!ready.isEmpty()) {
            GenerationStep next = ready.poll();
            ordered.add(next);
            for (GenerationStep dependent : dependents.getOrDefault(next.id(), List.of())) {
                int remaining = pending.merge(dependent.id(), -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() < active.size()) {
            var blocked = new LinkedHashMap<String, GenerationStep>();
            for (GenerationStep step : active.values()) {
                if (pending.get(step.id()) > 0) {
                    blocked.put(step.id(), step);
                }
            }
            throw new CyclicDependencyException(findCycle(blocked));
        }
        return new ExecutionPlan(ordered);
    }

    private static void validateDependencies(GeneratorRegistry registry, Map<String, GenerationStep> active) {
        for (GenerationStep step : active.values()) {
            for (String dependency : step.requires()) {
                if (!registry.contains(dependency)) {
                    throw new UnsatisfiedDependencyException(
                        step.id(),
                        dependency,
                        UnsatisfiedDependencyException.Reason.NOT_REGISTERED
                    );
                }
                if (!active.containsKey(dependency)) {
                    throw new UnsatisfiedDependencyException(
                        step.id(),
                        dependency,
                        UnsatisfiedDependencyException.Reason.INACTIVE
                    );
                }
            }
        }
    }

    /**
     * Walks {@code requires} edges among the steps the sort could not place. Every such step
     * sits on a cycle or downstream of one, so the walk always closes a loop.
     */
    private static List<String> findCycle(Map<String, GenerationStep> blocked) {
        var state = new HashMap<String, Boolean>();
        for (String start : blocked.keySet()) {
            if (state.containsKey(start)) {
                continue;
            }
            var path = new ArrayList<String>();
            List<String> cycle = visit(start, blocked, state, path);
            if (cycle != null) {
                return cycle;
            }
        }
        return new ArrayList<>(blocked.keySet());
    }

    // state: absent = unvisited, TRUE = on the current path, FALSE = done
    private static List<String> visit(
        String id,
        Map<String, GenerationStep> blocked,
        Map<String, Boolean> state,
        List<String> path
    ) {
        state.put(id, Boolean.TRUE);
        path.add(id);
        for (String dependency : blocked.get(id).requires()) {
            if (!blocked.containsKey(dependency)) {
                continue;
            }
            Boolean seen = state.get(dependency);
            if (Boolean.TRUE.equals(seen)) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                return cycle;
            }
            if (seen == null) {
                List<String> found = visit(dependency, blocked, state, path);
                if (found != null) {
                    return found;
                }
            }
        }
        state.put(id, Boolean.FALSE);
        path.remove(path.size() - 1);
        return null;
    }
}
