package com.z254.butterfly.scout.orchestration;

import com.z254.butterfly.scout.domain.model.AgentDescriptor;
import com.z254.butterfly.scout.exception.OrchestrationSetupException;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Predecessor graph of a run plan, validated on construction.
 * <p>
 * Rejects empty plans, duplicate or blank names, unknown predecessors, self-dependencies
 * and cycles. Validation happens before any task runs.
 */
@Slf4j
public final class DependencyGraph {

    private final Map<String, AgentDescriptor> agents;
    private final Map<String, Set<String>> dependents;
    private final List<String> topologicalOrder;

    private DependencyGraph(Map<String, AgentDescriptor> agents,
                            Map<String, Set<String>> dependents,
                            List<String> topologicalOrder) {
        this.agents = agents;
        this.dependents = dependents;
        this.topologicalOrder = topologicalOrder;
    }

    public static DependencyGraph build(List<AgentDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            throw new OrchestrationSetupException("Run plan has no agents");
        }

        // Step 1: index by name
        Map<String, AgentDescriptor> agents = new LinkedHashMap<>();
        for (AgentDescriptor descriptor : descriptors) {
            String name = descriptor.getName();
            if (name == null || name.isBlank()) {
                throw new OrchestrationSetupException("Agent name is required");
            }
            if (descriptor.getTask() == null) {
                throw new OrchestrationSetupException("Agent " + name + " has no task",
                        Map.of("agent", name));
            }
            if (agents.putIfAbsent(name, descriptor) != null) {
                throw new OrchestrationSetupException("Duplicate agent name: " + name,
                        Map.of("agent", name));
            }
        }

        // Step 2: resolve predecessor edges
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        agents.keySet().forEach(name -> {
            dependents.put(name, new LinkedHashSet<>());
            inDegree.put(name, 0);
        });
        for (AgentDescriptor descriptor : agents.values()) {
            for (String predecessor : new LinkedHashSet<>(descriptor.getPredecessors())) {
                if (predecessor.equals(descriptor.getName())) {
                    throw new OrchestrationSetupException("Agent " + predecessor + " depends on itself",
                            Map.of("agent", predecessor));
                }
                if (!agents.containsKey(predecessor)) {
                    throw new OrchestrationSetupException(
                            "Agent " + descriptor.getName() + " depends on unknown agent " + predecessor,
                            Map.of("agent", descriptor.getName(), "predecessor", predecessor));
                }
                dependents.get(predecessor).add(descriptor.getName());
                inDegree.merge(descriptor.getName(), 1, Integer::sum);
            }
        }

        // Step 3: Kahn's algorithm, plan order breaks ties
        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                queue.add(name);
            }
        });
        List<String> order = new ArrayList<>(agents.size());
        while (!queue.isEmpty()) {
            String name = queue.poll();
            order.add(name);
            for (String dependent : dependents.get(name)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (order.size() < agents.size()) {
            List<String> cycle = findCycle(agents, inDegree);
            throw new OrchestrationSetupException("Dependency cycle: " + String.join(" -> ", cycle),
                    Map.of("cycle", cycle));
        }

        log.debug("Built dependency graph: agents={}, order={}", agents.size(), order);
        return new DependencyGraph(Collections.unmodifiableMap(agents), dependents, List.copyOf(order));
    }

    /**
     * Walk predecessor edges among the agents Kahn's algorithm could not order until a name
     * repeats.
     */
    private static List<String> findCycle(Map<String, AgentDescriptor> agents, Map<String, Integer> inDegree) {
        String start = inDegree.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow();
        List<String> path = new ArrayList<>();
        Map<String, Integer> seenAt = new HashMap<>();
        String current = start;
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, path.size());
            path.add(current);
            current = agents.get(current).getPredecessors().stream()
                    .filter(p -> inDegree.get(p) > 0)
                    .findFirst()
                    .orElseThrow();
        }
        List<String> cycle = new ArrayList<>(path.subList(seenAt.get(current), path.size()));
        Collections.reverse(cycle);
        cycle.add(cycle.get(0));
        return cycle;
    }

    public Collection<AgentDescriptor> getAgents() {
        return agents.values();
    }

    public AgentDescriptor getAgent(String name) {
        return agents.get(name);
    }

    public Set<String> getNames() {
        return agents.keySet();
    }

    /**
     * Agents that declare the given agent as a predecessor.
     */
    public Set<String> getDependents(String name) {
        return Collections.unmodifiableSet(dependents.getOrDefault(name, Set.of()));
    }

    /**
     * Every agent after all of its predecessors; ties keep plan order.
     */
    public List<String> getTopologicalOrder() {
        return topologicalOrder;
    }

    public int size() {
        return agents.size();
    }
}
