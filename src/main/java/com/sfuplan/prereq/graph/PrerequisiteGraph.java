package com.sfuplan.prereq.graph;

import com.sfuplan.prereq.domain.DomainModels.PrerequisiteEntry;
import com.sfuplan.prereq.domain.PrerequisiteTrees;
import com.sfuplan.prereq.graph.PrerequisiteGraphModels.GraphEdge;
import com.sfuplan.prereq.graph.PrerequisiteGraphModels.GraphValidationIssue;

import java.util.*;

/**
 * Course dependency graph of one catalog snapshot. An edge {@code P -> C} means P appears as a
 * course leaf in C's requirement tree.
 * <p>
 * Immutable once built. Catalog data may contain cycles; every traversal keeps a visited set.
 */
public final class PrerequisiteGraph {
    private final Map<String, Set<String>> dependents;
    private final Map<String, Set<String>> prerequisites;
    private final Set<String> catalogIds;
    private final int edgeCount;

    private PrerequisiteGraph(Map<String, Set<String>> dependents,
                              Map<String, Set<String>> prerequisites,
                              Set<String> catalogIds,
                              int edgeCount) {
        this.dependents = dependents;
        this.prerequisites = prerequisites;
        this.catalogIds = catalogIds;
        this.edgeCount = edgeCount;
    }

    public static PrerequisiteGraph build(Collection<PrerequisiteEntry> entries) {
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        Map<String, Set<String>> prerequisites = new LinkedHashMap<>();
        Set<String> catalogIds = new HashSet<>();
        int edges = 0;

        for (PrerequisiteEntry entry : entries) {
            catalogIds.add(entry.courseId());
            if (entry.tree() == null) continue;

            addNode(entry.courseId(), dependents, prerequisites);
            for (String prerequisite : PrerequisiteTrees.flatten(entry.tree())) {
                addNode(prerequisite, dependents, prerequisites);
                if (dependents.get(prerequisite).add(entry.courseId())) {
                    prerequisites.get(entry.courseId()).add(prerequisite);
                    edges++;
                }
            }
        }
        return new PrerequisiteGraph(freeze(dependents), freeze(prerequisites), Set.copyOf(catalogIds), edges);
    }

    public List<String> prerequisiteChain(String courseId) {
        return reachable(courseId, prerequisites);
    }

    public List<String> unlockedBy(String courseId) {
        return reachable(courseId, dependents);
    }

    public boolean contains(String courseId) {
        return dependents.containsKey(courseId);
    }

    public Set<String> nodes() {
        return dependents.keySet();
    }

    public List<GraphEdge> edges() {
        List<GraphEdge> edges = new ArrayList<>();
        dependents.forEach((from, targets) -> targets.forEach(to -> edges.add(new GraphEdge(from, to))));
        return edges;
    }

    public int nodeCount() {
        return dependents.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public List<GraphValidationIssue> validate() {
        List<GraphValidationIssue> issues = new ArrayList<>();

        nodes().stream()
                .filter(node -> !catalogIds.contains(node))
                .sorted()
                .forEach(node -> issues.add(new GraphValidationIssue("UNKNOWN_PREREQUISITE",
                        "Prerequisite references a course missing from the catalog", node)));

        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String node : nodes()) {
            if (hasCycle(node, visiting, visited)) {
                issues.add(new GraphValidationIssue("CYCLE_DETECTED", "Cycle detected in prerequisite graph", node));
                break;
            }
        }
        return issues;
    }

    private List<String> reachable(String start, Map<String, Set<String>> adjacency) {
        if (start == null || !adjacency.containsKey(start)) return List.of();

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            for (String next : adjacency.getOrDefault(queue.poll(), Set.of())) {
                if (visited.add(next)) queue.add(next);
            }
        }
        visited.remove(start);
        return visited.stream().sorted().toList();
    }

    private boolean hasCycle(String node, Set<String> visiting, Set<String> visited) {
        if (visited.contains(node)) return false;
        if (visiting.contains(node)) return true;

        visiting.add(node);
        for (String next : dependents.getOrDefault(node, Set.of())) {
            if (hasCycle(next, visiting, visited)) return true;
        }
        visiting.remove(node);
        visited.add(node);
        return false;
    }

    private static void addNode(String id, Map<String, Set<String>> dependents, Map<String, Set<String>> prerequisites) {
        dependents.computeIfAbsent(id, k -> new LinkedHashSet<>());
        prerequisites.computeIfAbsent(id, k -> new LinkedHashSet<>());
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        adjacency.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return Collections.unmodifiableMap(frozen);
    }
}
