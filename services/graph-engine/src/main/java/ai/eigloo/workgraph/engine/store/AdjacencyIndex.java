package ai.eigloo.workgraph.engine.store;

import ai.eigloo.workgraph.graph.model.AcyclicityFamily;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory adjacency lists keyed by element id. Not thread-safe; the owning store guards it.
 * Edge lists keep insertion order.
 */
final class AdjacencyIndex {

    private final Map<DependencyKey, Dependency> edges = new LinkedHashMap<>();
    private final Map<String, List<Dependency>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<Dependency>> incoming = new LinkedHashMap<>();

    Dependency get(DependencyKey key) {
        return edges.get(key);
    }

    boolean contains(DependencyKey key) {
        return edges.containsKey(key);
    }

    void add(Dependency dependency) {
        edges.put(dependency.key(), dependency);
        outgoing.computeIfAbsent(dependency.sourceId(), id -> new ArrayList<>()).add(dependency);
        incoming.computeIfAbsent(dependency.targetId(), id -> new ArrayList<>()).add(dependency);
    }

    /**
     * Swaps an indexed edge for a copy with the same key, keeping its position.
     */
    void replace(Dependency dependency) {
        DependencyKey key = dependency.key();
        if (edges.replace(key, dependency) == null) {
            throw new IllegalStateException("Edge not indexed: " + key);
        }
        replaceIn(outgoing.get(dependency.sourceId()), dependency);
        replaceIn(incoming.get(dependency.targetId()), dependency);
    }

    Dependency remove(DependencyKey key) {
        Dependency removed = edges.remove(key);
        if (removed != null) {
            removeFrom(outgoing, removed.sourceId(), key);
            removeFrom(incoming, removed.targetId(), key);
        }
        return removed;
    }

    List<Dependency> outgoing(String elementId) {
        return outgoing.getOrDefault(elementId, List.of());
    }

    List<Dependency> incoming(String elementId) {
        return incoming.getOrDefault(elementId, List.of());
    }

    /**
     * Ids reachable in one step from {@code elementId} over edges of {@code family}.
     */
    List<String> successors(String elementId, AcyclicityFamily family) {
        List<String> result = new ArrayList<>();
        for (Dependency edge : outgoing(elementId)) {
            if (edge.type().family() == family) {
                result.add(edge.targetId());
            }
        }
        return result;
    }

    Collection<Dependency> all() {
        return edges.values();
    }

    int size() {
        return edges.size();
    }

    void clear() {
        edges.clear();
        outgoing.clear();
        incoming.clear();
    }

    private static void replaceIn(List<Dependency> list, Dependency dependency) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).key().equals(dependency.key())) {
                list.set(i, dependency);
                return;
            }
        }
    }

    private static void removeFrom(Map<String, List<Dependency>> lists, String elementId, DependencyKey key) {
        List<Dependency> list = lists.get(elementId);
        if (list == null) {
            return;
        }
        list.removeIf(edge -> edge.key().equals(key));
        if (list.isEmpty()) {
            lists.remove(elementId);
        }
    }
}
