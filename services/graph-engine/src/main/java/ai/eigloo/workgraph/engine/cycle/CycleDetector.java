package ai.eigloo.workgraph.engine.cycle;

import ai.eigloo.workgraph.graph.model.AcyclicityFamily;
import ai.eigloo.workgraph.graph.model.Dependency;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Reachability checks used before any mutation that must keep a structure acyclic.
 *
 * <p>All methods are pure and may be called speculatively. Each check is a breadth-first
 * search, O(V+E) in the edges of the family.</p>
 */
public final class CycleDetector {

    private CycleDetector() {
    }

    /**
     * Returns true when adding {@code source -> target} to {@code edges} would close a cycle
     * within {@code family}. Edges of other families are ignored. A self-loop is always a cycle.
     */
    public static boolean wouldCreateCycle(Collection<Dependency> edges, AcyclicityFamily family,
                                           String source, String target) {
        if (source.equals(target)) {
            return true;
        }
        Map<String, List<String>> successors = new HashMap<>();
        for (Dependency edge : edges) {
            if (edge.type().family() == family) {
                successors.computeIfAbsent(edge.sourceId(), key -> new ArrayList<>()).add(edge.targetId());
            }
        }
        return wouldCreateCycle(id -> successors.getOrDefault(id, List.of()), source, target);
    }

    /**
     * Same check over an adjacency function, so an index can be searched in place.
     *
     * @param successors returns the ids directly reachable from an id, already restricted to one family
     */
    public static boolean wouldCreateCycle(Function<String, ? extends Collection<String>> successors,
                                           String source, String target) {
        if (source.equals(target)) {
            return true;
        }
        return isReachable(successors, target, source);
    }

    /**
     * Returns true when {@code to} can be reached from {@code from} by following {@code successors}.
     */
    public static boolean isReachable(Function<String, ? extends Collection<String>> successors,
                                      String from, String to) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        visited.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(to)) {
                return true;
            }
            for (String next : successors.apply(current)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }

    /**
     * Finds a directed cycle among the edges of one family.
     *
     * @return the ids along the cycle, first id repeated at the end, or empty when acyclic
     */
    public static Optional<List<String>> findCycle(Collection<Dependency> edges, AcyclicityFamily family) {
        Map<String, List<String>> successors = new LinkedHashMap<>();
        for (Dependency edge : edges) {
            if (edge.type().family() == family) {
                successors.computeIfAbsent(edge.sourceId(), key -> new ArrayList<>()).add(edge.targetId());
                successors.computeIfAbsent(edge.targetId(), key -> new ArrayList<>());
            }
        }

        // iterative DFS with white/grey/black colouring
        Map<String, Integer> state = new HashMap<>();
        Map<String, String> parent = new HashMap<>();
        for (String start : successors.keySet()) {
            if (state.containsKey(start)) {
                continue;
            }
            Deque<Iterator<String>> stack = new ArrayDeque<>();
            Deque<String> path = new ArrayDeque<>();
            state.put(start, 1);
            path.push(start);
            stack.push(successors.get(start).iterator());
            while (!stack.isEmpty()) {
                Iterator<String> children = stack.peek();
                String current = path.peek();
                if (!children.hasNext()) {
                    state.put(current, 2);
                    stack.pop();
                    path.pop();
                    continue;
                }
                String next = children.next();
                Integer nextState = state.get(next);
                if (nextState == null) {
                    state.put(next, 1);
                    parent.put(next, current);
                    path.push(next);
                    stack.push(successors.get(next).iterator());
                } else if (nextState == 1) {
                    List<String> cycle = new ArrayList<>();
                    cycle.add(next);
                    for (String node = current; !node.equals(next); node = parent.get(node)) {
                        cycle.add(node);
                    }
                    cycle.add(next);
                    Collections.reverse(cycle);
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns true when making {@code proposedManagerId} the manager of {@code entityId} would
     * form a reporting cycle: walking up from the proposed manager reaches the entity.
     *
     * @param reportsTo returns an entity's manager id, or null at the top of a chain
     * @param maxDepth bound on the walk; an already cyclic stored chain stops here
     */
    public static boolean wouldCreateReportingCycle(String entityId, String proposedManagerId,
                                                    Function<String, String> reportsTo, int maxDepth) {
        if (entityId.equals(proposedManagerId)) {
            return true;
        }
        Set<String> visited = new HashSet<>();
        String current = proposedManagerId;
        int hops = 0;
        while (current != null && hops < maxDepth) {
            if (current.equals(entityId)) {
                return true;
            }
            if (!visited.add(current)) {
                return false;
            }
            current = reportsTo.apply(current);
            hops++;
        }
        return false;
    }
}
