package ai.eigloo.workgraph.engine.store;

import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the typed edges between elements. Every structural change goes through
 * {@link #addDependency} or {@link #removeDependency}, which enforce uniqueness and
 * per-family acyclicity.
 *
 * <p>{@code relates-to} lookups accept either endpoint order.</p>
 */
public interface DependencyGraphStore {

    /**
     * Adds an edge.
     *
     * @param metadata type-specific metadata, may be null
     * @param actor creating actor, defaults to the source element's creator when null
     * @throws ai.eigloo.workgraph.graph.exception.GraphOperationException with
     *         {@code NOT_FOUND}, {@code DUPLICATE_DEPENDENCY}, {@code CYCLE_DETECTED} or
     *         {@code VALIDATION_ERROR}
     */
    Dependency addDependency(String sourceId, String targetId, DependencyType type,
                             Map<String, Object> metadata, String actor);

    default Dependency addDependency(String sourceId, String targetId, DependencyType type) {
        return addDependency(sourceId, targetId, type, null, null);
    }

    /**
     * Removes an edge. Container membership rules are not checked here.
     *
     * @throws ai.eigloo.workgraph.graph.exception.GraphOperationException with {@code NOT_FOUND}
     */
    void removeDependency(String sourceId, String targetId, DependencyType type, String actor);

    /**
     * Marks the external or webhook gate on an {@code awaits} edge satisfied.
     */
    Dependency satisfyGate(String sourceId, String targetId, String actor);

    /**
     * Records one approval on the approval gate of an {@code awaits} edge.
     */
    Dependency recordApproval(String sourceId, String targetId, String approverId, String actor);

    /**
     * Edges whose source is {@code elementId}, filtered to {@code types} unless it is null or empty.
     */
    List<Dependency> getOutgoing(String elementId, Set<DependencyType> types);

    default List<Dependency> getOutgoing(String elementId) {
        return getOutgoing(elementId, Set.of());
    }

    /**
     * Edges whose target is {@code elementId}, filtered to {@code types} unless it is null or empty.
     */
    List<Dependency> getIncoming(String elementId, Set<DependencyType> types);

    default List<Dependency> getIncoming(String elementId) {
        return getIncoming(elementId, Set.of());
    }

    Optional<Dependency> getDependency(String sourceId, String targetId, DependencyType type);

    default boolean exists(String sourceId, String targetId, DependencyType type) {
        return getDependency(sourceId, targetId, type).isPresent();
    }

    /**
     * {@code relates-to} edges touching {@code elementId} in either direction.
     */
    List<Dependency> getRelatedTo(String elementId);

    default int countOutgoing(String elementId, Set<DependencyType> types) {
        return getOutgoing(elementId, types).size();
    }

    default int countIncoming(String elementId, Set<DependencyType> types) {
        return getIncoming(elementId, types).size();
    }

    /**
     * Removes every edge touching {@code elementId}. Used when an element is hard-deleted.
     *
     * @return the removed edges
     */
    List<Dependency> removeAllForElement(String elementId, String actor);

    /**
     * Consistent copy of all edges, in insertion order.
     */
    List<Dependency> snapshot();

    /**
     * Rebuilds the index from the persistence collaborator.
     */
    void reload();

    int size();
}
