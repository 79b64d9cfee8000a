package ai.eigloo.workgraph.graph.model;

import java.time.Instant;
import java.util.Set;

/**
 * Common view over every addressable work item.
 *
 * <p>Elements are immutable values. Updates produce a new instance that the storage
 * collaborator saves in place of the old one.</p>
 */
public interface Element {

    String id();

    ElementType type();

    Instant createdAt();

    Instant updatedAt();

    String createdBy();

    Set<String> tags();

    /**
     * Soft-delete marker; null while the element is live.
     */
    Instant deletedAt();

    default boolean isDeleted() {
        return deletedAt() != null;
    }

    /**
     * Returns true when this element no longer holds up work that depends on it.
     * Elements without a lifecycle never block.
     */
    default boolean isResolved() {
        return true;
    }
}
