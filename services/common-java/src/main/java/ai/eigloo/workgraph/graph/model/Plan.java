package ai.eigloo.workgraph.graph.model;

import java.time.Instant;
import java.util.Set;

/**
 * An ordered collection of tasks. Membership is held in {@code parent-child} edges
 * from each task to the plan, never in the plan itself.
 *
 * @param id The plan id
 * @param title Human-readable title
 * @param status Lifecycle status
 * @param tags Free-form tags
 * @param createdBy Id of the creating actor
 * @param createdAt Creation time
 * @param updatedAt Last update time
 * @param deletedAt Soft-delete time, null while live
 */
public record Plan(
        String id,
        String title,
        PlanStatus status,
        Set<String> tags,
        String createdBy,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt) implements Element {

    public Plan {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Plan id cannot be null or empty");
        }
        if (title == null || title.trim().isEmpty()) {
            throw new IllegalArgumentException("Plan title cannot be null or empty");
        }
        if (status == null) {
            status = PlanStatus.DRAFT;
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public static Plan draft(String id, String title, String createdBy) {
        return new Plan(id, title, PlanStatus.DRAFT, Set.of(), createdBy, null, null, null);
    }

    @Override
    public ElementType type() {
        return ElementType.PLAN;
    }

    @Override
    public boolean isResolved() {
        return status.isTerminal();
    }

    public Plan withStatus(PlanStatus newStatus) {
        return new Plan(id, title, newStatus, tags, createdBy, createdAt, Instant.now(), deletedAt);
    }

    public Plan withDeletedAt(Instant newDeletedAt) {
        return new Plan(id, title, status, tags, createdBy, createdAt, Instant.now(), newDeletedAt);
    }
}
