package ai.eigloo.workgraph.graph.model;

import java.time.Instant;
import java.util.Set;

/**
 * An actor: agent, human or system. {@code reportsTo} forms the management tree.
 *
 * @param id The entity id
 * @param name Display name
 * @param kind Actor kind
 * @param reportsTo Manager entity id, null at the top of a chain
 * @param tags Free-form tags
 * @param createdBy Id of the creating actor
 * @param createdAt Creation time
 * @param updatedAt Last update time
 * @param deletedAt Soft-delete time, null while live
 */
public record Entity(
        String id,
        String name,
        EntityKind kind,
        String reportsTo,
        Set<String> tags,
        String createdBy,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt) implements Element {

    public Entity {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Entity id cannot be null or empty");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Entity name cannot be null or empty");
        }
        if (kind == null) {
            kind = EntityKind.AGENT;
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public static Entity of(String id, String name, EntityKind kind) {
        return new Entity(id, name, kind, null, Set.of(), id, null, null, null);
    }

    @Override
    public ElementType type() {
        return ElementType.ENTITY;
    }

    public Entity withReportsTo(String newReportsTo) {
        return new Entity(id, name, kind, newReportsTo, tags, createdBy, createdAt, Instant.now(), deletedAt);
    }

    public Entity withDeletedAt(Instant newDeletedAt) {
        return new Entity(id, name, kind, reportsTo, tags, createdBy, createdAt, Instant.now(), newDeletedAt);
    }
}
