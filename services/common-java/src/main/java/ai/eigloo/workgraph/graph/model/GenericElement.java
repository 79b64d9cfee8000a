package ai.eigloo.workgraph.graph.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Document, channel, message, team or library. The engine only reads the common element
 * attributes; the payload is carried through untouched.
 */
public record GenericElement(
        String id,
        ElementType type,
        Map<String, Object> payload,
        Set<String> tags,
        String createdBy,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt) implements Element {

    public GenericElement {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Element id cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Element type cannot be null");
        }
        if (type == ElementType.TASK || type == ElementType.PLAN
                || type == ElementType.WORKFLOW || type == ElementType.ENTITY) {
            throw new IllegalArgumentException("Element type " + type.value() + " has a dedicated model");
        }
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    public static GenericElement of(String id, ElementType type, String createdBy) {
        return new GenericElement(id, type, Map.of(), Set.of(), createdBy, null, null, null);
    }

    public GenericElement withDeletedAt(Instant newDeletedAt) {
        return new GenericElement(id, type, payload, tags, createdBy, createdAt, Instant.now(), newDeletedAt);
    }
}
