package ai.eigloo.workgraph.graph.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, typed edge between two elements.
 *
 * @param sourceId The source element id
 * @param targetId The target element id
 * @param type The dependency type
 * @param metadata Type-specific metadata, for example awaits gate settings
 * @param createdBy Id of the actor that created the edge
 * @param createdAt Creation time
 */
public record Dependency(
        String sourceId,
        String targetId,
        DependencyType type,
        Map<String, Object> metadata,
        String createdBy,
        Instant createdAt) {

    public Dependency {
        if (sourceId == null || sourceId.trim().isEmpty()) {
            throw new IllegalArgumentException("Source id cannot be null or empty");
        }
        if (targetId == null || targetId.trim().isEmpty()) {
            throw new IllegalArgumentException("Target id cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Dependency type cannot be null");
        }
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static Dependency of(String sourceId, String targetId, DependencyType type, String createdBy) {
        return new Dependency(sourceId, targetId, type, Map.of(), createdBy, null);
    }

    public DependencyKey key() {
        return new DependencyKey(sourceId, targetId, type);
    }
}
