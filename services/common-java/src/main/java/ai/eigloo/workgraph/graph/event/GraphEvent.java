package ai.eigloo.workgraph.graph.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit record of a committed graph mutation.
 *
 * @param elementId The element the event is about
 * @param eventType What happened
 * @param actor Who did it
 * @param oldValue State before the change, may be null
 * @param newValue State after the change, may be null
 * @param createdAt When it happened
 */
public record GraphEvent(
        String elementId,
        GraphEventType eventType,
        String actor,
        Map<String, Object> oldValue,
        Map<String, Object> newValue,
        Instant createdAt) {

    public GraphEvent {
        if (elementId == null || elementId.trim().isEmpty()) {
            throw new IllegalArgumentException("Event element id cannot be null or empty");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        oldValue = oldValue == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(oldValue));
        newValue = newValue == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(newValue));
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static GraphEvent of(String elementId, GraphEventType eventType, String actor,
                                Map<String, Object> oldValue, Map<String, Object> newValue) {
        return new GraphEvent(elementId, eventType, actor, oldValue, newValue, Instant.now());
    }
}
