package ai.eigloo.workgraph.graph.model;

import java.util.Locale;

/**
 * What kind of actor an {@link Entity} represents.
 */
public enum EntityKind {
    AGENT("agent"),
    HUMAN("human"),
    SYSTEM("system");

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static EntityKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Entity kind cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + value);
    }
}
