package ai.eigloo.workgraph.graph.model;

import java.util.Locale;

/**
 * Kinds of addressable elements. Each kind owns the short prefix used in its ids.
 */
public enum ElementType {
    TASK("task", "tsk"),
    PLAN("plan", "pln"),
    WORKFLOW("workflow", "wfl"),
    ENTITY("entity", "ent"),
    DOCUMENT("document", "doc"),
    CHANNEL("channel", "chn"),
    MESSAGE("message", "msg"),
    TEAM("team", "tem"),
    LIBRARY("library", "lib");

    private final String value;
    private final String idPrefix;

    ElementType(String value, String idPrefix) {
        this.value = value;
        this.idPrefix = idPrefix;
    }

    public String value() {
        return value;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /**
     * Returns true for the element kinds that own member tasks through parent-child edges.
     */
    public boolean isTaskContainer() {
        return this == PLAN || this == WORKFLOW;
    }

    public static ElementType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Element type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ElementType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown element type: " + value);
    }
}
