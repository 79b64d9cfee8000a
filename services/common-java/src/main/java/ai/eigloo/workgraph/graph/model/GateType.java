package ai.eigloo.workgraph.graph.model;

import java.util.Locale;

/**
 * Kinds of gate an {@code awaits} edge can carry.
 */
public enum GateType {
    TIMER("timer"),
    APPROVAL("approval"),
    EXTERNAL("external"),
    WEBHOOK("webhook");

    private final String value;

    GateType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static GateType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Gate type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (GateType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown gate type: " + value);
    }
}
