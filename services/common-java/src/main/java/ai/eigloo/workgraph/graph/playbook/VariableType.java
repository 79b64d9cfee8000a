package ai.eigloo.workgraph.graph.playbook;

import java.util.Locale;

/**
 * Declared type of a playbook variable.
 */
public enum VariableType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean");

    private final String value;

    VariableType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static VariableType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Variable type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (VariableType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown variable type: " + value);
    }
}
