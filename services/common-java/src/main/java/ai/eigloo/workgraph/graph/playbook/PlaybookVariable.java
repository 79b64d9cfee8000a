package ai.eigloo.workgraph.graph.playbook;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A variable a playbook declares.
 *
 * @param name The variable name referenced by {@code {{name}}} placeholders
 * @param type The declared type
 * @param required Whether a value must be supplied when no default exists
 * @param defaultValue Value used when none is supplied, may be null
 * @param allowedValues Permitted values, empty when unrestricted
 * @param description Free-form description, may be null
 */
public record PlaybookVariable(
        String name,
        VariableType type,
        boolean required,
        Object defaultValue,
        List<Object> allowedValues,
        String description) {

    public PlaybookVariable {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be null or empty");
        }
        if (type == null) {
            type = VariableType.STRING;
        }
        // allowed values are user data; keep nulls out but do not reject the record for them
        if (allowedValues == null) {
            allowedValues = List.of();
        } else {
            List<Object> copy = new ArrayList<>(allowedValues);
            copy.removeIf(value -> value == null);
            allowedValues = Collections.unmodifiableList(copy);
        }
    }

    public static PlaybookVariable required(String name, VariableType type) {
        return new PlaybookVariable(name, type, true, null, List.of(), null);
    }

    public static PlaybookVariable optional(String name, VariableType type, Object defaultValue) {
        return new PlaybookVariable(name, type, false, defaultValue, List.of(), null);
    }

    public PlaybookVariable withAllowedValues(List<Object> newAllowedValues) {
        return new PlaybookVariable(name, type, required, defaultValue, newAllowedValues, description);
    }
}
