package ai.eigloo.workgraph.engine.pour;

import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.playbook.PlaybookVariable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks supplied values against the variables a playbook declares and fills in defaults.
 *
 * <p>Numeric and boolean strings are coerced ({@code "42"}, {@code "true"}). Supplied
 * variables the playbook does not declare pass through unchanged.</p>
 */
public final class VariableResolver {

    private VariableResolver() {
    }

    /**
     * @throws GraphValidationException listing every problem found
     */
    public static Map<String, Object> resolve(List<PlaybookVariable> declared, Map<String, Object> supplied) {
        List<String> issues = new ArrayList<>();
        Map<String, Object> resolved = resolve(declared, supplied, issues);
        if (!issues.isEmpty()) {
            throw new GraphValidationException(String.join("; ", issues), Map.of("issues", List.copyOf(issues)));
        }
        return resolved;
    }

    /**
     * Resolves what it can and appends a message to {@code issues} for each problem.
     */
    public static Map<String, Object> resolve(List<PlaybookVariable> declared, Map<String, Object> supplied,
                                              List<String> issues) {
        Map<String, Object> input = supplied == null ? Map.of() : supplied;
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (PlaybookVariable variable : declared) {
            Object raw = input.get(variable.name());
            boolean fromDefault = false;
            if (raw == null) {
                if (variable.defaultValue() != null) {
                    raw = variable.defaultValue();
                    fromDefault = true;
                } else {
                    if (variable.required()) {
                        issues.add("Missing required variable: " + variable.name());
                    }
                    continue;
                }
            }
            Object value = coerce(variable, raw);
            if (value == null) {
                issues.add((fromDefault ? "Default of variable " : "Variable ") + variable.name()
                        + " must be a " + variable.type().value() + ", got '" + raw + "'");
                continue;
            }
            if (!variable.allowedValues().isEmpty() && !isAllowed(variable, value)) {
                issues.add("Variable " + variable.name() + " must be one of " + variable.allowedValues()
                        + ", got '" + TemplateEvaluator.stringify(value) + "'");
                continue;
            }
            resolved.put(variable.name(), value);
        }
        for (Map.Entry<String, Object> entry : input.entrySet()) {
            if (!resolved.containsKey(entry.getKey()) && declared.stream().noneMatch(v -> v.name().equals(entry.getKey()))) {
                resolved.put(entry.getKey(), entry.getValue());
            }
        }
        return resolved;
    }

    /**
     * Returns the value converted to the declared type, or null when it cannot be.
     */
    static Object coerce(PlaybookVariable variable, Object raw) {
        return switch (variable.type()) {
            case STRING -> raw instanceof String ? raw : null;
            case NUMBER -> toNumber(raw);
            case BOOLEAN -> toBoolean(raw);
        };
    }

    private static Object toNumber(Object raw) {
        if (raw instanceof Number) {
            return raw;
        }
        if (raw instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                BigDecimal decimal = new BigDecimal(trimmed);
                if (decimal.scale() <= 0 || decimal.stripTrailingZeros().scale() <= 0) {
                    try {
                        return decimal.longValueExact();
                    } catch (ArithmeticException e) {
                        return decimal.doubleValue();
                    }
                }
                return decimal.doubleValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Object toBoolean(Object raw) {
        if (raw instanceof Boolean) {
            return raw;
        }
        if (raw instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true")) {
                return Boolean.TRUE;
            }
            if (normalized.equals("false")) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    private static boolean isAllowed(PlaybookVariable variable, Object value) {
        String text = TemplateEvaluator.stringify(value);
        for (Object allowed : variable.allowedValues()) {
            if (TemplateEvaluator.stringify(allowed).equals(text)) {
                return true;
            }
        }
        return false;
    }
}
