package ai.eigloo.workgraph.engine.pour;

import ai.eigloo.workgraph.graph.exception.GraphValidationException;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{name}}} placeholders from a variable map.
 *
 * <p>Whitespace inside the braces is ignored. A placeholder naming an absent variable
 * renders as the empty string; an unclosed or empty placeholder is rejected.</p>
 */
public final class TemplateEvaluator {

    static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private TemplateEvaluator() {
    }

    public static String render(String template, Map<String, Object> variables) {
        if (template == null) {
            return null;
        }
        StringBuilder result = new StringBuilder(template.length());
        int position = 0;
        while (true) {
            int start = template.indexOf(OPEN, position);
            if (start < 0) {
                result.append(template, position, template.length());
                return result.toString();
            }
            int end = template.indexOf(CLOSE, start + OPEN.length());
            if (end < 0) {
                throw malformed(template, "unclosed placeholder");
            }
            String name = placeholderName(template, template.substring(start + OPEN.length(), end));
            result.append(template, position, start);
            result.append(stringify(variables.get(name)));
            position = end + CLOSE.length();
        }
    }

    /**
     * Names of the variables a template refers to, in order of first appearance.
     */
    public static Set<String> referencedVariables(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        int position = 0;
        while (true) {
            int start = template.indexOf(OPEN, position);
            if (start < 0) {
                return names;
            }
            int end = template.indexOf(CLOSE, start + OPEN.length());
            if (end < 0) {
                throw malformed(template, "unclosed placeholder");
            }
            names.add(placeholderName(template, template.substring(start + OPEN.length(), end)));
            position = end + CLOSE.length();
        }
    }

    /**
     * Text form of a variable value. Integral numbers render without a fraction.
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (!Double.isInfinite(number) && number == Math.rint(number) && Math.abs(number) < 1e15) {
                return Long.toString((long) number);
            }
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    static String placeholderName(String template, String inner) {
        String name = inner.trim();
        if (!VARIABLE_NAME.matcher(name).matches()) {
            throw malformed(template, "invalid variable name '" + name + "'");
        }
        return name;
    }

    private static GraphValidationException malformed(String template, String problem) {
        return new GraphValidationException("Malformed template: " + problem, Map.of("template", template));
    }
}
