package ai.eigloo.workgraph.engine.pour;

import ai.eigloo.workgraph.graph.exception.GraphValidationException;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates step conditions against resolved variables.
 *
 * <p>Accepted forms: {@code {{v}}}, {@code !{{v}}}, {@code {{v}} == literal} and
 * {@code {{v}} != literal}. Literals may be wrapped in single or double quotes. A blank
 * condition is true.</p>
 */
public final class ConditionEvaluator {

    private static final Set<String> FALSY = Set.of("false", "0", "no", "off");

    private ConditionEvaluator() {
    }

    public static boolean evaluate(String condition, Map<String, Object> variables) {
        if (condition == null || condition.trim().isEmpty()) {
            return true;
        }
        String expression = condition.trim();
        if (expression.startsWith("!") && !expression.startsWith("!=")) {
            Placeholder placeholder = leadingPlaceholder(condition, expression.substring(1).trim());
            if (!placeholder.rest().isEmpty()) {
                throw malformed(condition);
            }
            return !isTruthy(variables.get(placeholder.name()));
        }

        Placeholder placeholder = leadingPlaceholder(condition, expression);
        String rest = placeholder.rest();
        if (rest.isEmpty()) {
            return isTruthy(variables.get(placeholder.name()));
        }
        boolean equals;
        if (rest.startsWith("==")) {
            equals = true;
        } else if (rest.startsWith("!=")) {
            equals = false;
        } else {
            throw malformed(condition);
        }
        String literal = literal(condition, rest.substring(2).trim());
        boolean matches = TemplateEvaluator.stringify(variables.get(placeholder.name())).equals(literal);
        return equals == matches;
    }

    /**
     * Non-empty and not one of {@code false}, {@code 0}, {@code no}, {@code off}, ignoring case.
     */
    public static boolean isTruthy(Object value) {
        String text = TemplateEvaluator.stringify(value).trim();
        return !text.isEmpty() && !FALSY.contains(text.toLowerCase(Locale.ROOT));
    }

    private static Placeholder leadingPlaceholder(String condition, String expression) {
        if (!expression.startsWith("{{")) {
            throw malformed(condition);
        }
        int end = expression.indexOf("}}");
        if (end < 0) {
            throw malformed(condition);
        }
        String name;
        try {
            name = TemplateEvaluator.placeholderName(condition, expression.substring(2, end));
        } catch (GraphValidationException e) {
            throw malformed(condition);
        }
        return new Placeholder(name, expression.substring(end + 2).trim());
    }

    private static String literal(String condition, String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        if (text.isEmpty() || text.contains("{{") || text.contains(" ")) {
            throw malformed(condition);
        }
        return text;
    }

    private static GraphValidationException malformed(String condition) {
        return new GraphValidationException("Malformed condition: " + condition, Map.of("condition", condition));
    }

    private record Placeholder(String name, String rest) {
    }
}
