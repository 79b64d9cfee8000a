package ai.eigloo.workgraph.engine.pour;

import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionEvaluatorTest {

    private final Map<String, Object> variables = Map.of(
            "run_tests", true,
            "skip_docs", "no",
            "env", "prod",
            "replicas", 3L);

    @Test
    void blankConditionIsTrue() {
        assertTrue(ConditionEvaluator.evaluate(null, variables));
        assertTrue(ConditionEvaluator.evaluate("  ", variables));
    }

    @Test
    void truthinessAndNegation() {
        assertTrue(ConditionEvaluator.evaluate("{{run_tests}}", variables));
        assertFalse(ConditionEvaluator.evaluate("!{{run_tests}}", variables));
        assertFalse(ConditionEvaluator.evaluate("{{skip_docs}}", variables));
        assertFalse(ConditionEvaluator.evaluate("{{missing}}", variables));
        assertTrue(ConditionEvaluator.evaluate("! {{missing}}", variables));
    }

    @Test
    void equalityAgainstLiterals() {
        assertTrue(ConditionEvaluator.evaluate("{{env}} == prod", variables));
        assertTrue(ConditionEvaluator.evaluate("{{env}} == 'prod'", variables));
        assertTrue(ConditionEvaluator.evaluate("{{env}} != \"staging\"", variables));
        assertTrue(ConditionEvaluator.evaluate("{{replicas}} == 3", variables));
        assertFalse(ConditionEvaluator.evaluate("{{env}} != prod", variables));
    }

    @ParameterizedTest
    @ValueSource(strings = {"env", "{{env}} = prod", "{{env}} == two words", "{{env}} ==", "{{env", "!{{env}} == x"})
    void malformedConditionsAreRejected(String condition) {
        assertThrows(GraphValidationException.class, () -> ConditionEvaluator.evaluate(condition, variables));
    }

    @Test
    void falsyValues() {
        assertFalse(ConditionEvaluator.isTruthy("OFF"));
        assertFalse(ConditionEvaluator.isTruthy(0L));
        assertFalse(ConditionEvaluator.isTruthy(""));
        assertTrue(ConditionEvaluator.isTruthy("yes"));
    }
}
