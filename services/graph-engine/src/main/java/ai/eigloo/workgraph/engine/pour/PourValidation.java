package ai.eigloo.workgraph.engine.pour;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a dry-run pour.
 */
public record PourValidation(
        boolean valid,
        List<String> includedSteps,
        List<String> skippedSteps,
        Map<String, Object> resolvedVariables,
        List<String> issues) {

    public PourValidation {
        includedSteps = List.copyOf(includedSteps);
        skippedSteps = List.copyOf(skippedSteps);
        resolvedVariables = Collections.unmodifiableMap(new LinkedHashMap<>(resolvedVariables));
        issues = List.copyOf(issues);
    }
}
