package ai.eigloo.workgraph.graph.playbook;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable workflow template. Playbooks arrive already parsed; this type only enforces
 * structural consistency of the steps.
 *
 * @param id Playbook id
 * @param name Short machine name
 * @param title Title template for poured workflows
 * @param steps Ordered steps, may be empty (pouring an empty playbook is rejected)
 * @param variables Declared variables
 */
public record Playbook(
        String id,
        String name,
        String title,
        List<PlaybookStep> steps,
        List<PlaybookVariable> variables) {

    public Playbook {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Playbook name cannot be null or empty");
        }
        if (title == null || title.trim().isEmpty()) {
            title = name;
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        variables = variables == null ? List.of() : List.copyOf(variables);

        Set<String> stepIds = new HashSet<>();
        for (PlaybookStep step : steps) {
            if (!stepIds.add(step.id())) {
                throw new IllegalArgumentException("Duplicate step id: " + step.id());
            }
        }
        for (PlaybookStep step : steps) {
            for (String dependency : step.dependsOn()) {
                if (!stepIds.contains(dependency)) {
                    throw new IllegalArgumentException(
                            "Step " + step.id() + " depends on unknown step: " + dependency);
                }
                if (dependency.equals(step.id())) {
                    throw new IllegalArgumentException("Step " + step.id() + " cannot depend on itself");
                }
            }
        }
        Set<String> variableNames = new HashSet<>();
        for (PlaybookVariable variable : variables) {
            if (!variableNames.add(variable.name())) {
                throw new IllegalArgumentException("Duplicate variable name: " + variable.name());
            }
        }
    }

    public static Playbook of(String name, List<PlaybookStep> steps, List<PlaybookVariable> variables) {
        return new Playbook(null, name, name, steps, variables);
    }

    public Optional<PlaybookStep> findStep(String stepId) {
        return steps.stream().filter(step -> step.id().equals(stepId)).findFirst();
    }
}
