package ai.eigloo.workgraph.graph.playbook;

import java.util.List;
import java.util.Set;

/**
 * One step of a playbook: a task template plus an optional inclusion condition and
 * ordering hints.
 *
 * @param id Step id, unique within the playbook
 * @param title Title template
 * @param description Description template, may be null
 * @param assignee Assignee template, may be null
 * @param priority Task priority, null for the default
 * @param tags Tags copied onto the generated task
 * @param dependsOn Ids of steps that must finish first
 * @param condition Inclusion condition, null or blank to always include
 */
public record PlaybookStep(
        String id,
        String title,
        String description,
        String assignee,
        Integer priority,
        Set<String> tags,
        List<String> dependsOn,
        String condition) {

    public PlaybookStep {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Step id cannot be null or empty");
        }
        if (title == null || title.trim().isEmpty()) {
            throw new IllegalArgumentException("Step title cannot be null or empty");
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static PlaybookStep of(String id, String title) {
        return new PlaybookStep(id, title, null, null, null, Set.of(), List.of(), null);
    }

    public PlaybookStep withDependsOn(String... stepIds) {
        return new PlaybookStep(id, title, description, assignee, priority, tags, List.of(stepIds), condition);
    }

    public PlaybookStep withCondition(String newCondition) {
        return new PlaybookStep(id, title, description, assignee, priority, tags, dependsOn, newCondition);
    }

    public boolean hasCondition() {
        return condition != null && !condition.trim().isEmpty();
    }
}
