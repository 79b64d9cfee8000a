package ai.eigloo.workgraph.graph.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A workflow instance, usually poured from a playbook.
 *
 * <p>Like a {@link Plan}, a workflow owns its tasks through {@code parent-child} edges and
 * must keep at least one live task. Ephemeral workflows can be burned; squashing makes
 * them durable.</p>
 *
 * @param id The workflow id
 * @param title Human-readable title
 * @param status Lifecycle status
 * @param ephemeral Whether the workflow is disposable
 * @param playbookId Id of the playbook it was poured from, may be null
 * @param variables Resolved variable bindings
 * @param tags Free-form tags
 * @param createdBy Id of the creating actor
 * @param createdAt Creation time
 * @param updatedAt Last update time
 * @param deletedAt Soft-delete time, null while live
 */
public record Workflow(
        String id,
        String title,
        WorkflowStatus status,
        boolean ephemeral,
        String playbookId,
        Map<String, Object> variables,
        Set<String> tags,
        String createdBy,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt) implements Element {

    public Workflow {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Workflow id cannot be null or empty");
        }
        if (title == null || title.trim().isEmpty()) {
            throw new IllegalArgumentException("Workflow title cannot be null or empty");
        }
        if (status == null) {
            status = WorkflowStatus.PENDING;
        }
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @Override
    public ElementType type() {
        return ElementType.WORKFLOW;
    }

    @Override
    public boolean isResolved() {
        return status.isTerminal();
    }

    public Workflow withStatus(WorkflowStatus newStatus) {
        return new Workflow(id, title, newStatus, ephemeral, playbookId, variables, tags,
                createdBy, createdAt, Instant.now(), deletedAt);
    }

    public Workflow withEphemeral(boolean newEphemeral) {
        return new Workflow(id, title, status, newEphemeral, playbookId, variables, tags,
                createdBy, createdAt, Instant.now(), deletedAt);
    }

    public Workflow withDeletedAt(Instant newDeletedAt) {
        return new Workflow(id, title, status, ephemeral, playbookId, variables, tags,
                createdBy, createdAt, Instant.now(), newDeletedAt);
    }
}
