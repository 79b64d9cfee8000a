package ai.eigloo.workgraph.graph.model;

import java.time.Instant;
import java.util.Set;

/**
 * A unit of work. Readiness is never stored here; it is derived from the dependency graph.
 *
 * @param id The task id
 * @param title Human-readable title
 * @param description Longer description, may be null
 * @param status Stored status
 * @param priority 1 (critical) to 5 (minimal)
 * @param assignee Assigned entity id, may be null
 * @param scheduledFor Earliest instant the task may become ready, may be null
 * @param tags Free-form tags
 * @param createdBy Id of the creating actor
 * @param createdAt Creation time
 * @param updatedAt Last update time
 * @param deletedAt Soft-delete time, null while live
 */
public record Task(
        String id,
        String title,
        String description,
        TaskStatus status,
        int priority,
        String assignee,
        Instant scheduledFor,
        Set<String> tags,
        String createdBy,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt) implements Element {

    public static final int DEFAULT_PRIORITY = 3;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    public Task {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (title == null) {
            title = "";
        }
        if (status == null) {
            status = TaskStatus.OPEN;
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Task priority must be between 1 and 5, got " + priority);
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Creates an open task with default priority.
     */
    public static Task open(String id, String title, String createdBy) {
        return new Task(id, title, null, TaskStatus.OPEN, DEFAULT_PRIORITY, null, null, Set.of(),
                createdBy, null, null, null);
    }

    @Override
    public ElementType type() {
        return ElementType.TASK;
    }

    @Override
    public boolean isResolved() {
        return status.isTerminal();
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, title, description, newStatus, priority, assignee, scheduledFor, tags,
                createdBy, createdAt, Instant.now(), deletedAt);
    }

    public Task withPriority(int newPriority) {
        return new Task(id, title, description, status, newPriority, assignee, scheduledFor, tags,
                createdBy, createdAt, Instant.now(), deletedAt);
    }

    public Task withScheduledFor(Instant newScheduledFor) {
        return new Task(id, title, description, status, priority, assignee, newScheduledFor, tags,
                createdBy, createdAt, Instant.now(), deletedAt);
    }

    public Task withCreatedAt(Instant newCreatedAt) {
        return new Task(id, title, description, status, priority, assignee, scheduledFor, tags,
                createdBy, newCreatedAt, newCreatedAt, deletedAt);
    }

    public Task withDeletedAt(Instant newDeletedAt) {
        return new Task(id, title, description, status, priority, assignee, scheduledFor, tags,
                createdBy, createdAt, Instant.now(), newDeletedAt);
    }
}
