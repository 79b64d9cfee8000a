package ai.eigloo.workgraph.graph.model;

import java.util.Locale;

/**
 * Stored task status. The blocked state used for scheduling is derived from the graph;
 * {@link #BLOCKED} here is only what a caller last wrote.
 */
public enum TaskStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    BLOCKED("blocked"),
    CLOSED("closed"),
    CANCELLED("cancelled");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Returns true when a task in this status no longer blocks anything.
     */
    public boolean isTerminal() {
        return this == CLOSED || this == CANCELLED;
    }

    public static TaskStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Task status cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TaskStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
