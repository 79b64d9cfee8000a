package ai.eigloo.workgraph.graph.model;

import java.util.Locale;

/**
 * Lifecycle status of a workflow instance.
 */
public enum WorkflowStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    WorkflowStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Returns true when this status is terminal.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Returns true when a workflow can transition from the current status to the target status.
     */
    public boolean canTransitionTo(WorkflowStatus target) {
        if (target == null) {
            return false;
        }
        if (this == target) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == RUNNING || target == FAILED || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    public static WorkflowStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Workflow status cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (WorkflowStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown workflow status: " + value);
    }
}
