package ai.eigloo.workgraph.graph.model;

import java.util.Locale;

/**
 * Lifecycle status of a plan.
 */
public enum PlanStatus {
    DRAFT("draft"),
    ACTIVE("active"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String value;

    PlanStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Returns true when tasks may still be added to a plan in this status.
     */
    public boolean acceptsTasks() {
        return this == DRAFT || this == ACTIVE;
    }

    public static PlanStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Plan status cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PlanStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown plan status: " + value);
    }
}
