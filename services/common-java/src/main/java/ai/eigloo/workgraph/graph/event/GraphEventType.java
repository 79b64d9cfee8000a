package ai.eigloo.workgraph.graph.event;

import java.util.Locale;

/**
 * Audit event kinds emitted by graph mutations.
 */
public enum GraphEventType {
    DEPENDENCY_ADDED("dependency_added"),
    DEPENDENCY_REMOVED("dependency_removed"),
    AUTO_BLOCKED("auto_blocked"),
    AUTO_UNBLOCKED("auto_unblocked"),
    MANAGER_ASSIGNED("manager_assigned"),
    MANAGER_CLEARED("manager_cleared"),
    WORKFLOW_POURED("workflow_poured"),
    WORKFLOW_BURNED("workflow_burned"),
    WORKFLOW_SQUASHED("workflow_squashed"),
    WORKFLOW_STATUS_CHANGED("workflow_status_changed"),
    TASK_ADDED_TO_CONTAINER("task_added_to_container"),
    TASK_REMOVED_FROM_CONTAINER("task_removed_from_container"),
    GATE_UPDATED("gate_updated");

    private final String value;

    GraphEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static GraphEventType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (GraphEventType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
