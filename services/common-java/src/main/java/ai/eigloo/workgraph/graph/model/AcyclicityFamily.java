package ai.eigloo.workgraph.graph.model;

/**
 * Groups of dependency types that share an acyclicity constraint.
 */
public enum AcyclicityFamily {
    /** Unconstrained; cycles are allowed. */
    NONE,
    /** {@code blocks} and {@code awaits}: scheduling order. */
    SCHEDULING,
    /** {@code parent-child}: containment. */
    CONTAINMENT;

    public boolean isChecked() {
        return this != NONE;
    }
}
