package ai.eigloo.workgraph.graph.exception;

/**
 * Failure kinds reported by graph operations.
 */
public enum ErrorCode {
    /** A referenced element or edge is absent or soft-deleted. */
    NOT_FOUND,
    /** An edge with the same source, target and type already exists. */
    DUPLICATE_DEPENDENCY,
    /** The edge would close a cycle within its acyclicity family. */
    CYCLE_DETECTED,
    /** Input or state rules were violated. */
    VALIDATION_ERROR,
    /** The element already belongs to another container. */
    ALREADY_EXISTS
}
