package ai.eigloo.workgraph.graph.model;

/**
 * Broad grouping of dependency types.
 */
public enum DependencyCategory {
    BLOCKING,
    ASSOCIATIVE,
    ATTRIBUTION,
    THREADING
}
