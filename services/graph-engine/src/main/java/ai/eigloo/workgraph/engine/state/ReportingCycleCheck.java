package ai.eigloo.workgraph.engine.state;

/**
 * Outcome of a reporting-cycle check.
 *
 * @param hasCycle whether the proposed assignment would close a cycle
 */
public record ReportingCycleCheck(boolean hasCycle) {
}
