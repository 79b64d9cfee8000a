package ai.eigloo.workgraph.engine.state;

import ai.eigloo.workgraph.graph.model.Task;

/**
 * A task held up by at least one unresolved blocker.
 *
 * @param task The blocked task
 * @param blockedBy Id of the first unresolved blocker
 * @param reason Human-readable explanation
 */
public record BlockedTask(Task task, String blockedBy, String reason) {
}
