package ai.eigloo.workgraph.engine.pour;

import ai.eigloo.workgraph.graph.model.Task;

/**
 * A poured task and the step it came from.
 */
public record CreatedTask(Task task, String stepId) {
}
