package ai.eigloo.workgraph.engine.workflow;

import java.util.List;

/**
 * What a burn removed.
 *
 * @param workflowId The burned workflow
 * @param deletedTaskIds Tasks hard-deleted with it
 * @param deletedDependencyCount Edges removed, across the workflow and its tasks
 */
public record BurnResult(String workflowId, List<String> deletedTaskIds, int deletedDependencyCount) {

    public BurnResult {
        deletedTaskIds = List.copyOf(deletedTaskIds);
    }
}
