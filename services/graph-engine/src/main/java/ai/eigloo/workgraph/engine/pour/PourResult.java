package ai.eigloo.workgraph.engine.pour;

import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.Workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unpersisted graph fragment produced by a pour.
 *
 * @param workflow The new workflow
 * @param tasks Tasks for the included steps, in step order
 * @param blocksDependencies Ordering edges between the tasks
 * @param parentChildDependencies One membership edge per task
 * @param skippedSteps Ids of steps whose condition was false
 * @param resolvedVariables Variables after defaults and coercion
 */
public record PourResult(
        Workflow workflow,
        List<CreatedTask> tasks,
        List<Dependency> blocksDependencies,
        List<Dependency> parentChildDependencies,
        List<String> skippedSteps,
        Map<String, Object> resolvedVariables) {

    public PourResult {
        tasks = List.copyOf(tasks);
        blocksDependencies = List.copyOf(blocksDependencies);
        parentChildDependencies = List.copyOf(parentChildDependencies);
        skippedSteps = List.copyOf(skippedSteps);
        resolvedVariables = Collections.unmodifiableMap(new LinkedHashMap<>(resolvedVariables));
    }

    public List<Task> taskList() {
        return tasks.stream().map(CreatedTask::task).toList();
    }
}
