package ai.eigloo.workgraph.engine.workflow;

import ai.eigloo.workgraph.engine.pour.CreatedTask;
import ai.eigloo.workgraph.engine.pour.PourResult;
import ai.eigloo.workgraph.engine.spi.ElementStore;
import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.engine.state.DerivedStateCalculator;
import ai.eigloo.workgraph.engine.store.DependencyGraphStore;
import ai.eigloo.workgraph.graph.event.GraphEvent;
import ai.eigloo.workgraph.graph.event.GraphEventType;
import ai.eigloo.workgraph.graph.exception.GraphOperationException;
import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.Element;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.TaskStatus;
import ai.eigloo.workgraph.graph.model.Workflow;
import ai.eigloo.workgraph.graph.model.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Commits poured workflows and drives their lifecycle: burn, squash and automatic status
 * transitions.
 */
public class WorkflowLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowLifecycleService.class);

    private final ElementStore elementStore;
    private final DependencyGraphStore graphStore;
    private final DerivedStateCalculator stateCalculator;
    private final GraphEventPublisher eventPublisher;
    private final Clock clock;

    public WorkflowLifecycleService(ElementStore elementStore,
                                    DependencyGraphStore graphStore,
                                    DerivedStateCalculator stateCalculator,
                                    GraphEventPublisher eventPublisher,
                                    Clock clock) {
        this.elementStore = elementStore;
        this.graphStore = graphStore;
        this.stateCalculator = stateCalculator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Saves the workflow and tasks of a pour, then inserts its edges through the graph store,
     * membership edges first. On any failure every inserted edge and created element is
     * removed before the exception propagates.
     */
    public Workflow persistPour(PourResult result, String actor) {
        Workflow workflow = result.workflow();
        if (elementStore.findById(workflow.id()).isPresent()) {
            throw GraphOperationException.alreadyExists("Element already exists: " + workflow.id(),
                    Map.of("elementId", workflow.id()));
        }

        List<String> createdElements = new ArrayList<>();
        List<Dependency> insertedEdges = new ArrayList<>();
        try {
            elementStore.save(workflow);
            createdElements.add(workflow.id());
            for (CreatedTask created : result.tasks()) {
                elementStore.save(created.task());
                createdElements.add(created.task().id());
            }
            for (Dependency edge : result.parentChildDependencies()) {
                insertedEdges.add(insert(edge, actor));
            }
            for (Dependency edge : result.blocksDependencies()) {
                insertedEdges.add(insert(edge, actor));
            }
        } catch (RuntimeException e) {
            logger.warn("Persisting workflow {} failed after {} elements and {} edges, rolling back: {}",
                    workflow.id(), createdElements.size(), insertedEdges.size(), e.getMessage());
            rollback(createdElements, insertedEdges, actor, e);
            throw e;
        }

        logger.info("Workflow {} persisted with {} tasks and {} edges", workflow.id(), result.tasks().size(),
                insertedEdges.size());
        Map<String, Object> newValue = new LinkedHashMap<>();
        newValue.put("playbookId", workflow.playbookId());
        newValue.put("taskCount", result.tasks().size());
        newValue.put("skippedSteps", result.skippedSteps());
        newValue.put("ephemeral", workflow.ephemeral());
        publish(workflow.id(), GraphEventType.WORKFLOW_POURED, actor, null, newValue);
        return workflow;
    }

    /**
     * Hard-deletes a workflow, its tasks and every edge touching them.
     *
     * @param force required to burn a durable workflow
     */
    public BurnResult burn(String workflowId, boolean force, String actor) {
        Workflow workflow = requireWorkflow(workflowId, true);
        if (!workflow.ephemeral() && !force) {
            throw new GraphValidationException("Workflow " + workflowId + " is durable; burning it requires force",
                    Map.of("workflowId", workflowId));
        }

        List<Task> members = stateCalculator.getMemberTasks(workflowId, true);
        List<String> deletedTaskIds = new ArrayList<>();
        int removedEdges = 0;
        for (Task task : members) {
            removedEdges += graphStore.removeAllForElement(task.id(), actor).size();
            elementStore.hardDelete(task.id());
            deletedTaskIds.add(task.id());
        }
        removedEdges += graphStore.removeAllForElement(workflowId, actor).size();
        elementStore.hardDelete(workflowId);

        logger.info("Burned workflow {} ({} tasks, {} edges)", workflowId, deletedTaskIds.size(), removedEdges);
        publish(workflowId, GraphEventType.WORKFLOW_BURNED, actor,
                Map.of("ephemeral", workflow.ephemeral(), "taskIds", deletedTaskIds), null);
        return new BurnResult(workflowId, deletedTaskIds, removedEdges);
    }

    /**
     * Promotes an ephemeral workflow to durable. One way.
     */
    public Workflow squash(String workflowId, String actor) {
        Workflow workflow = requireWorkflow(workflowId, false);
        if (!workflow.ephemeral()) {
            throw new GraphValidationException("Workflow " + workflowId + " is already durable",
                    Map.of("workflowId", workflowId));
        }
        Workflow squashed = workflow.withEphemeral(false);
        elementStore.save(squashed);
        logger.info("Squashed workflow {}", workflowId);
        publish(workflowId, GraphEventType.WORKFLOW_SQUASHED, actor, Map.of("ephemeral", true),
                Map.of("ephemeral", false));
        return squashed;
    }

    /**
     * Status the workflow should move to given its member tasks, or empty when it should stay.
     * Failure wins over start, start over completion.
     *
     * @param tasks every member task, soft-deleted ones included
     */
    public Optional<WorkflowStatus> computeWorkflowStatus(Workflow workflow, List<Task> tasks) {
        WorkflowStatus status = workflow.status();
        boolean active = status == WorkflowStatus.PENDING || status == WorkflowStatus.RUNNING;
        if (active && tasks.stream().anyMatch(Element::isDeleted)) {
            return Optional.of(WorkflowStatus.FAILED);
        }
        if (status == WorkflowStatus.PENDING
                && tasks.stream().anyMatch(task -> task.status() == TaskStatus.IN_PROGRESS)) {
            return Optional.of(WorkflowStatus.RUNNING);
        }
        if (status == WorkflowStatus.RUNNING && !tasks.isEmpty()
                && tasks.stream().allMatch(task -> task.status() == TaskStatus.CLOSED)) {
            return Optional.of(WorkflowStatus.COMPLETED);
        }
        return Optional.empty();
    }

    /**
     * Applies {@link #computeWorkflowStatus} to a stored workflow.
     */
    public Workflow refreshWorkflowStatus(String workflowId, String actor) {
        Workflow workflow = requireWorkflow(workflowId, false);
        List<Task> tasks = stateCalculator.getMemberTasks(workflowId, true);
        Optional<WorkflowStatus> next = computeWorkflowStatus(workflow, tasks);
        if (next.isEmpty() || next.get() == workflow.status() || !workflow.status().canTransitionTo(next.get())) {
            return workflow;
        }
        Workflow updated = workflow.withStatus(next.get());
        elementStore.save(updated);
        logger.info("Workflow {} status {} -> {}", workflowId, workflow.status().value(), next.get().value());
        publish(workflowId, GraphEventType.WORKFLOW_STATUS_CHANGED, actor,
                Map.of("status", workflow.status().value()), Map.of("status", next.get().value()));
        return updated;
    }

    private Dependency insert(Dependency edge, String actor) {
        return graphStore.addDependency(edge.sourceId(), edge.targetId(), edge.type(), edge.metadata(),
                actor != null ? actor : edge.createdBy());
    }

    private void rollback(List<String> createdElements, List<Dependency> insertedEdges, String actor,
                          RuntimeException cause) {
        for (int i = insertedEdges.size() - 1; i >= 0; i--) {
            Dependency edge = insertedEdges.get(i);
            try {
                graphStore.removeDependency(edge.sourceId(), edge.targetId(), edge.type(), actor);
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
        for (int i = createdElements.size() - 1; i >= 0; i--) {
            try {
                elementStore.hardDelete(createdElements.get(i));
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
    }

    private Workflow requireWorkflow(String workflowId, boolean allowDeleted) {
        Element element = elementStore.findById(workflowId)
                .filter(found -> allowDeleted || !found.isDeleted())
                .orElseThrow(() -> GraphOperationException.notFound("Workflow not found: " + workflowId, workflowId));
        if (!(element instanceof Workflow workflow)) {
            throw new GraphValidationException("Element " + workflowId + " is a " + element.type().value()
                    + ", not a workflow", Map.of("elementId", workflowId));
        }
        return workflow;
    }

    private void publish(String workflowId, GraphEventType type, String actor,
                         Map<String, Object> oldValue, Map<String, Object> newValue) {
        try {
            eventPublisher.publish(new GraphEvent(workflowId, type, actor, oldValue, newValue, Instant.now(clock)));
        } catch (RuntimeException e) {
            logger.warn("Failed to publish {} event for {}: {}", type.value(), workflowId, e.getMessage());
        }
    }
}
