package ai.eigloo.workgraph.engine.containment;

import ai.eigloo.workgraph.engine.spi.ElementStore;
import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.engine.state.DerivedStateCalculator;
import ai.eigloo.workgraph.engine.store.DependencyGraphStore;
import ai.eigloo.workgraph.graph.event.GraphEvent;
import ai.eigloo.workgraph.graph.event.GraphEventType;
import ai.eigloo.workgraph.graph.exception.ErrorCode;
import ai.eigloo.workgraph.graph.exception.GraphOperationException;
import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyType;
import ai.eigloo.workgraph.graph.model.Element;
import ai.eigloo.workgraph.graph.model.ElementType;
import ai.eigloo.workgraph.graph.model.Plan;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Membership of tasks in plans and workflows.
 *
 * <p>A task belongs to at most one container, and a container keeps at least one live task.
 * Membership changes are serialized so two concurrent removals cannot empty a container.</p>
 */
public class ContainmentService {

    private static final Logger logger = LoggerFactory.getLogger(ContainmentService.class);

    private static final Set<DependencyType> PARENT_CHILD = Set.of(DependencyType.PARENT_CHILD);

    private final ElementStore elementStore;
    private final DependencyGraphStore graphStore;
    private final DerivedStateCalculator stateCalculator;
    private final GraphEventPublisher eventPublisher;
    private final Clock clock;
    private final ReentrantLock membershipLock = new ReentrantLock();

    public ContainmentService(ElementStore elementStore,
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
     * Saves a plan together with its initial members. On any failure the plan and every
     * edge inserted so far are removed before the exception propagates.
     */
    public Plan createPlan(Plan plan, List<String> initialTaskIds, String actor) {
        return createContainer(plan, initialTaskIds, actor);
    }

    /**
     * Saves a workflow together with its initial members, with the same rollback as
     * {@link #createPlan}.
     */
    public Workflow createWorkflow(Workflow workflow, List<String> initialTaskIds, String actor) {
        return createContainer(workflow, initialTaskIds, actor);
    }

    public Dependency addTaskToPlan(String taskId, String planId, String actor) {
        return addTask(taskId, planId, ElementType.PLAN, actor);
    }

    public Dependency addTaskToWorkflow(String taskId, String workflowId, String actor) {
        return addTask(taskId, workflowId, ElementType.WORKFLOW, actor);
    }

    public void removeTaskFromPlan(String taskId, String planId, String actor) {
        removeTask(taskId, planId, ElementType.PLAN, actor);
    }

    public void removeTaskFromWorkflow(String taskId, String workflowId, String actor) {
        removeTask(taskId, workflowId, ElementType.WORKFLOW, actor);
    }

    public List<Task> getTasksInPlan(String planId) {
        requireContainer(planId, ElementType.PLAN);
        return stateCalculator.getMemberTasks(planId, false);
    }

    public List<Task> getTasksInWorkflow(String workflowId) {
        requireContainer(workflowId, ElementType.WORKFLOW);
        return stateCalculator.getMemberTasks(workflowId, false);
    }

    private <C extends Element> C createContainer(C container, List<String> initialTaskIds, String actor) {
        if (container == null) {
            throw new GraphValidationException("Container is required");
        }
        String kind = container.type().value();
        if (initialTaskIds == null || initialTaskIds.isEmpty()) {
            throw new GraphValidationException("A " + kind + " must be created with at least one task",
                    Map.of("elementId", container.id()));
        }
        Set<String> taskIds = new LinkedHashSet<>(initialTaskIds);

        membershipLock.lock();
        try {
            if (elementStore.findById(container.id()).isPresent()) {
                throw GraphOperationException.alreadyExists("Element already exists: " + container.id(),
                        Map.of("elementId", container.id()));
            }
            for (String taskId : taskIds) {
                requireLiveTask(taskId);
                requireUnassigned(taskId, container.id());
            }

            elementStore.save(container);
            List<Dependency> inserted = new ArrayList<>();
            try {
                for (String taskId : taskIds) {
                    inserted.add(graphStore.addDependency(taskId, container.id(), DependencyType.PARENT_CHILD,
                            null, actor));
                }
            } catch (RuntimeException e) {
                logger.warn("Creating {} {} failed, rolling back: {}", kind, container.id(), e.getMessage());
                rollback(container.id(), inserted, actor, e);
                throw e;
            }
            logger.info("Created {} {} with {} tasks", kind, container.id(), taskIds.size());
            return container;
        } finally {
            membershipLock.unlock();
        }
    }

    private void rollback(String containerId, List<Dependency> inserted, String actor, RuntimeException cause) {
        for (Dependency dependency : inserted) {
            try {
                graphStore.removeDependency(dependency.sourceId(), dependency.targetId(), dependency.type(), actor);
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
            }
        }
        try {
            elementStore.hardDelete(containerId);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private Dependency addTask(String taskId, String containerId, ElementType containerType, String actor) {
        membershipLock.lock();
        try {
            Element container = requireContainer(containerId, containerType);
            if (container instanceof Plan plan && !plan.status().acceptsTasks()) {
                throw new GraphValidationException("Cannot add tasks to a " + plan.status().value() + " plan",
                        Map.of("planId", containerId, "status", plan.status().value()));
            }
            requireLiveTask(taskId);
            requireUnassigned(taskId, containerId);

            Dependency dependency = graphStore.addDependency(taskId, containerId, DependencyType.PARENT_CHILD,
                    null, actor);
            logger.info("Task {} added to {} {}", taskId, containerType.value(), containerId);
            publish(containerId, GraphEventType.TASK_ADDED_TO_CONTAINER, actor, null, Map.of("taskId", taskId));
            return dependency;
        } finally {
            membershipLock.unlock();
        }
    }

    private void removeTask(String taskId, String containerId, ElementType containerType, String actor) {
        membershipLock.lock();
        try {
            requireContainer(containerId, containerType);
            if (!graphStore.exists(taskId, containerId, DependencyType.PARENT_CHILD)) {
                throw new GraphOperationException(ErrorCode.NOT_FOUND,
                        "Task " + taskId + " is not in " + containerType.value() + " " + containerId,
                        Map.of("taskId", taskId, "containerId", containerId));
            }
            List<Task> live = stateCalculator.getMemberTasks(containerId, false);
            boolean removingLive = live.stream().anyMatch(task -> task.id().equals(taskId));
            if (removingLive && live.size() == 1) {
                logger.debug("Rejected removal of last task {} from {}", taskId, containerId);
                throw new GraphValidationException("Cannot remove the last task from " + containerType.value()
                        + " " + containerId, Map.of("taskId", taskId, "containerId", containerId));
            }

            graphStore.removeDependency(taskId, containerId, DependencyType.PARENT_CHILD, actor);
            logger.info("Task {} removed from {} {}", taskId, containerType.value(), containerId);
            publish(containerId, GraphEventType.TASK_REMOVED_FROM_CONTAINER, actor, Map.of("taskId", taskId), null);
        } finally {
            membershipLock.unlock();
        }
    }

    private void requireUnassigned(String taskId, String containerId) {
        for (Dependency edge : graphStore.getOutgoing(taskId, PARENT_CHILD)) {
            if (edge.targetId().equals(containerId)) {
                continue;
            }
            Optional<Element> other = elementStore.findById(edge.targetId());
            if (other.isPresent() && other.get().type().isTaskContainer()) {
                throw GraphOperationException.alreadyExists(
                        "Task " + taskId + " already belongs to " + other.get().type().value() + " " + edge.targetId(),
                        Map.of("taskId", taskId, "containerId", edge.targetId()));
            }
        }
    }

    private Task requireLiveTask(String taskId) {
        Element element = elementStore.findById(taskId)
                .filter(found -> !found.isDeleted())
                .orElseThrow(() -> GraphOperationException.notFound("Task not found: " + taskId, taskId));
        if (!(element instanceof Task task)) {
            throw new GraphValidationException("Element " + taskId + " is a " + element.type().value()
                    + ", not a task", Map.of("elementId", taskId));
        }
        return task;
    }

    private Element requireContainer(String containerId, ElementType type) {
        Element element = elementStore.findById(containerId)
                .filter(found -> !found.isDeleted())
                .orElseThrow(() -> GraphOperationException.notFound(type.value() + " not found: " + containerId,
                        containerId));
        if (element.type() != type) {
            throw new GraphValidationException("Element " + containerId + " is a " + element.type().value()
                    + ", not a " + type.value(), Map.of("elementId", containerId));
        }
        return element;
    }

    private void publish(String containerId, GraphEventType type, String actor,
                         Map<String, Object> oldValue, Map<String, Object> newValue) {
        try {
            eventPublisher.publish(new GraphEvent(containerId, type, actor, oldValue, newValue, Instant.now(clock)));
        } catch (RuntimeException e) {
            logger.warn("Failed to publish {} event for {}: {}", type.value(), containerId, e.getMessage());
        }
    }
}
