package ai.eigloo.workgraph.engine.state;

import ai.eigloo.workgraph.engine.cycle.CycleDetector;
import ai.eigloo.workgraph.engine.spi.ElementStore;
import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.engine.store.DependencyGraphStore;
import ai.eigloo.workgraph.graph.event.GraphEvent;
import ai.eigloo.workgraph.graph.event.GraphEventType;
import ai.eigloo.workgraph.graph.exception.GraphOperationException;
import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.AcyclicityFamily;
import ai.eigloo.workgraph.graph.model.AwaitsGate;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyType;
import ai.eigloo.workgraph.graph.model.Element;
import ai.eigloo.workgraph.graph.model.ElementType;
import ai.eigloo.workgraph.graph.model.Entity;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.TaskStatus;
import ai.eigloo.workgraph.graph.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-side queries derived from the dependency graph: readiness, blocked tasks, container
 * progress and management chains.
 *
 * <p>Nothing here is cached. Each query takes one consistent snapshot of the edges and
 * recomputes from it, so stored task statuses may lag behind what is reported.</p>
 */
public class DerivedStateCalculator {

    private static final Logger logger = LoggerFactory.getLogger(DerivedStateCalculator.class);

    public static final int DEFAULT_MAX_CHAIN_DEPTH = 100;

    static final Comparator<Task> READY_ORDER = Comparator.comparingInt(Task::priority)
            .thenComparing(Task::createdAt)
            .thenComparing(Task::id);

    private static final Set<DependencyType> SCHEDULING_TYPES = DependencyType.ofFamily(AcyclicityFamily.SCHEDULING);

    private final ElementStore elementStore;
    private final DependencyGraphStore graphStore;
    private final GraphEventPublisher eventPublisher;
    private final GateEvaluator gateEvaluator;
    private final Clock clock;
    private final int maxChainDepth;

    public DerivedStateCalculator(ElementStore elementStore,
                                  DependencyGraphStore graphStore,
                                  GraphEventPublisher eventPublisher,
                                  Clock clock,
                                  int maxChainDepth) {
        if (maxChainDepth < 1) {
            throw new IllegalArgumentException("Max chain depth must be positive");
        }
        this.elementStore = elementStore;
        this.graphStore = graphStore;
        this.eventPublisher = eventPublisher;
        this.gateEvaluator = new GateEvaluator(clock);
        this.clock = clock;
        this.maxChainDepth = maxChainDepth;
    }

    public DerivedStateCalculator(ElementStore elementStore, DependencyGraphStore graphStore,
                                  GraphEventPublisher eventPublisher, Clock clock) {
        this(elementStore, graphStore, eventPublisher, clock, DEFAULT_MAX_CHAIN_DEPTH);
    }

    /**
     * Tasks that can start now, excluding tasks of ephemeral workflows.
     */
    public List<Task> ready() {
        return ready(ReadyQuery.defaults());
    }

    /**
     * Live, non-terminal tasks with no unresolved incoming {@code blocks} or {@code awaits}
     * edge and no future {@code scheduledFor}, ordered by priority then creation time.
     */
    public List<Task> ready(ReadyQuery query) {
        Evaluation evaluation = new Evaluation(graphStore.snapshot());
        List<Task> result = new ArrayList<>();
        for (Task task : liveActiveTasks()) {
            if (!query.includeEphemeral() && evaluation.inEphemeralWorkflow(task.id())) {
                continue;
            }
            if (evaluation.isReady(task)) {
                result.add(task);
            }
        }
        result.sort(READY_ORDER);
        if (query.limit() != null && result.size() > query.limit()) {
            return List.copyOf(result.subList(0, query.limit()));
        }
        return result;
    }

    /**
     * Live, non-terminal tasks with at least one unresolved blocker.
     */
    public List<BlockedTask> blocked() {
        Evaluation evaluation = new Evaluation(graphStore.snapshot());
        List<BlockedTask> result = new ArrayList<>();
        for (Task task : liveActiveTasks()) {
            evaluation.firstUnresolvedBlocker(task).ifPresent(result::add);
        }
        result.sort(Comparator.comparing(BlockedTask::task, READY_ORDER));
        return result;
    }

    /**
     * Derived blocked state of one task.
     */
    public Optional<BlockedTask> blockingState(String taskId) {
        Task task = requireTask(taskId);
        if (task.isDeleted() || task.status().isTerminal()) {
            return Optional.empty();
        }
        return new Evaluation(graphStore.getIncoming(taskId, SCHEDULING_TYPES)).firstUnresolvedBlocker(task);
    }

    public boolean isBlocked(String taskId) {
        return blockingState(taskId).isPresent();
    }

    public Progress getPlanProgress(String planId) {
        return progressOf(planId, ElementType.PLAN);
    }

    public Progress getWorkflowProgress(String workflowId) {
        return progressOf(workflowId, ElementType.WORKFLOW);
    }

    /**
     * Ready tasks belonging to one workflow, whether or not it is ephemeral.
     */
    public List<Task> getReadyTasksInWorkflow(String workflowId) {
        requireContainer(workflowId, ElementType.WORKFLOW);
        Evaluation evaluation = new Evaluation(graphStore.snapshot());
        List<Task> result = new ArrayList<>();
        for (Task task : getMemberTasks(workflowId, false)) {
            if (!task.status().isTerminal() && evaluation.isReady(task)) {
                result.add(task);
            }
        }
        result.sort(READY_ORDER);
        return result;
    }

    /**
     * Tasks linked to a container by {@code parent-child} edges, in membership order.
     *
     * @param includeDeleted whether soft-deleted members are returned
     */
    public List<Task> getMemberTasks(String containerId, boolean includeDeleted) {
        List<Task> members = new ArrayList<>();
        for (Dependency edge : graphStore.getIncoming(containerId, Set.of(DependencyType.PARENT_CHILD))) {
            elementStore.findById(edge.sourceId())
                    .filter(Task.class::isInstance)
                    .map(Task.class::cast)
                    .filter(task -> includeDeleted || !task.isDeleted())
                    .ifPresent(members::add);
        }
        return members;
    }

    /**
     * Ancestors of {@code entity} along {@code reportsTo}, nearest manager first.
     *
     * <p>The walk stops at a missing or soft-deleted manager, after the configured number of
     * hops, or on revisiting an entity, so a cycle in stored data cannot make it loop.</p>
     */
    public List<Entity> getManagementChain(Entity entity, Function<String, Optional<Entity>> resolve) {
        List<Entity> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(entity.id());
        String nextId = entity.reportsTo();
        while (nextId != null) {
            if (chain.size() >= maxChainDepth) {
                logger.warn("Management chain of {} exceeded {} hops; truncated", entity.id(), maxChainDepth);
                break;
            }
            if (!visited.add(nextId)) {
                logger.warn("Management chain of {} revisits {}; stored reporting cycle", entity.id(), nextId);
                break;
            }
            Optional<Entity> manager = resolve.apply(nextId);
            if (manager.isEmpty() || manager.get().isDeleted()) {
                break;
            }
            chain.add(manager.get());
            nextId = manager.get().reportsTo();
        }
        return chain;
    }

    /**
     * Whether making {@code proposedManagerId} the manager of {@code entityId} would close a
     * reporting cycle.
     */
    public ReportingCycleCheck detectReportingCycle(String entityId, String proposedManagerId,
                                                    Function<String, Optional<Entity>> resolve) {
        boolean hasCycle = CycleDetector.wouldCreateReportingCycle(entityId, proposedManagerId,
                id -> resolve.apply(id).map(Entity::reportsTo).orElse(null), maxChainDepth);
        return new ReportingCycleCheck(hasCycle);
    }

    /**
     * Stores a new task status and emits {@code auto_blocked} / {@code auto_unblocked} for each
     * dependent whose derived blocked state flipped as a result.
     */
    public Task recordStatusChange(String taskId, TaskStatus newStatus, String actor) {
        if (newStatus == null) {
            throw new GraphValidationException("Task status is required");
        }
        Task task = requireTask(taskId);
        if (task.isDeleted()) {
            throw GraphOperationException.notFound("Task not found: " + taskId, taskId);
        }

        Map<String, Boolean> before = new LinkedHashMap<>();
        for (Dependency edge : graphStore.getOutgoing(taskId, SCHEDULING_TYPES)) {
            elementStore.findById(edge.targetId())
                    .filter(Task.class::isInstance)
                    .filter(dependent -> !dependent.isDeleted())
                    .ifPresent(dependent -> before.put(dependent.id(), isBlocked(dependent.id())));
        }

        Task updated = task.withStatus(newStatus);
        elementStore.save(updated);
        logger.info("Task {} status {} -> {}", taskId, task.status().value(), newStatus.value());

        for (Map.Entry<String, Boolean> entry : before.entrySet()) {
            boolean blockedNow = isBlocked(entry.getKey());
            if (blockedNow == entry.getValue()) {
                continue;
            }
            GraphEventType type = blockedNow ? GraphEventType.AUTO_BLOCKED : GraphEventType.AUTO_UNBLOCKED;
            logger.debug("Task {} {} after {} became {}", entry.getKey(), type.value(), taskId, newStatus.value());
            Map<String, Object> cause = Map.of("causedBy", taskId, "status", newStatus.value());
            publish(new GraphEvent(entry.getKey(), type, actor, Map.of("blocked", entry.getValue()),
                    merge(cause, blockedNow), Instant.now(clock)));
        }
        return updated;
    }

    private static Map<String, Object> merge(Map<String, Object> cause, boolean blocked) {
        Map<String, Object> value = new LinkedHashMap<>(cause);
        value.put("blocked", blocked);
        return value;
    }

    private Progress progressOf(String containerId, ElementType type) {
        requireContainer(containerId, type);
        List<Task> members = getMemberTasks(containerId, false);
        Evaluation evaluation = new Evaluation(graphStore.snapshot());

        int closed = 0;
        int cancelled = 0;
        int open = 0;
        int inProgress = 0;
        int blocked = 0;
        int readyTasks = 0;
        int blockedTasks = 0;
        for (Task task : members) {
            switch (task.status()) {
                case CLOSED -> closed++;
                case CANCELLED -> cancelled++;
                case OPEN -> open++;
                case IN_PROGRESS -> inProgress++;
                case BLOCKED -> blocked++;
            }
            if (task.status().isTerminal()) {
                continue;
            }
            if (evaluation.firstUnresolvedBlocker(task).isPresent()) {
                blockedTasks++;
            } else if (evaluation.isReady(task)) {
                readyTasks++;
            }
        }
        int total = members.size();
        return new Progress(containerId, total, closed, cancelled, open, inProgress, blocked,
                readyTasks, blockedTasks, Progress.percentComplete(total, closed, cancelled));
    }

    private List<Task> liveActiveTasks() {
        List<Task> tasks = new ArrayList<>();
        for (Element element : elementStore.findAll(ElementType.TASK)) {
            if (element instanceof Task task && !task.isDeleted() && !task.status().isTerminal()) {
                tasks.add(task);
            }
        }
        return tasks;
    }

    private Task requireTask(String taskId) {
        Element element = elementStore.findById(taskId)
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
                .orElseThrow(() -> GraphOperationException.notFound(
                        capitalize(type.value()) + " not found: " + containerId, containerId));
        if (element.type() != type) {
            throw new GraphValidationException("Element " + containerId + " is a " + element.type().value()
                    + ", not a " + type.value(), Map.of("elementId", containerId));
        }
        return element;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    private void publish(GraphEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            logger.warn("Failed to publish {} event for {}: {}", event.eventType().value(), event.elementId(),
                    e.getMessage());
        }
    }

    /**
     * Blocker resolution over one edge snapshot, with element lookups memoized for the query.
     */
    private final class Evaluation {

        private final Map<String, List<Dependency>> schedulingIncoming = new HashMap<>();
        private final Map<String, List<String>> parents = new HashMap<>();
        private final Map<String, Optional<Element>> elements = new HashMap<>();
        private final Instant now = Instant.now(clock);

        Evaluation(List<Dependency> edges) {
            for (Dependency edge : edges) {
                if (edge.type().isScheduling()) {
                    schedulingIncoming.computeIfAbsent(edge.targetId(), id -> new ArrayList<>()).add(edge);
                } else if (edge.type() == DependencyType.PARENT_CHILD) {
                    parents.computeIfAbsent(edge.sourceId(), id -> new ArrayList<>()).add(edge.targetId());
                }
            }
        }

        boolean isReady(Task task) {
            if (task.scheduledFor() != null && task.scheduledFor().isAfter(now)) {
                return false;
            }
            return firstUnresolvedBlocker(task).isEmpty();
        }

        Optional<BlockedTask> firstUnresolvedBlocker(Task task) {
            for (Dependency edge : schedulingIncoming.getOrDefault(task.id(), List.of())) {
                String reason = unresolvedReason(edge);
                if (reason != null) {
                    return Optional.of(new BlockedTask(task, edge.sourceId(), reason));
                }
            }
            return Optional.empty();
        }

        boolean inEphemeralWorkflow(String taskId) {
            for (String parentId : parents.getOrDefault(taskId, List.of())) {
                Optional<Element> parent = lookup(parentId);
                if (parent.isPresent() && parent.get() instanceof Workflow workflow && workflow.ephemeral()) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Returns why {@code edge} still blocks its target, or null when it no longer does.
         */
        private String unresolvedReason(Dependency edge) {
            Optional<Element> source = lookup(edge.sourceId());
            boolean sourceClear = source.isEmpty() || source.get().isDeleted() || source.get().isResolved();
            if (!sourceClear) {
                return edge.type() == DependencyType.BLOCKS
                        ? "Blocked by " + edge.sourceId() + " (blocks dependency)"
                        : "Awaiting " + edge.sourceId() + " (awaits dependency)";
            }
            if (edge.type() != DependencyType.AWAITS) {
                return null;
            }
            Optional<AwaitsGate> gate;
            try {
                gate = AwaitsGate.fromMetadata(edge.metadata());
            } catch (IllegalArgumentException e) {
                logger.warn("Invalid gate metadata on {}: {}", edge.key(), e.getMessage());
                return "Blocked by gate (invalid metadata)";
            }
            if (gate.isPresent() && !gateEvaluator.isSatisfied(gate.get())) {
                return "Blocked by gate (" + gate.get().gateType().value() + ")";
            }
            return null;
        }

        private Optional<Element> lookup(String elementId) {
            return elements.computeIfAbsent(elementId, elementStore::findById);
        }
    }
}
