package ai.eigloo.workgraph.engine.support;

import ai.eigloo.workgraph.engine.containment.ContainmentService;
import ai.eigloo.workgraph.engine.hierarchy.HierarchyService;
import ai.eigloo.workgraph.engine.state.DerivedStateCalculator;
import ai.eigloo.workgraph.engine.store.IndexedDependencyGraphStore;
import ai.eigloo.workgraph.engine.workflow.WorkflowLifecycleService;
import ai.eigloo.workgraph.graph.model.Entity;
import ai.eigloo.workgraph.graph.model.EntityKind;
import ai.eigloo.workgraph.graph.model.Task;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Engine wired over in-memory collaborators with a fixed clock.
 */
public class EngineFixture {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    public final Clock clock;
    public final InMemoryElementStore elements = new InMemoryElementStore();
    public final InMemoryDependencyPersistence persistence = new InMemoryDependencyPersistence();
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final IndexedDependencyGraphStore graph;
    public final DerivedStateCalculator state;
    public final ContainmentService containment;
    public final HierarchyService hierarchy;
    public final WorkflowLifecycleService workflows;

    public EngineFixture() {
        this(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    public EngineFixture(Clock clock) {
        this.clock = clock;
        this.graph = new IndexedDependencyGraphStore(elements, persistence, events, clock);
        this.state = new DerivedStateCalculator(elements, graph, events, clock);
        this.containment = new ContainmentService(elements, graph, state, events, clock);
        this.hierarchy = new HierarchyService(elements, state, events, clock);
        this.workflows = new WorkflowLifecycleService(elements, graph, state, events, clock);
    }

    public Task task(String id) {
        Task task = Task.open(id, "Task " + id, "tester").withCreatedAt(NOW);
        elements.save(task);
        return task;
    }

    public Task task(String id, int priority, Instant createdAt) {
        Task task = Task.open(id, "Task " + id, "tester").withPriority(priority).withCreatedAt(createdAt);
        elements.save(task);
        return task;
    }

    public Entity entity(String id) {
        Entity entity = Entity.of(id, "Entity " + id, EntityKind.AGENT);
        elements.save(entity);
        return entity;
    }
}
