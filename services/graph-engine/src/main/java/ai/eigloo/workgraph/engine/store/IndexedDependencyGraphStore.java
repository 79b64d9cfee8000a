package ai.eigloo.workgraph.engine.store;

import ai.eigloo.workgraph.engine.cycle.CycleDetector;
import ai.eigloo.workgraph.engine.spi.DependencyPersistence;
import ai.eigloo.workgraph.engine.spi.ElementStore;
import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.graph.event.GraphEvent;
import ai.eigloo.workgraph.graph.event.GraphEventType;
import ai.eigloo.workgraph.graph.exception.ErrorCode;
import ai.eigloo.workgraph.graph.exception.GraphOperationException;
import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.AwaitsGate;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyKey;
import ai.eigloo.workgraph.graph.model.DependencyType;
import ai.eigloo.workgraph.graph.model.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * {@link DependencyGraphStore} backed by an in-memory adjacency index over a persistence
 * collaborator.
 *
 * <p>The duplicate check, cycle check and insert run under one write lock, so racing
 * inserts of the same edge or of two halves of a cycle cannot both succeed. The index
 * changes only after the persistence call returns.</p>
 */
public class IndexedDependencyGraphStore implements DependencyGraphStore {

    private static final Logger logger = LoggerFactory.getLogger(IndexedDependencyGraphStore.class);

    private final ElementStore elementStore;
    private final DependencyPersistence persistence;
    private final GraphEventPublisher eventPublisher;
    private final Clock clock;

    private final AdjacencyIndex index = new AdjacencyIndex();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public IndexedDependencyGraphStore(ElementStore elementStore,
                                       DependencyPersistence persistence,
                                       GraphEventPublisher eventPublisher,
                                       Clock clock) {
        this.elementStore = elementStore;
        this.persistence = persistence;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public Dependency addDependency(String sourceId, String targetId, DependencyType type,
                                    Map<String, Object> metadata, String actor) {
        requireId(sourceId, "sourceId");
        requireId(targetId, "targetId");
        if (type == null) {
            throw new GraphValidationException("Dependency type is required");
        }
        DependencyKey key = new DependencyKey(sourceId, targetId, type).normalized();

        if (key.isSelfReference()) {
            logger.debug("Rejected self-referencing dependency {}", key);
            if (type.family().isChecked()) {
                throw GraphOperationException.cycle(sourceId, targetId, type.value());
            }
            throw new GraphValidationException("An element cannot depend on itself",
                    Map.of("elementId", sourceId, "type", type.value()));
        }
        if (type == DependencyType.AWAITS) {
            validateGate(metadata);
        }

        Element source = requireLive(sourceId);
        requireLive(targetId);
        String createdBy = actor != null ? actor : source.createdBy();
        Dependency dependency = new Dependency(key.sourceId(), key.targetId(), type, metadata, createdBy,
                Instant.now(clock));

        lock.writeLock().lock();
        try {
            if (index.contains(key)) {
                logger.debug("Rejected duplicate dependency {}", key);
                throw GraphOperationException.duplicate(key.sourceId(), key.targetId(), type.value());
            }
            if (type.family().isChecked()
                    && CycleDetector.wouldCreateCycle(id -> index.successors(id, type.family()),
                    key.sourceId(), key.targetId())) {
                logger.debug("Rejected dependency {}: would create a cycle", key);
                throw GraphOperationException.cycle(key.sourceId(), key.targetId(), type.value());
            }
            persistence.insert(dependency);
            index.add(dependency);
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Dependency added {} -> {} ({})", dependency.sourceId(), dependency.targetId(), type.value());
        publish(dependency.sourceId(), GraphEventType.DEPENDENCY_ADDED, createdBy, null, describe(dependency));
        return dependency;
    }

    @Override
    public void removeDependency(String sourceId, String targetId, DependencyType type, String actor) {
        requireId(sourceId, "sourceId");
        requireId(targetId, "targetId");
        if (type == null) {
            throw new GraphValidationException("Dependency type is required");
        }
        DependencyKey key = new DependencyKey(sourceId, targetId, type).normalized();

        Dependency removed;
        lock.writeLock().lock();
        try {
            removed = index.get(key);
            if (removed == null) {
                throw new GraphOperationException(ErrorCode.NOT_FOUND,
                        "Dependency not found: " + key,
                        Map.of("sourceId", key.sourceId(), "targetId", key.targetId(), "type", type.value()));
            }
            persistence.delete(key);
            index.remove(key);
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Dependency removed {} -> {} ({})", removed.sourceId(), removed.targetId(), type.value());
        publish(removed.sourceId(), GraphEventType.DEPENDENCY_REMOVED, actor != null ? actor : removed.createdBy(),
                describe(removed), null);
    }

    @Override
    public Dependency satisfyGate(String sourceId, String targetId, String actor) {
        return updateGate(sourceId, targetId, actor, AwaitsGate::markSatisfied);
    }

    @Override
    public Dependency recordApproval(String sourceId, String targetId, String approverId, String actor) {
        requireId(approverId, "approverId");
        return updateGate(sourceId, targetId, actor, gate -> gate.withApproval(approverId));
    }

    private Dependency updateGate(String sourceId, String targetId, String actor, UnaryOperator<AwaitsGate> change) {
        requireId(sourceId, "sourceId");
        requireId(targetId, "targetId");
        DependencyKey key = new DependencyKey(sourceId, targetId, DependencyType.AWAITS);

        Dependency before;
        Dependency after;
        lock.writeLock().lock();
        try {
            before = index.get(key);
            if (before == null) {
                throw new GraphOperationException(ErrorCode.NOT_FOUND,
                        "Dependency not found: " + key,
                        Map.of("sourceId", sourceId, "targetId", targetId, "type", DependencyType.AWAITS.value()));
            }
            AwaitsGate gate = AwaitsGate.fromMetadata(before.metadata())
                    .orElseThrow(() -> new GraphValidationException("Dependency carries no gate: " + key));
            AwaitsGate updated;
            try {
                updated = change.apply(gate);
            } catch (IllegalArgumentException e) {
                throw new GraphValidationException(e.getMessage(), Map.of("gateType", gate.gateType().value()));
            }
            Map<String, Object> metadata = new LinkedHashMap<>(before.metadata());
            metadata.putAll(updated.toMetadata());
            after = new Dependency(before.sourceId(), before.targetId(), before.type(), metadata,
                    before.createdBy(), before.createdAt());
            persistence.update(after);
            index.replace(after);
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Gate updated on {}", key);
        publish(sourceId, GraphEventType.GATE_UPDATED, actor, before.metadata(), after.metadata());
        return after;
    }

    @Override
    public List<Dependency> getOutgoing(String elementId, Set<DependencyType> types) {
        lock.readLock().lock();
        try {
            return filter(index.outgoing(elementId), types);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Dependency> getIncoming(String elementId, Set<DependencyType> types) {
        lock.readLock().lock();
        try {
            return filter(index.incoming(elementId), types);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Dependency> getDependency(String sourceId, String targetId, DependencyType type) {
        DependencyKey key = new DependencyKey(sourceId, targetId, type).normalized();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(index.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Dependency> getRelatedTo(String elementId) {
        Set<DependencyType> relatesTo = Set.of(DependencyType.RELATES_TO);
        lock.readLock().lock();
        try {
            List<Dependency> result = new ArrayList<>(filter(index.outgoing(elementId), relatesTo));
            result.addAll(filter(index.incoming(elementId), relatesTo));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Dependency> removeAllForElement(String elementId, String actor) {
        requireId(elementId, "elementId");
        List<Dependency> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Set<Dependency> touching = new LinkedHashSet<>(index.outgoing(elementId));
            touching.addAll(index.incoming(elementId));
            for (Dependency dependency : touching) {
                persistence.delete(dependency.key());
                index.remove(dependency.key());
                removed.add(dependency);
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (!removed.isEmpty()) {
            logger.info("Removed {} dependencies of {}", removed.size(), elementId);
        }
        for (Dependency dependency : removed) {
            publish(dependency.sourceId(), GraphEventType.DEPENDENCY_REMOVED,
                    actor != null ? actor : dependency.createdBy(), describe(dependency), null);
        }
        return removed;
    }

    @Override
    public List<Dependency> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(index.all());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void reload() {
        List<Dependency> stored = persistence.loadAll();
        lock.writeLock().lock();
        try {
            index.clear();
            for (Dependency dependency : stored) {
                index.add(dependency);
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Dependency index loaded with {} edges", stored.size());
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Element requireLive(String elementId) {
        Optional<Element> element = elementStore.findById(elementId);
        if (element.isEmpty() || element.get().isDeleted()) {
            logger.debug("Rejected dependency: element {} not found", elementId);
            throw GraphOperationException.notFound("Element not found: " + elementId, elementId);
        }
        return element.get();
    }

    private static void validateGate(Map<String, Object> metadata) {
        try {
            AwaitsGate.fromMetadata(metadata);
        } catch (IllegalArgumentException e) {
            throw new GraphValidationException("Invalid awaits gate: " + e.getMessage(),
                    Map.of("type", DependencyType.AWAITS.value()));
        }
    }

    private static void requireId(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new GraphValidationException(field + " is required", Map.of("field", field));
        }
    }

    private static List<Dependency> filter(List<Dependency> edges, Set<DependencyType> types) {
        if (types == null || types.isEmpty()) {
            return List.copyOf(edges);
        }
        List<Dependency> result = new ArrayList<>();
        for (Dependency edge : edges) {
            if (types.contains(edge.type())) {
                result.add(edge);
            }
        }
        return result;
    }

    private static Map<String, Object> describe(Dependency dependency) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("sourceId", dependency.sourceId());
        value.put("targetId", dependency.targetId());
        value.put("type", dependency.type().value());
        if (!dependency.metadata().isEmpty()) {
            value.put("metadata", dependency.metadata());
        }
        return value;
    }

    private void publish(String elementId, GraphEventType type, String actor,
                         Map<String, Object> oldValue, Map<String, Object> newValue) {
        try {
            eventPublisher.publish(new GraphEvent(elementId, type, actor, oldValue, newValue, Instant.now(clock)));
        } catch (RuntimeException e) {
            logger.warn("Failed to publish {} event for {}: {}", type.value(), elementId, e.getMessage());
        }
    }
}
