package ai.eigloo.workgraph.engine.hierarchy;

import ai.eigloo.workgraph.engine.spi.ElementStore;
import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.engine.state.DerivedStateCalculator;
import ai.eigloo.workgraph.engine.state.ReportingCycleCheck;
import ai.eigloo.workgraph.graph.event.GraphEvent;
import ai.eigloo.workgraph.graph.event.GraphEventType;
import ai.eigloo.workgraph.graph.exception.GraphOperationException;
import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.Element;
import ai.eigloo.workgraph.graph.model.ElementType;
import ai.eigloo.workgraph.graph.model.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maintains the {@code reportsTo} management tree between entities.
 */
public class HierarchyService {

    private static final Logger logger = LoggerFactory.getLogger(HierarchyService.class);

    private final ElementStore elementStore;
    private final DerivedStateCalculator stateCalculator;
    private final GraphEventPublisher eventPublisher;
    private final Clock clock;
    private final ReentrantLock reportingLock = new ReentrantLock();

    public HierarchyService(ElementStore elementStore,
                            DerivedStateCalculator stateCalculator,
                            GraphEventPublisher eventPublisher,
                            Clock clock) {
        this.elementStore = elementStore;
        this.stateCalculator = stateCalculator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Makes {@code managerId} the manager of {@code entityId}.
     *
     * @throws GraphValidationException on self-assignment or when the assignment would close a cycle
     * @throws GraphOperationException with {@code NOT_FOUND} when either entity is unknown
     */
    public Entity assignManager(String entityId, String managerId, String actor) {
        if (entityId == null || managerId == null) {
            throw new GraphValidationException("Entity id and manager id are required");
        }
        if (entityId.equals(managerId)) {
            throw new GraphValidationException("An entity cannot manage itself", Map.of("entityId", entityId));
        }
        Entity entity;
        Entity updated;
        reportingLock.lock();
        try {
            entity = requireEntity(entityId);
            requireEntity(managerId);

            ReportingCycleCheck check = detectReportingCycle(entityId, managerId);
            if (check.hasCycle()) {
                logger.debug("Rejected manager {} for {}: reporting cycle", managerId, entityId);
                throw new GraphValidationException("Assigning " + managerId + " as manager of " + entityId
                        + " would create a reporting cycle", Map.of("entityId", entityId, "managerId", managerId));
            }

            updated = entity.withReportsTo(managerId);
            elementStore.save(updated);
        } finally {
            reportingLock.unlock();
        }
        logger.info("Entity {} now reports to {}", entityId, managerId);
        publish(entityId, GraphEventType.MANAGER_ASSIGNED, actor, entity.reportsTo(), managerId);
        return updated;
    }

    public Entity clearManager(String entityId, String actor) {
        Entity entity;
        Entity updated;
        reportingLock.lock();
        try {
            entity = requireEntity(entityId);
            if (entity.reportsTo() == null) {
                return entity;
            }
            updated = entity.withReportsTo(null);
            elementStore.save(updated);
        } finally {
            reportingLock.unlock();
        }
        logger.info("Entity {} no longer reports to {}", entityId, entity.reportsTo());
        publish(entityId, GraphEventType.MANAGER_CLEARED, actor, entity.reportsTo(), null);
        return updated;
    }

    public List<Entity> getManagementChain(String entityId) {
        return stateCalculator.getManagementChain(requireEntity(entityId), this::findEntity);
    }

    public ReportingCycleCheck detectReportingCycle(String entityId, String proposedManagerId) {
        return stateCalculator.detectReportingCycle(entityId, proposedManagerId, this::findEntity);
    }

    /**
     * Live entities whose manager is {@code managerId}.
     */
    public List<Entity> getDirectReports(String managerId) {
        requireEntity(managerId);
        List<Entity> reports = new ArrayList<>();
        for (Element element : elementStore.findAll(ElementType.ENTITY)) {
            if (element instanceof Entity entity && !entity.isDeleted() && managerId.equals(entity.reportsTo())) {
                reports.add(entity);
            }
        }
        return reports;
    }

    private Optional<Entity> findEntity(String id) {
        return elementStore.findById(id).filter(Entity.class::isInstance).map(Entity.class::cast);
    }

    private Entity requireEntity(String entityId) {
        Element element = elementStore.findById(entityId)
                .filter(found -> !found.isDeleted())
                .orElseThrow(() -> GraphOperationException.notFound("Entity not found: " + entityId, entityId));
        if (!(element instanceof Entity entity)) {
            throw new GraphValidationException("Element " + entityId + " is a " + element.type().value()
                    + ", not an entity", Map.of("elementId", entityId));
        }
        return entity;
    }

    private void publish(String entityId, GraphEventType type, String actor, String oldManager, String newManager) {
        Map<String, Object> oldValue = new HashMap<>();
        oldValue.put("reportsTo", oldManager);
        Map<String, Object> newValue = new HashMap<>();
        newValue.put("reportsTo", newManager);
        try {
            eventPublisher.publish(new GraphEvent(entityId, type, actor, oldValue, newValue, Instant.now(clock)));
        } catch (RuntimeException e) {
            logger.warn("Failed to publish {} event for {}: {}", type.value(), entityId, e.getMessage());
        }
    }
}
