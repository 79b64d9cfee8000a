package ai.eigloo.workgraph.service.persistence;

import ai.eigloo.workgraph.graph.entity.ElementEntity;
import ai.eigloo.workgraph.graph.exception.GraphPersistenceException;
import ai.eigloo.workgraph.graph.model.Element;
import ai.eigloo.workgraph.graph.model.Entity;
import ai.eigloo.workgraph.graph.model.EntityKind;
import ai.eigloo.workgraph.graph.model.GenericElement;
import ai.eigloo.workgraph.graph.model.Plan;
import ai.eigloo.workgraph.graph.model.PlanStatus;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.TaskStatus;
import ai.eigloo.workgraph.graph.model.Workflow;
import ai.eigloo.workgraph.graph.model.WorkflowStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Converts between domain elements and {@link ElementEntity} rows. Fields that queries do not
 * filter on travel in the JSON payload column.
 */
@Component
public class ElementMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ElementMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ElementEntity toEntity(Element element) {
        ElementEntity entity = new ElementEntity(element.id(), element.type(), null, null);
        Map<String, Object> payload = new LinkedHashMap<>();
        if (element instanceof Task task) {
            entity.setTitle(task.title());
            entity.setStatus(task.status().value());
            payload.put("description", task.description());
            payload.put("priority", task.priority());
            payload.put("assignee", task.assignee());
            payload.put("scheduledFor", task.scheduledFor() != null ? task.scheduledFor().toString() : null);
        } else if (element instanceof Plan plan) {
            entity.setTitle(plan.title());
            entity.setStatus(plan.status().value());
        } else if (element instanceof Workflow workflow) {
            entity.setTitle(workflow.title());
            entity.setStatus(workflow.status().value());
            payload.put("ephemeral", workflow.ephemeral());
            payload.put("playbookId", workflow.playbookId());
            payload.put("variables", workflow.variables());
        } else if (element instanceof Entity actor) {
            entity.setTitle(actor.name());
            payload.put("kind", actor.kind().value());
            payload.put("reportsTo", actor.reportsTo());
        } else if (element instanceof GenericElement generic) {
            payload.putAll(generic.payload());
        } else {
            throw new GraphPersistenceException("Unsupported element class: " + element.getClass().getName());
        }
        entity.setPayload(write(payload, element.id()));
        entity.setTags(write(new TreeSet<>(element.tags()), element.id()));
        entity.setCreatedBy(element.createdBy());
        entity.setCreatedAt(element.createdAt());
        entity.setUpdatedAt(element.updatedAt());
        entity.setDeletedAt(element.deletedAt());
        return entity;
    }

    public Element toDomain(ElementEntity entity) {
        Map<String, Object> payload = readPayload(entity);
        Set<String> tags = readTags(entity);
        return switch (entity.getElementType()) {
            case TASK -> new Task(
                    entity.getId(),
                    entity.getTitle(),
                    (String) payload.get("description"),
                    TaskStatus.fromValue(entity.getStatus()),
                    payload.get("priority") instanceof Number number ? number.intValue() : Task.DEFAULT_PRIORITY,
                    (String) payload.get("assignee"),
                    instant(payload.get("scheduledFor")),
                    tags,
                    entity.getCreatedBy(),
                    entity.getCreatedAt(),
                    entity.getUpdatedAt(),
                    entity.getDeletedAt());
            case PLAN -> new Plan(
                    entity.getId(),
                    entity.getTitle(),
                    PlanStatus.fromValue(entity.getStatus()),
                    tags,
                    entity.getCreatedBy(),
                    entity.getCreatedAt(),
                    entity.getUpdatedAt(),
                    entity.getDeletedAt());
            case WORKFLOW -> new Workflow(
                    entity.getId(),
                    entity.getTitle(),
                    WorkflowStatus.fromValue(entity.getStatus()),
                    Boolean.TRUE.equals(payload.get("ephemeral")),
                    (String) payload.get("playbookId"),
                    variables(payload.get("variables")),
                    tags,
                    entity.getCreatedBy(),
                    entity.getCreatedAt(),
                    entity.getUpdatedAt(),
                    entity.getDeletedAt());
            case ENTITY -> new Entity(
                    entity.getId(),
                    entity.getTitle(),
                    payload.get("kind") != null ? EntityKind.fromValue((String) payload.get("kind")) : null,
                    (String) payload.get("reportsTo"),
                    tags,
                    entity.getCreatedBy(),
                    entity.getCreatedAt(),
                    entity.getUpdatedAt(),
                    entity.getDeletedAt());
            default -> new GenericElement(
                    entity.getId(),
                    entity.getElementType(),
                    payload,
                    tags,
                    entity.getCreatedBy(),
                    entity.getCreatedAt(),
                    entity.getUpdatedAt(),
                    entity.getDeletedAt());
        };
    }

    private Map<String, Object> readPayload(ElementEntity entity) {
        if (entity.getPayload() == null || entity.getPayload().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(entity.getPayload(), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new GraphPersistenceException("Unreadable payload for element " + entity.getId(), e);
        }
    }

    private Set<String> readTags(ElementEntity entity) {
        if (entity.getTags() == null || entity.getTags().isBlank()) {
            return Set.of();
        }
        try {
            return Set.copyOf(objectMapper.readValue(entity.getTags(), TAGS_TYPE));
        } catch (JsonProcessingException e) {
            throw new GraphPersistenceException("Unreadable tags for element " + entity.getId(), e);
        }
    }

    private String write(Object value, String elementId) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GraphPersistenceException("Cannot serialize element " + elementId, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> variables(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static Instant instant(Object value) {
        return value instanceof String text ? Instant.parse(text) : null;
    }
}
