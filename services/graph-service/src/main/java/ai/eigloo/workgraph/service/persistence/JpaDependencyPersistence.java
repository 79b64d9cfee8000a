package ai.eigloo.workgraph.service.persistence;

import ai.eigloo.workgraph.engine.spi.DependencyPersistence;
import ai.eigloo.workgraph.graph.entity.DependencyEntity;
import ai.eigloo.workgraph.graph.exception.GraphPersistenceException;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyKey;
import ai.eigloo.workgraph.graph.repository.DependencyRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link DependencyPersistence} over the {@code dependencies} table. Edge metadata is stored
 * as JSON text.
 */
@Service
public class JpaDependencyPersistence implements DependencyPersistence {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final DependencyRepository dependencyRepository;
    private final ObjectMapper objectMapper;

    public JpaDependencyPersistence(DependencyRepository dependencyRepository, ObjectMapper objectMapper) {
        this.dependencyRepository = dependencyRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void insert(Dependency dependency) {
        DependencyEntity entity = new DependencyEntity(
                UUID.randomUUID().toString(),
                dependency.sourceId(),
                dependency.targetId(),
                dependency.type(),
                writeMetadata(dependency),
                dependency.createdBy(),
                dependency.createdAt());
        try {
            dependencyRepository.saveAndFlush(entity);
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to insert dependency " + dependency.key() + ": "
                    + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public void update(Dependency dependency) {
        try {
            DependencyEntity entity = dependencyRepository.findBySourceIdAndTargetIdAndDependencyType(
                            dependency.sourceId(), dependency.targetId(), dependency.type())
                    .orElseThrow(() -> new GraphPersistenceException("Dependency row missing: " + dependency.key()));
            entity.setMetadata(writeMetadata(dependency));
            dependencyRepository.save(entity);
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to update dependency " + dependency.key() + ": "
                    + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public void delete(DependencyKey key) {
        try {
            dependencyRepository.deleteBySourceIdAndTargetIdAndDependencyType(key.sourceId(), key.targetId(),
                    key.type());
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to delete dependency " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Dependency> loadAll() {
        try {
            return dependencyRepository.findAll().stream().map(this::toDomain).toList();
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to load dependencies: " + e.getMessage(), e);
        }
    }

    private Dependency toDomain(DependencyEntity entity) {
        return new Dependency(entity.getSourceId(), entity.getTargetId(), entity.getDependencyType(),
                readMetadata(entity), entity.getCreatedBy(), entity.getCreatedAt());
    }

    private String writeMetadata(Dependency dependency) {
        if (dependency.metadata().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(dependency.metadata());
        } catch (JsonProcessingException e) {
            throw new GraphPersistenceException("Cannot serialize metadata of " + dependency.key(), e);
        }
    }

    private Map<String, Object> readMetadata(DependencyEntity entity) {
        if (entity.getMetadata() == null || entity.getMetadata().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(entity.getMetadata(), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new GraphPersistenceException("Unreadable metadata on dependency " + entity.getId(), e);
        }
    }
}
