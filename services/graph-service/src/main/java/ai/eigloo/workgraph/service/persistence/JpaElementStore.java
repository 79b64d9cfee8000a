package ai.eigloo.workgraph.service.persistence;

import ai.eigloo.workgraph.engine.spi.ElementStore;
import ai.eigloo.workgraph.graph.exception.GraphPersistenceException;
import ai.eigloo.workgraph.graph.model.Element;
import ai.eigloo.workgraph.graph.model.ElementType;
import ai.eigloo.workgraph.graph.repository.ElementRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link ElementStore} over the {@code elements} table.
 */
@Service
public class JpaElementStore implements ElementStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaElementStore.class);

    private final ElementRepository elementRepository;
    private final ElementMapper elementMapper;

    public JpaElementStore(ElementRepository elementRepository, ElementMapper elementMapper) {
        this.elementRepository = elementRepository;
        this.elementMapper = elementMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Element> findById(String id) {
        try {
            return elementRepository.findById(id).map(elementMapper::toDomain);
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to load element " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Element> findAll(ElementType type) {
        try {
            return elementRepository.findByElementType(type).stream().map(elementMapper::toDomain).toList();
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to list " + type.value() + " elements: " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public Element save(Element element) {
        try {
            elementRepository.save(elementMapper.toEntity(element));
            logger.debug("Saved {} {}", element.type().value(), element.id());
            return element;
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to save element " + element.id() + ": " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public void hardDelete(String id) {
        try {
            if (elementRepository.existsById(id)) {
                elementRepository.deleteById(id);
                logger.debug("Hard-deleted element {}", id);
            }
        } catch (DataAccessException e) {
            throw new GraphPersistenceException("Failed to delete element " + id + ": " + e.getMessage(), e);
        }
    }
}
