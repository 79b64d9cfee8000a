package ai.eigloo.workgraph.graph.repository;

import ai.eigloo.workgraph.graph.entity.ElementEntity;
import ai.eigloo.workgraph.graph.model.ElementType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for ElementEntity operations.
 */
@Repository
public interface ElementRepository extends JpaRepository<ElementEntity, String> {

    /**
     * Find all elements of a type, soft-deleted ones included.
     */
    List<ElementEntity> findByElementType(ElementType elementType);

    /**
     * Find live elements of a type.
     */
    List<ElementEntity> findByElementTypeAndDeletedAtIsNull(ElementType elementType);

    /**
     * Find elements of a type in a given stored status.
     */
    List<ElementEntity> findByElementTypeAndStatus(ElementType elementType, String status);
}
