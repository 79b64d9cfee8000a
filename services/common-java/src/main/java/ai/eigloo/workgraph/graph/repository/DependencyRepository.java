package ai.eigloo.workgraph.graph.repository;

import ai.eigloo.workgraph.graph.entity.DependencyEntity;
import ai.eigloo.workgraph.graph.model.DependencyType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for DependencyEntity operations.
 */
@Repository
public interface DependencyRepository extends JpaRepository<DependencyEntity, String> {

    Optional<DependencyEntity> findBySourceIdAndTargetIdAndDependencyType(
            String sourceId, String targetId, DependencyType dependencyType);

    boolean existsBySourceIdAndTargetIdAndDependencyType(
            String sourceId, String targetId, DependencyType dependencyType);

    List<DependencyEntity> findBySourceId(String sourceId);

    List<DependencyEntity> findByTargetId(String targetId);

    List<DependencyEntity> findByTargetIdAndDependencyType(String targetId, DependencyType dependencyType);

    /**
     * Delete one edge by its identifying triple.
     */
    long deleteBySourceIdAndTargetIdAndDependencyType(
            String sourceId, String targetId, DependencyType dependencyType);
}
