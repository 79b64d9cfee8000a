package ai.eigloo.workgraph.graph.entity;

import ai.eigloo.workgraph.graph.model.DependencyType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Persisted dependency edge. The unique constraint backs the one-edge-per-triple rule.
 */
@Entity
@Table(name = "dependencies", indexes = {
        @Index(name = "idx_dependencies_source", columnList = "source_id, dependency_type"),
        @Index(name = "idx_dependencies_target", columnList = "target_id, dependency_type")
}, uniqueConstraints = {
        @UniqueConstraint(
                name = "uq_dependencies_triple",
                columnNames = {"source_id", "target_id", "dependency_type"})
})
public class DependencyEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @NotBlank
    @Size(max = 64)
    @Column(name = "source_id", nullable = false, length = 64)
    private String sourceId;

    @NotBlank
    @Size(max = 64)
    @Column(name = "target_id", nullable = false, length = 64)
    private String targetId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "dependency_type", nullable = false, length = 20)
    private DependencyType dependencyType;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Size(max = 64)
    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public DependencyEntity() {
        this.createdAt = Instant.now();
    }

    public DependencyEntity(
            String id,
            String sourceId,
            String targetId,
            DependencyType dependencyType,
            String metadata,
            String createdBy,
            Instant createdAt) {
        this.id = id;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.dependencyType = dependencyType;
        this.metadata = metadata;
        this.createdBy = createdBy;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public DependencyType getDependencyType() {
        return dependencyType;
    }

    public void setDependencyType(DependencyType dependencyType) {
        this.dependencyType = dependencyType;
    }

    public String getMetadata() {
        return metadata;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "DependencyEntity{" +
                "id='" + id + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", targetId='" + targetId + '\'' +
                ", dependencyType=" + dependencyType +
                '}';
    }
}
