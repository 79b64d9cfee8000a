package ai.eigloo.workgraph.graph.entity;

import ai.eigloo.workgraph.graph.model.ElementType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Persisted element row. Type-specific fields live in the JSON {@code payload} column;
 * the columns that queries filter on are promoted.
 */
@Entity
@Table(name = "elements", indexes = {
        @Index(name = "idx_elements_type", columnList = "element_type"),
        @Index(name = "idx_elements_status", columnList = "status"),
        @Index(name = "idx_elements_deleted_at", columnList = "deleted_at")
})
public class ElementEntity {

    @Id
    @NotBlank
    @Size(max = 64)
    @Column(name = "id", length = 64, nullable = false)
    private String id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "element_type", length = 20, nullable = false)
    private ElementType elementType;

    @Size(max = 500)
    @Column(name = "title", length = 500)
    private String title;

    @Size(max = 32)
    @Column(name = "status", length = 32)
    private String status;

    @Size(max = 1000)
    @Column(name = "tags", length = 1000)
    private String tags;

    @Column(name = "payload", columnDefinition = "text")
    private String payload;

    @Size(max = 64)
    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public ElementEntity() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    public ElementEntity(String id, ElementType elementType, String title, String status) {
        this();
        this.id = id;
        this.elementType = elementType;
        this.title = title;
        this.status = status;
    }

    @PreUpdate
    protected void onUpdate() {
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public ElementType getElementType() {
        return elementType;
    }

    public void setElementType(ElementType elementType) {
        this.elementType = elementType;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getTags() {
        return tags;
    }

    public void setTags(String tags) {
        this.tags = tags;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
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

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }

    public void setDeletedAt(Instant deletedAt) {
        this.deletedAt = deletedAt;
    }

    @Override
    public String toString() {
        return "ElementEntity{" +
                "id='" + id + '\'' +
                ", elementType=" + elementType +
                ", title='" + title + '\'' +
                ", status='" + status + '\'' +
                ", deletedAt=" + deletedAt +
                '}';
    }
}
