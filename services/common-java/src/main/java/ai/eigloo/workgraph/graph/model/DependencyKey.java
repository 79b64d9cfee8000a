package ai.eigloo.workgraph.graph.model;

/**
 * Identity of an edge: at most one edge exists per key.
 *
 * @param sourceId The source element id
 * @param targetId The target element id
 * @param type The dependency type
 */
public record DependencyKey(String sourceId, String targetId, DependencyType type) {

    public DependencyKey {
        if (sourceId == null || sourceId.trim().isEmpty()) {
            throw new IllegalArgumentException("Source id cannot be null or empty");
        }
        if (targetId == null || targetId.trim().isEmpty()) {
            throw new IllegalArgumentException("Target id cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Dependency type cannot be null");
        }
    }

    /**
     * Returns the stored form of this key. {@code relates-to} keys are reordered so the
     * lexicographically smaller id is the source; all other keys are returned as is.
     */
    public DependencyKey normalized() {
        if (type.isBidirectional() && sourceId.compareTo(targetId) > 0) {
            return new DependencyKey(targetId, sourceId, type);
        }
        return this;
    }

    public boolean isSelfReference() {
        return sourceId.equals(targetId);
    }

    @Override
    public String toString() {
        return sourceId + " -[" + type.value() + "]-> " + targetId;
    }
}
