package ai.eigloo.workgraph.graph.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Closed set of dependency types with their acyclicity family and category.
 *
 * <p>For {@link #BLOCKS} and {@link #AWAITS} the source is the blocker and the target is the
 * blocked element. For {@link #PARENT_CHILD} the source is the child and the target the
 * container. {@link #RELATES_TO} is bidirectional and stored with the smaller id as source.</p>
 */
public enum DependencyType {
    BLOCKS("blocks", AcyclicityFamily.SCHEDULING, DependencyCategory.BLOCKING),
    AWAITS("awaits", AcyclicityFamily.SCHEDULING, DependencyCategory.BLOCKING),
    PARENT_CHILD("parent-child", AcyclicityFamily.CONTAINMENT, DependencyCategory.BLOCKING),
    RELATES_TO("relates-to", AcyclicityFamily.NONE, DependencyCategory.ASSOCIATIVE),
    REFERENCES("references", AcyclicityFamily.NONE, DependencyCategory.ASSOCIATIVE),
    SUPERSEDES("supersedes", AcyclicityFamily.NONE, DependencyCategory.ASSOCIATIVE),
    DUPLICATES("duplicates", AcyclicityFamily.NONE, DependencyCategory.ASSOCIATIVE),
    CAUSED_BY("caused-by", AcyclicityFamily.NONE, DependencyCategory.ASSOCIATIVE),
    VALIDATES("validates", AcyclicityFamily.NONE, DependencyCategory.ASSOCIATIVE),
    AUTHORED_BY("authored-by", AcyclicityFamily.NONE, DependencyCategory.ATTRIBUTION),
    ASSIGNED_TO("assigned-to", AcyclicityFamily.NONE, DependencyCategory.ATTRIBUTION),
    APPROVED_BY("approved-by", AcyclicityFamily.NONE, DependencyCategory.ATTRIBUTION),
    REPLIES_TO("replies-to", AcyclicityFamily.NONE, DependencyCategory.THREADING);

    private final String value;
    private final AcyclicityFamily family;
    private final DependencyCategory category;

    DependencyType(String value, AcyclicityFamily family, DependencyCategory category) {
        this.value = value;
        this.family = family;
        this.category = category;
    }

    public String value() {
        return value;
    }

    public AcyclicityFamily family() {
        return family;
    }

    public DependencyCategory category() {
        return category;
    }

    /**
     * Returns true for the types that hold up the readiness of their target task.
     */
    public boolean isScheduling() {
        return family == AcyclicityFamily.SCHEDULING;
    }

    public boolean isBidirectional() {
        return this == RELATES_TO;
    }

    /**
     * Returns the member types of a family, in declaration order.
     */
    public static Set<DependencyType> ofFamily(AcyclicityFamily family) {
        EnumSet<DependencyType> result = EnumSet.noneOf(DependencyType.class);
        for (DependencyType type : values()) {
            if (type.family == family) {
                result.add(type);
            }
        }
        return result;
    }

    public static DependencyType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Dependency type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DependencyType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown dependency type: " + value);
    }
}
