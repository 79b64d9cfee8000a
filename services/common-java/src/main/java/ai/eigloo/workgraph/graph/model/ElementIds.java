package ai.eigloo.workgraph.graph.model;

import java.security.SecureRandom;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Element id generation and parsing.
 *
 * <p>Ids look like {@code tsk-0a1b2c3d4e}: the type prefix, a dash and ten lowercase
 * base-36 characters. Poured tasks get hierarchical ids {@code <workflowId>.<n>}.</p>
 */
public final class ElementIds {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 10;
    private static final Pattern ROOT_ID = Pattern.compile("^[a-z]{3}-[0-9a-z]{" + RANDOM_LENGTH + "}$");
    private static final Pattern CHILD_ID = Pattern.compile("^[a-z]{3}-[0-9a-z]{" + RANDOM_LENGTH + "}(\\.[1-9][0-9]*)+$");
    private static final Random RANDOM = new SecureRandom();

    private ElementIds() {
    }

    public static String generate(ElementType type) {
        return generate(type, RANDOM);
    }

    public static String generate(ElementType type, Random random) {
        if (type == null) {
            throw new IllegalArgumentException("Element type cannot be null");
        }
        StringBuilder builder = new StringBuilder(type.idPrefix().length() + 1 + RANDOM_LENGTH);
        builder.append(type.idPrefix()).append('-');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }

    /**
     * Returns the hierarchical id of the {@code index}-th child (1-based) of {@code parentId}.
     */
    public static String childId(String parentId, int index) {
        if (parentId == null || parentId.isEmpty()) {
            throw new IllegalArgumentException("Parent id cannot be null or empty");
        }
        if (index < 1) {
            throw new IllegalArgumentException("Child index must be positive, got " + index);
        }
        return parentId + "." + index;
    }

    public static boolean isValid(String id) {
        return id != null && (ROOT_ID.matcher(id).matches() || CHILD_ID.matcher(id).matches());
    }

    /**
     * Returns the parent id of a hierarchical id, or null for a root id.
     */
    public static String parentOf(String id) {
        if (id == null) {
            return null;
        }
        int dot = id.lastIndexOf('.');
        return dot < 0 ? null : id.substring(0, dot);
    }
}
