package ai.eigloo.workgraph.graph.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure of a graph mutation or query. The graph is left in its prior state.
 */
public class GraphOperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public GraphOperationException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    public GraphOperationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        if (errorCode == null) {
            throw new IllegalArgumentException("Error code cannot be null");
        }
        this.errorCode = errorCode;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static GraphOperationException notFound(String message, String elementId) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (elementId != null) {
            details.put("elementId", elementId);
        }
        return new GraphOperationException(ErrorCode.NOT_FOUND, message, details);
    }

    public static GraphOperationException duplicate(String sourceId, String targetId, String type) {
        return new GraphOperationException(ErrorCode.DUPLICATE_DEPENDENCY,
                "Dependency already exists: " + sourceId + " -[" + type + "]-> " + targetId,
                Map.of("sourceId", sourceId, "targetId", targetId, "type", type));
    }

    public static GraphOperationException cycle(String sourceId, String targetId, String type) {
        return new GraphOperationException(ErrorCode.CYCLE_DETECTED,
                "Adding " + sourceId + " -[" + type + "]-> " + targetId + " would create a cycle",
                Map.of("sourceId", sourceId, "targetId", targetId, "type", type));
    }

    public static GraphOperationException alreadyExists(String message, Map<String, Object> details) {
        return new GraphOperationException(ErrorCode.ALREADY_EXISTS, message, details);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "GraphOperationException{" +
                "errorCode=" + errorCode +
                ", message='" + getMessage() + '\'' +
                ", details=" + details +
                '}';
    }
}
