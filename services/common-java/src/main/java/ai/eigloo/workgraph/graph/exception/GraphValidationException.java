package ai.eigloo.workgraph.graph.exception;

import java.util.Map;

/**
 * A {@link ErrorCode#VALIDATION_ERROR} failure: bad input or a violated state rule such as
 * removing the last task of a plan.
 */
public class GraphValidationException extends GraphOperationException {

    private static final long serialVersionUID = 1L;

    public GraphValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public GraphValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
