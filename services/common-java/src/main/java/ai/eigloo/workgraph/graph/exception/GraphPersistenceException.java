package ai.eigloo.workgraph.graph.exception;

/**
 * Infrastructure failure raised by a storage adapter. Not a graph rule violation.
 */
public class GraphPersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GraphPersistenceException(String message) {
        super(message);
    }

    public GraphPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
