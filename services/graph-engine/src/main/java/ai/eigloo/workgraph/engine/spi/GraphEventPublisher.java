package ai.eigloo.workgraph.engine.spi;

import ai.eigloo.workgraph.graph.event.GraphEvent;

/**
 * Receives audit events for committed mutations. Fire-and-forget: implementations must not
 * expect the caller to react to delivery failures.
 */
@FunctionalInterface
public interface GraphEventPublisher {

    void publish(GraphEvent event);

    static GraphEventPublisher noop() {
        return event -> {
        };
    }
}
