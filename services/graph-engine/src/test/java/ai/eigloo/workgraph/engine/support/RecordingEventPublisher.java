package ai.eigloo.workgraph.engine.support;

import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.graph.event.GraphEvent;
import ai.eigloo.workgraph.graph.event.GraphEventType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingEventPublisher implements GraphEventPublisher {

    private final List<GraphEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(GraphEvent event) {
        events.add(event);
    }

    public List<GraphEvent> events() {
        return events;
    }

    public List<GraphEvent> ofType(GraphEventType type) {
        return events.stream().filter(event -> event.eventType() == type).toList();
    }

    public void clear() {
        events.clear();
    }
}
