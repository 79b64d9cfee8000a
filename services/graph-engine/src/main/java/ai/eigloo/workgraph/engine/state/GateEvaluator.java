package ai.eigloo.workgraph.engine.state;

import ai.eigloo.workgraph.graph.model.AwaitsGate;

import java.time.Clock;
import java.time.Instant;

/**
 * Decides whether an awaits gate has opened, reading time from the injected clock.
 */
public class GateEvaluator {

    private final Clock clock;

    public GateEvaluator(Clock clock) {
        this.clock = clock;
    }

    public boolean isSatisfied(AwaitsGate gate) {
        return switch (gate.gateType()) {
            case TIMER -> !Instant.now(clock).isBefore(gate.waitUntil());
            case APPROVAL -> gate.currentApprovers().size() >= gate.requiredApprovalCount();
            case EXTERNAL, WEBHOOK -> gate.satisfied();
        };
    }
}
