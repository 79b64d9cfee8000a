package ai.eigloo.workgraph.graph.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowStatusTest {

    @Test
    void canTransitionTo_shouldAllowDeclaredWorkflowTransitions() {
        assertTrue(WorkflowStatus.PENDING.canTransitionTo(WorkflowStatus.PENDING));
        assertTrue(WorkflowStatus.PENDING.canTransitionTo(WorkflowStatus.RUNNING));
        assertTrue(WorkflowStatus.PENDING.canTransitionTo(WorkflowStatus.FAILED));
        assertTrue(WorkflowStatus.PENDING.canTransitionTo(WorkflowStatus.CANCELLED));

        assertTrue(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.COMPLETED));
        assertTrue(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.FAILED));
        assertTrue(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.CANCELLED));
    }

    @Test
    void canTransitionTo_shouldRejectIllegalWorkflowTransitions() {
        assertFalse(WorkflowStatus.PENDING.canTransitionTo(WorkflowStatus.COMPLETED));
        assertFalse(WorkflowStatus.COMPLETED.canTransitionTo(WorkflowStatus.RUNNING));
        assertFalse(WorkflowStatus.FAILED.canTransitionTo(WorkflowStatus.RUNNING));
        assertFalse(WorkflowStatus.CANCELLED.canTransitionTo(WorkflowStatus.PENDING));
        assertFalse(WorkflowStatus.RUNNING.canTransitionTo(null));
    }

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertFalse(WorkflowStatus.PENDING.isTerminal());
        assertFalse(WorkflowStatus.RUNNING.isTerminal());
        assertTrue(WorkflowStatus.COMPLETED.isTerminal());
        assertTrue(WorkflowStatus.FAILED.isTerminal());
        assertTrue(WorkflowStatus.CANCELLED.isTerminal());
    }

    @Test
    void fromValue_shouldParseWireValues() {
        assertEquals(WorkflowStatus.RUNNING, WorkflowStatus.fromValue("running"));
        assertEquals(TaskStatus.IN_PROGRESS, TaskStatus.fromValue(" IN_PROGRESS "));
        assertEquals(PlanStatus.DRAFT, PlanStatus.fromValue("draft"));
        assertThrows(IllegalArgumentException.class, () -> WorkflowStatus.fromValue("paused"));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromValue(null));
    }

    @Test
    void planStatus_shouldOnlyAcceptTasksWhileDraftOrActive() {
        assertTrue(PlanStatus.DRAFT.acceptsTasks());
        assertTrue(PlanStatus.ACTIVE.acceptsTasks());
        assertFalse(PlanStatus.COMPLETED.acceptsTasks());
        assertFalse(PlanStatus.CANCELLED.acceptsTasks());
    }
}
