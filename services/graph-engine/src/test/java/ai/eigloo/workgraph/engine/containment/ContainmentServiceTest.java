package ai.eigloo.workgraph.engine.containment;

import ai.eigloo.workgraph.engine.support.EngineFixture;
import ai.eigloo.workgraph.graph.event.GraphEventType;
import ai.eigloo.workgraph.graph.exception.ErrorCode;
import ai.eigloo.workgraph.graph.exception.GraphOperationException;
import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.DependencyType;
import ai.eigloo.workgraph.graph.model.Plan;
import ai.eigloo.workgraph.graph.model.PlanStatus;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.Workflow;
import ai.eigloo.workgraph.graph.model.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ContainmentServiceTest {

    private EngineFixture fixture;
    private ContainmentService containment;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        containment = fixture.containment;
        fixture.task("t1");
        fixture.task("t2");
        fixture.task("t3");
    }

    @Test
    void createPlanLinksInitialTasks() {
        containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of("t1", "t2"), "tester");

        assertThat(ids(containment.getTasksInPlan("pln-1"))).containsExactly("t1", "t2");
        assertThat(fixture.graph.getIncoming("pln-1", Set.of(DependencyType.PARENT_CHILD))).hasSize(2);
    }

    @Test
    void containerNeedsAtLeastOneTask() {
        assertThatThrownBy(() -> containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of(), "tester"))
                .isInstanceOf(GraphValidationException.class);
        assertThat(fixture.elements.findById("pln-1")).isEmpty();
    }

    @Test
    void createRollsBackWhenATaskIsMissing() {
        GraphOperationException error = catchThrowableOfType(
                () -> containment.createWorkflow(workflow("wfl-1"), List.of("t1", "missing"), "tester"),
                GraphOperationException.class);

        assertThat(error.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(fixture.elements.findById("wfl-1")).isEmpty();
        assertThat(fixture.graph.size()).isZero();
    }

    @Test
    void existingContainerIdIsRejected() {
        containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of("t1"), "tester");

        GraphOperationException error = catchThrowableOfType(
                () -> containment.createPlan(Plan.draft("pln-1", "Again", "tester"), List.of("t2"), "tester"),
                GraphOperationException.class);

        assertThat(error.getErrorCode()).isEqualTo(ErrorCode.ALREADY_EXISTS);
    }

    @Test
    void taskBelongsToAtMostOneContainer() {
        containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of("t1"), "tester");
        containment.createWorkflow(workflow("wfl-1"), List.of("t2"), "tester");

        GraphOperationException error = catchThrowableOfType(
                () -> containment.addTaskToWorkflow("t1", "wfl-1", "tester"), GraphOperationException.class);

        assertThat(error.getErrorCode()).isEqualTo(ErrorCode.ALREADY_EXISTS);
        assertThat(error.getDetails()).containsEntry("containerId", "pln-1");
    }

    @Test
    void addTaskEmitsEvent() {
        containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of("t1"), "tester");

        containment.addTaskToPlan("t2", "pln-1", "alice");

        assertThat(ids(containment.getTasksInPlan("pln-1"))).containsExactly("t1", "t2");
        assertThat(fixture.events.ofType(GraphEventType.TASK_ADDED_TO_CONTAINER)).singleElement()
                .satisfies(event -> assertThat(event.newValue()).containsEntry("taskId", "t2"));
    }

    @Test
    void closedPlanDoesNotAcceptTasks() {
        containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of("t1"), "tester");
        fixture.elements.save(((Plan) fixture.elements.findById("pln-1").orElseThrow())
                .withStatus(PlanStatus.COMPLETED));

        assertThatThrownBy(() -> containment.addTaskToPlan("t2", "pln-1", "alice"))
                .isInstanceOf(GraphValidationException.class);
    }

    @Test
    void lastLiveTaskCannotBeRemoved() {
        containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of("t1", "t2"), "tester");

        containment.removeTaskFromPlan("t1", "pln-1", "alice");

        assertThatThrownBy(() -> containment.removeTaskFromPlan("t2", "pln-1", "alice"))
                .isInstanceOf(GraphValidationException.class)
                .hasMessageContaining("last task");
        assertThat(ids(containment.getTasksInPlan("pln-1"))).containsExactly("t2");
        assertThat(fixture.events.ofType(GraphEventType.TASK_REMOVED_FROM_CONTAINER)).hasSize(1);
    }

    @Test
    void softDeletedMembersDoNotCountAsLive() {
        containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of("t1", "t2"), "tester");
        fixture.elements.save(fixture.task("t1").withDeletedAt(EngineFixture.NOW));

        assertThat(ids(containment.getTasksInPlan("pln-1"))).containsExactly("t2");
        assertThatThrownBy(() -> containment.removeTaskFromPlan("t2", "pln-1", "alice"))
                .isInstanceOf(GraphValidationException.class);
        containment.removeTaskFromPlan("t1", "pln-1", "alice");
    }

    @Test
    void removingNonMemberIsNotFound() {
        containment.createPlan(Plan.draft("pln-1", "Launch", "tester"), List.of("t1"), "tester");

        GraphOperationException error = catchThrowableOfType(
                () -> containment.removeTaskFromPlan("t3", "pln-1", "alice"), GraphOperationException.class);

        assertThat(error.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
    }

    private static Workflow workflow(String id) {
        return new Workflow(id, "Flow " + id, WorkflowStatus.PENDING, false, null, Map.of(), Set.of(), "tester",
                null, null, null);
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }
}
