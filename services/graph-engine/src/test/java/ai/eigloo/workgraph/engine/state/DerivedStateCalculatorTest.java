package ai.eigloo.workgraph.engine.state;

import ai.eigloo.workgraph.engine.spi.GraphEventPublisher;
import ai.eigloo.workgraph.engine.support.EngineFixture;
import ai.eigloo.workgraph.graph.event.GraphEvent;
import ai.eigloo.workgraph.graph.event.GraphEventType;
import ai.eigloo.workgraph.graph.exception.ErrorCode;
import ai.eigloo.workgraph.graph.exception.GraphOperationException;
import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.AwaitsGate;
import ai.eigloo.workgraph.graph.model.DependencyType;
import ai.eigloo.workgraph.graph.model.Plan;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.TaskStatus;
import ai.eigloo.workgraph.graph.model.Workflow;
import ai.eigloo.workgraph.graph.model.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DerivedStateCalculatorTest {

    private EngineFixture fixture;
    private DerivedStateCalculator calculator;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        calculator = fixture.state;
    }

    @Test
    void blockerKeepsDependentOutOfReadyUntilClosed() {
        fixture.task("t1");
        fixture.task("t2");
        fixture.graph.addDependency("t1", "t2", DependencyType.BLOCKS);

        assertThat(ids(calculator.ready())).containsExactly("t1");
        assertThat(calculator.blocked()).singleElement().satisfies(blocked -> {
            assertThat(blocked.task().id()).isEqualTo("t2");
            assertThat(blocked.blockedBy()).isEqualTo("t1");
        });

        calculator.recordStatusChange("t1", TaskStatus.CLOSED, "alice");

        assertThat(ids(calculator.ready())).containsExactly("t2");
        assertThat(calculator.blocked()).isEmpty();
    }

    @Test
    void cancelledAndDeletedBlockersResolve() {
        fixture.task("t1");
        fixture.task("t2");
        fixture.task("t3");
        fixture.task("t4");
        fixture.graph.addDependency("t1", "t2", DependencyType.BLOCKS);
        fixture.graph.addDependency("t3", "t4", DependencyType.BLOCKS);

        fixture.elements.save(fixture.task("t1").withStatus(TaskStatus.CANCELLED));
        fixture.elements.save(fixture.task("t3").withDeletedAt(EngineFixture.NOW));

        assertThat(ids(calculator.ready())).containsExactly("t2", "t4");
    }

    @Test
    void associativeEdgesNeverBlock() {
        fixture.task("t1");
        fixture.task("t2");
        fixture.graph.addDependency("t1", "t2", DependencyType.REFERENCES);
        fixture.graph.addDependency("t1", "t2", DependencyType.CAUSED_BY);

        assertThat(ids(calculator.ready())).containsExactlyInAnyOrder("t1", "t2");
    }

    @Test
    void ungatedAwaitsBehavesLikeBlocks() {
        fixture.task("t1");
        fixture.task("t2");
        fixture.graph.addDependency("t1", "t2", DependencyType.AWAITS);

        assertThat(calculator.isBlocked("t2")).isTrue();
        assertThat(calculator.blockingState("t2")).hasValueSatisfying(
                blocked -> assertThat(blocked.reason()).contains("awaits"));
    }

    @Test
    void timerGateOpensAtWaitUntil() {
        fixture.task("t1");
        fixture.task("t2");
        Instant opensAt = EngineFixture.NOW.plus(Duration.ofHours(1));
        fixture.graph.addDependency("t1", "t2", DependencyType.AWAITS, AwaitsGate.timer(opensAt).toMetadata(), "a");
        fixture.elements.save(fixture.task("t1").withStatus(TaskStatus.CLOSED));

        assertThat(calculator.blockingState("t2")).hasValueSatisfying(
                blocked -> assertThat(blocked.reason()).contains("timer"));

        DerivedStateCalculator later = new DerivedStateCalculator(fixture.elements, fixture.graph,
                GraphEventPublisher.noop(), Clock.fixed(opensAt, ZoneOffset.UTC));
        assertThat(later.isBlocked("t2")).isFalse();
        assertThat(ids(later.ready())).containsExactly("t2");
    }

    @Test
    void gateDoesNotOverrideOpenSource() {
        fixture.task("t1");
        fixture.task("t2");
        fixture.graph.addDependency("t1", "t2", DependencyType.AWAITS,
                AwaitsGate.external("ci", "build-1", true).toMetadata(), "a");

        assertThat(calculator.isBlocked("t2")).isTrue();

        calculator.recordStatusChange("t1", TaskStatus.CLOSED, "a");

        assertThat(calculator.isBlocked("t2")).isFalse();
    }

    @Test
    void approvalGateNeedsEnoughApprovers() {
        fixture.task("t1");
        fixture.task("t2");
        fixture.elements.save(fixture.task("t1").withStatus(TaskStatus.CLOSED));
        fixture.graph.addDependency("t1", "t2", DependencyType.AWAITS,
                AwaitsGate.approval(List.of("alice", "bob"), null, null).toMetadata(), "a");

        fixture.graph.recordApproval("t1", "t2", "alice", "alice");
        assertThat(calculator.isBlocked("t2")).isTrue();

        fixture.graph.recordApproval("t1", "t2", "bob", "bob");
        assertThat(calculator.isBlocked("t2")).isFalse();
    }

    @Test
    void ephemeralWorkflowTasksAreHiddenByDefault() {
        fixture.task("t1");
        fixture.task("t2");
        Workflow wisp = new Workflow("wfl-w", "Wisp", WorkflowStatus.PENDING, true, null, Map.of(), Set.of(),
                "tester", null, null, null);
        fixture.containment.createWorkflow(wisp, List.of("t1"), "tester");

        assertThat(ids(calculator.ready())).containsExactly("t2");
        assertThat(ids(calculator.ready(ReadyQuery.defaults().withEphemeral()))).containsExactly("t1", "t2");
        assertThat(ids(calculator.getReadyTasksInWorkflow("wfl-w"))).containsExactly("t1");
    }

    @Test
    void futureScheduledTasksAreNeitherReadyNorBlocked() {
        fixture.elements.save(fixture.task("t1").withScheduledFor(EngineFixture.NOW.plusSeconds(60)));
        fixture.elements.save(fixture.task("t2").withScheduledFor(EngineFixture.NOW.minusSeconds(60)));

        assertThat(ids(calculator.ready())).containsExactly("t2");
        assertThat(calculator.blocked()).isEmpty();
    }

    @Test
    void readyIsSortedByPriorityThenAgeAndLimited() {
        fixture.task("late-high", 1, EngineFixture.NOW.plusSeconds(10));
        fixture.task("early-high", 1, EngineFixture.NOW);
        fixture.task("low", 5, EngineFixture.NOW.minusSeconds(100));
        fixture.task("mid", 3, EngineFixture.NOW);

        assertThat(ids(calculator.ready())).containsExactly("early-high", "late-high", "mid", "low");
        assertThat(ids(calculator.ready(ReadyQuery.defaults().withLimit(2)))).containsExactly("early-high", "late-high");
    }

    @Test
    void terminalTasksAreNotReady() {
        fixture.elements.save(fixture.task("done").withStatus(TaskStatus.CLOSED));
        fixture.elements.save(fixture.task("busy").withStatus(TaskStatus.IN_PROGRESS));

        assertThat(ids(calculator.ready())).containsExactly("busy");
    }

    @Test
    void planProgressCountsMembers() {
        fixture.task("a");
        fixture.task("b");
        fixture.task("c");
        fixture.task("d");
        fixture.containment.createPlan(Plan.draft("pln-1", "Release", "tester"), List.of("a", "b", "c", "d"), "tester");
        fixture.graph.addDependency("d", "c", DependencyType.BLOCKS);
        fixture.elements.save(fixture.task("a").withStatus(TaskStatus.CLOSED));
        fixture.elements.save(fixture.task("b").withStatus(TaskStatus.CANCELLED));
        fixture.elements.save(fixture.task("d").withStatus(TaskStatus.IN_PROGRESS));

        Progress progress = calculator.getPlanProgress("pln-1");

        assertThat(progress.total()).isEqualTo(4);
        assertThat(progress.closed()).isEqualTo(1);
        assertThat(progress.cancelled()).isEqualTo(1);
        assertThat(progress.open()).isEqualTo(1);
        assertThat(progress.inProgress()).isEqualTo(1);
        assertThat(progress.blockedTasks()).isEqualTo(1);
        assertThat(progress.readyTasks()).isEqualTo(1);
        assertThat(progress.percentComplete()).isEqualTo(33);
    }

    @Test
    void percentCompleteIsZeroWhenEverythingIsCancelled() {
        assertThat(Progress.percentComplete(2, 0, 2)).isZero();
        assertThat(Progress.percentComplete(0, 0, 0)).isZero();
        assertThat(Progress.percentComplete(3, 2, 0)).isEqualTo(67);
    }

    @Test
    void progressOfUnknownOrWrongContainer() {
        fixture.task("t1");

        GraphOperationException missing = catchThrowableOfType(
                () -> calculator.getPlanProgress("pln-none"), GraphOperationException.class);
        assertThat(missing.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> calculator.getWorkflowProgress("t1")).isInstanceOf(GraphValidationException.class);
    }

    @Test
    void statusChangeEmitsAutoUnblockAndAutoBlock() {
        fixture.task("t1");
        fixture.task("t2");
        fixture.task("t3");
        fixture.task("t4");
        fixture.graph.addDependency("t1", "t2", DependencyType.BLOCKS);
        fixture.graph.addDependency("t1", "t3", DependencyType.BLOCKS);
        fixture.graph.addDependency("t4", "t3", DependencyType.BLOCKS);
        fixture.events.clear();

        calculator.recordStatusChange("t1", TaskStatus.CLOSED, "alice");

        List<GraphEvent> unblocked = fixture.events.ofType(GraphEventType.AUTO_UNBLOCKED);
        assertThat(unblocked).singleElement().satisfies(event -> {
            assertThat(event.elementId()).isEqualTo("t2");
            assertThat(event.newValue()).containsEntry("causedBy", "t1");
        });

        calculator.recordStatusChange("t1", TaskStatus.OPEN, "alice");

        assertThat(fixture.events.ofType(GraphEventType.AUTO_BLOCKED)).singleElement()
                .satisfies(event -> assertThat(event.elementId()).isEqualTo("t2"));
    }

    @Test
    void statusChangeOfDeletedTaskIsNotFound() {
        fixture.elements.save(fixture.task("t1").withDeletedAt(EngineFixture.NOW));

        GraphOperationException error = catchThrowableOfType(
                () -> calculator.recordStatusChange("t1", TaskStatus.CLOSED, "alice"), GraphOperationException.class);

        assertThat(error.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }
}
