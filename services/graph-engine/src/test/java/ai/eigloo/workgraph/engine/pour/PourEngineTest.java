package ai.eigloo.workgraph.engine.pour;

import ai.eigloo.workgraph.graph.exception.GraphValidationException;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyType;
import ai.eigloo.workgraph.graph.model.ElementIds;
import ai.eigloo.workgraph.graph.model.ElementType;
import ai.eigloo.workgraph.graph.model.Task;
import ai.eigloo.workgraph.graph.model.TaskStatus;
import ai.eigloo.workgraph.graph.model.WorkflowStatus;
import ai.eigloo.workgraph.graph.playbook.Playbook;
import ai.eigloo.workgraph.graph.playbook.PlaybookStep;
import ai.eigloo.workgraph.graph.playbook.PlaybookVariable;
import ai.eigloo.workgraph.graph.playbook.VariableType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PourEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final PourEngine engine = new PourEngine(CLOCK, new Random(7));

    private static Playbook releasePlaybook() {
        PlaybookStep build = new PlaybookStep("build", "Build {{service}}", "Build {{service}} at {{version}}",
                "{{builder}}", 2, Set.of("ci"), List.of(), null);
        PlaybookStep docs = PlaybookStep.of("docs", "Write docs for {{service}}")
                .withDependsOn("build")
                .withCondition("{{write_docs}}");
        PlaybookStep deploy = PlaybookStep.of("deploy", "Deploy {{service}} to {{env}}")
                .withDependsOn("build", "docs");
        return new Playbook("tem-release", "release", "Release {{service}} {{version}}",
                List.of(build, docs, deploy),
                List.of(PlaybookVariable.required("service", VariableType.STRING),
                        PlaybookVariable.optional("version", VariableType.NUMBER, 1),
                        PlaybookVariable.optional("env", VariableType.STRING, "staging"),
                        PlaybookVariable.optional("write_docs", VariableType.BOOLEAN, false),
                        PlaybookVariable.optional("builder", VariableType.STRING, "")));
    }

    @Test
    void titleRenderingEmptyFallsBackToPlaybookName() {
        Playbook untitled = new Playbook("tem-hotfix", "hotfix", "{{project}}",
                List.of(PlaybookStep.of("patch", "Patch it")), List.of());

        PourResult rendered = engine.pour(untitled, Map.of(), "alice", PourOptions.defaults());
        PourResult overridden = engine.pour(untitled, Map.of("project", "core"), "alice",
                PourOptions.defaults().withTitle(" "));

        assertThat(rendered.workflow().title()).isEqualTo("hotfix");
        assertThat(overridden.workflow().title()).isEqualTo("hotfix");
        assertThat(rendered.taskList()).extracting(Task::title).containsExactly("Patch it");
    }

    @Test
    void pourSkipsFilteredStepsAndRewiresOrdering() {
        PourResult result = engine.pour(releasePlaybook(), Map.of("service", "billing"), "alice",
                PourOptions.defaults());

        String workflowId = result.workflow().id();
        assertThat(ElementIds.isValid(workflowId)).isTrue();
        assertThat(workflowId).startsWith(ElementType.WORKFLOW.idPrefix() + "-");
        assertThat(result.workflow().title()).isEqualTo("Release billing 1");
        assertThat(result.workflow().status()).isEqualTo(WorkflowStatus.PENDING);
        assertThat(result.workflow().ephemeral()).isFalse();
        assertThat(result.workflow().playbookId()).isEqualTo("tem-release");
        assertThat(result.skippedSteps()).containsExactly("docs");

        List<Task> tasks = result.taskList();
        assertThat(tasks).extracting(Task::id).containsExactly(workflowId + ".1", workflowId + ".2");
        assertThat(tasks).extracting(Task::title).containsExactly("Build billing", "Deploy billing to staging");
        assertThat(tasks).allSatisfy(task -> {
            assertThat(task.status()).isEqualTo(TaskStatus.OPEN);
            assertThat(task.createdBy()).isEqualTo("alice");
            assertThat(task.createdAt()).isEqualTo(NOW);
        });
        Task build = tasks.get(0);
        assertThat(build.priority()).isEqualTo(2);
        assertThat(build.assignee()).isNull();
        assertThat(build.description()).isEqualTo("Build billing at 1");
        assertThat(build.tags()).containsExactly("ci");
        assertThat(result.tasks()).extracting(CreatedTask::stepId).containsExactly("build", "deploy");

        assertThat(result.blocksDependencies()).singleElement().satisfies(edge -> {
            assertThat(edge.sourceId()).isEqualTo(workflowId + ".1");
            assertThat(edge.targetId()).isEqualTo(workflowId + ".2");
            assertThat(edge.type()).isEqualTo(DependencyType.BLOCKS);
        });
        assertThat(result.parentChildDependencies())
                .extracting(Dependency::targetId)
                .containsOnly(workflowId);
        assertThat(result.parentChildDependencies()).hasSize(2);
    }

    @Test
    void includedConditionalStepKeepsFullOrdering() {
        PourResult result = engine.pour(releasePlaybook(),
                Map.of("service", "billing", "write_docs", "true", "builder", "ci-bot"), "alice",
                PourOptions.ephemeralPour().withTitle("Hotfix"));

        assertThat(result.tasks()).hasSize(3);
        assertThat(result.skippedSteps()).isEmpty();
        assertThat(result.blocksDependencies()).hasSize(3);
        assertThat(result.workflow().ephemeral()).isTrue();
        assertThat(result.workflow().title()).isEqualTo("Hotfix");
        assertThat(result.taskList().get(0).assignee()).isEqualTo("ci-bot");
        assertThat(result.resolvedVariables()).containsEntry("write_docs", true);
    }

    @Test
    void samePourInputsWithSameSeedAreDeterministic() {
        PourResult first = new PourEngine(CLOCK, new Random(11)).pour(releasePlaybook(),
                Map.of("service", "billing"), "alice", null);
        PourResult second = new PourEngine(CLOCK, new Random(11)).pour(releasePlaybook(),
                Map.of("service", "billing"), "alice", null);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void emptyPlaybookIsRejected() {
        Playbook empty = Playbook.of("empty", List.of(), List.of());

        assertThatThrownBy(() -> engine.pour(empty, Map.of(), "alice", null))
                .isInstanceOf(GraphValidationException.class)
                .hasMessage("Playbook empty has no steps defined");
    }

    @Test
    void allStepsFilteredIsRejected() {
        Playbook gated = Playbook.of("gated",
                List.of(PlaybookStep.of("only", "Only").withCondition("{{enabled}}")),
                List.of(PlaybookVariable.optional("enabled", VariableType.BOOLEAN, false)));

        assertThatThrownBy(() -> engine.pour(gated, Map.of(), "alice", null))
                .isInstanceOf(GraphValidationException.class)
                .hasMessageContaining("were filtered by conditions");
    }

    @Test
    void missingRequiredVariableIsRejected() {
        assertThatThrownBy(() -> engine.pour(releasePlaybook(), Map.of(), "alice", null))
                .isInstanceOf(GraphValidationException.class)
                .hasMessageContaining("service");
    }

    @Test
    void validatePourCollectsIssuesWithoutThrowing() {
        Playbook broken = Playbook.of("broken",
                List.of(PlaybookStep.of("a", "Title {{oops"),
                        PlaybookStep.of("b", "B").withCondition("{{flag}} = 1")),
                List.of(PlaybookVariable.required("name", VariableType.STRING)));

        PourValidation validation = engine.validatePour(broken, Map.of());

        assertThat(validation.valid()).isFalse();
        assertThat(validation.issues()).hasSize(3);
        assertThat(validation.includedSteps()).containsExactly("a");
    }

    @Test
    void validatePourReportsSkippedSteps() {
        PourValidation validation = engine.validatePour(releasePlaybook(), Map.of("service", "billing"));

        assertThat(validation.valid()).isTrue();
        assertThat(validation.includedSteps()).containsExactly("build", "deploy");
        assertThat(validation.skippedSteps()).containsExactly("docs");
        assertThat(validation.resolvedVariables()).containsEntry("env", "staging");
    }
}
