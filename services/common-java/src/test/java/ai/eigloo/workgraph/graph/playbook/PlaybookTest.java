package ai.eigloo.workgraph.graph.playbook;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlaybookTest {

    @Test
    void shouldKeepStepOrderAndDefaultTitle() {
        Playbook playbook = Playbook.of("release", List.of(
                PlaybookStep.of("build", "Build"),
                PlaybookStep.of("test", "Test").withDependsOn("build")), List.of());

        assertThat(playbook.title()).isEqualTo("release");
        assertThat(playbook.steps()).extracting(PlaybookStep::id).containsExactly("build", "test");
        assertThat(playbook.findStep("test"))
                .hasValueSatisfying(step -> assertThat(step.dependsOn()).containsExactly("build"));
    }

    @Test
    void shouldAllowEmptyStepList() {
        Playbook playbook = Playbook.of("empty", List.of(), List.of());

        assertThat(playbook.steps()).isEmpty();
    }

    @Test
    void shouldRejectDuplicateStepIds() {
        assertThatThrownBy(() -> Playbook.of("dup", List.of(
                PlaybookStep.of("a", "A"),
                PlaybookStep.of("a", "Again")), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate step id");
    }

    @Test
    void shouldRejectDependsOnUnknownStep() {
        assertThatThrownBy(() -> Playbook.of("bad", List.of(
                PlaybookStep.of("a", "A").withDependsOn("missing")), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldRejectDuplicateVariables() {
        assertThatThrownBy(() -> Playbook.of("vars", List.of(PlaybookStep.of("a", "A")), List.of(
                PlaybookVariable.required("env", VariableType.STRING),
                PlaybookVariable.optional("env", VariableType.STRING, "dev"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("env");
    }

    @Test
    void stepConditionShouldTreatBlankAsAbsent() {
        assertThat(PlaybookStep.of("a", "A").withCondition("  ").hasCondition()).isFalse();
        assertThat(PlaybookStep.of("a", "A").withCondition("{{x}}").hasCondition()).isTrue();
    }
}
