package ai.eigloo.workgraph.engine.cycle;

import ai.eigloo.workgraph.graph.model.AcyclicityFamily;
import ai.eigloo.workgraph.graph.model.Dependency;
import ai.eigloo.workgraph.graph.model.DependencyType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class CycleDetectorTest {

    private static Dependency edge(String source, String target, DependencyType type) {
        return Dependency.of(source, target, type, "tester");
    }

    @Test
    void detectsClosingEdgeOfChain() {
        List<Dependency> edges = List.of(
                edge("a", "b", DependencyType.BLOCKS),
                edge("b", "c", DependencyType.AWAITS));

        assertThat(CycleDetector.wouldCreateCycle(edges, AcyclicityFamily.SCHEDULING, "c", "a")).isTrue();
        assertThat(CycleDetector.wouldCreateCycle(edges, AcyclicityFamily.SCHEDULING, "a", "c")).isFalse();
    }

    @Test
    void selfLoopIsACycle() {
        assertThat(CycleDetector.wouldCreateCycle(List.of(), AcyclicityFamily.SCHEDULING, "a", "a")).isTrue();
    }

    @Test
    void familiesAreCheckedIndependently() {
        List<Dependency> edges = List.of(
                edge("a", "b", DependencyType.BLOCKS),
                edge("b", "c", DependencyType.PARENT_CHILD));

        assertThat(CycleDetector.wouldCreateCycle(edges, AcyclicityFamily.SCHEDULING, "c", "a")).isFalse();
        assertThat(CycleDetector.wouldCreateCycle(edges, AcyclicityFamily.CONTAINMENT, "c", "b")).isTrue();
    }

    @Test
    void isReachableFollowsSuccessors() {
        Map<String, List<String>> graph = Map.of("a", List.of("b"), "b", List.of("c"), "c", List.of());

        assertThat(CycleDetector.isReachable(id -> graph.getOrDefault(id, List.of()), "a", "c")).isTrue();
        assertThat(CycleDetector.isReachable(id -> graph.getOrDefault(id, List.of()), "c", "a")).isFalse();
    }

    @Test
    void findCycleReturnsPathWithRepeatedStart() {
        List<Dependency> edges = List.of(
                edge("a", "b", DependencyType.BLOCKS),
                edge("b", "c", DependencyType.BLOCKS),
                edge("c", "a", DependencyType.BLOCKS),
                edge("x", "a", DependencyType.BLOCKS));

        Optional<List<String>> cycle = CycleDetector.findCycle(edges, AcyclicityFamily.SCHEDULING);

        assertThat(cycle).isPresent();
        List<String> path = cycle.get();
        assertThat(path.get(0)).isEqualTo(path.get(path.size() - 1));
        assertThat(path).hasSize(4).containsAll(List.of("a", "b", "c"));
    }

    @Test
    void findCycleIgnoresOtherFamilies() {
        List<Dependency> edges = List.of(
                edge("a", "b", DependencyType.RELATES_TO),
                edge("b", "a", DependencyType.REFERENCES),
                edge("a", "b", DependencyType.BLOCKS));

        assertThat(CycleDetector.findCycle(edges, AcyclicityFamily.SCHEDULING)).isEmpty();
    }

    @Test
    void randomlyGrownGraphsStayAcyclic() {
        Random random = new Random(42);
        for (int round = 0; round < 50; round++) {
            List<Dependency> accepted = new ArrayList<>();
            Map<String, List<String>> successors = new HashMap<>();
            for (int attempt = 0; attempt < 60; attempt++) {
                String source = "n" + random.nextInt(12);
                String target = "n" + random.nextInt(12);
                if (CycleDetector.wouldCreateCycle(
                        id -> successors.getOrDefault(id, List.of()), source, target)) {
                    continue;
                }
                accepted.add(edge(source, target, DependencyType.BLOCKS));
                successors.computeIfAbsent(source, key -> new ArrayList<>()).add(target);
            }
            assertThat(CycleDetector.findCycle(accepted, AcyclicityFamily.SCHEDULING))
                    .as("round %d", round)
                    .isEmpty();
        }
    }

    @Test
    void reportingCycleDetection() {
        Map<String, String> reportsTo = new HashMap<>();
        reportsTo.put("b", "a");
        reportsTo.put("c", "b");

        assertThat(CycleDetector.wouldCreateReportingCycle("a", "c", reportsTo::get, 100)).isTrue();
        assertThat(CycleDetector.wouldCreateReportingCycle("d", "c", reportsTo::get, 100)).isFalse();
        assertThat(CycleDetector.wouldCreateReportingCycle("a", "a", reportsTo::get, 100)).isTrue();
    }

    @Test
    void reportingWalkTerminatesOnStoredCycle() {
        Map<String, String> reportsTo = Map.of("x", "y", "y", "x");

        assertThat(CycleDetector.wouldCreateReportingCycle("a", "x", reportsTo::get, 100)).isFalse();
    }
}
