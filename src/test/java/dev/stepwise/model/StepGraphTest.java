package dev.stepwise.model;

import dev.stepwise.error.DependencyException;
import dev.stepwise.error.DuplicateIdException;
import dev.stepwise.error.GraphSealedException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepGraphTest {

    private static StepNode node(String id, String output, String... dependencies) {
        return new StepNode(id, "simplify", "rule-" + id, "in", output,
            Explanation.of("explained"), List.of(dependencies), Map.of());
    }

    @Test
    void startsEmptyAndUnsealed() {
        var graph = StepGraph.empty();

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.isSealed()).isFalse();
        assertThat(graph.lastNode()).isEmpty();
        assertThat(graph.finalOutput()).isEmpty();
    }

    @Test
    void keepsAppendOrder() {
        var graph = StepGraph.empty();
        graph.append(node("step_001", "a"));
        graph.append(node("step_002", "b", "step_001"));
        graph.append(node("step_003", "c", "step_002"));

        assertThat(graph.nodes()).extracting(StepNode::id).containsExactly("step_001", "step_002", "step_003");
        assertThat(graph.size()).isEqualTo(3);
        assertThat(graph.finalOutput()).contains("c");
        assertThat(graph.contains("step_002")).isTrue();
        assertThat(graph.node("step_002")).map(StepNode::output).contains("b");
    }

    @Test
    void rejectsForwardReference() {
        var graph = StepGraph.empty();
        graph.append(node("step_001", "a"));

        assertThatThrownBy(() -> graph.append(node("step_002", "b", "step_003")))
            .isInstanceOfSatisfying(DependencyException.class, e -> {
                assertThat(e.nodeId()).isEqualTo("step_002");
                assertThat(e.missingId()).isEqualTo("step_003");
            });
        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    void rejectsDuplicateId() {
        var graph = StepGraph.empty();
        graph.append(node("step_001", "a"));

        assertThatThrownBy(() -> graph.append(node("step_001", "b")))
            .isInstanceOf(DuplicateIdException.class);
    }

    @Test
    void sealedGraphRejectsAppend() {
        var graph = StepGraph.empty();
        graph.append(node("step_001", "a"));
        graph.seal();

        assertThat(graph.isSealed()).isTrue();
        assertThatThrownBy(() -> graph.append(node("step_002", "b", "step_001")))
            .isInstanceOf(GraphSealedException.class);
    }

    @Test
    void sealingTwiceIsHarmless() {
        var graph = StepGraph.empty();
        graph.seal();
        graph.seal();

        assertThat(graph.isSealed()).isTrue();
    }

    @Test
    void nodeListIsReadOnly() {
        var graph = StepGraph.empty();
        graph.append(node("step_001", "a"));

        assertThatThrownBy(() -> graph.nodes().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void viewCannotBeUsedToAppend() {
        var graph = StepGraph.empty();
        graph.append(node("step_001", "a"));

        StepHistory view = graph.view();

        assertThat(view).isNotInstanceOf(StepGraph.class);
        assertThat(view.size()).isEqualTo(1);
        assertThat(view.lastNode()).map(StepNode::id).contains("step_001");
    }

    @Test
    void nodeIsImmutableAfterConstruction() {
        var dependencies = new ArrayList<>(List.of("step_001"));
        var metadata = new HashMap<String, Object>(Map.of("tag", "power"));
        var node = new StepNode("step_002", "simplify", "r", "in", "out",
            Explanation.of("e"), dependencies, metadata);

        dependencies.add("step_999");
        metadata.put("tag", "changed");

        assertThat(node.dependencies()).containsExactly("step_001");
        assertThat(node.metadata()).containsEntry("tag", "power");
        assertThatThrownBy(() -> node.dependencies().add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> node.metadata().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nodeRequiresIdOperationAndRule() {
        assertThatThrownBy(() -> new StepNode(" ", "op", "r", "i", "o", Explanation.of("e"), null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("id");
        assertThatThrownBy(() -> new StepNode("id", "op", "", "i", "o", Explanation.of("e"), null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("rule");
    }

    @Test
    void duplicateDependenciesCollapse() {
        var node = new StepNode("s", "op", "r", "i", "o", Explanation.of("e"), List.of("a", "b", "a"), null);

        assertThat(node.dependencies()).containsExactly("a", "b");
    }
}
