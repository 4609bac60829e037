package io.diagramsessions.server.core;

import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.EdgeTypeHint;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.ShapeTypeHint;
import io.diagramsessions.core.TypeHint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.diagramsessions.server.core.TestDiagrams.FLOW;
import static io.diagramsessions.server.core.TestDiagrams.LANE;
import static io.diagramsessions.server.core.TestDiagrams.TASK;
import static io.diagramsessions.server.core.TestDiagrams.root;
import static io.diagramsessions.server.core.TestDiagrams.shape;
import static io.diagramsessions.server.core.TestDiagrams.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeHintGateTest {

    private static final Map<String, TypeHint> HINTS = Map.of("task", TASK, "lane", LANE, "flow", FLOW);

    @Test
    void rootWithoutHintAcceptsAnything() {
        ModelIndex index = ModelIndex.of(root(task("t1")));
        TypeHintGate gate = new TypeHintGate(HINTS, index);

        assertThat(gate.accepts(index.root(), "lane")).isTrue();
        assertThat(gate.accepts(index.require("t1"), "lane")).isFalse();
    }

    @Test
    void hintedRootUsesItsContainableList() {
        ModelElement model = ModelElement.root("board", "root").withChild(task("t1"));
        ModelIndex index = ModelIndex.of(model);
        Map<String, TypeHint> hints = Map.of("task", TASK, "lane", LANE, "board",
                new ShapeTypeHint("board", false, false, false, false, List.of("lane")));
        TypeHintGate gate = new TypeHintGate(hints, index);

        assertThat(gate.allowsCreateNode("lane", index.root())).isTrue();
        assertThat(gate.allowsCreateNode("task", index.root())).isFalse();
    }

    @Test
    void typesWithoutHintsAreNeitherCreatableNorModifiable() {
        ModelIndex index = ModelIndex.of(root(shape("cloud", "c1")));
        TypeHintGate gate = new TypeHintGate(HINTS, index);

        assertThat(gate.allowsCreateNode("cloud", index.root())).isFalse();
        assertThat(gate.allowsDelete(index.require("c1"))).isFalse();
        assertThat(gate.allowsChangeBounds(index.require("c1"), true, false)).isFalse();
        assertThatThrownBy(() -> gate.checkChangeContainer(index.require("c1"), index.root()))
                .isInstanceOf(DiagramSessionsException.OperationNotPermitted.class)
                .hasMessageContaining("cloud");
    }

    @Test
    void emptyEndpointListsAllowAnyType() {
        ModelIndex index = ModelIndex.of(root(task("t1"), shape("lane", "l1")));
        Map<String, TypeHint> hints = Map.of("link",
                new EdgeTypeHint("link", false, true, false, List.of(), List.of()));
        TypeHintGate gate = new TypeHintGate(hints, index);

        assertThat(gate.allowsCreateConnection("link", index.require("t1"), index.require("l1"))).isTrue();
        assertThat(gate.allowsCreateConnection("link", index.root(), index.require("l1"))).isFalse();
    }
}
