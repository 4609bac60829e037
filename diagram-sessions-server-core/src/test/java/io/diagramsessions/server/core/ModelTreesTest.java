package io.diagramsessions.server.core;

import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.Dimension;
import io.diagramsessions.core.ElementAndAlignment;
import io.diagramsessions.core.ElementAndBounds;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.Point;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.diagramsessions.server.core.TestDiagrams.childIds;
import static io.diagramsessions.server.core.TestDiagrams.flow;
import static io.diagramsessions.server.core.TestDiagrams.root;
import static io.diagramsessions.server.core.TestDiagrams.shape;
import static io.diagramsessions.server.core.TestDiagrams.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelTreesTest {

    @Test
    void removalCascadesThroughEdgesOnEdges() {
        // e2 connects to the edge e1, so removing t1 orphans e1 and then e2
        ModelElement model = root(task("t1"), task("t2"), flow("e1", "t1", "t2"), flow("e2", "e1", "t2"));

        ModelElement pruned = ModelTrees.removeAll(model, Set.of("t1"));

        assertThat(childIds(pruned)).containsExactly("t2");
    }

    @Test
    void removingANestedContainerTakesItsSubtree() {
        ModelElement model = root(shape("lane", "l1", task("t1")), task("t2"), flow("e1", "t1", "t2"));

        assertThat(childIds(ModelTrees.removeAll(model, Set.of("l1")))).containsExactly("t2");
    }

    @Test
    void untouchedTreesAreReturnedAsIs() {
        ModelElement model = root(task("t1"));

        assertThat(ModelTrees.removeAll(model, Set.of("x"))).isSameAs(model);
        assertThat(ModelTrees.replace(model, "x", e -> e.withPosition(Point.ORIGIN))).isSameAs(model);
        assertThat(ModelTrees.mergeLayout(model, List.of(), List.of())).isSameAs(model);
    }

    @Test
    void mergeLayoutAppliesBoundsAndAlignmentsAndIgnoresUnknownIds() {
        ModelElement model = root(shape("lane", "l1", task("t1")));

        ModelElement merged = ModelTrees.mergeLayout(model,
                List.of(new ElementAndBounds("t1", new Point(4, 5), new Dimension(10, 20)),
                        new ElementAndBounds("gone", Point.ORIGIN, null)),
                List.of(new ElementAndAlignment("t1", new Point(1, 2))));

        ModelElement t1 = merged.children().get(0).children().get(0);
        assertThat(t1.position()).isEqualTo(new Point(4, 5));
        assertThat(t1.size()).isEqualTo(new Dimension(10, 20));
        assertThat(t1.alignment()).isEqualTo(new Point(1, 2));
    }

    @Test
    void indexRejectsDuplicateIdsAndDanglingEdges() {
        assertThatThrownBy(() -> ModelIndex.of(root(task("t1"), shape("lane", "l1", task("t1")))))
                .isInstanceOf(DiagramSessionsException.InvalidElementReference.class)
                .hasMessageContaining("duplicate element id: t1");
        assertThatThrownBy(() -> ModelIndex.of(root(task("t1"), flow("e1", "t1", "t9"))))
                .isInstanceOf(DiagramSessionsException.InvalidElementReference.class)
                .hasMessageContaining("e1");
    }

    @Test
    void indexAnswersAncestry() {
        ModelIndex index = ModelIndex.of(root(shape("lane", "l1", shape("lane", "l2", task("t1")))));

        assertThat(index.isSelfOrAncestor("l1", "t1")).isTrue();
        assertThat(index.isSelfOrAncestor("t1", "l1")).isFalse();
        assertThat(index.parent("t1")).map(ModelElement::id).contains("l2");
        assertThat(index.parent("root")).isEmpty();
    }
}
