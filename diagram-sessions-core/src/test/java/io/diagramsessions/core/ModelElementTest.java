package io.diagramsessions.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelElementTest {

    @Test
    void withersLeaveTheOriginalUntouched() {
        ModelElement task = ModelElement.node("task", "t1", Point.ORIGIN);

        ModelElement labelled = task.withProperty(Protocol.PROPERTY_TEXT, "Review");

        assertThat(task.property(Protocol.PROPERTY_TEXT)).isEmpty();
        assertThat(labelled.property(Protocol.PROPERTY_TEXT)).contains("Review");
        assertThat(labelled.withProperty(Protocol.PROPERTY_TEXT, null)).isEqualTo(task);
    }

    @Test
    void boundsNeedPositionAndSize() {
        ModelElement task = ModelElement.node("task", "t1", new Point(3, 4));

        assertThat(task.bounds()).isEmpty();
        assertThat(task.withSize(new Dimension(10, 5)).bounds()).contains(new Bounds(3, 4, 10, 5));
    }

    @Test
    void edgesAreElementsWithBothEndpoints() {
        assertThat(ModelElement.edge("flow", "e1", "a", "b").isEdge()).isTrue();
        assertThat(ModelElement.emptyRoot().isEdge()).isFalse();
        assertThat(ModelElement.emptyRoot().id()).isEqualTo(Protocol.DEFAULT_ROOT_ID);
        assertThatThrownBy(() -> ModelElement.edge("flow", "e1", null, "b")).isInstanceOf(NullPointerException.class);
    }

    @Test
    void childrenAreCopied() {
        ModelElement root = ModelElement.emptyRoot().withChild(ModelElement.node("task", "t1", Point.ORIGIN));

        assertThat(root.children()).extracting(ModelElement::id).containsExactly("t1");
        assertThatThrownBy(() -> root.children().add(ModelElement.emptyRoot()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void negativeExtentsAreRejected() {
        assertThatThrownBy(() -> new Bounds(0, 0, -1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Dimension(-1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void operationLabelDefaultsToItsId() {
        OperationDescriptor delete = new OperationDescriptor("delete", null, null, OperationKind.DELETE, false);

        assertThat(delete.label()).isEqualTo("delete");
        assertThat(delete.withActive(false)).isSameAs(delete);
        assertThat(delete.withActive(true).active()).isTrue();
    }
}
