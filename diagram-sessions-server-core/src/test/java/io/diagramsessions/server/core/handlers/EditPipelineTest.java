package io.diagramsessions.server.core.handlers;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.Dimension;
import io.diagramsessions.core.ElementAndBounds;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.Point;
import io.diagramsessions.core.Protocol;
import io.diagramsessions.core.Severity;
import io.diagramsessions.server.core.DiagramSessionsEngine;
import io.diagramsessions.server.spi.InMemoryModelPersistence;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.diagramsessions.server.core.TestDiagrams.childIds;
import static io.diagramsessions.server.core.TestDiagrams.engine;
import static io.diagramsessions.server.core.TestDiagrams.first;
import static io.diagramsessions.server.core.TestDiagrams.flow;
import static io.diagramsessions.server.core.TestDiagrams.locked;
import static io.diagramsessions.server.core.TestDiagrams.root;
import static io.diagramsessions.server.core.TestDiagrams.send;
import static io.diagramsessions.server.core.TestDiagrams.shape;
import static io.diagramsessions.server.core.TestDiagrams.snapshot;
import static io.diagramsessions.server.core.TestDiagrams.stored;
import static io.diagramsessions.server.core.TestDiagrams.task;
import static org.assertj.core.api.Assertions.assertThat;

class EditPipelineTest {

    private static DiagramSessionsEngine loaded(ModelElement root) {
        DiagramSessionsEngine engine = engine(stored(root)).build();
        send(engine, Action.RequestModel.create());
        return engine;
    }

    private static ModelElement updated(List<Action> out) {
        return first(out, Action.UpdateModel.class).newRoot();
    }

    private static String error(List<Action> out) {
        Action.ServerStatus status = first(out, Action.ServerStatus.class);
        assertThat(status.severity()).isEqualTo(Severity.ERROR);
        return status.message();
    }

    @Test
    void deleteCascadesToAttachedEdges() {
        DiagramSessionsEngine engine = loaded(root(task("t1"), task("t2"), task("t3"), flow("e1", "t1", "t2"), flow("e2", "t2", "t3")));

        ModelElement root = updated(send(engine, new Action.DeleteElement(List.of("t1"))));

        assertThat(childIds(root)).containsExactly("t2", "t3", "e2");
    }

    @Test
    void deleteWithoutIdsRemovesTheSelection() {
        DiagramSessionsEngine engine = loaded(root(task("t1"), task("t2")));
        send(engine, new Action.Select(List.of("t2", "missing"), List.of()));
        assertThat(snapshot(engine).selection()).containsExactly("t2");

        ModelElement root = updated(send(engine, new Action.DeleteElement(List.of())));

        assertThat(childIds(root)).containsExactly("t1");
        assertThat(snapshot(engine).selection()).isEmpty();
    }

    @Test
    void selectAllCoversVisibleElements() {
        DiagramSessionsEngine engine = loaded(root(task("t1"), shape("note", "n1")));

        send(engine, new Action.SelectAll(true));
        assertThat(snapshot(engine).selection()).containsExactly("t1");

        send(engine, new Action.SelectAll(false));
        assertThat(snapshot(engine).selection()).isEmpty();
    }

    @Test
    void createNodeRespectsContainerHints() {
        DiagramSessionsEngine engine = loaded(root(shape("lane", "l1"), task("t1")));

        ModelElement root = updated(send(engine, new Action.CreateNode("task", new Point(1, 1), "l1", Map.of("id", "t2", "name", "Review"))));
        ModelElement lane = root.children().get(0);
        assertThat(childIds(lane)).containsExactly("t2");
        assertThat(lane.children().get(0).property("name")).contains("Review");

        assertThat(error(send(engine, new Action.CreateNode("lane", null, "t1", Map.of())))).contains("does not accept");
        assertThat(error(send(engine, new Action.CreateNode("unknown", null, null, Map.of())))).contains("no shape type hint");
    }

    @Test
    void duplicateProposedIdIsRejected() {
        DiagramSessionsEngine engine = loaded(root(task("t1")));

        assertThat(error(send(engine, new Action.CreateNode("task", null, null, Map.of(Protocol.ARG_ELEMENT_ID, "t1")))))
                .contains("duplicate element id");
        assertThat(snapshot(engine).modelRevision()).isZero();
    }

    @Test
    void connectionsFollowEdgeHints() {
        DiagramSessionsEngine engine = loaded(root(task("t1"), task("t2"), shape("lane", "l1")));

        ModelElement root = updated(send(engine, new Action.CreateConnection("flow", "t1", "t2", Map.of("id", "e1"))));
        assertThat(root.children().get(3)).satisfies(edge -> {
            assertThat(edge.isEdge()).isTrue();
            assertThat(edge.sourceId()).isEqualTo("t1");
            assertThat(edge.targetId()).isEqualTo("t2");
        });

        assertThat(error(send(engine, new Action.CreateConnection("flow", "l1", "t2", Map.of())))).contains("cannot start at lane");
        assertThat(error(send(engine, new Action.CreateConnection("flow", "t1", "nowhere", Map.of())))).contains("nowhere");
    }

    @Test
    void changeBoundsChecksMoveAndResizeSeparately() {
        DiagramSessionsEngine engine = loaded(root(task("t1"), locked("k1")));

        ModelElement root = updated(send(engine, new Action.ChangeBounds(List.of(
                new ElementAndBounds("t1", new Point(5, 6), new Dimension(30, 10))))));
        assertThat(root.children().get(0).bounds()).hasValueSatisfying(bounds -> {
            assertThat(bounds.x()).isEqualTo(5);
            assertThat(bounds.width()).isEqualTo(30);
        });

        assertThat(error(send(engine, new Action.ChangeBounds(List.of(new ElementAndBounds("k1", new Point(9, 9), null))))))
                .contains("not repositionable");
        assertThat(error(send(engine, new Action.ChangeBounds(List.of(new ElementAndBounds("k1", null, new Dimension(1, 1)))))))
                .contains("not resizable");
    }

    @Test
    void reparentingMovesSubtreeAndKeepsEdges() {
        DiagramSessionsEngine engine = loaded(root(shape("lane", "l1"), task("t1"), task("t2"), flow("e1", "t1", "t2")));

        ModelElement root = updated(send(engine, new Action.ChangeContainer("t1", "l1", new Point(3, 3))));

        assertThat(childIds(root)).containsExactly("l1", "t2", "e1");
        assertThat(root.children().get(0).children()).singleElement().satisfies(t1 -> {
            assertThat(t1.id()).isEqualTo("t1");
            assertThat(t1.position()).isEqualTo(new Point(3, 3));
        });
    }

    @Test
    void reparentingIntoOwnDescendantIsRejected() {
        DiagramSessionsEngine engine = loaded(root(shape("lane", "l1", shape("lane", "l2"))));

        assertThat(error(send(engine, new Action.ChangeContainer("l1", "l2", null)))).contains("cycle");
        assertThat(error(send(engine, new Action.ChangeContainer("k9", "l2", null)))).contains("k9");
    }

    @Test
    void reconnectAndRerouteEdges() {
        DiagramSessionsEngine engine = loaded(root(task("t1"), task("t2"), task("t3"), flow("e1", "t1", "t2")));

        ModelElement reconnected = updated(send(engine, new Action.ReconnectEdge("e1", "t1", "t3")));
        assertThat(reconnected.children().get(3).targetId()).isEqualTo("t3");

        List<Point> points = List.of(new Point(1, 1), new Point(2, 2));
        ModelElement rerouted = updated(send(engine, new Action.ChangeRoutingPoints("e1", points)));
        assertThat(rerouted.children().get(3).routingPoints()).isEqualTo(points);

        assertThat(error(send(engine, new Action.ChangeRoutingPoints("t1", points)))).contains("not an edge");
    }

    @Test
    void labelEditReplacesText() {
        DiagramSessionsEngine engine = loaded(root(task("t1")));

        ModelElement root = updated(send(engine, new Action.ApplyLabelEdit("t1", "Approve")));

        assertThat(root.children().get(0).property(Protocol.PROPERTY_TEXT)).contains("Approve");
    }

    @Test
    void hiddenElementsCannotBeEdited() {
        DiagramSessionsEngine engine = loaded(root(shape("note", "n1")));

        assertThat(error(send(engine, new Action.DeleteElement(List.of("n1"))))).contains("inactive layer");
        assertThat(error(send(engine, new Action.CreateNode("note", null, null, Map.of())))).contains("inactive layer");
    }

    @Test
    void editsBeforeAnyModelAreRejected() {
        DiagramSessionsEngine engine = engine(new InMemoryModelPersistence()).build();
        send(engine, new Action.RequestTools());

        assertThat(error(send(engine, new Action.CreateNode("task", null, null, Map.of())))).contains("no model");
    }

    @Test
    void editValidationIsADryRun() {
        DiagramSessionsEngine engine = loaded(root(shape("lane", "l1"), task("t1"), locked("k1")));

        assertThat(send(engine, new Action.RequestEditValidation(Protocol.EDIT_CONTEXT_CONTAINER, "t1", "l1", null)))
                .containsExactly(new Action.SetEditValidationResult(Severity.OK, null));
        assertThat(send(engine, new Action.RequestEditValidation(Protocol.EDIT_CONTEXT_POSITION, "k1", null, new Point(1, 1))))
                .singleElement().isInstanceOfSatisfying(Action.SetEditValidationResult.class,
                        result -> assertThat(result.status()).isEqualTo(Severity.ERROR));
        assertThat(snapshot(engine).modelRevision()).isZero();
    }

    @Test
    void saveClearsDirtyStateAndExportIsForwarded() {
        InMemoryModelPersistence persistence = new InMemoryModelPersistence();
        DiagramSessionsEngine engine = engine(persistence).build();
        send(engine, Action.RequestModel.create());
        send(engine, new Action.CreateNode("task", null, null, Map.of("id", "t1")));

        List<Action> saved = send(engine, new Action.SaveModel("mem://saved"));

        assertThat(saved).containsExactly(new Action.SetDirtyState(false, Protocol.DIRTY_REASON_SAVE));
        assertThat(persistence.load("mem://saved")).hasValueSatisfying(root -> assertThat(childIds(root)).containsExactly("t1"));
        assertThat(send(engine, new Action.SaveModel("mem://saved"))).isEmpty();

        assertThat(send(engine, new Action.ExportSvg("<svg/>"))).isEmpty();
        assertThat(persistence.exported(null)).contains("<svg/>");
    }
}
