package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.ActionEnvelope;
import io.diagramsessions.core.EdgeTypeHint;
import io.diagramsessions.core.LayerDescriptor;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.OperationDescriptor;
import io.diagramsessions.core.OperationKind;
import io.diagramsessions.core.Point;
import io.diagramsessions.core.Protocol;
import io.diagramsessions.core.ShapeTypeHint;
import io.diagramsessions.core.ToolDescriptor;
import io.diagramsessions.server.spi.CapabilityProvider;
import io.diagramsessions.server.spi.InMemoryModelPersistence;
import io.diagramsessions.server.spi.StaticCapabilityProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * A small process-diagram language shared by the engine tests: tasks connected by flows, lanes
 * holding tasks and lanes, locked shapes, and notes on an "annotations" layer that starts hidden.
 */
public final class TestDiagrams {

    public static final String CLIENT = "client-1";
    public static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    public static final ShapeTypeHint TASK = new ShapeTypeHint("task", true, true, true, true, List.of());
    public static final ShapeTypeHint LANE = new ShapeTypeHint("lane", true, true, true, true, List.of("lane", "task"));
    public static final ShapeTypeHint LOCKED = new ShapeTypeHint("locked", false, false, false, false, List.of());
    public static final ShapeTypeHint NOTE = new ShapeTypeHint("note", true, true, true, false, List.of());
    public static final EdgeTypeHint FLOW = new EdgeTypeHint("flow", false, true, true, List.of("task"), List.of("task"));

    public static final LayerDescriptor ANNOTATIONS = new LayerDescriptor("annotations", "Annotations", List.of("note"), false);

    public static final ToolDescriptor TASK_TOOL = new ToolDescriptor("task-tool", "Task", "task");
    public static final ToolDescriptor NOTE_TOOL = new ToolDescriptor("note-tool", "Note", "note");

    public static final OperationDescriptor CREATE_TASK = new OperationDescriptor("create-task", "task", "Create task", OperationKind.CREATE_NODE, false);
    public static final OperationDescriptor CREATE_NOTE = new OperationDescriptor("create-note", "note", "Create note", OperationKind.CREATE_NODE, false);
    public static final OperationDescriptor CREATE_FLOW = new OperationDescriptor("create-flow", "flow", "Connect", OperationKind.CREATE_CONNECTION, false);
    public static final OperationDescriptor DELETE = new OperationDescriptor("delete", null, "Delete", OperationKind.DELETE, false);

    private TestDiagrams() {}

    public static CapabilityProvider provider() {
        return StaticCapabilityProvider.builder()
                .shapeHint(TASK)
                .shapeHint(LANE)
                .shapeHint(LOCKED)
                .shapeHint(NOTE)
                .edgeHint(FLOW)
                .layer(ANNOTATIONS)
                .tool(TASK_TOOL)
                .tool(NOTE_TOOL)
                .operation(CREATE_TASK)
                .operation(CREATE_NOTE)
                .operation(CREATE_FLOW)
                .operation(DELETE)
                .build();
    }

    /**
     * Engine running every session task on the calling thread, so a submitted envelope has been
     * fully processed when {@code submit} returns.
     */
    public static DiagramSessionsEngine.Builder engine(InMemoryModelPersistence persistence) {
        return DiagramSessionsEngine.builder(provider())
                .executor(Runnable::run)
                .persistence(persistence)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    public static InMemoryModelPersistence stored(ModelElement root) {
        return new InMemoryModelPersistence(Map.of("", root));
    }

    public static List<Action> send(DiagramSessionsEngine engine, Action action) {
        return engine.submit(new ActionEnvelope(CLIENT, action)).join().stream()
                .map(ActionEnvelope::action)
                .toList();
    }

    public static SessionSnapshot snapshot(DiagramSessionsEngine engine) {
        return engine.snapshot(CLIENT).join().orElseThrow();
    }

    public static Action.RequestModel requestModelWithClientLayout() {
        return new Action.RequestModel(Map.of(Protocol.OPTION_NEEDS_CLIENT_LAYOUT, Protocol.BOOL_TRUE));
    }

    public static ModelElement root(ModelElement... children) {
        return ModelElement.emptyRoot().withChildren(List.of(children));
    }

    public static ModelElement task(String id) {
        return ModelElement.node("task", id, new Point(0, 0));
    }

    public static ModelElement locked(String id) {
        return ModelElement.node("locked", id, new Point(0, 0));
    }

    public static ModelElement shape(String type, String id, ModelElement... children) {
        return ModelElement.node(type, id, new Point(0, 0)).withChildren(List.of(children));
    }

    public static ModelElement flow(String id, String sourceId, String targetId) {
        return ModelElement.edge("flow", id, sourceId, targetId);
    }

    public static List<String> childIds(ModelElement element) {
        return element.children().stream().map(ModelElement::id).toList();
    }

    public static <A extends Action> A first(List<Action> actions, Class<A> type) {
        return actions.stream().filter(type::isInstance).map(type::cast).findFirst()
                .orElseThrow(() -> new AssertionError("no " + type.getSimpleName() + " in " + actions));
    }
}
