package io.diagramsessions.server.core.handlers;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.ElementAndBounds;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.Protocol;
import io.diagramsessions.core.Severity;
import io.diagramsessions.server.core.ActionRegistry;
import io.diagramsessions.server.core.LayerVisibility;
import io.diagramsessions.server.core.ModelIndex;
import io.diagramsessions.server.core.ModelTrees;
import io.diagramsessions.server.core.ModelUpdater;
import io.diagramsessions.server.core.Session;
import io.diagramsessions.server.core.SessionState;
import io.diagramsessions.server.core.TypeHintGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Validates and applies structural edits.
 *
 * <p>Each operation is checked against the element index (unknown, hidden or duplicated ids) and
 * the session's type hints before anything changes. A rejected operation leaves the model and
 * the revision untouched. Accepted operations hand the new tree to the {@link ModelUpdater}, which
 * marks the session dirty once the tree is committed or sent for measuring. While a bounds
 * handshake is pending, operations are queued and replayed after it commits.
 */
public final class EditPipeline {

    private static final Logger log = LoggerFactory.getLogger(EditPipeline.class);

    private final ModelUpdater updater;
    private final LayerVisibility visibility;

    public EditPipeline(ModelUpdater updater, LayerVisibility visibility) {
        this.updater = Objects.requireNonNull(updater, "updater");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public void registerWith(ActionRegistry.Builder registry) {
        registry.register(Action.CreateNode.KIND, Action.CreateNode.class, (ctx, a) -> apply(ctx.session(), a, this::createNode));
        registry.register(Action.CreateConnection.KIND, Action.CreateConnection.class, (ctx, a) -> apply(ctx.session(), a, this::createConnection));
        registry.register(Action.DeleteElement.KIND, Action.DeleteElement.class, (ctx, a) -> apply(ctx.session(), a, this::delete));
        registry.register(Action.ChangeBounds.KIND, Action.ChangeBounds.class, (ctx, a) -> apply(ctx.session(), a, this::changeBounds));
        registry.register(Action.ChangeContainer.KIND, Action.ChangeContainer.class, (ctx, a) -> apply(ctx.session(), a, this::changeContainer));
        registry.register(Action.ReconnectEdge.KIND, Action.ReconnectEdge.class, (ctx, a) -> apply(ctx.session(), a, this::reconnect));
        registry.register(Action.ChangeRoutingPoints.KIND, Action.ChangeRoutingPoints.class, (ctx, a) -> apply(ctx.session(), a, this::reroute));
        registry.register(Action.ApplyLabelEdit.KIND, Action.ApplyLabelEdit.class, (ctx, a) -> apply(ctx.session(), a, this::editLabel));
        registry.register(Action.RequestEditValidation.KIND, Action.RequestEditValidation.class, (ctx, a) -> validate(ctx.session(), a));
    }

    @FunctionalInterface
    private interface Mutation<A extends Action.Operation> {
        ModelElement apply(Edit edit, A operation);
    }

    private <A extends Action.Operation> CompletableFuture<List<Action>> apply(Session session, A operation, Mutation<A> mutation) {
        if (session.state() == SessionState.AWAITING_BOUNDS) {
            session.queueEdit(operation);
            log.debug("client {}: queued {} until bounds arrive", session.clientId(), operation.kind());
            return CompletableFuture.completedFuture(List.of());
        }
        ModelElement current = session.model().orElseThrow(() ->
                new DiagramSessionsException.OperationNotPermitted("no model has been loaded for " + session.clientId()));
        ModelElement next = mutation.apply(new Edit(session, ModelIndex.of(current)), operation);
        if (next == current) {
            return CompletableFuture.completedFuture(List.of());
        }
        ModelIndex.of(next);
        session.retainSelection(ModelTrees.collectIds(next));
        log.debug("client {}: applied {}", session.clientId(), operation.kind());
        return updater.propose(session, next, true);
    }

    private ModelElement createNode(Edit edit, Action.CreateNode op) {
        ModelElement container = op.containerId() == null ? edit.index.root() : edit.visible(op.containerId());
        edit.requireVisibleType(op.elementTypeId());
        edit.gate.checkCreateNode(op.elementTypeId(), container);
        ModelElement node = ModelElement.node(op.elementTypeId(), edit.newId(op.args(), op.elementTypeId()), op.location());
        return ModelTrees.insert(edit.index.root(), container.id(), withArgs(node, op.args()));
    }

    private ModelElement createConnection(Edit edit, Action.CreateConnection op) {
        ModelElement source = edit.visible(op.sourceElementId());
        ModelElement target = edit.visible(op.targetElementId());
        edit.requireVisibleType(op.elementTypeId());
        edit.gate.checkCreateConnection(op.elementTypeId(), source, target);
        ModelElement edge = ModelElement.edge(op.elementTypeId(), edit.newId(op.args(), op.elementTypeId()), source.id(), target.id());
        ModelElement root = edit.index.root();
        return ModelTrees.insert(root, root.id(), withArgs(edge, op.args()));
    }

    private ModelElement delete(Edit edit, Action.DeleteElement op) {
        Set<String> ids = new LinkedHashSet<>(op.elementIds().isEmpty() ? edit.session.selection() : op.elementIds());
        if (ids.isEmpty()) {
            return edit.index.root();
        }
        for (String id : ids) {
            edit.gate.checkDelete(edit.visible(id));
        }
        return ModelTrees.removeAll(edit.index.root(), ids);
    }

    private ModelElement changeBounds(Edit edit, Action.ChangeBounds op) {
        for (ElementAndBounds change : op.newBounds()) {
            ModelElement element = edit.visible(change.elementId());
            boolean move = change.newPosition() != null && !change.newPosition().equals(element.position());
            boolean resize = change.newSize() != null && !change.newSize().equals(element.size());
            edit.gate.checkChangeBounds(element, move, resize);
        }
        return ModelTrees.mergeLayout(edit.index.root(), op.newBounds(), List.of());
    }

    private ModelElement changeContainer(Edit edit, Action.ChangeContainer op) {
        ModelElement element = edit.visible(op.elementId());
        ModelElement target = edit.visible(op.targetContainerId());
        edit.gate.checkChangeContainer(element, target);
        ModelElement moved = op.location() != null ? element.withPosition(op.location()) : element;
        return ModelTrees.insert(ModelTrees.detach(edit.index.root(), element.id()), target.id(), moved);
    }

    private ModelElement reconnect(Edit edit, Action.ReconnectEdge op) {
        ModelElement edge = edit.visibleEdge(op.edgeId());
        ModelElement source = edit.visible(op.sourceElementId());
        ModelElement target = edit.visible(op.targetElementId());
        edit.gate.checkReconnect(edge, source, target);
        return ModelTrees.replace(edit.index.root(), edge.id(), e -> e.withEndpoints(source.id(), target.id()));
    }

    private ModelElement reroute(Edit edit, Action.ChangeRoutingPoints op) {
        ModelElement edge = edit.visibleEdge(op.edgeId());
        edit.gate.checkReroute(edge);
        return ModelTrees.replace(edit.index.root(), edge.id(), e -> e.withRoutingPoints(op.routingPoints()));
    }

    private ModelElement editLabel(Edit edit, Action.ApplyLabelEdit op) {
        ModelElement label = edit.visible(op.labelId());
        return ModelTrees.replace(edit.index.root(), label.id(), e -> e.withProperty(Protocol.PROPERTY_TEXT, op.text()));
    }

    /**
     * Dry run of the container or position gate. Rejections are answered, not raised.
     */
    CompletableFuture<List<Action>> validate(Session session, Action.RequestEditValidation request) {
        Action.SetEditValidationResult result;
        try {
            ModelElement model = session.model().orElseThrow(() ->
                    new DiagramSessionsException.OperationNotPermitted("no model has been loaded for " + session.clientId()));
            Edit edit = new Edit(session, ModelIndex.of(model));
            ModelElement element = edit.visible(request.elementId());
            switch (request.contextId()) {
                case Protocol.EDIT_CONTEXT_CONTAINER -> edit.gate.checkChangeContainer(element, edit.visible(request.targetContainerId()));
                case Protocol.EDIT_CONTEXT_POSITION -> edit.gate.checkChangeBounds(element, true, false);
                default -> throw new DiagramSessionsException.OperationNotPermitted("unknown validation context: " + request.contextId());
            }
            result = new Action.SetEditValidationResult(Severity.OK, null);
        } catch (DiagramSessionsException e) {
            log.debug("client {}: {} fails validation: {}", session.clientId(), request.elementId(), e.getMessage());
            result = new Action.SetEditValidationResult(Severity.ERROR, e.getMessage());
        }
        return CompletableFuture.completedFuture(List.of(result));
    }

    private static ModelElement withArgs(ModelElement element, Map<String, String> args) {
        ModelElement result = element;
        for (Map.Entry<String, String> arg : args.entrySet()) {
            if (!Protocol.ARG_ELEMENT_ID.equals(arg.getKey())) result = result.withProperty(arg.getKey(), arg.getValue());
        }
        return result;
    }

    /**
     * One edit against one committed model.
     */
    private final class Edit {
        final Session session;
        final ModelIndex index;
        final TypeHintGate gate;
        final Set<String> activeLayers;

        Edit(Session session, ModelIndex index) {
            this.session = session;
            this.index = index;
            this.gate = new TypeHintGate(session.typeHints(), index);
            this.activeLayers = session.activeLayers();
        }

        ModelElement visible(String id) {
            ModelElement element = index.require(id);
            if (!visibility.isVisible(element.type(), activeLayers)) {
                throw new DiagramSessionsException.InvalidElementReference("element " + id + " is on an inactive layer");
            }
            return element;
        }

        ModelElement visibleEdge(String id) {
            ModelElement element = visible(id);
            if (!element.isEdge()) throw new DiagramSessionsException.InvalidElementReference(id + " is not an edge");
            return element;
        }

        void requireVisibleType(String elementTypeId) {
            if (!visibility.isVisible(elementTypeId, activeLayers)) {
                throw new DiagramSessionsException.OperationNotPermitted(elementTypeId + " is on an inactive layer");
            }
        }

        String newId(Map<String, String> args, String elementTypeId) {
            String proposed = args.get(Protocol.ARG_ELEMENT_ID);
            if (proposed != null) {
                if (index.contains(proposed)) {
                    throw new DiagramSessionsException.InvalidElementReference("duplicate element id: " + proposed);
                }
                return proposed;
            }
            int n = index.ids().size();
            while (index.contains(elementTypeId + "_" + n)) n++;
            return elementTypeId + "_" + n;
        }
    }
}
