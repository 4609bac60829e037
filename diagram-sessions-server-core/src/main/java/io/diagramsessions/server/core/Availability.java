package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.OperationDescriptor;
import io.diagramsessions.core.Protocol;
import io.diagramsessions.core.ToolDescriptor;
import io.diagramsessions.server.spi.CapabilityProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives what a session is offered (tools, operations, layer state) and which of those lists
 * have to be broadcast again.
 *
 * <p>Lists are only rebroadcast to clients that asked for them: layers after
 * {@code requestLayers}, tools and operations after {@code requestTools}.
 */
public final class Availability {

    private final CapabilityProvider provider;
    private final LayerVisibility visibility;

    public Availability(CapabilityProvider provider, LayerVisibility visibility) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public List<ToolDescriptor> tools(Session session) {
        Set<String> active = session.activeLayers();
        List<ToolDescriptor> tools = new ArrayList<>();
        for (ToolDescriptor tool : provider.tools()) {
            if (visibility.isVisible(tool.elementTypeId(), active)) tools.add(tool);
        }
        return tools;
    }

    /**
     * Operations whose element type is visible, with {@code active} reflecting whether the
     * committed model currently admits them. Generic operations keep the declared flag.
     */
    public List<OperationDescriptor> operations(Session session) {
        Set<String> active = session.activeLayers();
        ModelIndex index = session.model()
                .map(root -> ModelIndex.of(visibility.project(root, active)))
                .orElse(null);
        TypeHintGate gate = index == null ? null : new TypeHintGate(session.typeHints(), index);
        List<OperationDescriptor> operations = new ArrayList<>();
        for (OperationDescriptor operation : provider.operations()) {
            if (!visibility.isVisible(operation.elementTypeId(), active)) continue;
            operations.add(operation.withActive(isApplicable(operation, index, gate)));
        }
        return operations;
    }

    public Action.SetLayers layersMessage(Session session) {
        List<String> active = session.activeLayerList();
        session.broadcastLayers(active);
        return new Action.SetLayers(provider.layers(), active);
    }

    public Action.SetTools toolsMessage(Session session) {
        List<ToolDescriptor> tools = tools(session);
        session.broadcastTools(tools);
        return new Action.SetTools(tools);
    }

    public Action.SetOperations operationsMessage(Session session) {
        List<OperationDescriptor> operations = operations(session);
        session.broadcastOperations(operations);
        return new Action.SetOperations(operations);
    }

    /**
     * Dirty state, layers, tools and operations that differ from what the client was last told,
     * in that order.
     */
    public List<Action> changedBroadcasts(Session session) {
        List<Action> out = new ArrayList<>();
        if (session.isDirty() != session.broadcastDirty()) {
            boolean dirty = session.isDirty();
            out.add(new Action.SetDirtyState(dirty, dirty ? Protocol.DIRTY_REASON_OPERATION : Protocol.DIRTY_REASON_SAVE));
            session.broadcastDirty(dirty);
        }
        if (session.isSatisfied(Session.Capability.LAYERS)
                && !session.activeLayerList().equals(session.broadcastLayers().orElse(null))) {
            out.add(layersMessage(session));
        }
        if (session.isSatisfied(Session.Capability.TOOLS)) {
            List<ToolDescriptor> tools = tools(session);
            if (!tools.equals(session.broadcastTools().orElse(null))) {
                session.broadcastTools(tools);
                out.add(new Action.SetTools(tools));
            }
            List<OperationDescriptor> operations = operations(session);
            if (!operations.equals(session.broadcastOperations().orElse(null))) {
                session.broadcastOperations(operations);
                out.add(new Action.SetOperations(operations));
            }
        }
        return out;
    }

    private static boolean isApplicable(OperationDescriptor operation, ModelIndex index, TypeHintGate gate) {
        if (index == null) {
            return false;
        }
        String type = operation.elementTypeId();
        switch (operation.operationKind()) {
            case CREATE_NODE:
                for (ModelElement container : index.elements()) {
                    if (gate.allowsCreateNode(type, container)) return true;
                }
                return false;
            case CREATE_CONNECTION:
                return hasConnectionCandidates(type, index, gate);
            case DELETE:
                for (ModelElement element : index.elements()) {
                    if (matches(type, element) && gate.allowsDelete(element)) return true;
                }
                return false;
            case CHANGE_BOUNDS:
                for (ModelElement element : index.elements()) {
                    if (index.isRoot(element.id()) || !matches(type, element)) continue;
                    if (gate.allowsChangeBounds(element, true, false) || gate.allowsChangeBounds(element, false, true)) {
                        return true;
                    }
                }
                return false;
            case CHANGE_CONTAINER:
                for (ModelElement element : index.elements()) {
                    if (!matches(type, element)) continue;
                    ModelElement parent = index.parent(element.id()).orElse(null);
                    for (ModelElement target : index.elements()) {
                        if (target != parent && gate.allowsChangeContainer(element, target)) return true;
                    }
                }
                return false;
            default:
                return operation.active();
        }
    }

    private static boolean hasConnectionCandidates(String edgeType, ModelIndex index, TypeHintGate gate) {
        for (ModelElement source : index.elements()) {
            if (index.isRoot(source.id())) continue;
            for (ModelElement target : index.elements()) {
                if (index.isRoot(target.id())) continue;
                if (gate.allowsCreateConnection(edgeType, source, target)) return true;
            }
        }
        return false;
    }

    private static boolean matches(String elementTypeId, ModelElement element) {
        return elementTypeId == null || elementTypeId.equals(element.type());
    }
}
