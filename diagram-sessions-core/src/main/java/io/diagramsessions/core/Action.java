package io.diagramsessions.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Closed set of protocol actions. Every variant carries exactly one {@link #kind()} and kinds
 * are unique across {@link ActionTypes#defaults()}.
 *
 * <p>Variants are grouped by marker interfaces:
 * <ul>
 *   <li>{@link CapabilityRequest}: opens a session and may arrive in any order</li>
 *   <li>{@link Operation}: structural edit, queued while a bounds handshake is in flight</li>
 *   <li>{@link Response}: answer to a request, eligible for identifiable correlation</li>
 * </ul>
 */
public sealed interface Action {

    String kind();

    sealed interface CapabilityRequest extends Action {}

    sealed interface Operation extends Action {}

    sealed interface Response extends Action {}

    // ===== Client to server: capability handshake =====

    record RequestModel(Map<String, String> options) implements CapabilityRequest {
        public static final String KIND = "requestModel";

        public RequestModel {
            options = options == null ? Map.of() : Map.copyOf(options);
        }

        public static RequestModel create() {
            return new RequestModel(Map.of());
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record RequestTools() implements CapabilityRequest {
        public static final String KIND = "requestTools";

        @Override
        public String kind() {
            return KIND;
        }
    }

    record RequestLayers() implements CapabilityRequest {
        public static final String KIND = "requestLayers";

        @Override
        public String kind() {
            return KIND;
        }
    }

    record RequestTypeHints() implements Action {
        public static final String KIND = "requestTypeHints";

        @Override
        public String kind() {
            return KIND;
        }
    }

    /**
     * Dry run of the type-hint gate for a container change ({@link Protocol#EDIT_CONTEXT_CONTAINER})
     * or a position change ({@link Protocol#EDIT_CONTEXT_POSITION}).
     */
    record RequestEditValidation(String contextId, String elementId, String targetContainerId, Point newPosition) implements Action {
        public static final String KIND = "requestEditValidation";

        public RequestEditValidation {
            Objects.requireNonNull(contextId, "contextId");
            Objects.requireNonNull(elementId, "elementId");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    // ===== Client to server: layout and layers =====

    record ComputedBounds(long revision, List<ElementAndBounds> bounds, List<ElementAndAlignment> alignments) implements Action {
        public static final String KIND = "computedBounds";

        public ComputedBounds {
            bounds = bounds == null ? List.of() : List.copyOf(bounds);
            alignments = alignments == null ? List.of() : List.copyOf(alignments);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record ToggleLayer(String layerId, boolean active) implements Action {
        public static final String KIND = "toggleLayer";

        public ToggleLayer {
            Objects.requireNonNull(layerId, "layerId");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    // ===== Client to server: operations =====

    record CreateNode(String elementTypeId, Point location, String containerId, Map<String, String> args) implements Operation {
        public static final String KIND = "createNode";

        public CreateNode {
            Objects.requireNonNull(elementTypeId, "elementTypeId");
            args = args == null ? Map.of() : Map.copyOf(args);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record CreateConnection(String elementTypeId, String sourceElementId, String targetElementId, Map<String, String> args) implements Operation {
        public static final String KIND = "createConnection";

        public CreateConnection {
            Objects.requireNonNull(elementTypeId, "elementTypeId");
            Objects.requireNonNull(sourceElementId, "sourceElementId");
            Objects.requireNonNull(targetElementId, "targetElementId");
            args = args == null ? Map.of() : Map.copyOf(args);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    /** Deletes the given elements, or the current selection when {@code elementIds} is empty. */
    record DeleteElement(List<String> elementIds) implements Operation {
        public static final String KIND = "deleteElement";

        public DeleteElement {
            elementIds = elementIds == null ? List.of() : List.copyOf(elementIds);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record ChangeBounds(List<ElementAndBounds> newBounds) implements Operation {
        public static final String KIND = "changeBounds";

        public ChangeBounds {
            newBounds = newBounds == null ? List.of() : List.copyOf(newBounds);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record ChangeContainer(String elementId, String targetContainerId, Point location) implements Operation {
        public static final String KIND = "changeContainer";

        public ChangeContainer {
            Objects.requireNonNull(elementId, "elementId");
            Objects.requireNonNull(targetContainerId, "targetContainerId");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record ReconnectEdge(String edgeId, String sourceElementId, String targetElementId) implements Operation {
        public static final String KIND = "reconnectEdge";

        public ReconnectEdge {
            Objects.requireNonNull(edgeId, "edgeId");
            Objects.requireNonNull(sourceElementId, "sourceElementId");
            Objects.requireNonNull(targetElementId, "targetElementId");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record ChangeRoutingPoints(String edgeId, List<Point> routingPoints) implements Operation {
        public static final String KIND = "changeRoutingPoints";

        public ChangeRoutingPoints {
            Objects.requireNonNull(edgeId, "edgeId");
            routingPoints = routingPoints == null ? List.of() : List.copyOf(routingPoints);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record ApplyLabelEdit(String labelId, String text) implements Operation {
        public static final String KIND = "applyLabelEdit";

        public ApplyLabelEdit {
            Objects.requireNonNull(labelId, "labelId");
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    // ===== Client to server: selection, save, export =====

    record Select(List<String> selectedElementIds, List<String> deselectedElementIds) implements Action {
        public static final String KIND = "elementSelected";

        public Select {
            selectedElementIds = selectedElementIds == null ? List.of() : List.copyOf(selectedElementIds);
            deselectedElementIds = deselectedElementIds == null ? List.of() : List.copyOf(deselectedElementIds);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record SelectAll(boolean select) implements Action {
        public static final String KIND = "allSelected";

        @Override
        public String kind() {
            return KIND;
        }
    }

    record SaveModel(String fileUri) implements Action {
        public static final String KIND = "saveModel";

        @Override
        public String kind() {
            return KIND;
        }
    }

    record ExportSvg(String svg) implements Action {
        public static final String KIND = "exportSvg";

        public ExportSvg {
            Objects.requireNonNull(svg, "svg");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    // ===== Identifiable correlation (both directions) =====

    record IdentifiableRequest(String id, Action action) implements Action {
        public static final String KIND = "identifiableRequestAction";

        public IdentifiableRequest {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(action, "action");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record IdentifiableResponse(String id, Action action) implements Action {
        public static final String KIND = "identifiableResponseAction";

        public IdentifiableResponse {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(action, "action");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    // ===== Server to client =====

    record SetModel(ModelElement newRoot) implements Response {
        public static final String KIND = "setModel";

        public SetModel {
            Objects.requireNonNull(newRoot, "newRoot");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record UpdateModel(ModelElement newRoot, boolean animate, List<Match> matches) implements Response {
        public static final String KIND = "updateModel";

        public UpdateModel {
            Objects.requireNonNull(newRoot, "newRoot");
            matches = matches == null ? List.of() : List.copyOf(matches);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record RequestBounds(ModelElement newRoot) implements Action {
        public static final String KIND = "requestBounds";

        public RequestBounds {
            Objects.requireNonNull(newRoot, "newRoot");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record SetTools(List<ToolDescriptor> tools) implements Response {
        public static final String KIND = "setTools";

        public SetTools {
            tools = tools == null ? List.of() : List.copyOf(tools);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record SetLayers(List<LayerDescriptor> layers, List<String> activeLayerIds) implements Response {
        public static final String KIND = "setLayers";

        public SetLayers {
            layers = layers == null ? List.of() : List.copyOf(layers);
            activeLayerIds = activeLayerIds == null ? List.of() : List.copyOf(activeLayerIds);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record SetOperations(List<OperationDescriptor> operations) implements Response {
        public static final String KIND = "setOperations";

        public SetOperations {
            operations = operations == null ? List.of() : List.copyOf(operations);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record SetTypeHints(List<ShapeTypeHint> shapeHints, List<EdgeTypeHint> edgeHints) implements Response {
        public static final String KIND = "setTypeHints";

        public SetTypeHints {
            shapeHints = shapeHints == null ? List.of() : List.copyOf(shapeHints);
            edgeHints = edgeHints == null ? List.of() : List.copyOf(edgeHints);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record SetEditValidationResult(Severity status, String message) implements Response {
        public static final String KIND = "setEditValidationResult";

        public SetEditValidationResult {
            Objects.requireNonNull(status, "status");
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    record SetDirtyState(boolean dirty, String reason) implements Action {
        public static final String KIND = "setDirtyState";

        @Override
        public String kind() {
            return KIND;
        }
    }

    record ServerStatus(Severity severity, String message, String details) implements Response {
        public static final String KIND = "serverStatus";

        public ServerStatus {
            Objects.requireNonNull(severity, "severity");
            Objects.requireNonNull(message, "message");
        }

        public static ServerStatus error(String message) {
            return new ServerStatus(Severity.ERROR, message, null);
        }

        @Override
        public String kind() {
            return KIND;
        }
    }

    /**
     * An action whose kind is not in the codec's {@link ActionTypes}. Kept so the dispatcher can
     * answer with an unknown-kind status instead of failing the transport.
     */
    record Unrecognized(String kind, Map<String, Object> payload) implements Action {

        public Unrecognized {
            Objects.requireNonNull(kind, "kind");
            payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        }
    }
}
