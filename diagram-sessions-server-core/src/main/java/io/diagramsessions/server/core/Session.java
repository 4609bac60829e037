package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.OperationDescriptor;
import io.diagramsessions.core.Protocol;
import io.diagramsessions.core.ToolDescriptor;
import io.diagramsessions.core.TypeHint;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Per-client protocol state.
 *
 * <p>A session is confined to its {@link SessionActor}: every read and write happens inside a task
 * of that actor, so the class carries no synchronization of its own.
 */
public final class Session {

    /**
     * Capabilities a client has asked for. Each one gates the corresponding broadcast.
     */
    public enum Capability { MODEL, TOOLS, LAYERS }

    private final String clientId;
    private final Instant openedAt;
    private SessionState state = SessionState.AWAITING_CAPABILITIES;
    private final Set<Capability> satisfied = EnumSet.noneOf(Capability.class);

    private long modelRevision;
    private ModelElement model;
    private PendingBounds pendingBounds;
    private final Deque<Action> queuedEdits = new ArrayDeque<>();
    private final List<String> deferredResponses = new ArrayList<>();
    private final Map<String, CompletableFuture<Action>> pendingRequests = new LinkedHashMap<>();

    private final Set<String> activeLayers = new LinkedHashSet<>();
    private final Map<String, TypeHint> typeHints = new LinkedHashMap<>();
    private final Set<String> selection = new LinkedHashSet<>();

    private boolean needsClientLayout;
    private boolean animate;
    private String sourceUri;
    private boolean optionsApplied;
    private boolean dirty;

    // what the client has been told
    private ModelElement broadcastRoot;
    private boolean broadcastDirty;
    private List<String> broadcastLayers;
    private List<ToolDescriptor> broadcastTools;
    private List<OperationDescriptor> broadcastOperations;

    Session(String clientId, Instant openedAt, boolean needsClientLayout, boolean animate) {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt");
        this.needsClientLayout = needsClientLayout;
        this.animate = animate;
    }

    public String clientId() {
        return clientId;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public SessionState state() {
        return state;
    }

    public boolean isClosed() {
        return state == SessionState.CLOSED;
    }

    public boolean isSatisfied(Capability capability) {
        return satisfied.contains(capability);
    }

    public void satisfy(Capability capability) {
        satisfied.add(capability);
    }

    // --- revisions and model

    public long modelRevision() {
        return modelRevision;
    }

    /**
     * Increment and return the model revision.
     */
    public long advanceRevision() {
        return ++modelRevision;
    }

    public boolean hasModel() {
        return model != null;
    }

    /**
     * The last committed model, unprojected.
     */
    public Optional<ModelElement> model() {
        return Optional.ofNullable(model);
    }

    /**
     * The model further changes build on: the pending candidate while a handshake is in flight,
     * otherwise the committed model.
     */
    public Optional<ModelElement> workingModel() {
        return pendingBounds != null ? Optional.of(pendingBounds.candidateRoot()) : model();
    }

    public Optional<PendingBounds> pendingBounds() {
        return Optional.ofNullable(pendingBounds);
    }

    /**
     * Record an outstanding bounds computation, replacing (and so superseding) any earlier one.
     */
    public void awaitBounds(PendingBounds pending) {
        requireOpen();
        this.pendingBounds = Objects.requireNonNull(pending, "pending");
        this.state = SessionState.AWAITING_BOUNDS;
    }

    /**
     * Make {@code root} the committed model and leave any handshake.
     */
    public void commit(ModelElement root) {
        requireOpen();
        this.model = Objects.requireNonNull(root, "root");
        this.pendingBounds = null;
        this.satisfied.add(Capability.MODEL);
        this.state = SessionState.READY;
    }

    // --- queued edits

    /**
     * Hold an edit until the pending handshake commits. The edit is either an operation or an
     * identifiable request wrapping one, so a correlated caller still gets its answer on replay.
     */
    public void queueEdit(Action edit) {
        queuedEdits.addLast(Objects.requireNonNull(edit, "edit"));
    }

    public Optional<Action> pollQueuedEdit() {
        return Optional.ofNullable(queuedEdits.pollFirst());
    }

    public int queuedEditCount() {
        return queuedEdits.size();
    }

    // --- correlation

    /**
     * Answer the client request {@code id} with the model sent by the next commit.
     */
    public void deferResponse(String id) {
        deferredResponses.add(Objects.requireNonNull(id, "id"));
    }

    public List<String> takeDeferredResponses() {
        if (deferredResponses.isEmpty()) return List.of();
        List<String> ids = List.copyOf(deferredResponses);
        deferredResponses.clear();
        return ids;
    }

    public void addPendingRequest(String id, CompletableFuture<Action> reply) {
        if (pendingRequests.putIfAbsent(id, reply) != null) {
            throw new IllegalStateException("request id already outstanding: " + id);
        }
    }

    /**
     * Remove and return the reply future registered under {@code id}, if any.
     */
    public Optional<CompletableFuture<Action>> takePendingRequest(String id) {
        return Optional.ofNullable(pendingRequests.remove(id));
    }

    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    // --- layers, hints, selection

    public Set<String> activeLayers() {
        return Set.copyOf(activeLayers);
    }

    /**
     * Active layer ids in activation order.
     */
    public List<String> activeLayerList() {
        return new ArrayList<>(activeLayers);
    }

    /**
     * @return whether the active set changed
     */
    public boolean setLayerActive(String layerId, boolean active) {
        return active ? activeLayers.add(layerId) : activeLayers.remove(layerId);
    }

    public Map<String, TypeHint> typeHints() {
        return Map.copyOf(typeHints);
    }

    public Optional<TypeHint> typeHint(String elementTypeId) {
        return Optional.ofNullable(typeHints.get(elementTypeId));
    }

    /**
     * Replace the whole hint table.
     */
    public void replaceTypeHints(Collection<? extends TypeHint> hints) {
        typeHints.clear();
        for (TypeHint hint : hints) typeHints.put(hint.elementTypeId(), hint);
    }

    public Set<String> selection() {
        return Set.copyOf(selection);
    }

    public void select(Collection<String> ids) {
        selection.addAll(ids);
    }

    public void deselect(Collection<String> ids) {
        selection.removeAll(ids);
    }

    /**
     * Drop selected ids that are not in {@code existing}.
     */
    public void retainSelection(Set<String> existing) {
        selection.retainAll(existing);
    }

    public void clearSelection() {
        selection.clear();
    }

    // --- options

    public boolean needsClientLayout() {
        return needsClientLayout;
    }

    public boolean animate() {
        return animate;
    }

    public Optional<String> sourceUri() {
        return Optional.ofNullable(sourceUri);
    }

    /**
     * Apply {@code requestModel} options. Only the first call has an effect.
     */
    public void applyOptions(Map<String, String> options) {
        if (optionsApplied) return;
        optionsApplied = true;
        String layout = options.get(Protocol.OPTION_NEEDS_CLIENT_LAYOUT);
        if (layout != null) needsClientLayout = Boolean.parseBoolean(layout);
        String anim = options.get(Protocol.OPTION_ANIMATE);
        if (anim != null) animate = Boolean.parseBoolean(anim);
        sourceUri = options.get(Protocol.OPTION_SOURCE_URI);
    }

    // --- dirty state

    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        dirty = true;
    }

    public void markSaved() {
        dirty = false;
    }

    // --- broadcast bookkeeping

    public Optional<ModelElement> broadcastRoot() {
        return Optional.ofNullable(broadcastRoot);
    }

    public void broadcastRoot(ModelElement root) {
        this.broadcastRoot = root;
    }

    public boolean broadcastDirty() {
        return broadcastDirty;
    }

    public void broadcastDirty(boolean dirty) {
        this.broadcastDirty = dirty;
    }

    public Optional<List<String>> broadcastLayers() {
        return Optional.ofNullable(broadcastLayers);
    }

    public void broadcastLayers(List<String> activeLayerIds) {
        this.broadcastLayers = List.copyOf(activeLayerIds);
    }

    public Optional<List<ToolDescriptor>> broadcastTools() {
        return Optional.ofNullable(broadcastTools);
    }

    public void broadcastTools(List<ToolDescriptor> tools) {
        this.broadcastTools = List.copyOf(tools);
    }

    public Optional<List<OperationDescriptor>> broadcastOperations() {
        return Optional.ofNullable(broadcastOperations);
    }

    public void broadcastOperations(List<OperationDescriptor> operations) {
        this.broadcastOperations = List.copyOf(operations);
    }

    // --- lifecycle

    /**
     * Enter the terminal state. Outstanding server requests fail with
     * {@link DiagramSessionsException.UnknownSession}; queued edits and any pending handshake are
     * dropped.
     */
    public void close() {
        if (state == SessionState.CLOSED) return;
        state = SessionState.CLOSED;
        pendingBounds = null;
        queuedEdits.clear();
        deferredResponses.clear();
        for (CompletableFuture<Action> reply : pendingRequests.values()) {
            reply.completeExceptionally(new DiagramSessionsException.UnknownSession(clientId));
        }
        pendingRequests.clear();
    }

    private void requireOpen() {
        if (state == SessionState.CLOSED) {
            throw new DiagramSessionsException.UnknownSession(clientId);
        }
    }
}
