package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.ActionEnvelope;
import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.LayerDescriptor;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.TypeHint;
import io.diagramsessions.server.core.handlers.BoundsCoordinator;
import io.diagramsessions.server.core.handlers.CorrelationHandler;
import io.diagramsessions.server.core.handlers.EditPipeline;
import io.diagramsessions.server.core.handlers.LayerToolHandler;
import io.diagramsessions.server.core.handlers.ModelLifecycleHandler;
import io.diagramsessions.server.spi.AsyncModelPersistence;
import io.diagramsessions.server.spi.BlockingToAsyncPersistence;
import io.diagramsessions.server.spi.CapabilityProvider;
import io.diagramsessions.server.spi.InMemoryModelPersistence;
import io.diagramsessions.server.spi.LayoutEngine;
import io.diagramsessions.server.spi.ModelDiffer;
import io.diagramsessions.server.spi.ModelPersistence;
import io.diagramsessions.server.spi.OutboundSink;
import io.diagramsessions.server.spi.RequestIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Transport-neutral entry point of the Diagram Sessions protocol.
 *
 * <p>The transport hands every decoded envelope to {@link #submit(ActionEnvelope)}. Envelopes of
 * one client are processed strictly in arrival order by that client's {@link SessionActor};
 * different clients proceed in parallel. Outbound actions are returned from {@code submit} and
 * also published to the client's observers, which additionally receive server-originated
 * traffic ({@link #request}, {@link #replaceModel}).
 *
 * <p>Use {@link #builder(CapabilityProvider)} to create instances:
 * <pre>{@code
 * DiagramSessionsEngine engine = DiagramSessionsEngine.builder(provider)
 *     .persistence(myPersistence)
 *     .needsClientLayout(true)
 *     .build();
 * }</pre>
 */
public final class DiagramSessionsEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagramSessionsEngine.class);

    private final CapabilityProvider provider;
    private final ActionDispatcher dispatcher;
    private final ModelUpdater updater;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final boolean needsClientLayout;
    private final boolean animateUpdates;
    private final Clock clock;
    private final RequestIdGenerator requestIds;

    private final ConcurrentMap<String, Entry> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ObserverList> observers = new ConcurrentHashMap<>();

    /**
     * Creates a new builder.
     *
     * @param provider the diagram language's type hints, layers, tools and operations (required)
     */
    public static Builder builder(CapabilityProvider provider) {
        return new Builder(provider);
    }

    private DiagramSessionsEngine(Builder builder) {
        this.provider = builder.provider;
        this.ownedExecutor = builder.executor == null ? SessionThreads.create() : null;
        this.executor = builder.executor != null ? builder.executor : ownedExecutor;
        this.needsClientLayout = builder.needsClientLayout;
        this.animateUpdates = builder.animateUpdates;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.requestIds = builder.requestIdGenerator != null ? builder.requestIdGenerator : new SequentialRequestIdGenerator();
        AsyncModelPersistence persistence = builder.persistence;
        if (persistence == null) {
            ModelPersistence blocking = builder.blockingPersistence != null ? builder.blockingPersistence : new InMemoryModelPersistence();
            persistence = new BlockingToAsyncPersistence(blocking, executor);
        }
        ModelDiffer differ = builder.modelDiffer != null ? builder.modelDiffer : ModelDiffer.none();

        LayerVisibility visibility = new LayerVisibility(provider);
        Availability availability = new Availability(provider, visibility);
        this.updater = new ModelUpdater(visibility, availability, builder.layoutEngine, differ);

        ActionRegistry.Builder registry = ActionRegistry.builder();
        new ModelLifecycleHandler(provider, persistence, updater, availability, visibility).registerWith(registry);
        new BoundsCoordinator(updater).registerWith(registry);
        new EditPipeline(updater, visibility).registerWith(registry);
        new LayerToolHandler(availability, visibility, updater).registerWith(registry);
        new CorrelationHandler().registerWith(registry);
        for (Consumer<ActionRegistry.Builder> extension : builder.extensions) {
            extension.accept(registry);
        }
        this.dispatcher = new ActionDispatcher(registry.build());
    }

    /**
     * Process one inbound envelope.
     *
     * <p>Capability requests open a session if the client has none. Any other action for a client
     * without an open session is answered with an {@code UnknownSession} status. The returned
     * future completes with the outbound envelopes of this envelope (including those of queued
     * edits it released) and never completes exceptionally.
     */
    public CompletableFuture<List<ActionEnvelope>> submit(ActionEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        String clientId = envelope.clientId();
        Action action = envelope.action();
        Entry entry = opensSession(action) ? sessions.computeIfAbsent(clientId, this::open) : sessions.get(clientId);
        if (entry == null) {
            log.warn("client {}: no open session for {}", clientId, action.kind());
            return CompletableFuture.completedFuture(publish(clientId, List.of(unknownSession(clientId))));
        }
        return entry.actor.submit(() -> {
            Session session = entry.session;
            if (session.isClosed()) {
                return CompletableFuture.completedFuture(publish(clientId, List.of(unknownSession(clientId))));
            }
            return dispatcher.dispatch(session, action)
                    .thenCompose(out -> replayQueuedEdits(session, out))
                    .thenApply(out -> publish(clientId, out));
        });
    }

    /**
     * Register a sink for every outbound envelope of {@code clientId}. A sink may be registered
     * before the session opens. Cancelling the last subscription of a client drops its entry.
     */
    public ObserverList.Subscription observe(String clientId, OutboundSink sink) {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(sink, "sink");
        ObserverList list = observers.compute(clientId, (id, existing) -> {
            ObserverList target = existing != null ? existing : new ObserverList();
            target.add(sink);
            return target;
        });
        return () -> observers.computeIfPresent(clientId, (id, current) -> {
            list.remove(sink);
            return current == list && list.isEmpty() ? null : current;
        });
    }

    /**
     * Send a server-originated identifiable request and await the client's answer.
     *
     * @return the inner action of the matching {@code identifiableResponseAction}; fails with
     *         {@link DiagramSessionsException.UnknownSession} if the session is or gets closed
     */
    public CompletableFuture<Action> request(String clientId, Action action) {
        Objects.requireNonNull(action, "action");
        Entry entry = sessions.get(clientId);
        if (entry == null) {
            return CompletableFuture.failedFuture(new DiagramSessionsException.UnknownSession(clientId));
        }
        CompletableFuture<Action> reply = new CompletableFuture<>();
        entry.actor.submit(() -> {
            Session session = entry.session;
            if (session.isClosed()) {
                throw new DiagramSessionsException.UnknownSession(clientId);
            }
            String id = requestIds.next(clientId);
            session.addPendingRequest(id, reply);
            log.debug("client {}: sending request {} ({})", clientId, id, action.kind());
            publish(clientId, List.of(new Action.IdentifiableRequest(id, action)));
            return CompletableFuture.<Void>completedFuture(null);
        }).whenComplete((ignored, failure) -> {
            if (failure != null) reply.completeExceptionally(ActionDispatcher.unwrap(failure));
        });
        return reply;
    }

    /**
     * Replace the model of an open session from the server side, for example after the source
     * changed outside the editor. The change follows the same commit or handshake path as an edit
     * but does not mark the session dirty.
     */
    public CompletableFuture<List<ActionEnvelope>> replaceModel(String clientId, ModelElement root) {
        Objects.requireNonNull(root, "root");
        Entry entry = sessions.get(clientId);
        if (entry == null) {
            return CompletableFuture.failedFuture(new DiagramSessionsException.UnknownSession(clientId));
        }
        return entry.actor.submit(() -> {
            Session session = entry.session;
            if (session.isClosed()) {
                throw new DiagramSessionsException.UnknownSession(clientId);
            }
            ModelIndex.of(root);
            log.debug("client {}: model replaced by the server", clientId);
            return updater.propose(session, root)
                    .thenCompose(out -> replayQueuedEdits(session, out))
                    .thenApply(out -> publish(clientId, out));
        });
    }

    /**
     * Send actions to a client's observers without touching its session, if any.
     */
    public void send(String clientId, Action action) {
        if (!hasObservers(clientId)) {
            log.debug("client {}: nobody observes, {} dropped", clientId, action.kind());
        }
        publish(clientId, List.of(action));
    }

    boolean hasObservers(String clientId) {
        return observers.containsKey(clientId);
    }

    public CompletableFuture<Optional<SessionSnapshot>> snapshot(String clientId) {
        Entry entry = sessions.get(clientId);
        if (entry == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return entry.actor.submit(() -> CompletableFuture.completedFuture(Optional.of(SessionSnapshot.of(entry.session))));
    }

    public Set<String> clientIds() {
        return Set.copyOf(sessions.keySet());
    }

    /**
     * Tear down the session of {@code clientId} after the envelopes already submitted for it,
     * whose outbound envelopes still reach the client's observers. Later envelopes other than
     * capability requests are answered with {@code UnknownSession}.
     */
    public CompletableFuture<Void> close(String clientId) {
        Entry entry = sessions.remove(clientId);
        ObserverList list = observers.get(clientId);
        if (entry == null) {
            if (list != null) observers.remove(clientId, list);
            return CompletableFuture.completedFuture(null);
        }
        return entry.actor.submit(() -> {
            entry.session.close();
            if (list != null) observers.remove(clientId, list);
            log.info("client {}: session closed", clientId);
            return CompletableFuture.<Void>completedFuture(null);
        });
    }

    /**
     * Close every open session, then stop the executor the engine created for itself. An executor
     * passed to {@link Builder#executor(Executor)} stays running.
     */
    public CompletableFuture<Void> shutdown() {
        List<CompletableFuture<Void>> closing = new ArrayList<>();
        for (String clientId : sessions.keySet()) closing.add(close(clientId));
        return CompletableFuture.allOf(closing.toArray(new CompletableFuture<?>[0]))
                .whenComplete((ignored, failure) -> {
                    if (ownedExecutor != null) {
                        ownedExecutor.shutdown();
                        log.info("session executor stopped");
                    }
                });
    }

    public ActionRegistry registry() {
        return dispatcher.registry();
    }

    private Entry open(String clientId) {
        Session session = new Session(clientId, clock.instant(), needsClientLayout, animateUpdates);
        List<TypeHint> hints = new ArrayList<>(provider.shapeHints());
        hints.addAll(provider.edgeHints());
        session.replaceTypeHints(hints);
        for (LayerDescriptor layer : provider.layers()) {
            if (layer.activeByDefault()) session.setLayerActive(layer.id(), true);
        }
        log.info("client {}: session opened", clientId);
        return new Entry(session, new SessionActor(executor));
    }

    private CompletableFuture<List<Action>> replayQueuedEdits(Session session, List<Action> out) {
        if (session.state() != SessionState.READY) {
            return CompletableFuture.completedFuture(out);
        }
        Optional<Action> next = session.pollQueuedEdit();
        if (next.isEmpty()) {
            return CompletableFuture.completedFuture(out);
        }
        log.debug("client {}: replaying queued {}", session.clientId(), next.get().kind());
        return dispatcher.dispatch(session, next.get()).thenCompose(more -> {
            List<Action> all = new ArrayList<>(out);
            all.addAll(more);
            return replayQueuedEdits(session, all);
        });
    }

    private List<ActionEnvelope> publish(String clientId, List<Action> actions) {
        List<ActionEnvelope> envelopes = new ArrayList<>(actions.size());
        for (Action action : actions) envelopes.add(new ActionEnvelope(clientId, action));
        ObserverList list = observers.get(clientId);
        if (list != null) {
            for (ActionEnvelope envelope : envelopes) list.publish(envelope);
        }
        return envelopes;
    }

    private static boolean opensSession(Action action) {
        if (action instanceof Action.IdentifiableRequest request) {
            return request.action() instanceof Action.CapabilityRequest;
        }
        return action instanceof Action.CapabilityRequest;
    }

    private static Action unknownSession(String clientId) {
        return Action.ServerStatus.error(new DiagramSessionsException.UnknownSession(clientId).getMessage());
    }

    private static final class Entry {
        final Session session;
        final SessionActor actor;

        Entry(Session session, SessionActor actor) {
            this.session = session;
            this.actor = actor;
        }
    }

    /**
     * Builder for {@link DiagramSessionsEngine}.
     */
    public static final class Builder {
        private final CapabilityProvider provider;
        private AsyncModelPersistence persistence;
        private ModelPersistence blockingPersistence;
        private LayoutEngine layoutEngine;
        private ModelDiffer modelDiffer;
        private Executor executor;
        private boolean needsClientLayout;
        private boolean animateUpdates;
        private Clock clock;
        private RequestIdGenerator requestIdGenerator;
        private final List<Consumer<ActionRegistry.Builder>> extensions = new ArrayList<>();

        private Builder(CapabilityProvider provider) {
            this.provider = Objects.requireNonNull(provider, "provider");
        }

        /** Sets the asynchronous persistence collaborator. Default: in-memory. */
        public Builder persistence(AsyncModelPersistence persistence) {
            this.persistence = persistence;
            this.blockingPersistence = null;
            return this;
        }

        /** Sets a blocking persistence collaborator, run on the engine executor. */
        public Builder persistence(ModelPersistence persistence) {
            this.blockingPersistence = persistence;
            this.persistence = null;
            return this;
        }

        /** Sets the server-side layout used when the client does not measure. Default: none. */
        public Builder layoutEngine(LayoutEngine layoutEngine) {
            this.layoutEngine = layoutEngine;
            return this;
        }

        /** Sets the differ producing matches for animated updates. Default: {@link ModelDiffer#none()}. */
        public Builder modelDiffer(ModelDiffer modelDiffer) {
            this.modelDiffer = modelDiffer;
            return this;
        }

        /**
         * Sets the executor session actors run on. The caller keeps ownership. Default: an
         * engine-owned executor of {@code diagram-sessions-N} threads, stopped by
         * {@link DiagramSessionsEngine#shutdown()}.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Whether sessions delegate layout to the client unless their {@code requestModel}
         * options say otherwise. Default: false.
         */
        public Builder needsClientLayout(boolean needsClientLayout) {
            this.needsClientLayout = needsClientLayout;
            return this;
        }

        /** Whether updates ask the client to animate. Default: false. */
        public Builder animateUpdates(boolean animateUpdates) {
            this.animateUpdates = animateUpdates;
            return this;
        }

        /** Sets the clock for session timestamps. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Sets the id strategy for server requests. Default: {@link SequentialRequestIdGenerator}. */
        public Builder requestIdGenerator(RequestIdGenerator requestIdGenerator) {
            this.requestIdGenerator = requestIdGenerator;
            return this;
        }

        /**
         * Registers a handler for an additional action kind. Kinds already handled by the engine
         * are rejected when the engine is built.
         */
        public <A extends Action> Builder handler(String kind, Class<A> type, ActionHandler<? super A> handler) {
            extensions.add(registry -> registry.register(kind, type, handler));
            return this;
        }

        /** Builds the engine with the configured settings. */
        public DiagramSessionsEngine build() {
            return new DiagramSessionsEngine(this);
        }
    }
}
