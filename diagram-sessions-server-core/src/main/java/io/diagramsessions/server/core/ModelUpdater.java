package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.server.spi.LayoutEngine;
import io.diagramsessions.server.spi.ModelDiffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Turns a new candidate model into outbound actions, either by committing it directly or by
 * starting the bounds handshake.
 *
 * <p>Revision rules: the first candidate a session ever sees keeps revision 0; every later
 * candidate advances the revision before it is sent or committed. A candidate that replaces a
 * pending one supersedes it, so only the newest bounds request can still commit.
 */
public final class ModelUpdater {

    private static final Logger log = LoggerFactory.getLogger(ModelUpdater.class);

    private final LayerVisibility visibility;
    private final Availability availability;
    private final LayoutEngine layoutEngine;
    private final ModelDiffer differ;

    /**
     * @param layoutEngine server-side layout, or null to commit candidates as they are
     */
    public ModelUpdater(LayerVisibility visibility, Availability availability, LayoutEngine layoutEngine, ModelDiffer differ) {
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.availability = Objects.requireNonNull(availability, "availability");
        this.layoutEngine = layoutEngine;
        this.differ = Objects.requireNonNull(differ, "differ");
    }

    public CompletableFuture<List<Action>> propose(Session session, ModelElement candidate) {
        return propose(session, candidate, false);
    }

    /**
     * @param edit whether the candidate comes from a client edit; the session is marked dirty
     *             once the candidate is committed or its handshake has started
     */
    public CompletableFuture<List<Action>> propose(Session session, ModelElement candidate, boolean edit) {
        Objects.requireNonNull(candidate, "candidate");
        boolean initial = !session.hasModel() && session.pendingBounds().isEmpty();
        if (session.needsClientLayout()) {
            long revision = initial ? session.modelRevision() : session.advanceRevision();
            if (edit) session.markDirty();
            return CompletableFuture.completedFuture(requestBounds(session, candidate, revision));
        }
        if (layoutEngine == null) {
            if (!initial) session.advanceRevision();
            if (edit) session.markDirty();
            return CompletableFuture.completedFuture(commit(session, candidate));
        }
        // revision and dirty flag move only after the layout succeeds
        long revision = initial ? session.modelRevision() : session.modelRevision() + 1;
        ModelElement visible = visibility.project(candidate, session.activeLayers()).withRevision(revision);
        return layoutEngine.layout(visible, revision).thenApply(result -> {
            if (result.revision() != revision) {
                throw new IllegalStateException("layout engine answered revision " + result.revision() + " for " + revision);
            }
            if (!initial) session.advanceRevision();
            if (edit) session.markDirty();
            return commit(session, ModelTrees.mergeLayout(candidate, result.bounds(), result.alignments()));
        });
    }

    /**
     * Store {@code candidate} as the pending computation for {@code revision} and ask the client
     * to measure its visible part.
     */
    public List<Action> requestBounds(Session session, ModelElement candidate, long revision) {
        Optional<PendingBounds> superseded = session.pendingBounds();
        session.awaitBounds(new PendingBounds(revision, candidate));
        superseded.ifPresent(old -> log.debug("client {}: bounds request {} superseded by {}",
                session.clientId(), old.requestedRevision(), revision));
        log.debug("client {}: requesting bounds for revision {}", session.clientId(), revision);
        ModelElement visible = visibility.project(candidate, session.activeLayers()).withRevision(revision);
        return List.of(new Action.RequestBounds(visible));
    }

    /**
     * Commit {@code root} at the current revision and describe the change to the client: a
     * {@code setModel} the first time, an {@code updateModel} afterwards, followed by whatever
     * derived lists changed. Client requests waiting on this commit each get the model change
     * wrapped in their own {@code identifiableResponseAction}.
     */
    public List<Action> commit(Session session, ModelElement root) {
        ModelElement committed = root.withRevision(session.modelRevision());
        Optional<ModelElement> previous = session.broadcastRoot();
        session.commit(committed);
        ModelElement visible = visibility.project(committed, session.activeLayers());
        Action change;
        if (previous.isEmpty()) {
            change = new Action.SetModel(visible);
        } else {
            boolean animate = session.animate();
            change = new Action.UpdateModel(visible, animate, animate ? differ.diff(previous.get(), visible) : List.of());
        }
        List<Action> out = new ArrayList<>();
        List<String> waiting = session.takeDeferredResponses();
        if (waiting.isEmpty()) {
            out.add(change);
        } else {
            for (String id : waiting) out.add(new Action.IdentifiableResponse(id, change));
        }
        session.broadcastRoot(visible);
        log.debug("client {}: committed revision {}", session.clientId(), session.modelRevision());
        out.addAll(availability.changedBroadcasts(session));
        return out;
    }
}
