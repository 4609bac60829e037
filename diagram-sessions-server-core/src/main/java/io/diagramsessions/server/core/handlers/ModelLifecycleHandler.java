package io.diagramsessions.server.core.handlers;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.TypeHint;
import io.diagramsessions.server.core.ActionRegistry;
import io.diagramsessions.server.core.Availability;
import io.diagramsessions.server.core.LayerVisibility;
import io.diagramsessions.server.core.ModelIndex;
import io.diagramsessions.server.core.ModelUpdater;
import io.diagramsessions.server.core.PendingBounds;
import io.diagramsessions.server.core.Session;
import io.diagramsessions.server.spi.AsyncModelPersistence;
import io.diagramsessions.server.spi.CapabilityProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Model loading, type hints, selection, save and export.
 */
public final class ModelLifecycleHandler {

    private static final Logger log = LoggerFactory.getLogger(ModelLifecycleHandler.class);

    private final CapabilityProvider provider;
    private final AsyncModelPersistence persistence;
    private final ModelUpdater updater;
    private final Availability availability;
    private final LayerVisibility visibility;

    public ModelLifecycleHandler(
            CapabilityProvider provider,
            AsyncModelPersistence persistence,
            ModelUpdater updater,
            Availability availability,
            LayerVisibility visibility) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.updater = Objects.requireNonNull(updater, "updater");
        this.availability = Objects.requireNonNull(availability, "availability");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public void registerWith(ActionRegistry.Builder registry) {
        registry.register(Action.RequestModel.KIND, Action.RequestModel.class, (ctx, a) -> requestModel(ctx.session(), a));
        registry.register(Action.RequestTypeHints.KIND, Action.RequestTypeHints.class, (ctx, a) -> requestTypeHints(ctx.session()));
        registry.register(Action.Select.KIND, Action.Select.class, (ctx, a) -> select(ctx.session(), a));
        registry.register(Action.SelectAll.KIND, Action.SelectAll.class, (ctx, a) -> selectAll(ctx.session(), a));
        registry.register(Action.SaveModel.KIND, Action.SaveModel.class, (ctx, a) -> save(ctx.session(), a));
        registry.register(Action.ExportSvg.KIND, Action.ExportSvg.class, (ctx, a) -> export(ctx.session(), a));
    }

    /**
     * Load and emit the model on the first request; repeat requests re-send what the client
     * should currently hold without touching the revision.
     */
    CompletableFuture<List<Action>> requestModel(Session session, Action.RequestModel request) {
        session.applyOptions(request.options());
        Optional<ModelElement> shown = session.broadcastRoot();
        if (shown.isPresent()) {
            return CompletableFuture.completedFuture(List.of(new Action.SetModel(shown.get())));
        }
        Optional<PendingBounds> pending = session.pendingBounds();
        if (pending.isPresent()) {
            ModelElement candidate = visibility.project(pending.get().candidateRoot(), session.activeLayers())
                    .withRevision(pending.get().requestedRevision());
            return CompletableFuture.completedFuture(List.of(new Action.RequestBounds(candidate)));
        }
        String sourceUri = session.sourceUri().orElse(null);
        return persistence.load(sourceUri).thenCompose(loaded -> {
            ModelElement root = loaded.orElseGet(ModelElement::emptyRoot);
            int size = ModelIndex.of(root).ids().size();
            log.info("client {}: loaded model from {} ({} elements)", session.clientId(), sourceUri, size);
            return updater.propose(session, root);
        });
    }

    CompletableFuture<List<Action>> requestTypeHints(Session session) {
        List<TypeHint> hints = new ArrayList<>(provider.shapeHints());
        hints.addAll(provider.edgeHints());
        session.replaceTypeHints(hints);
        return CompletableFuture.completedFuture(List.of(new Action.SetTypeHints(provider.shapeHints(), provider.edgeHints())));
    }

    CompletableFuture<List<Action>> select(Session session, Action.Select select) {
        ModelIndex index = ModelIndex.of(requireModel(session));
        List<String> known = new ArrayList<>();
        for (String id : select.selectedElementIds()) {
            if (index.contains(id)) {
                known.add(id);
            } else {
                log.debug("client {}: ignoring selection of unknown element {}", session.clientId(), id);
            }
        }
        session.deselect(select.deselectedElementIds());
        session.select(known);
        return CompletableFuture.completedFuture(List.of());
    }

    CompletableFuture<List<Action>> selectAll(Session session, Action.SelectAll selectAll) {
        ModelElement model = requireModel(session);
        session.clearSelection();
        if (selectAll.select()) {
            ModelIndex visible = ModelIndex.of(visibility.project(model, session.activeLayers()));
            List<String> ids = new ArrayList<>(visible.ids());
            ids.remove(visible.root().id());
            session.select(ids);
        }
        return CompletableFuture.completedFuture(List.of());
    }

    CompletableFuture<List<Action>> save(Session session, Action.SaveModel save) {
        ModelElement model = requireModel(session);
        String uri = save.fileUri() != null ? save.fileUri() : session.sourceUri().orElse(null);
        return persistence.save(uri, model).thenApply(ignored -> {
            session.markSaved();
            log.info("client {}: saved revision {} to {}", session.clientId(), model.revision(), uri);
            return availability.changedBroadcasts(session);
        });
    }

    CompletableFuture<List<Action>> export(Session session, Action.ExportSvg export) {
        requireModel(session);
        String uri = session.sourceUri().orElse(null);
        return persistence.export(uri, export.svg()).thenApply(ignored -> {
            log.debug("client {}: exported svg for {}", session.clientId(), uri);
            return List.of();
        });
    }

    private static ModelElement requireModel(Session session) {
        return session.model().orElseThrow(() ->
                new DiagramSessionsException.OperationNotPermitted("no model has been loaded for " + session.clientId()));
    }
}
