package io.diagramsessions.server.core.handlers;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.server.core.ActionRegistry;
import io.diagramsessions.server.core.Availability;
import io.diagramsessions.server.core.LayerVisibility;
import io.diagramsessions.server.core.ModelUpdater;
import io.diagramsessions.server.core.Session;
import io.diagramsessions.server.core.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Tool, operation and layer requests, and layer toggling.
 *
 * <p>A toggle that changes what the client sees goes through the model update path first, so the
 * list broadcasts follow the new model instead of preceding it. While a handshake is pending
 * every effective toggle supersedes it.
 */
public final class LayerToolHandler {

    private static final Logger log = LoggerFactory.getLogger(LayerToolHandler.class);

    private final Availability availability;
    private final LayerVisibility visibility;
    private final ModelUpdater updater;

    public LayerToolHandler(Availability availability, LayerVisibility visibility, ModelUpdater updater) {
        this.availability = Objects.requireNonNull(availability, "availability");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.updater = Objects.requireNonNull(updater, "updater");
    }

    public void registerWith(ActionRegistry.Builder registry) {
        registry.register(Action.RequestTools.KIND, Action.RequestTools.class, (ctx, a) -> requestTools(ctx.session()));
        registry.register(Action.RequestLayers.KIND, Action.RequestLayers.class, (ctx, a) -> requestLayers(ctx.session()));
        registry.register(Action.ToggleLayer.KIND, Action.ToggleLayer.class, (ctx, a) -> toggleLayer(ctx.session(), a));
    }

    CompletableFuture<List<Action>> requestTools(Session session) {
        session.satisfy(Session.Capability.TOOLS);
        return CompletableFuture.completedFuture(List.of(
                availability.toolsMessage(session),
                availability.operationsMessage(session)));
    }

    CompletableFuture<List<Action>> requestLayers(Session session) {
        session.satisfy(Session.Capability.LAYERS);
        return CompletableFuture.completedFuture(List.of(availability.layersMessage(session)));
    }

    CompletableFuture<List<Action>> toggleLayer(Session session, Action.ToggleLayer toggle) {
        if (visibility.layer(toggle.layerId()).isEmpty()) {
            throw new DiagramSessionsException.InvalidElementReference("unknown layer: " + toggle.layerId());
        }
        Set<String> before = session.activeLayers();
        if (!session.setLayerActive(toggle.layerId(), toggle.active())) {
            log.debug("client {}: layer {} already {}", session.clientId(), toggle.layerId(),
                    toggle.active() ? "active" : "inactive");
            return CompletableFuture.completedFuture(List.of());
        }
        log.debug("client {}: layer {} {}", session.clientId(), toggle.layerId(), toggle.active() ? "on" : "off");
        Optional<ModelElement> working = session.workingModel();
        if (working.isPresent()) {
            ModelElement model = working.get();
            boolean shown = !visibility.project(model, before).equals(visibility.project(model, session.activeLayers()));
            if (shown || session.state() == SessionState.AWAITING_BOUNDS) {
                return updater.propose(session, model);
            }
        }
        return CompletableFuture.completedFuture(availability.changedBroadcasts(session));
    }
}
