package io.diagramsessions.server.core;

import io.diagramsessions.core.LayerDescriptor;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.server.spi.CapabilityProvider;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which element types a session shows.
 *
 * <p>A type that no layer claims is always visible. A claimed type is visible while at least one
 * of the layers claiming it is active. The root is always visible.
 */
public final class LayerVisibility {

    private final CapabilityProvider provider;

    public LayerVisibility(CapabilityProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public Optional<LayerDescriptor> layer(String layerId) {
        for (LayerDescriptor layer : provider.layers()) {
            if (layer.id().equals(layerId)) return Optional.of(layer);
        }
        return Optional.empty();
    }

    public boolean isVisible(String elementTypeId, Set<String> activeLayers) {
        if (elementTypeId == null) return true;
        boolean claimed = false;
        for (LayerDescriptor layer : provider.layers()) {
            if (!layer.elementTypeIds().contains(elementTypeId)) continue;
            if (activeLayers.contains(layer.id())) return true;
            claimed = true;
        }
        return !claimed;
    }

    /**
     * The part of {@code root} the client sees: hidden elements are removed with their subtrees,
     * along with edges that lost an endpoint.
     */
    public ModelElement project(ModelElement root, Set<String> activeLayers) {
        return ModelTrees.prune(root, element -> isVisible(element.type(), activeLayers));
    }
}
