package io.diagramsessions.server.spi;

import io.diagramsessions.core.ModelElement;

import java.util.Optional;

/**
 * Storage abstraction for diagram models.
 *
 * <p>This SPI is intentionally minimal and blocking. The engine runs it through
 * {@link BlockingToAsyncPersistence} so a slow store never blocks a session actor.
 */
public interface ModelPersistence {

    /**
     * Load the model stored for a source.
     *
     * @param sourceUri source identifier (may be null for an anonymous model)
     * @return the stored root, or empty when nothing is stored yet
     */
    Optional<ModelElement> load(String sourceUri) throws Exception;

    /**
     * Persist the current model.
     */
    void save(String sourceUri, ModelElement root) throws Exception;

    /**
     * Store an SVG rendering produced by the client.
     */
    void export(String sourceUri, String svg) throws Exception;
}
