package io.diagramsessions.server.spi;

import io.diagramsessions.core.ModelElement;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference in-memory {@link ModelPersistence}.
 *
 * <p>Good for unit tests and examples. Not intended for production. A null source URI is stored
 * under the empty key.
 */
public final class InMemoryModelPersistence implements ModelPersistence {

    private final Map<String, ModelElement> models = new ConcurrentHashMap<>();
    private final Map<String, String> exports = new ConcurrentHashMap<>();

    public InMemoryModelPersistence() {
    }

    public InMemoryModelPersistence(Map<String, ModelElement> initialModels) {
        Objects.requireNonNull(initialModels, "initialModels");
        initialModels.forEach((uri, root) -> models.put(key(uri), root));
    }

    @Override
    public Optional<ModelElement> load(String sourceUri) {
        return Optional.ofNullable(models.get(key(sourceUri)));
    }

    @Override
    public void save(String sourceUri, ModelElement root) {
        Objects.requireNonNull(root, "root");
        models.put(key(sourceUri), root);
    }

    @Override
    public void export(String sourceUri, String svg) {
        Objects.requireNonNull(svg, "svg");
        exports.put(key(sourceUri), svg);
    }

    public Optional<String> exported(String sourceUri) {
        return Optional.ofNullable(exports.get(key(sourceUri)));
    }

    private static String key(String sourceUri) {
        return sourceUri == null ? "" : sourceUri;
    }
}
