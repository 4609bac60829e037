package io.diagramsessions.server.core;

import io.diagramsessions.core.ActionTypes;
import io.diagramsessions.json.spi.EnvelopeCodec;
import io.diagramsessions.json.spi.EnvelopeCodecProvider;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Envelope codec lookup backed by {@link ServiceLoader}.
 *
 * <p>Providers are keyed by their lower-cased {@link EnvelopeCodecProvider#name()}; when two share
 * a name the first one found wins.
 */
public final class ServiceLoaderEnvelopeCodecs {

    private final Map<String, EnvelopeCodecProvider> byName;

    public ServiceLoaderEnvelopeCodecs(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Map<String, EnvelopeCodecProvider> map = new LinkedHashMap<>();
        for (EnvelopeCodecProvider provider : ServiceLoader.load(EnvelopeCodecProvider.class, cl)) {
            String name = normalize(provider.name());
            if (!name.isEmpty()) map.putIfAbsent(name, provider);
        }
        this.byName = map;
    }

    public static ServiceLoaderEnvelopeCodecs defaultCodecs() {
        return new ServiceLoaderEnvelopeCodecs(Thread.currentThread().getContextClassLoader());
    }

    public Set<String> names() {
        return Set.copyOf(byName.keySet());
    }

    public Optional<EnvelopeCodec> find(String name, ActionTypes types) {
        EnvelopeCodecProvider provider = byName.get(normalize(name));
        return provider == null ? Optional.empty() : Optional.of(provider.create(types));
    }

    /**
     * A codec from the first provider on the class path.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public EnvelopeCodec first(ActionTypes types) {
        return byName.values().stream()
                .findFirst()
                .map(provider -> provider.create(types))
                .orElseThrow(() -> new IllegalStateException("no EnvelopeCodecProvider on the class path"));
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
