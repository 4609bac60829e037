package io.diagramsessions.json.spi;

import io.diagramsessions.core.ActionTypes;

/**
 * ServiceLoader provider for {@link EnvelopeCodec}.
 *
 * <p>Modules such as {@code diagram-sessions-json-jackson} should register implementations
 * via {@code META-INF/services}.
 */
public interface EnvelopeCodecProvider {

    /**
     * Short name of the underlying library, used to pick among several providers.
     */
    String name();

    /**
     * Create a codec decoding the kinds of the given table.
     */
    EnvelopeCodec create(ActionTypes types);
}
