package io.diagramsessions.json.jackson;

import io.diagramsessions.core.ActionTypes;
import io.diagramsessions.json.spi.EnvelopeCodec;
import io.diagramsessions.json.spi.EnvelopeCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonEnvelopeCodec}.
 */
public final class JacksonEnvelopeCodecProvider implements EnvelopeCodecProvider {

    public static final String NAME = "jackson";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EnvelopeCodec create(ActionTypes types) {
        return new JacksonEnvelopeCodec(types);
    }
}
