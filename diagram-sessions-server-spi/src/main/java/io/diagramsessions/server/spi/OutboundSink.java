package io.diagramsessions.server.spi;

import io.diagramsessions.core.ActionEnvelope;

/**
 * Transport-side consumer of outbound envelopes. One session may have several sinks (observers).
 *
 * <p>Implementations must not block; the engine calls them from session actor threads.
 */
@FunctionalInterface
public interface OutboundSink {

    void accept(ActionEnvelope envelope);
}
