package io.diagramsessions.server.core;

import io.diagramsessions.core.ActionEnvelope;
import io.diagramsessions.server.spi.OutboundSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of one client's outbound envelopes to every registered sink.
 *
 * <p>A failing sink is logged and skipped; the remaining sinks still receive the envelope.
 */
public final class ObserverList {

    private static final Logger log = LoggerFactory.getLogger(ObserverList.class);

    /**
     * Handle returned by {@link DiagramSessionsEngine#observe}; cancelling it removes the sink.
     */
    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }

    private final List<OutboundSink> sinks = new CopyOnWriteArrayList<>();

    void add(OutboundSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    void remove(OutboundSink sink) {
        sinks.remove(sink);
    }

    boolean isEmpty() {
        return sinks.isEmpty();
    }

    void publish(ActionEnvelope envelope) {
        for (OutboundSink sink : sinks) {
            try {
                sink.accept(envelope);
            } catch (RuntimeException e) {
                log.warn("observer of client {} failed on {}", envelope.clientId(), envelope.action().kind(), e);
            }
        }
    }
}
