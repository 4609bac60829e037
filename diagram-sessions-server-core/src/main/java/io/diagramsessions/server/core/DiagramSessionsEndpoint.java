package io.diagramsessions.server.core;

import io.diagramsessions.core.Action;
import io.diagramsessions.core.ActionEnvelope;
import io.diagramsessions.json.spi.EnvelopeCodec;
import io.diagramsessions.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Byte-level adapter between a framing transport (WebSocket, stdio, sockets) and the engine.
 *
 * <p>Inbound frames are decoded and submitted; outbound envelopes reach the transport through the
 * frame consumer given to {@link #connect}. A frame that cannot be decoded is answered with an
 * error status when its client id can still be read, otherwise it is logged and dropped.
 */
public final class DiagramSessionsEndpoint {

    private static final Logger log = LoggerFactory.getLogger(DiagramSessionsEndpoint.class);

    private final DiagramSessionsEngine engine;
    private final EnvelopeCodec codec;

    public DiagramSessionsEndpoint(DiagramSessionsEngine engine, EnvelopeCodec codec) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Route every outbound envelope of {@code clientId} to {@code frames} as encoded bytes.
     */
    public ObserverList.Subscription connect(String clientId, Consumer<byte[]> frames) {
        Objects.requireNonNull(frames, "frames");
        return engine.observe(clientId, envelope -> {
            try {
                frames.accept(codec.encode(envelope));
            } catch (JsonException e) {
                log.error("client {}: cannot encode {}", clientId, envelope.action().kind(), e);
            }
        });
    }

    /**
     * Decode and submit one inbound frame. The future completes once the frame's outbound
     * envelopes have been published.
     */
    public CompletableFuture<Void> receive(byte[] frame) {
        ActionEnvelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (JsonException e) {
            Optional<String> clientId = codec.peekClientId(frame);
            if (clientId.isEmpty()) {
                log.warn("dropping undecodable frame: {}", e.getMessage());
            } else {
                log.warn("client {}: undecodable frame: {}", clientId.get(), e.getMessage());
                engine.send(clientId.get(), Action.ServerStatus.error("malformed message: " + e.getMessage()));
            }
            return CompletableFuture.completedFuture(null);
        }
        return engine.submit(envelope).thenApply(ignored -> null);
    }

    /**
     * The transport lost {@code clientId}.
     */
    public CompletableFuture<Void> disconnect(String clientId) {
        return engine.close(clientId);
    }
}
