package io.diagramsessions.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.diagramsessions.core.ActionTypes;
import io.diagramsessions.core.ShapeTypeHint;
import io.diagramsessions.json.spi.EnvelopeCodec;
import io.diagramsessions.server.core.DiagramSessionsEndpoint;
import io.diagramsessions.server.core.DiagramSessionsEngine;
import io.diagramsessions.server.core.ServiceLoaderEnvelopeCodecs;
import io.diagramsessions.server.spi.StaticCapabilityProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonEndpointTest {

    private final ObjectMapper plain = new ObjectMapper();
    private final List<JsonNode> frames = new ArrayList<>();
    private DiagramSessionsEndpoint endpoint;

    @BeforeEach
    void setUp() {
        EnvelopeCodec codec = ServiceLoaderEnvelopeCodecs.defaultCodecs()
                .find(JacksonEnvelopeCodecProvider.NAME, ActionTypes.defaults())
                .orElseThrow();
        DiagramSessionsEngine engine = DiagramSessionsEngine.builder(StaticCapabilityProvider.builder()
                        .shapeHint(new ShapeTypeHint("task", true, true, true, true, List.of()))
                        .build())
                .executor(Runnable::run)
                .build();
        endpoint = new DiagramSessionsEndpoint(engine, codec);
        endpoint.connect("c1", bytes -> {
            try {
                frames.add(plain.readTree(bytes));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @Test
    void jacksonCodecIsDiscoveredThroughServiceLoader() {
        assertThat(ServiceLoaderEnvelopeCodecs.defaultCodecs().names()).contains("jackson");
    }

    @Test
    void modelRequestIsAnsweredWithEncodedModel() {
        receive("{\"clientId\":\"c1\",\"action\":{\"kind\":\"requestModel\"}}");

        JsonNode first = frames.get(0);
        assertThat(first.get("clientId").asText()).isEqualTo("c1");
        assertThat(first.get("action").get("kind").asText()).isEqualTo("setModel");
        assertThat(first.get("action").get("newRoot").get("id").asText()).isEqualTo("root");
        assertThat(first.get("action").get("newRoot").get("revision").asLong()).isZero();
    }

    @Test
    void createdNodeIsSentBackInTheNextRevision() {
        receive("{\"clientId\":\"c1\",\"action\":{\"kind\":\"requestModel\"}}");
        frames.clear();

        receive("{\"clientId\":\"c1\",\"action\":{\"kind\":\"createNode\",\"elementTypeId\":\"task\","
                + "\"location\":{\"x\":10,\"y\":20},\"args\":{\"id\":\"t1\"}}}");

        JsonNode update = frames.stream()
                .filter(frame -> frame.get("action").get("kind").asText().equals("updateModel"))
                .findFirst()
                .orElseThrow();
        JsonNode root = update.get("action").get("newRoot");
        assertThat(root.get("revision").asLong()).isEqualTo(1);
        assertThat(root.get("children").get(0).get("id").asText()).isEqualTo("t1");
        assertThat(root.get("children").get(0).get("position").get("x").asDouble()).isEqualTo(10.0);
    }

    @Test
    void malformedFrameIsReportedToItsSender() {
        receive("{\"clientId\":\"c1\",\"action\":{\"layerId\":\"x\"}}");

        assertThat(frames).hasSize(1);
        JsonNode status = frames.get(0).get("action");
        assertThat(status.get("kind").asText()).isEqualTo("serverStatus");
        assertThat(status.get("severity").asText()).isEqualTo("ERROR");
        assertThat(status.get("message").asText()).startsWith("malformed message");
    }

    @Test
    void frameWithoutClientIdIsDropped() {
        receive("garbage");

        assertThat(frames).isEmpty();
    }

    @Test
    void unknownKindIsAnsweredWithErrorStatus() {
        receive("{\"clientId\":\"c1\",\"action\":{\"kind\":\"requestTools\"}}");
        frames.clear();

        receive("{\"clientId\":\"c1\",\"action\":{\"kind\":\"fitToScreen\",\"padding\":5}}");

        assertThat(frames).hasSize(1);
        assertThat(frames.get(0).get("action").get("message").asText()).isEqualTo("unknown action kind: fitToScreen");
    }

    @Test
    void disconnectStopsDelivery() {
        receive("{\"clientId\":\"c1\",\"action\":{\"kind\":\"requestTools\"}}");
        endpoint.disconnect("c1").join();
        frames.clear();

        receive("{\"clientId\":\"c1\",\"action\":{\"kind\":\"requestTools\"}}");

        assertThat(frames).isEmpty();
    }

    private void receive(String json) {
        endpoint.receive(json.getBytes(StandardCharsets.UTF_8)).join();
    }
}
