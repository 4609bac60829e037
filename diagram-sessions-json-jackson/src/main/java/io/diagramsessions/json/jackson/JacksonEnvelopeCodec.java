package io.diagramsessions.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.diagramsessions.core.Action;
import io.diagramsessions.core.ActionEnvelope;
import io.diagramsessions.core.ActionTypes;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.json.spi.EnvelopeCodec;
import io.diagramsessions.json.spi.JsonException;

import java.util.Objects;
import java.util.Optional;

/**
 * Jackson implementation of {@link EnvelopeCodec}.
 *
 * <p>Actions are written as flat objects whose first field is {@code kind}; decoding resolves the
 * record type through the configured {@link ActionTypes}. Null fields are omitted on the wire.
 */
public final class JacksonEnvelopeCodec implements EnvelopeCodec {
    private final ObjectMapper mapper;
    private final ActionTypes types;

    /**
     * Creates a codec for the built-in action kinds.
     */
    public JacksonEnvelopeCodec() {
        this(ActionTypes.defaults());
    }

    /**
     * Creates a codec for a custom action table with a default ObjectMapper.
     */
    public JacksonEnvelopeCodec(ActionTypes types) {
        this(types, new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a codec configuring the given ObjectMapper. The mapper is modified in place
     * and should not be shared with unrelated code.
     */
    public JacksonEnvelopeCodec(ActionTypes types, ObjectMapper mapper) {
        this.types = Objects.requireNonNull(types, "types");
        this.mapper = configure(Objects.requireNonNull(mapper, "mapper"), types);
    }

    static ObjectMapper configure(ObjectMapper mapper, ActionTypes types) {
        SimpleModule module = new SimpleModule("diagram-sessions");
        module.setSerializerModifier(new ActionSerializerModifier());
        module.addDeserializer(Action.class, new ActionDeserializer(types));
        return mapper
                .registerModule(module)
                .addMixIn(ModelElement.class, ModelElementMixin.class)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    public ActionTypes types() {
        return types;
    }

    @Override
    public byte[] encode(ActionEnvelope envelope) throws JsonException {
        rejectUnrecognized(envelope);
        try {
            return mapper.writeValueAsBytes(envelope);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize envelope to bytes", e);
        }
    }

    @Override
    public String encodeString(ActionEnvelope envelope) throws JsonException {
        rejectUnrecognized(envelope);
        try {
            return mapper.writeValueAsString(envelope);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize envelope to string", e);
        }
    }

    @Override
    public ActionEnvelope decode(byte[] data) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot decode empty frame");
        }
        try {
            return mapper.readValue(data, ActionEnvelope.class);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + ActionEnvelope.class.getName(), e);
        }
    }

    @Override
    public ActionEnvelope decode(String json) throws JsonException {
        if (json == null || json.isBlank()) {
            throw new JsonException("Cannot decode empty frame");
        }
        try {
            return mapper.readValue(json, ActionEnvelope.class);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to " + ActionEnvelope.class.getName(), e);
        }
    }

    @Override
    public Optional<String> peekClientId(byte[] data) {
        if (data == null || data.length == 0) return Optional.empty();
        try (JsonParser parser = mapper.getFactory().createParser(data)) {
            JsonNode node = mapper.readTree(parser);
            if (node == null || !node.isObject()) return Optional.empty();
            JsonNode clientId = node.get("clientId");
            if (clientId == null || !clientId.isTextual() || clientId.asText().isBlank()) return Optional.empty();
            return Optional.of(clientId.asText());
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static void rejectUnrecognized(ActionEnvelope envelope) throws JsonException {
        Objects.requireNonNull(envelope, "envelope");
        if (envelope.action() instanceof Action.Unrecognized unrecognized) {
            throw new JsonException("Refusing to encode unrecognized action kind: " + unrecognized.kind());
        }
    }
}
