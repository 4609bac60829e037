package io.diagramsessions.json.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.diagramsessions.core.Action;
import io.diagramsessions.core.ActionTypes;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the record type of an action object from its {@code kind} field.
 *
 * <p>Unknown kinds become {@link Action.Unrecognized} so that the server can answer with a status
 * action instead of dropping the frame.
 */
final class ActionDeserializer extends StdDeserializer<Action> {
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD = new TypeReference<>() {};

    private final ActionTypes types;

    ActionDeserializer(ActionTypes types) {
        super(Action.class);
        this.types = Objects.requireNonNull(types, "types");
    }

    @Override
    public Action deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || !node.isObject()) {
            return (Action) ctxt.handleUnexpectedToken(Action.class, p);
        }
        JsonNode kindNode = node.get("kind");
        if (kindNode == null || !kindNode.isTextual() || kindNode.asText().isBlank()) {
            return (Action) ctxt.reportInputMismatch(Action.class, "action has no 'kind'");
        }
        String kind = kindNode.asText();
        ObjectNode fields = ((ObjectNode) node).deepCopy();
        fields.remove("kind");

        Optional<Class<? extends Action>> type = types.find(kind);
        if (type.isEmpty()) {
            Map<String, Object> payload = ctxt.readTreeAsValue(fields, ctxt.getTypeFactory().constructType(PAYLOAD));
            return new Action.Unrecognized(kind, payload);
        }
        return ctxt.readTreeAsValue(fields, type.get());
    }
}
