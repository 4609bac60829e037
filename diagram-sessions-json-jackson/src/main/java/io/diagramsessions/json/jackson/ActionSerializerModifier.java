package io.diagramsessions.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.ser.ResolvableSerializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.util.NameTransformer;
import io.diagramsessions.core.Action;

import java.io.IOException;
import java.util.Map;

/**
 * Prefixes the bean serialization of every {@link Action} record with its {@code kind}.
 *
 * <p>Records without components have no bean serializer at all; for those only the kind is written.
 */
final class ActionSerializerModifier extends BeanSerializerModifier {

    @Override
    public JsonSerializer<?> modifySerializer(SerializationConfig config, BeanDescription beanDesc, JsonSerializer<?> serializer) {
        if (Action.class.isAssignableFrom(beanDesc.getBeanClass())) {
            return new KindPrefixedSerializer(serializer);
        }
        return serializer;
    }

    static final class KindPrefixedSerializer extends StdSerializer<Action> implements ResolvableSerializer {
        private final JsonSerializer<?> delegate;
        private JsonSerializer<Object> fields;

        KindPrefixedSerializer(JsonSerializer<?> delegate) {
            super(Action.class);
            this.delegate = delegate;
        }

        @Override
        @SuppressWarnings("unchecked")
        public void resolve(SerializerProvider provider) throws JsonMappingException {
            if (delegate == null) return;
            if (delegate instanceof ResolvableSerializer resolvable) {
                resolvable.resolve(provider);
            }
            fields = (JsonSerializer<Object>) delegate.unwrappingSerializer(NameTransformer.NOP);
        }

        @Override
        public void serialize(Action value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject(value);
            gen.writeStringField("kind", value.kind());
            if (value instanceof Action.Unrecognized unrecognized) {
                for (Map.Entry<String, Object> e : unrecognized.payload().entrySet()) {
                    if ("kind".equals(e.getKey())) continue;
                    provider.defaultSerializeField(e.getKey(), e.getValue(), gen);
                }
            } else {
                if (fields == null && delegate != null) {
                    resolve(provider);
                }
                if (fields != null) {
                    fields.serialize(value, gen, provider);
                }
            }
            gen.writeEndObject();
        }
    }
}
