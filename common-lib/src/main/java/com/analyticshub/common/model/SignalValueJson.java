package com.analyticshub.common.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.LinkedHashMap;

/** Jackson codecs for {@link SignalValue}. */
final class SignalValueJson {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private SignalValueJson() {}

    static final class Serializer extends JsonSerializer<SignalValue> {
        @Override
        public void serialize(SignalValue value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            if (value instanceof SignalValue.Numeric numeric) {
                gen.writeNumber(numeric.value());
            } else if (value instanceof SignalValue.Structured structured) {
                provider.defaultSerializeValue(structured.fields(), gen);
            }
        }
    }

    static final class Deserializer extends JsonDeserializer<SignalValue> {
        @Override
        public SignalValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node.isNumber()) {
                return SignalValue.numeric(node.doubleValue());
            }
            if (node.isObject()) {
                JavaType mapType = ctxt.getTypeFactory().constructType(OBJECT_TYPE);
                LinkedHashMap<String, Object> fields = ctxt.readTreeAsValue(node, mapType);
                return SignalValue.structured(fields);
            }
            return ctxt.reportInputMismatch(SignalValue.class,
                "Signal value must be a number or a JSON object, got %s", node.getNodeType());
        }
    }
}
