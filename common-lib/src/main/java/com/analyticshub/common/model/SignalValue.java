package com.analyticshub.common.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Value carried by a {@link Signal}: either a plain number or a structured JSON object.
 *
 * <p>The two shapes are never aggregated together. Keeping them as distinct variants
 * means the consensus engine partitions by type instead of inspecting raw values.
 *
 * <p>On the wire the variant is implicit: a JSON number decodes to {@link Numeric},
 * a JSON object to {@link Structured}; anything else is rejected by
 * {@link SignalValueJson.Deserializer}.
 */
@JsonSerialize(using = SignalValueJson.Serializer.class)
@JsonDeserialize(using = SignalValueJson.Deserializer.class)
public sealed interface SignalValue permits SignalValue.Numeric, SignalValue.Structured {

    static SignalValue numeric(double value) {
        return new Numeric(value);
    }

    static SignalValue structured(Map<String, Object> fields) {
        return new Structured(fields);
    }

    boolean isNumeric();

    /**
     * Numeric reading of this value.
     *
     * @throws IllegalStateException when called on a {@link Structured} value
     */
    double asNumber();

    record Numeric(double value) implements SignalValue {

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double asNumber() {
            return value;
        }
    }

    record Structured(Map<String, Object> fields) implements SignalValue {

        public Structured {
            Objects.requireNonNull(fields, "fields");
            // insertion order is part of the serialized identity
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public boolean isNumeric() {
            return false;
        }

        @Override
        public double asNumber() {
            throw new IllegalStateException("Structured signal value has no numeric reading: " + fields);
        }
    }
}
