package com.pyscope.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Serializer for Const values. Floats keep their decimal point so they read
 * back as floats, and non-finite floats are written as the bare tokens
 * Infinity, -Infinity and NaN.
 */
public class ConstValueSerializer extends JsonSerializer<Object> {
    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            writeFloating(d, gen);
        } else if (value instanceof Float f) {
            writeFloating(f.doubleValue(), gen);
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Integer i) {
            gen.writeNumber(i);
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else if (value instanceof Number n) {
            gen.writeNumber(n.longValue());
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }

    private static void writeFloating(double d, JsonGenerator gen) throws IOException {
        if (Double.isNaN(d)) {
            gen.writeNumber("NaN");
        } else if (d == Double.POSITIVE_INFINITY) {
            gen.writeNumber("Infinity");
        } else if (d == Double.NEGATIVE_INFINITY) {
            gen.writeNumber("-Infinity");
        } else {
            gen.writeNumber(d);
        }
    }
}
