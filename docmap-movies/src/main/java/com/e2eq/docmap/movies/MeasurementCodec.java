package com.e2eq.docmap.movies;

import com.e2eq.docmap.codec.ValueCodec;
import com.e2eq.docmap.exceptions.MalformedDocumentException;

import java.util.Map;

/**
 * Stores a {@link Measurement} as {@code {amount: <number>, units: <string>}}.
 * <p>
 * Besides the stored form, {@link #normalize(Object, String)} accepts a bare number, a
 * {@code Measurement} and form input where the amount arrives as text.
 * </p>
 */
public class MeasurementCodec implements ValueCodec<Measurement> {

    private static final String SHAPE = "a measurement {amount: <number>, units: <string>}";

    @Override
    public Class<Measurement> getValueClass() {
        return Measurement.class;
    }

    @Override
    public Object encode(Measurement value) {
        return value == null ? null : value.toDocument();
    }

    @Override
    public Measurement decode(Object primitive, String field) {
        if (primitive == null) {
            return null;
        }
        if (primitive instanceof Measurement) {
            return (Measurement) primitive;
        }
        if (!(primitive instanceof Map)) {
            throw new MalformedDocumentException(field, SHAPE, primitive);
        }
        Map<?, ?> map = (Map<?, ?>) primitive;
        Object amount = map.get("amount");
        Object units = map.get("units");
        if (!(amount instanceof Number) || (units != null && !(units instanceof String))) {
            throw new MalformedDocumentException(field, SHAPE, primitive);
        }
        return new Measurement((Number) amount, (String) units);
    }

    @Override
    public Object normalize(Object input, String field) {
        if (input instanceof Number) {
            return encode(new Measurement((Number) input));
        }
        if (input instanceof String) {
            String text = ((String) input).trim();
            return text.isEmpty() ? null : encode(new Measurement(parseAmount(text, field, input)));
        }
        if (input instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) input;
            Object amount = map.get("amount");
            if (amount instanceof String) {
                if (((String) amount).isBlank()) {
                    return null;
                }
                amount = parseAmount(((String) amount).trim(), field, input);
            }
            Object units = map.get("units");
            if (!(amount instanceof Number) || (units != null && !(units instanceof String))) {
                throw new MalformedDocumentException(field, SHAPE, input);
            }
            return encode(new Measurement((Number) amount, (String) units));
        }
        return ValueCodec.super.normalize(input, field);
    }

    private Double parseAmount(String text, String field, Object input) {
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            throw new MalformedDocumentException(field, SHAPE, input, e);
        }
    }
}
