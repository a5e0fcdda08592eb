package com.e2eq.docmap.codec;

import com.e2eq.docmap.exceptions.MalformedDocumentException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;

public class InstantCodec implements ValueCodec<Instant> {

    private static final String SHAPE = "a timestamp";

    @Override
    public Class<Instant> getValueClass() {
        return Instant.class;
    }

    @Override
    public Object encode(Instant value) {
        return value == null ? null : Date.from(value);
    }

    @Override
    public Instant decode(Object primitive, String field) {
        if (primitive == null) {
            return null;
        }
        if (primitive instanceof Instant) {
            return (Instant) primitive;
        }
        if (primitive instanceof Date) {
            return ((Date) primitive).toInstant();
        }
        if (primitive instanceof String) {
            try {
                return Instant.parse(((String) primitive).trim());
            } catch (DateTimeParseException e) {
                throw new MalformedDocumentException(field, SHAPE, primitive, e);
            }
        }
        throw new MalformedDocumentException(field, SHAPE, primitive);
    }
}
