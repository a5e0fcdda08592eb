package com.e2eq.docmap.codec;

import com.e2eq.docmap.exceptions.MalformedDocumentException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Calendar dates are stored as a {@link Date} at midnight UTC.
 */
public class LocalDateCodec implements ValueCodec<LocalDate> {

    private static final String SHAPE = "a date";

    @Override
    public Class<LocalDate> getValueClass() {
        return LocalDate.class;
    }

    @Override
    public Object encode(LocalDate value) {
        if (value == null) {
            return null;
        }
        return Date.from(value.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    @Override
    public LocalDate decode(Object primitive, String field) {
        if (primitive == null) {
            return null;
        }
        if (primitive instanceof LocalDate) {
            return (LocalDate) primitive;
        }
        if (primitive instanceof Date) {
            return ((Date) primitive).toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        }
        if (primitive instanceof Instant) {
            return ((Instant) primitive).atZone(ZoneOffset.UTC).toLocalDate();
        }
        if (primitive instanceof String) {
            return parse((String) primitive, field);
        }
        throw new MalformedDocumentException(field, SHAPE, primitive);
    }

    @Override
    public Object normalize(Object input, String field) {
        if (input instanceof String && ((String) input).isBlank()) {
            return null;
        }
        return ValueCodec.super.normalize(input, field);
    }

    private LocalDate parse(String text, String field) {
        String trimmed = text.trim();
        try {
            if (trimmed.length() <= 10) {
                return LocalDate.parse(trimmed);
            }
            return OffsetDateTime.parse(trimmed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new MalformedDocumentException(field, SHAPE, text, e);
        }
    }
}
