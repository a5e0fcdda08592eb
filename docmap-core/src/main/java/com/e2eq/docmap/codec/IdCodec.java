package com.e2eq.docmap.codec;

import com.e2eq.docmap.exceptions.MalformedDocumentException;
import org.bson.types.ObjectId;

/**
 * A stored identifier: a string, or an {@link ObjectId} as written by other tools. Both forms are
 * kept as given so that filters built from them match the stored value exactly.
 */
public class IdCodec implements ValueCodec<Object> {

    private static final String SHAPE = "an identifier";

    @Override
    public Class<Object> getValueClass() {
        return Object.class;
    }

    @Override
    public Object encode(Object value) {
        return value;
    }

    @Override
    public Object decode(Object primitive, String field) {
        if (primitive == null || primitive instanceof String || primitive instanceof ObjectId) {
            return primitive;
        }
        if (primitive instanceof Number) {
            return primitive.toString();
        }
        throw new MalformedDocumentException(field, SHAPE, primitive);
    }

    @Override
    public Object normalize(Object input, String field) {
        if (input instanceof String) {
            String text = ((String) input).trim();
            return text.isEmpty() ? null : text;
        }
        return decode(input, field);
    }

    /**
     * Identifier equality across forms: an {@link ObjectId} matches its hex string.
     */
    public static boolean sameId(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.toString().equals(b.toString());
    }
}
