package com.e2eq.docmap.codec;

import com.e2eq.docmap.exceptions.MalformedDocumentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered list of identifiers, each kept in its stored form (see {@link IdCodec}). Form input
 * may supply a comma separated string.
 */
public class IdListCodec implements ValueCodec<List<Object>> {

    private static final String SHAPE = "a list of identifiers";

    @SuppressWarnings("unchecked")
    private static final Class<List<Object>> LIST_CLASS = (Class<List<Object>>) (Class<?>) List.class;

    private final IdCodec element = new IdCodec();

    @Override
    public Class<List<Object>> getValueClass() {
        return LIST_CLASS;
    }

    @Override
    public Object encode(List<Object> value) {
        return value == null ? null : new ArrayList<>(value);
    }

    @Override
    public List<Object> decode(Object primitive, String field) {
        if (primitive == null) {
            return null;
        }
        if (!(primitive instanceof Collection)) {
            throw new MalformedDocumentException(field, SHAPE, primitive);
        }
        List<Object> out = new ArrayList<>();
        for (Object id : (Collection<?>) primitive) {
            Object decoded;
            try {
                decoded = element.decode(id, field);
            } catch (MalformedDocumentException e) {
                throw new MalformedDocumentException(field, SHAPE, primitive, e);
            }
            if (decoded != null) {
                out.add(decoded);
            }
        }
        return out;
    }

    @Override
    public Object normalize(Object input, String field) {
        if (input == null) {
            return null;
        }
        if (input instanceof Collection) {
            List<Object> out = new ArrayList<>();
            for (Object id : (Collection<?>) input) {
                Object normalized = element.normalize(id, field);
                if (normalized != null) {
                    out.add(normalized);
                }
            }
            return out;
        }
        if (input instanceof String) {
            List<Object> out = new ArrayList<>();
            for (String part : ((String) input).split(",")) {
                Object normalized = element.normalize(part, field);
                if (normalized != null) {
                    out.add(normalized);
                }
            }
            return out;
        }
        throw new MalformedDocumentException(field, SHAPE, input);
    }
}
