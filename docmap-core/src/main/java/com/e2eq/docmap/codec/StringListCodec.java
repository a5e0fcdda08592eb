package com.e2eq.docmap.codec;

import com.e2eq.docmap.exceptions.MalformedDocumentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered list of strings. Form input may supply a single comma separated string,
 * which is split and trimmed during {@link #normalize(Object, String)}.
 */
public class StringListCodec implements ValueCodec<List<String>> {

    private static final String SHAPE = "a list of strings";

    @SuppressWarnings("unchecked")
    private static final Class<List<String>> LIST_CLASS = (Class<List<String>>) (Class<?>) List.class;

    @Override
    public Class<List<String>> getValueClass() {
        return LIST_CLASS;
    }

    @Override
    public Object encode(List<String> value) {
        return value == null ? null : new ArrayList<>(value);
    }

    @Override
    public List<String> decode(Object primitive, String field) {
        if (primitive == null) {
            return null;
        }
        if (!(primitive instanceof Collection)) {
            throw new MalformedDocumentException(field, SHAPE, primitive);
        }
        List<String> out = new ArrayList<>();
        for (Object element : (Collection<?>) primitive) {
            if (element == null || element instanceof String) {
                out.add((String) element);
            } else if (element instanceof Number || element instanceof Boolean) {
                out.add(element.toString());
            } else {
                throw new MalformedDocumentException(field, SHAPE, primitive);
            }
        }
        return out;
    }

    @Override
    public Object normalize(Object input, String field) {
        if (input instanceof String) {
            List<String> parts = new ArrayList<>();
            for (String part : ((String) input).split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    parts.add(trimmed);
                }
            }
            return parts;
        }
        if (input instanceof Collection) {
            return encode(decode(input, field));
        }
        return ValueCodec.super.normalize(input, field);
    }
}
