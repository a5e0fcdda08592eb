package com.e2eq.docmap.codec;

import com.e2eq.docmap.exceptions.MalformedDocumentException;

/**
 * Base for codecs whose primitive form is a single scalar. Form input arrives as text,
 * so {@link #normalize(Object, String)} parses strings and treats a blank string as no value.
 */
public abstract class ScalarCodec<T> implements ValueCodec<T> {

    private final Class<T> valueClass;
    private final String shape;

    protected ScalarCodec(Class<T> valueClass, String shape) {
        this.valueClass = valueClass;
        this.shape = shape;
    }

    @Override
    public Class<T> getValueClass() {
        return valueClass;
    }

    @Override
    public Object encode(T value) {
        return value;
    }

    @Override
    public T decode(Object primitive, String field) {
        if (primitive == null) {
            return null;
        }
        if (valueClass.isInstance(primitive)) {
            return valueClass.cast(primitive);
        }
        T converted = convert(primitive);
        if (converted == null) {
            throw malformed(field, primitive);
        }
        return converted;
    }

    @Override
    public Object normalize(Object input, String field) {
        if (input instanceof String && ((String) input).isBlank() && valueClass != String.class) {
            return null;
        }
        if (input instanceof String && valueClass != String.class) {
            try {
                return encode(parse(((String) input).trim()));
            } catch (RuntimeException e) {
                throw new MalformedDocumentException(field, shape, input, e);
            }
        }
        return ValueCodec.super.normalize(input, field);
    }

    protected MalformedDocumentException malformed(String field, Object value) {
        return new MalformedDocumentException(field, shape, value);
    }

    /**
     * Converts a primitive of a compatible but different Java type, or returns {@code null}
     * when the primitive cannot represent a value of this type.
     */
    protected abstract T convert(Object primitive);

    protected abstract T parse(String text);
}
