package com.e2eq.docmap.codec;

import com.e2eq.docmap.exceptions.MalformedDocumentException;

/**
 * Bidirectional converter between a typed value and its document-safe primitive form.
 * <p>
 * Primitive forms are the values a document may hold: strings, numbers, booleans,
 * {@link java.util.Date}, nested {@link org.bson.Document}s and lists.
 * Implementations must satisfy {@code decode(encode(v)).equals(v)} for canonical values,
 * and {@link #normalize(Object, String)} must converge on the same primitive regardless
 * of the form it was given.
 * </p>
 *
 * @param <T> the typed value
 */
public interface ValueCodec<T> {

    Class<T> getValueClass();

    /**
     * Typed value to primitive. {@code null} encodes to {@code null}.
     */
    Object encode(T value);

    /**
     * Primitive to typed value.
     *
     * @throws MalformedDocumentException if the primitive does not have the expected shape
     */
    T decode(Object primitive, String field) throws MalformedDocumentException;

    /**
     * Accepts a typed value, a raw primitive or a partially formed input and returns the
     * canonical primitive. Applying it to its own output returns an equal value.
     */
    default Object normalize(Object input, String field) {
        if (input == null) {
            return null;
        }
        if (getValueClass().isInstance(input)) {
            return encode(getValueClass().cast(input));
        }
        return encode(decode(input, field));
    }
}
