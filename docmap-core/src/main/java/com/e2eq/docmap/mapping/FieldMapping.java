package com.e2eq.docmap.mapping;

import com.e2eq.docmap.codec.ValueCodec;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of an entity type's field table: the key stored in the document, the optional
 * accessor alias application code uses, and the codec converting between the two forms.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FieldMapping<T> {

    private final String documentKey;
    private final String alias;
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final ValueCodec<T> codec;

    public FieldMapping(String documentKey, String alias, ValueCodec<T> codec) {
        if (documentKey == null || documentKey.isBlank()) {
            throw new IllegalArgumentException("documentKey is required");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec is required for field " + documentKey);
        }
        this.documentKey = documentKey;
        this.alias = alias;
        this.codec = codec;
    }

    public String getAccessorName() {
        return alias != null ? alias : documentKey;
    }

    public boolean isAliased() {
        return alias != null && !alias.equals(documentKey);
    }
}
