package com.e2eq.docmap.relation;

public enum RelationKind {
    EMBED_ONE,
    EMBED_MANY,
    REF_ONE,        // this side holds the foreign key
    REF_MANY,       // the other side holds the foreign key, or embeds children carrying this side's id
    MANY_TO_MANY;   // both sides hold an id collection

    public boolean isEmbedded() {
        return this == EMBED_ONE || this == EMBED_MANY;
    }
}
