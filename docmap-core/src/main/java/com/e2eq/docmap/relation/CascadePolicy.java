package com.e2eq.docmap.relation;

/**
 * What happens to related documents when an entity is destroyed.
 * <p>
 * ORPHAN and NULLIFY differ for referenced children: ORPHAN leaves the child's foreign key
 * pointing at the removed parent, NULLIFY clears it. For many-to-many partners both remove
 * the destroyed id from the partner's id collection.
 * </p>
 */
public enum CascadePolicy {
    ORPHAN,
    NULLIFY,
    DESTROY,
    DELETE,
    RESTRICT
}
