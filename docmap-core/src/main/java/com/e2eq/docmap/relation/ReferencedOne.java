package com.e2eq.docmap.relation;

import com.e2eq.docmap.exceptions.MissingIdentityException;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.store.Documents;

import java.util.Optional;

/**
 * The referencing side of a relationship: the owner holds the referenced entity's id in
 * {@code foreignKey}. The referenced entity is loaded on first {@link #get()} with a single query
 * and cached while the key is unchanged.
 */
public class ReferencedOne<T extends DocumentEntity> extends RelationSlot {

    private T cached;

    public ReferencedOne(DocumentEntity owner, RelationDescriptor descriptor) {
        super(owner, descriptor);
    }

    public Object getForeignKey() {
        return owner.rawAttribute(descriptor.getForeignKey());
    }

    public boolean isSet() {
        return getForeignKey() != null;
    }

    /**
     * Issues no query when the foreign key is unset.
     */
    public Optional<T> get() {
        Object key = getForeignKey();
        if (key == null) {
            cached = null;
            state = SlotState.ABSENT;
            return Optional.empty();
        }
        if (cached != null && Documents.valuesEqual(cached.getStoredId(), key)) {
            return Optional.of(cached);
        }
        Optional<T> loaded = datastore().findById(this.<T>targetType(), key);
        cached = loaded.orElse(null);
        state = cached == null ? SlotState.ABSENT : SlotState.ATTACHED;
        return loaded;
    }

    /**
     * Points the owner at {@code referenced}, or clears the key for {@code null}. Written with the
     * owner's next save.
     */
    public void assign(T referenced) {
        if (referenced == null) {
            owner.write(descriptor.getForeignKey(), null);
            cached = null;
            state = SlotState.REMOVED;
            return;
        }
        if (referenced.getId() == null) {
            throw new MissingIdentityException(referenced.getEntityType().getName(),
                    referenced.getEntityType().getIdentityField());
        }
        owner.write(descriptor.getForeignKey(), referenced.getStoredId());
        cached = referenced;
        state = SlotState.BUILT;
    }

    @Override
    public boolean isLoaded() {
        return cached != null;
    }
}
