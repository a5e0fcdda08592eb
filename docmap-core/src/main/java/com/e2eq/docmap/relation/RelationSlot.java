package com.e2eq.docmap.relation;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.DocumentMapper;
import com.e2eq.docmap.mapping.EntityType;

import java.util.List;

/**
 * Per-entity state of one declared relationship. Slots are created lazily by the owning entity
 * and are only mutated through it.
 */
public abstract class RelationSlot {

    protected final DocumentEntity owner;
    protected final RelationDescriptor descriptor;
    protected SlotState state = SlotState.UNLOADED;

    protected RelationSlot(DocumentEntity owner, RelationDescriptor descriptor) {
        this.owner = owner;
        this.descriptor = descriptor;
    }

    public static RelationSlot create(DocumentEntity owner, RelationDescriptor descriptor) {
        switch (descriptor.getKind()) {
            case EMBED_ONE:
                return new EmbeddedOne<>(owner, descriptor);
            case EMBED_MANY:
                return new EmbeddedMany<>(owner, descriptor);
            case REF_ONE:
                return new ReferencedOne<>(owner, descriptor);
            case REF_MANY:
                return descriptor.isEmbeddedChildren()
                        ? new EmbeddedChildren<>(owner, descriptor)
                        : new ReferencedMany<>(owner, descriptor);
            case MANY_TO_MANY:
                return new ManyToMany<>(owner, descriptor);
            default:
                throw new IllegalArgumentException("Unsupported relation kind " + descriptor.getKind());
        }
    }

    public RelationDescriptor getDescriptor() {
        return descriptor;
    }

    public SlotState getState() {
        return state;
    }

    public boolean isLoaded() {
        return state != SlotState.UNLOADED;
    }

    /**
     * The value to store under the relation's embedding path, or {@code null} to omit the key.
     * Only embedded slots hold part of the owner's document.
     */
    public Object toDocumentValue(DocumentMapper mapper) {
        return null;
    }

    /**
     * Entities that will be inserted as part of saving the owner. The owner's save validates them
     * and fails if any of them is invalid.
     */
    public List<DocumentEntity> unsavedDependents() {
        return List.of();
    }

    /**
     * Called once the owner's document has been written.
     */
    public void afterOwnerSaved(Datastore datastore) {
    }

    protected Datastore datastore() {
        return owner.requireDatastore();
    }

    @SuppressWarnings("unchecked")
    protected <T extends DocumentEntity> EntityType<T> targetType() {
        return (EntityType<T>) descriptor.getTarget();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + descriptor.getName() + ", " + state + "]";
    }
}
