package com.e2eq.docmap.relation;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.exceptions.UnsavedParentException;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.DocumentMapper;
import org.bson.Document;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * A single value embedded in the owner's document.
 * <p>
 * A stored empty document is a hollow value: {@link #hasValue()} reports {@code true} and its
 * attributes are all unset. A missing key is an absent value.
 * </p>
 */
public class EmbeddedOne<T extends DocumentEntity> extends RelationSlot {

    private T value;

    public EmbeddedOne(DocumentEntity owner, RelationDescriptor descriptor) {
        super(owner, descriptor);
    }

    private void load() {
        if (state != SlotState.UNLOADED) {
            return;
        }
        String key = descriptor.getEmbeddingPath();
        Object stored = owner.rawAttribute(key);
        if (stored == null) {
            state = SlotState.ABSENT;
            return;
        }
        value = DocumentMapper.instance().embeddedFromDocument(this.<T>targetType(), stored, owner, key);
        state = SlotState.ATTACHED;
    }

    public Optional<T> get() {
        load();
        return Optional.ofNullable(value);
    }

    public boolean hasValue() {
        load();
        return value != null;
    }

    /**
     * Replaces the value in memory. It is written with the owner's next save.
     */
    public T build() {
        return build(null);
    }

    public T build(Consumer<? super T> initializer) {
        load();
        T child = this.<T>targetType().newInstance();
        if (initializer != null) {
            initializer.accept(child);
        }
        child.setEmbeddedParent(owner);
        value = child;
        state = SlotState.BUILT;
        return child;
    }

    /**
     * Builds a value and writes it through to the stored owner document at once.
     *
     * @throws UnsavedParentException if the owner has not been saved
     */
    public T create() {
        return create(null);
    }

    public T create(Consumer<? super T> initializer) {
        if (!owner.isPersisted()) {
            throw new UnsavedParentException(owner.getEntityType().getName(), descriptor.getName());
        }
        if (owner.isEmbedded()) {
            throw new IllegalStateException("create is only supported on root documents, save "
                    + owner.getEmbeddedParent().getEntityType().getName() + " instead");
        }
        T child = build(initializer);
        String key = descriptor.getEmbeddingPath();
        Document stored = DocumentMapper.instance().toEmbeddedDocument(child, false);
        datastore().writeThrough(owner, new Document("$set", new Document(key, stored)));
        owner.refreshSnapshot(key, stored);
        state = SlotState.ATTACHED;
        return child;
    }

    /**
     * Sets or clears the value in memory. Clearing removes the key on the owner's next save.
     */
    public void assign(T newValue) {
        load();
        if (newValue == null) {
            if (value != null) {
                value.setEmbeddedParent(null);
                value = null;
                state = SlotState.REMOVED;
            }
            return;
        }
        newValue.setEmbeddedParent(owner);
        value = newValue;
        state = SlotState.BUILT;
    }

    @Override
    public Object toDocumentValue(DocumentMapper mapper) {
        return value == null ? null : mapper.toEmbeddedDocument(value, false);
    }

    @Override
    public void afterOwnerSaved(Datastore datastore) {
        if (state == SlotState.BUILT || state == SlotState.REMOVED) {
            state = value == null ? SlotState.ABSENT : SlotState.ATTACHED;
        }
    }
}
