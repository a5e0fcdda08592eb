package com.e2eq.docmap.relation;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.exceptions.MalformedDocumentException;
import com.e2eq.docmap.exceptions.MissingIdentityException;
import com.e2eq.docmap.exceptions.UnsavedParentException;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.DocumentMapper;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.store.Documents;
import org.bson.Document;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An ordered sequence of values embedded in the owner's document. Element identifiers are unique
 * within the owner.
 * <p>
 * On a persisted root owner, {@link #append(DocumentEntity)} and {@link #remove(String)} write
 * through with {@code $push} and {@code $pull}. Otherwise changes are staged and written with the
 * owner's next save.
 * </p>
 */
public class EmbeddedMany<T extends DocumentEntity> extends RelationSlot implements Iterable<T> {
    private static final Logger LOG = Logger.getLogger(EmbeddedMany.class);

    private final List<T> elements = new ArrayList<>();

    public EmbeddedMany(DocumentEntity owner, RelationDescriptor descriptor) {
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
        if (!(stored instanceof Collection)) {
            throw new MalformedDocumentException(key, "an array of embedded documents", stored);
        }
        EntityType<T> type = targetType();
        for (Object element : (Collection<?>) stored) {
            elements.add(DocumentMapper.instance().embeddedFromDocument(type, element, owner, key));
        }
        state = SlotState.ATTACHED;
    }

    public List<T> list() {
        load();
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<T> iterator() {
        return list().iterator();
    }

    public int size() {
        load();
        return elements.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Optional<T> find(String id) {
        load();
        if (id == null) {
            return Optional.empty();
        }
        return elements.stream().filter(e -> id.equals(e.getId())).findFirst();
    }

    public List<T> where(Predicate<? super T> predicate) {
        load();
        return elements.stream().filter(predicate).collect(Collectors.toList());
    }

    /**
     * Builds a new element and appends it in memory only.
     */
    public T build(Consumer<? super T> initializer) {
        load();
        T child = newElement(initializer);
        addInMemory(child);
        markStaged();
        return child;
    }

    /**
     * Builds a new element and writes it through to the stored owner document.
     *
     * @throws UnsavedParentException if the owner has not been saved
     */
    public T create(Consumer<? super T> initializer) {
        if (!owner.isPersisted()) {
            throw new UnsavedParentException(owner.getEntityType().getName(), descriptor.getName());
        }
        return append(newElement(initializer));
    }

    /**
     * Appends an element. Written through with {@code $push} when the owner is a persisted root
     * document, staged otherwise.
     *
     * @throws IllegalArgumentException if an element with the same identifier is already present
     * @throws MissingIdentityException if the element's identity cannot be derived
     */
    public T append(T child) {
        load();
        addInMemory(child);
        if (!writesThrough()) {
            markStaged();
            return child;
        }
        String key = descriptor.getEmbeddingPath();
        Document stored = DocumentMapper.instance().toEmbeddedDocument(child, true);
        datastore().writeThrough(owner, new Document("$push", new Document(key, stored)));
        List<Object> persisted = persistedElements();
        persisted.add(stored);
        owner.refreshSnapshot(key, persisted);
        if (state != SlotState.BUILT) {
            state = SlotState.ATTACHED;
        }
        return child;
    }

    public boolean remove(T child) {
        return remove(child.getId());
    }

    /**
     * Removes the element with the given identifier, writing through with {@code $pull} when the
     * owner is a persisted root document.
     *
     * @return {@code false} if no such element was present
     */
    public boolean remove(String id) {
        load();
        T existing = find(id).orElse(null);
        if (existing == null) {
            return false;
        }
        elements.remove(existing);
        existing.setEmbeddedParent(null);
        if (!writesThrough()) {
            markStaged();
            return true;
        }
        String key = descriptor.getEmbeddingPath();
        datastore().writeThrough(owner,
                new Document("$pull", new Document(key, new Document(DocumentEntity.ID, existing.getStoredId()))));
        List<Object> persisted = persistedElements();
        persisted.removeIf(e -> e instanceof Document
                && Documents.valuesEqual(((Document) e).get(DocumentEntity.ID), existing.getStoredId()));
        owner.refreshSnapshot(key, persisted);
        return true;
    }

    /**
     * Replaces all elements in memory; written with the owner's next save.
     */
    public void replaceAll(Collection<? extends T> replacement) {
        load();
        for (T element : elements) {
            element.setEmbeddedParent(null);
        }
        elements.clear();
        for (T element : replacement) {
            addInMemory(element);
        }
        markStaged();
    }

    public void clear() {
        replaceAll(List.of());
    }

    private T newElement(Consumer<? super T> initializer) {
        T child = this.<T>targetType().newInstance();
        if (initializer != null) {
            initializer.accept(child);
        }
        return child;
    }

    private void addInMemory(T child) {
        String id = child.getId();
        if (id == null) {
            throw new MissingIdentityException(child.getEntityType().getName(), child.getEntityType().getIdentityField());
        }
        for (T element : elements) {
            if (id.equals(element.getId())) {
                throw new IllegalArgumentException(descriptor.getName() + " of " + owner.getEntityType().getName()
                        + " already holds an element with id " + id);
            }
        }
        child.setEmbeddedParent(owner);
        elements.add(child);
    }

    private boolean writesThrough() {
        return owner.isPersisted() && !owner.isEmbedded();
    }

    private void markStaged() {
        state = SlotState.BUILT;
        if (owner.isPersisted() && LOG.isDebugEnabled()) {
            LOG.debugf("Staged change to %s.%s until the next save", owner.getEntityType().getName(), descriptor.getName());
        }
    }

    private List<Object> persistedElements() {
        Object stored = owner.getSnapshotValue(descriptor.getEmbeddingPath());
        return stored instanceof Collection ? new ArrayList<>((Collection<?>) stored) : new ArrayList<>();
    }

    @Override
    public Object toDocumentValue(DocumentMapper mapper) {
        if (state == SlotState.ABSENT && elements.isEmpty()) {
            return null;
        }
        List<Document> stored = new ArrayList<>(elements.size());
        for (T element : elements) {
            stored.add(mapper.toEmbeddedDocument(element, true));
        }
        return stored;
    }

    @Override
    public void afterOwnerSaved(Datastore datastore) {
        if (state == SlotState.BUILT) {
            state = SlotState.ATTACHED;
        }
    }
}
