package com.e2eq.docmap.relation;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.exceptions.MissingIdentityException;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.query.EntityQuery;
import org.bson.Document;

import java.util.List;
import java.util.Optional;

/**
 * The referenced side of a relationship: children live in their own collection and hold the
 * owner's id in {@code foreignKey}. Nothing is cached; every call queries.
 */
public class ReferencedMany<T extends DocumentEntity> extends RelationSlot {

    public ReferencedMany(DocumentEntity owner, RelationDescriptor descriptor) {
        super(owner, descriptor);
    }

    public EntityQuery<T> query() {
        return datastore().find(this.<T>targetType())
                .where(new Document(descriptor.getForeignKey(), owner.getStoredId()));
    }

    public List<T> list() {
        return query().toList();
    }

    /**
     * For singular relations.
     */
    public Optional<T> first() {
        return query().first();
    }

    public long count() {
        return query().count();
    }

    /**
     * Points {@code child} at the owner. When the owner is persisted the child is saved at once.
     *
     * @return {@code false} if the child failed validation
     */
    public boolean append(T child) {
        if (owner.getId() == null) {
            throw new MissingIdentityException(owner.getEntityType().getName(), owner.getEntityType().getIdentityField());
        }
        child.write(descriptor.getForeignKey(), owner.getStoredId());
        if (!owner.isPersisted()) {
            return true;
        }
        Datastore datastore = datastore();
        child.bind(datastore);
        return datastore.save(child);
    }
}
