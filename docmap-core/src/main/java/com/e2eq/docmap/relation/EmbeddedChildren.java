package com.e2eq.docmap.relation;

import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.query.EntityQuery;
import com.e2eq.docmap.store.Documents;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Navigation from an entity to the elements embedded elsewhere that carry its id, for example
 * from an actor to the roles embedded in movies.
 * <p>
 * Resolution takes two steps: {@link #parents()} finds every document of the target collection
 * whose embedded sequence holds a matching element, then {@link #children()} extracts that
 * element from each. The cost is one query plus work proportional to the matching parents.
 * </p>
 *
 * @param <P> the type embedding the children
 * @param <C> the embedded child type
 */
public class EmbeddedChildren<P extends DocumentEntity, C extends DocumentEntity> extends RelationSlot {

    public EmbeddedChildren(DocumentEntity owner, RelationDescriptor descriptor) {
        super(owner, descriptor);
    }

    public EntityQuery<P> parents() {
        String path = descriptor.getEmbeddingPath() + "." + descriptor.getForeignKey();
        return datastore().find(this.<P>targetType()).where(new Document(path, owner.getStoredId()));
    }

    public List<C> children() {
        String sequence = this.<P>targetType().embeddedRelationForKey(descriptor.getEmbeddingPath())
                .map(RelationDescriptor::getName)
                .orElseThrow(() -> new IllegalStateException(descriptor.getTarget().getName()
                        + " embeds nothing under '" + descriptor.getEmbeddingPath() + "'"));
        Object ownerId = owner.getStoredId();
        List<C> children = new ArrayList<>();
        for (P parent : parents()) {
            @SuppressWarnings("unchecked")
            EmbeddedMany<C> elements = (EmbeddedMany<C>) parent.relationSlot(sequence);
            for (C child : elements) {
                Object key = DocumentEntity.ID.equals(descriptor.getForeignKey())
                        ? child.getStoredId()
                        : child.rawAttribute(descriptor.getForeignKey());
                if (Documents.valuesEqual(ownerId, key)) {
                    children.add(child);
                }
            }
        }
        return children;
    }
}
