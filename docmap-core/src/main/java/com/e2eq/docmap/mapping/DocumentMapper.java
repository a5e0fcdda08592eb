package com.e2eq.docmap.mapping;

import com.e2eq.docmap.exceptions.MalformedDocumentException;
import com.e2eq.docmap.exceptions.MissingIdentityException;
import com.e2eq.docmap.relation.RelationDescriptor;
import com.e2eq.docmap.relation.RelationKind;
import com.e2eq.docmap.relation.RelationSlot;
import com.e2eq.docmap.store.Documents;
import org.bson.Document;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Map;

/**
 * Converts entities to documents and back. Stateless; use {@link #instance()}.
 * <p>
 * Documents always lead with {@code _id}. Embedded relations whose slot has been loaded are
 * serialized from the slot, otherwise their stored form is copied through unchanged.
 * </p>
 */
public final class DocumentMapper {
    private static final Logger LOG = Logger.getLogger(DocumentMapper.class);

    private static final DocumentMapper INSTANCE = new DocumentMapper();

    private DocumentMapper() {
    }

    public static DocumentMapper instance() {
        return INSTANCE;
    }

    /**
     * @throws MissingIdentityException when the entity's identity cannot be derived
     */
    public Document toDocument(DocumentEntity entity) {
        String id = entity.getId();
        if (id == null) {
            EntityType<?> type = entity.getEntityType();
            throw new MissingIdentityException(type.getName(), type.getIdentityField());
        }
        return serialize(entity);
    }

    /**
     * Serializes a value embedded in another document.
     *
     * @param identityRequired elements of an embedded sequence need an identifier, single
     *                         embedded values are written without one when it cannot be derived
     */
    public Document toEmbeddedDocument(DocumentEntity entity, boolean identityRequired) {
        if (entity.getId() == null && identityRequired) {
            EntityType<?> type = entity.getEntityType();
            throw new MissingIdentityException(type.getName(), type.getIdentityField());
        }
        return serialize(entity);
    }

    private Document serialize(DocumentEntity entity) {
        EntityType<?> type = entity.getEntityType();
        Document document = new Document();
        Object id = entity.rawAttribute(DocumentEntity.ID);
        if (id != null) {
            document.put(DocumentEntity.ID, id);
        }
        for (Map.Entry<String, Object> entry : entity.rawAttributes().entrySet()) {
            String key = entry.getKey();
            if (DocumentEntity.ID.equals(key)) {
                continue;
            }
            RelationDescriptor embedded = type.embeddedRelationForKey(key).orElse(null);
            if (embedded != null && entity.loadedSlot(embedded.getName()) != null) {
                continue;
            }
            document.put(key, Documents.deepCopy(entry.getValue()));
        }
        for (RelationDescriptor descriptor : type.relations()) {
            if (!descriptor.getKind().isEmbedded()) {
                continue;
            }
            RelationSlot slot = entity.loadedSlot(descriptor.getName());
            if (slot == null) {
                continue;
            }
            Object value = slot.toDocumentValue(this);
            if (value != null) {
                document.put(descriptor.getEmbeddingPath(), value);
            }
        }
        return document;
    }

    /**
     * Builds an entity from a stored document. Every mapped field and every embedded relation is
     * checked against its codec so that a malformed document fails here, not on first access.
     *
     * @throws MalformedDocumentException naming the first field whose value has the wrong shape
     */
    public <E extends DocumentEntity> E fromDocument(EntityType<E> type, Document document) {
        E entity = type.newInstance();
        load(entity, document);
        if (LOG.isTraceEnabled()) {
            LOG.tracef("Decoded %s %s", type.getName(), entity.getId());
        }
        return entity;
    }

    /**
     * Decodes one embedded value and links it to its parent.
     */
    public <E extends DocumentEntity> E embeddedFromDocument(EntityType<E> type, Object stored,
                                                             DocumentEntity parent, String field) {
        if (!(stored instanceof Map)) {
            throw new MalformedDocumentException(field, "an embedded document", stored);
        }
        E entity = type.newInstance();
        load(entity, toDocument((Map<?, ?>) stored));
        entity.setEmbeddedParent(parent);
        return entity;
    }

    private void load(DocumentEntity entity, Document document) {
        EntityType<?> type = entity.getEntityType();
        Document attributes = entity.rawAttributes();
        attributes.clear();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value != null) {
                check(type, key, value);
            }
            attributes.put(key, Documents.deepCopy(value));
        }
    }

    private void check(EntityType<?> type, String key, Object value) {
        FieldMapping<?> mapping = type.field(key).orElse(null);
        if (mapping != null && !DocumentEntity.ID.equals(key)) {
            mapping.getCodec().decode(value, key);
            return;
        }
        RelationDescriptor embedded = type.embeddedRelationForKey(key).orElse(null);
        if (embedded == null) {
            return;
        }
        if (embedded.getKind() == RelationKind.EMBED_ONE && !(value instanceof Map)) {
            throw new MalformedDocumentException(key, "an embedded document", value);
        }
        if (embedded.getKind() == RelationKind.EMBED_MANY) {
            if (!(value instanceof Collection)) {
                throw new MalformedDocumentException(key, "an array of embedded documents", value);
            }
            for (Object element : (Collection<?>) value) {
                if (!(element instanceof Map)) {
                    throw new MalformedDocumentException(key, "an array of embedded documents", value);
                }
            }
        }
    }

    private static Document toDocument(Map<?, ?> map) {
        if (map instanceof Document) {
            return (Document) map;
        }
        return (Document) Documents.deepCopy(map);
    }
}
