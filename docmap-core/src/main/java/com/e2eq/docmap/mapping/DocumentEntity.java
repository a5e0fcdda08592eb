package com.e2eq.docmap.mapping;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.relation.EmbeddedChildren;
import com.e2eq.docmap.relation.EmbeddedMany;
import com.e2eq.docmap.relation.EmbeddedOne;
import com.e2eq.docmap.relation.ManyToMany;
import com.e2eq.docmap.relation.ReferencedMany;
import com.e2eq.docmap.relation.ReferencedOne;
import com.e2eq.docmap.relation.RelationDescriptor;
import com.e2eq.docmap.relation.RelationKind;
import com.e2eq.docmap.relation.RelationSlot;
import com.e2eq.docmap.store.Documents;
import com.e2eq.docmap.validation.ValidationViolation;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of mapped entities.
 * <p>
 * Attribute values are held by document key in their primitive (stored) form; typed access goes
 * through the field codecs of the entity's {@link EntityType}. Keys the type does not map are
 * kept as raw values so that documents written by other tools survive a load/save cycle.
 * </p>
 * <p>
 * Subclasses expose typed getters and setters over {@link #read(String)} and
 * {@link #write(String, Object)}, and relationship accessors over the protected slot helpers.
 * </p>
 */
public abstract class DocumentEntity {

    public static final String ID = "_id";

    private final EntityType<?> entityType;
    private final Document attributes = new Document();
    private final Map<String, RelationSlot> slots = new LinkedHashMap<>();
    private Document snapshot;
    private boolean destroyed;
    private Datastore datastore;
    private DocumentEntity embeddedParent;
    private List<ValidationViolation> violations = List.of();

    protected DocumentEntity(EntityType<?> entityType) {
        this.entityType = Objects.requireNonNull(entityType, "entityType");
    }

    public EntityType<?> getEntityType() {
        return entityType;
    }

    /**
     * Returns the identifier, deriving it on first access when none was assigned. A derived value
     * is kept only once it is non-null, so an entity whose deriving field is still unset reports
     * {@code null} and derives again later.
     */
    public String getId() {
        Object id = attributes.get(ID);
        if (id != null) {
            return id.toString();
        }
        String derived = deriveIdentity();
        if (derived != null) {
            attributes.put(ID, derived);
        }
        return derived;
    }

    public void setId(String id) {
        write(ID, id);
    }

    /**
     * The identifier as stored, which may be an {@link ObjectId} for documents written by other
     * tools. Used to build filters that match the stored value exactly.
     */
    public Object getStoredId() {
        Object id = attributes.get(ID);
        return id != null ? id : getId();
    }

    private String deriveIdentity() {
        String field = entityType.getIdentityField();
        if (field == null) {
            return new ObjectId().toHexString();
        }
        Object value = attributes.get(field);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    /**
     * Typed read of a mapped field by document key or alias. Unmapped keys return the raw value.
     */
    @SuppressWarnings("unchecked")
    public <T> T read(String name) {
        String key = entityType.resolveKey(name);
        if (ID.equals(key)) {
            return (T) getId();
        }
        Object raw = attributes.get(key);
        FieldMapping<?> mapping = entityType.field(key).orElse(null);
        if (mapping == null || raw == null) {
            return (T) raw;
        }
        return (T) mapping.getCodec().decode(raw, key);
    }

    /**
     * The primitive form of an attribute. For an embedded relation whose slot is loaded, the
     * slot's current serialization.
     */
    public Object readRaw(String name) {
        String key = entityType.resolveKey(name);
        RelationDescriptor embedded = entityType.embeddedRelationForKey(key).orElse(null);
        if (embedded != null) {
            RelationSlot slot = slots.get(embedded.getName());
            if (slot != null && slot.isLoaded()) {
                return slot.toDocumentValue(DocumentMapper.instance());
            }
        }
        return attributes.get(key);
    }

    /**
     * Stores a value under the document key of {@code name}. Mapped fields are normalized by
     * their codec; writing {@code null} removes the key.
     */
    public DocumentEntity write(String name, Object value) {
        String key = entityType.resolveKey(name);
        if (ID.equals(key)) {
            if (value == null) {
                attributes.remove(ID);
            } else {
                attributes.put(ID, value instanceof ObjectId ? value : value.toString());
            }
            return this;
        }
        RelationDescriptor embedded = entityType.embeddedRelationForKey(key).orElse(null);
        if (embedded != null) {
            // the slot decodes the raw value again on next access
            slots.remove(embedded.getName());
            putOrRemove(key, Documents.deepCopy(value));
            return this;
        }
        FieldMapping<?> mapping = entityType.field(key).orElse(null);
        Object primitive = mapping != null
                ? mapping.getCodec().normalize(value, key)
                : entityType.getCodecs().normalizeAny(value, key);
        putOrRemove(key, primitive);
        return this;
    }

    private void putOrRemove(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(entityType.resolveKey(name));
    }

    public Set<String> attributeKeys() {
        return Collections.unmodifiableSet(attributes.keySet());
    }

    /**
     * Mass assignment from form or JSON input. Values pass through the type's sanitizer, then
     * through each field codec. A mapping given for an embed-one relation builds a new embedded
     * value; a list of mappings given for an embed-many relation replaces its elements.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void assignAttributes(Map<String, ?> params) {
        Map<String, Object> sanitized = entityType.sanitize(new LinkedHashMap<>(params));
        for (Map.Entry<String, Object> entry : sanitized.entrySet()) {
            String key = entityType.resolveKey(entry.getKey());
            Object value = entry.getValue();
            RelationDescriptor embedded = entityType.embeddedRelationForKey(key).orElse(null);
            if (embedded == null && entityType.relation(entry.getKey()).map(r -> r.getKind().isEmbedded()).orElse(false)) {
                embedded = entityType.requireRelation(entry.getKey());
            }
            if (embedded == null) {
                write(key, value);
            } else if (embedded.getKind() == RelationKind.EMBED_ONE) {
                EmbeddedOne slot = embedsOne(embedded.getName());
                slot.assign(value == null ? null : buildEmbedded(embedded, value));
            } else {
                EmbeddedMany slot = embedsMany(embedded.getName());
                List<DocumentEntity> elements = new ArrayList<>();
                if (value instanceof Collection) {
                    for (Object element : (Collection<?>) value) {
                        elements.add(buildEmbedded(embedded, element));
                    }
                } else if (value != null) {
                    throw new IllegalArgumentException("'" + key + "' expects a list of embedded values");
                }
                slot.replaceAll(elements);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private DocumentEntity buildEmbedded(RelationDescriptor descriptor, Object value) {
        if (value instanceof DocumentEntity) {
            return (DocumentEntity) value;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("'" + descriptor.getName() + "' expects a mapping of attributes");
        }
        DocumentEntity child = descriptor.getTarget().newInstance();
        child.assignAttributes((Map<String, ?>) value);
        return child;
    }

    // relationship slots

    protected <T extends DocumentEntity> EmbeddedOne<T> embedsOne(String relation) {
        return slot(relation, RelationKind.EMBED_ONE);
    }

    protected <T extends DocumentEntity> EmbeddedMany<T> embedsMany(String relation) {
        return slot(relation, RelationKind.EMBED_MANY);
    }

    protected <T extends DocumentEntity> ReferencedOne<T> belongsTo(String relation) {
        return slot(relation, RelationKind.REF_ONE);
    }

    protected <T extends DocumentEntity> ReferencedMany<T> hasMany(String relation) {
        return slot(relation, RelationKind.REF_MANY);
    }

    protected <P extends DocumentEntity, C extends DocumentEntity> EmbeddedChildren<P, C> embeddedChildren(String relation) {
        return slot(relation, RelationKind.REF_MANY);
    }

    protected <T extends DocumentEntity> ManyToMany<T> manyToMany(String relation) {
        return slot(relation, RelationKind.MANY_TO_MANY);
    }

    @SuppressWarnings("unchecked")
    private <S extends RelationSlot> S slot(String relation, RelationKind expected) {
        RelationSlot slot = relationSlot(relation);
        if (slot.getDescriptor().getKind() != expected) {
            throw new IllegalArgumentException("relation '" + relation + "' of " + entityType.getName()
                    + " is " + slot.getDescriptor().getKind() + ", not " + expected);
        }
        return (S) slot;
    }

    /**
     * The slot of a declared relation, created on first access.
     */
    public RelationSlot relationSlot(String relation) {
        return slots.computeIfAbsent(relation,
                name -> RelationSlot.create(this, entityType.requireRelation(name)));
    }

    public Collection<RelationSlot> activeSlots() {
        return Collections.unmodifiableCollection(new ArrayList<>(slots.values()));
    }

    /**
     * The loaded slot of a relation, or {@code null} if it was never accessed or not loaded.
     */
    public RelationSlot loadedSlot(String relation) {
        RelationSlot slot = slots.get(relation);
        return slot != null && slot.isLoaded() ? slot : null;
    }

    /**
     * The raw stored value under a document key, without identity derivation or decoding.
     */
    public Object rawAttribute(String documentKey) {
        return attributes.get(documentKey);
    }

    Document rawAttributes() {
        return attributes;
    }

    // lifecycle

    public boolean isPersisted() {
        return snapshot != null && !destroyed;
    }

    public boolean isNewRecord() {
        return snapshot == null;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Records the document as last written to or read from the store. Saves diff against it.
     */
    public void markPersisted(Document document) {
        this.snapshot = Documents.deepCopy(document);
    }

    public Document getSnapshot() {
        return snapshot;
    }

    public Object getSnapshotValue(String documentKey) {
        return snapshot == null ? null : snapshot.get(documentKey);
    }

    /**
     * Updates one key of the snapshot after a targeted write-through, so the next save does not
     * write it again.
     */
    public void refreshSnapshot(String documentKey, Object storedValue) {
        if (snapshot == null) {
            return;
        }
        if (storedValue == null) {
            snapshot.remove(documentKey);
        } else {
            snapshot.put(documentKey, Documents.deepCopy(storedValue));
        }
    }

    public void markDestroyed() {
        this.destroyed = true;
    }

    public Datastore getDatastore() {
        if (datastore == null && embeddedParent != null) {
            return embeddedParent.getDatastore();
        }
        return datastore;
    }

    public Datastore requireDatastore() {
        Datastore bound = getDatastore();
        if (bound == null) {
            throw new IllegalStateException(entityType.getName() + " is not bound to a datastore");
        }
        return bound;
    }

    public void bind(Datastore datastore) {
        this.datastore = datastore;
    }

    /**
     * The entity whose document holds this one. Lookup only; it is never serialized.
     */
    public DocumentEntity getEmbeddedParent() {
        return embeddedParent;
    }

    public void setEmbeddedParent(DocumentEntity embeddedParent) {
        this.embeddedParent = embeddedParent;
    }

    public boolean isEmbedded() {
        return embeddedParent != null;
    }

    public List<ValidationViolation> getViolations() {
        return violations;
    }

    public void setViolations(List<ValidationViolation> violations) {
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    @Override
    public String toString() {
        return entityType.getName() + attributes.toJson();
    }
}
