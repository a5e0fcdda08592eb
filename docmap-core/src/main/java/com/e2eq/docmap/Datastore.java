package com.e2eq.docmap;

import com.e2eq.docmap.cascade.CascadeEngine;
import com.e2eq.docmap.cascade.PostDestroyHook;
import com.e2eq.docmap.cascade.PreDestroyHook;
import com.e2eq.docmap.config.DocMapConfig;
import com.e2eq.docmap.exceptions.CascadeRestrictedException;
import com.e2eq.docmap.exceptions.DocumentValidationException;
import com.e2eq.docmap.exceptions.MissingIdentityException;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.DocumentMapper;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.query.EntityQuery;
import com.e2eq.docmap.relation.RelationSlot;
import com.e2eq.docmap.store.DocumentStore;
import com.e2eq.docmap.store.Documents;
import com.e2eq.docmap.validation.EntityValidator;
import com.e2eq.docmap.validation.ValidationViolation;
import org.bson.Document;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the mapping layer: entity lifecycle (save, destroy, delete), lookups and
 * destroy-hook registration over one {@link DocumentStore}.
 * <p>
 * Single-threaded use is assumed. Nothing is locked and concurrent writers to the same document
 * overwrite each other.
 * </p>
 */
public class Datastore {
    private static final Logger LOG = Logger.getLogger(Datastore.class);

    private final DocumentStore store;
    private final DocMapConfig config;
    private final DocumentMapper mapper = DocumentMapper.instance();
    private final EntityValidator validator;
    private final CascadeEngine cascadeEngine;
    private final Map<EntityType<?>, List<PreDestroyHook>> preDestroyHooks = new IdentityHashMap<>();
    private final Map<EntityType<?>, List<PostDestroyHook>> postDestroyHooks = new IdentityHashMap<>();

    public Datastore(DocumentStore store) {
        this(store, DocMapConfig.defaults());
    }

    public Datastore(DocumentStore store, DocMapConfig config) {
        this(store, config, new EntityValidator());
    }

    public Datastore(DocumentStore store, DocMapConfig config, EntityValidator validator) {
        this.store = store;
        this.config = config;
        this.validator = validator;
        this.cascadeEngine = new CascadeEngine(this);
    }

    public DocumentStore getStore() {
        return store;
    }

    public DocMapConfig getConfig() {
        return config;
    }

    public <E extends DocumentEntity> E newEntity(EntityType<E> type) {
        E entity = type.newInstance();
        entity.bind(this);
        return entity;
    }

    /**
     * Validates and writes a root entity: an insert the first time, afterwards an update holding
     * only the keys that changed since the last write. Pending many-to-many links are written
     * to the partners afterwards. Partners that will be inserted with the entity are validated
     * with it; their violations are reported on the entity under the relation's name.
     *
     * @return {@code false} if validation failed, the violations being on the entity, or if the
     *         entity's stored document was removed by someone else
     * @throws DocumentValidationException instead of returning {@code false} when strict
     *                                     validation is configured
     * @throws MissingIdentityException    if the entity's identity cannot be derived
     */
    public boolean save(DocumentEntity entity) {
        return save(entity, config.isStrictValidation());
    }

    /**
     * @throws DocumentValidationException if validation fails
     */
    public void saveStrict(DocumentEntity entity) {
        save(entity, true);
    }

    private boolean save(DocumentEntity entity, boolean strict) {
        EntityType<?> type = entity.getEntityType();
        if (entity.isEmbedded()) {
            throw new IllegalArgumentException(type.getName() + " is embedded; save its root document instead");
        }
        if (entity.isDestroyed()) {
            throw new IllegalStateException(type.getName() + " " + entity.getId() + " has been destroyed");
        }
        String collection = type.requireCollection();
        entity.bind(this);

        List<ValidationViolation> violations = new ArrayList<>(validator.validate(entity));
        for (RelationSlot slot : entity.activeSlots()) {
            for (DocumentEntity dependent : slot.unsavedDependents()) {
                List<ValidationViolation> dependentViolations = validator.validate(dependent);
                dependent.setViolations(dependentViolations);
                for (ValidationViolation violation : dependentViolations) {
                    violations.add(new ValidationViolation(
                            slot.getDescriptor().getName() + "." + violation.getField(),
                            violation.getMessage(), violation.getInvalidValue()));
                }
            }
        }
        entity.setViolations(violations);
        if (!violations.isEmpty()) {
            if (strict) {
                throw new DocumentValidationException(type.getName(), violations);
            }
            return false;
        }

        if (entity.isNewRecord()) {
            if (type.hasTimestamps()) {
                Instant now = Instant.now();
                if (!entity.hasAttribute(EntityType.CREATED_AT)) {
                    entity.write(EntityType.CREATED_AT, now);
                }
                entity.write(EntityType.UPDATED_AT, now);
            }
            Document document = mapper.toDocument(entity);
            store.insert(collection, document);
            entity.markPersisted(document);
            LOG.debugf("Inserted %s %s", type.getName(), entity.getId());
        } else {
            Document document = mapper.toDocument(entity);
            Document update = diff(entity.getSnapshot(), document);
            if (!update.isEmpty()) {
                if (type.hasTimestamps()) {
                    entity.write(EntityType.UPDATED_AT, Instant.now());
                    document = mapper.toDocument(entity);
                    update = diff(entity.getSnapshot(), document);
                }
                long matched = store.updateOne(collection, idFilter(entity), update);
                if (matched == 0) {
                    LOG.warnf("%s %s no longer exists in %s; update not applied", type.getName(), entity.getId(), collection);
                    return false;
                }
                LOG.debugf("Updated %s %s: %s", type.getName(), entity.getId(), update.keySet());
            }
            entity.markPersisted(document);
        }

        for (RelationSlot slot : entity.activeSlots()) {
            slot.afterOwnerSaved(this);
        }
        return true;
    }

    static Document diff(Document before, Document after) {
        Document set = new Document();
        Document unset = new Document();
        for (Map.Entry<String, Object> entry : after.entrySet()) {
            String key = entry.getKey();
            if (DocumentEntity.ID.equals(key)) {
                continue;
            }
            if (!before.containsKey(key) || !Documents.valuesEqual(before.get(key), entry.getValue())) {
                set.put(key, entry.getValue());
            }
        }
        for (String key : before.keySet()) {
            if (!after.containsKey(key)) {
                unset.put(key, "");
            }
        }
        Document update = new Document();
        if (!set.isEmpty()) {
            update.put("$set", set);
        }
        if (!unset.isEmpty()) {
            update.put("$unset", unset);
        }
        return update;
    }

    /**
     * Removes the entity after running its cascade policies and destroy hooks.
     *
     * @return {@code false} if the entity was never persisted or was already removed
     * @throws CascadeRestrictedException if a RESTRICT relation still has related documents
     */
    public boolean destroy(DocumentEntity entity) {
        entity.bind(this);
        return cascadeEngine.destroy(entity);
    }

    /**
     * Removes the entity's document only. No hooks run and related documents are untouched.
     */
    public boolean delete(DocumentEntity entity) {
        if (!entity.isPersisted()) {
            return false;
        }
        EntityType<?> type = entity.getEntityType();
        long removed = store.deleteOne(type.requireCollection(), idFilter(entity));
        entity.markDestroyed();
        LOG.debugf("Deleted %s %s", type.getName(), entity.getId());
        return removed > 0;
    }

    public <E extends DocumentEntity> EntityQuery<E> find(EntityType<E> type) {
        return new EntityQuery<>(this, type);
    }

    public <E extends DocumentEntity> Optional<E> findById(EntityType<E> type, Object id) {
        if (id == null) {
            return Optional.empty();
        }
        Document document = store.findOne(type.requireCollection(), new Document(DocumentEntity.ID, id));
        return document == null ? Optional.empty() : Optional.of(load(type, document));
    }

    /**
     * Decodes a stored document into a persisted entity bound to this datastore.
     */
    public <E extends DocumentEntity> E load(EntityType<E> type, Document document) {
        E entity = mapper.fromDocument(type, document);
        entity.bind(this);
        entity.markPersisted(document);
        return entity;
    }

    public void ensureIndexes(EntityType<?> type) {
        for (Document keys : type.getIndexes()) {
            store.createIndex(type.requireCollection(), keys);
            LOG.infof("Ensured index %s on %s", keys.toJson(), type.getCollectionName());
        }
    }

    /**
     * Applies a targeted mutation to a persisted root entity's document, bypassing validation and
     * the snapshot diff. Callers refresh the entity's snapshot for the keys they touched.
     */
    public void writeThrough(DocumentEntity root, Document mutation) {
        if (root.isEmbedded() || !root.isPersisted()) {
            throw new IllegalStateException("write-through requires a persisted root entity");
        }
        store.updateOne(root.getEntityType().requireCollection(), idFilter(root), mutation);
    }

    public void addPreDestroyHook(EntityType<?> type, PreDestroyHook hook) {
        preDestroyHooks.computeIfAbsent(type, t -> new ArrayList<>()).add(hook);
    }

    public void addPostDestroyHook(EntityType<?> type, PostDestroyHook hook) {
        postDestroyHooks.computeIfAbsent(type, t -> new ArrayList<>()).add(hook);
    }

    /**
     * The hooks declared on the type, followed by those registered here.
     */
    public List<PreDestroyHook> preDestroyHooks(EntityType<?> type) {
        List<PreDestroyHook> hooks = new ArrayList<>(type.getPreDestroyHooks());
        hooks.addAll(preDestroyHooks.getOrDefault(type, List.of()));
        return hooks;
    }

    public List<PostDestroyHook> postDestroyHooks(EntityType<?> type) {
        List<PostDestroyHook> hooks = new ArrayList<>(type.getPostDestroyHooks());
        hooks.addAll(postDestroyHooks.getOrDefault(type, List.of()));
        return hooks;
    }

    private static Document idFilter(DocumentEntity entity) {
        return new Document(DocumentEntity.ID, entity.getStoredId());
    }
}
