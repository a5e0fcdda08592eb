package com.e2eq.docmap.cascade;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.exceptions.CascadeRestrictedException;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.relation.CascadePolicy;
import com.e2eq.docmap.relation.RelationDescriptor;
import com.e2eq.docmap.relation.RelationKind;
import com.e2eq.docmap.store.DocumentStore;
import org.bson.Document;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Executes the cascade policies declared on an entity type's referenced-children and
 * many-to-many relations when an entity is destroyed.
 * <p>
 * Order of a destroy:
 * <ol>
 *   <li>RESTRICT checks over the entity and everything its DESTROY relations would reach; a live
 *   related document anywhere aborts with nothing mutated and no hook run</li>
 *   <li>pre-destroy hooks, type-declared first, then datastore-registered</li>
 *   <li>per-relation policy processing (recursing into DESTROY children)</li>
 *   <li>removal of the entity's own document</li>
 *   <li>ORPHAN unlinks of many-to-many partners</li>
 *   <li>post-destroy hooks</li>
 * </ol>
 * A failure part way through leaves earlier steps applied; nothing rolls them back.
 * </p>
 */
public class CascadeEngine {
    private static final Logger LOG = Logger.getLogger(CascadeEngine.class);

    private final Datastore datastore;

    public CascadeEngine(Datastore datastore) {
        this.datastore = datastore;
    }

    /**
     * @return {@code false} if the entity was never persisted or is already destroyed
     * @throws CascadeRestrictedException if a RESTRICT relation still has live related documents
     */
    public boolean destroy(DocumentEntity entity) {
        if (entity.isPersisted()) {
            checkRestrictions(entity, new HashSet<>());
        }
        return destroy(entity, new HashSet<>());
    }

    /**
     * Read-only walk over the entities a destroy would reach, counting every RESTRICT relation.
     */
    private void checkRestrictions(DocumentEntity entity, Set<String> visited) {
        EntityType<?> type = entity.getEntityType();
        if (!visited.add(type.requireCollection() + "/" + entity.getId())) {
            return;
        }
        for (RelationDescriptor descriptor : type.relations()) {
            if (!descriptor.participatesInCascade()) {
                continue;
            }
            if (descriptor.getCascade() == CascadePolicy.RESTRICT) {
                long related = countRelated(entity, descriptor);
                if (related > 0) {
                    throw new CascadeRestrictedException(type.getName(), entity.getId(), descriptor.getName(), related);
                }
            } else if (descriptor.getCascade() == CascadePolicy.DESTROY) {
                for (DocumentEntity reached : destroyTargets(entity, descriptor)) {
                    checkRestrictions(reached, visited);
                }
            }
        }
    }

    private boolean destroy(DocumentEntity entity, Set<String> visited) {
        EntityType<?> type = entity.getEntityType();
        if (!entity.isPersisted()) {
            LOG.debugf("Skipping destroy of unsaved or destroyed %s %s", type.getName(), entity.getId());
            return false;
        }
        String collection = type.requireCollection();
        if (!visited.add(collection + "/" + entity.getId())) {
            return false;
        }

        List<RelationDescriptor> cascading = new ArrayList<>();
        for (RelationDescriptor descriptor : type.relations()) {
            if (descriptor.participatesInCascade()) {
                cascading.add(descriptor);
            }
        }

        for (PreDestroyHook hook : datastore.preDestroyHooks(type)) {
            hook.beforeDestroy(entity);
        }

        List<RelationDescriptor> unlinkAfterRemoval = new ArrayList<>();
        for (RelationDescriptor descriptor : cascading) {
            if (descriptor.getKind() == RelationKind.MANY_TO_MANY) {
                applyToPartners(entity, descriptor, visited, unlinkAfterRemoval);
            } else {
                applyToChildren(entity, descriptor, visited);
            }
        }

        DocumentStore store = datastore.getStore();
        store.deleteOne(collection, idFilter(entity));
        for (RelationDescriptor descriptor : unlinkAfterRemoval) {
            pullFromPartners(entity, descriptor);
        }
        entity.markDestroyed();
        LOG.debugf("Destroyed %s %s", type.getName(), entity.getId());

        for (PostDestroyHook hook : datastore.postDestroyHooks(type)) {
            hook.afterDestroy(entity);
        }
        return true;
    }

    private void applyToChildren(DocumentEntity parent, RelationDescriptor descriptor, Set<String> visited) {
        EntityType<?> target = descriptor.getTarget();
        String collection = target.requireCollection();
        Document filter = new Document(descriptor.getForeignKey(), parent.getStoredId());
        DocumentStore store = datastore.getStore();
        switch (descriptor.getCascade()) {
            case NULLIFY:
                List<Object> childIds = new ArrayList<>();
                for (Document child : store.findMany(collection, filter)) {
                    childIds.add(child.get(DocumentEntity.ID));
                }
                for (Object childId : childIds) {
                    store.updateOne(collection, new Document(DocumentEntity.ID, childId),
                            new Document("$unset", new Document(descriptor.getForeignKey(), "")));
                }
                LOG.debugf("Nullified %s on %d %s", descriptor.getForeignKey(), childIds.size(), target.getName());
                break;
            case DESTROY:
                for (DocumentEntity child : destroyTargets(parent, descriptor)) {
                    destroy(child, visited);
                }
                break;
            case DELETE:
                long deleted = store.deleteMany(collection, filter);
                LOG.debugf("Deleted %d %s of %s %s", deleted, target.getName(),
                        parent.getEntityType().getName(), parent.getId());
                break;
            default:
                // ORPHAN leaves the stale key, RESTRICT was checked up front
                break;
        }
    }

    private void applyToPartners(DocumentEntity owner, RelationDescriptor descriptor, Set<String> visited,
                                 List<RelationDescriptor> unlinkAfterRemoval) {
        switch (descriptor.getCascade()) {
            case ORPHAN:
                unlinkAfterRemoval.add(descriptor);
                break;
            case NULLIFY:
            case DELETE:
                pullFromPartners(owner, descriptor);
                break;
            case DESTROY:
                for (DocumentEntity partner : destroyTargets(owner, descriptor)) {
                    destroy(partner, visited);
                }
                owner.write(descriptor.getForeignKey(), new ArrayList<>());
                break;
            default:
                break;
        }
    }

    /**
     * Removes the owner's id from every partner document that still lists it.
     */
    private void pullFromPartners(DocumentEntity owner, RelationDescriptor descriptor) {
        if (!descriptor.isBidirectional()) {
            return;
        }
        String collection = descriptor.getTarget().requireCollection();
        String inverseKey = descriptor.getInverseForeignKey();
        DocumentStore store = datastore.getStore();
        List<Object> partnerIds = new ArrayList<>();
        Object ownerId = owner.getStoredId();
        for (Document partner : store.findMany(collection, new Document(inverseKey, ownerId))) {
            partnerIds.add(partner.get(DocumentEntity.ID));
        }
        for (Object partnerId : partnerIds) {
            store.updateOne(collection, new Document(DocumentEntity.ID, partnerId),
                    new Document("$pull", new Document(inverseKey, ownerId)));
        }
        LOG.debugf("Pulled %s %s from %d %s", owner.getEntityType().getName(), owner.getId(),
                partnerIds.size(), descriptor.getTarget().getName());
    }

    private long countRelated(DocumentEntity entity, RelationDescriptor descriptor) {
        String collection = descriptor.getTarget().requireCollection();
        if (descriptor.getKind() == RelationKind.MANY_TO_MANY) {
            List<Object> ids = partnerIds(entity, descriptor);
            if (ids.isEmpty()) {
                return 0;
            }
            return datastore.getStore().count(collection, new Document(DocumentEntity.ID, new Document("$in", ids)));
        }
        return datastore.getStore().count(collection, new Document(descriptor.getForeignKey(), entity.getStoredId()));
    }

    /**
     * The children or partners a DESTROY relation reaches from {@code entity}.
     */
    private List<? extends DocumentEntity> destroyTargets(DocumentEntity entity, RelationDescriptor descriptor) {
        if (descriptor.getKind() == RelationKind.MANY_TO_MANY) {
            List<Object> ids = partnerIds(entity, descriptor);
            if (ids.isEmpty()) {
                return List.of();
            }
            return datastore.find(descriptor.getTarget())
                    .where(new Document(DocumentEntity.ID, new Document("$in", ids))).toList();
        }
        return datastore.find(descriptor.getTarget())
                .where(new Document(descriptor.getForeignKey(), entity.getStoredId())).toList();
    }

    private static List<Object> partnerIds(DocumentEntity entity, RelationDescriptor descriptor) {
        List<Object> ids = entity.read(descriptor.getForeignKey());
        return ids == null ? new ArrayList<>() : ids;
    }

    private static Document idFilter(DocumentEntity entity) {
        return new Document(DocumentEntity.ID, entity.getStoredId());
    }
}
