package com.e2eq.docmap.relation;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.codec.IdCodec;
import com.e2eq.docmap.exceptions.MissingIdentityException;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import lombok.Value;
import org.bson.Document;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Both sides hold an ordered set of the other side's ids. {@link #append(DocumentEntity)} and
 * {@link #remove(DocumentEntity)} update both sides in memory; when the owner is saved the partner
 * documents are updated with {@code $addToSet} or {@code $pull}, and partners that were never saved
 * are saved in full. Ids keep their stored form, so lists holding {@link org.bson.types.ObjectId}s
 * written by other tools are matched as they are.
 * <p>
 * A failure part way through leaves the two sides inconsistent; nothing repairs it.
 * </p>
 */
public class ManyToMany<T extends DocumentEntity> extends RelationSlot {
    private static final Logger LOG = Logger.getLogger(ManyToMany.class);

    private final Map<String, T> known = new LinkedHashMap<>();
    private final List<PendingLink<T>> pending = new ArrayList<>();

    public ManyToMany(DocumentEntity owner, RelationDescriptor descriptor) {
        super(owner, descriptor);
    }

    /**
     * A copy of the owner's id collection, each id in its stored form.
     */
    public List<Object> ids() {
        List<Object> ids = owner.read(descriptor.getForeignKey());
        return ids == null ? new ArrayList<>() : ids;
    }

    public boolean contains(T other) {
        String id = other.getId();
        return id != null && indexOf(ids(), id) >= 0;
    }

    public void append(T other) {
        requireId(other);
        requireId(owner);
        addId(owner, descriptor.getForeignKey(), other.getStoredId());
        if (descriptor.isBidirectional()) {
            addId(other, descriptor.getInverseForeignKey(), owner.getStoredId());
        }
        known.put(other.getId(), other);
        pending.add(new PendingLink<>(other, true));
        state = SlotState.BUILT;
    }

    public void remove(T other) {
        requireId(other);
        requireId(owner);
        removeId(owner, descriptor.getForeignKey(), other.getStoredId());
        if (descriptor.isBidirectional()) {
            removeId(other, descriptor.getInverseForeignKey(), owner.getStoredId());
        }
        known.remove(other.getId());
        pending.add(new PendingLink<>(other, false));
        state = SlotState.BUILT;
    }

    /**
     * Unlinks every partner currently held in memory.
     */
    public void clear() {
        for (T partner : list()) {
            remove(partner);
        }
    }

    /**
     * The partners in id order. Partners appended in this session are returned as held, the rest
     * are loaded with one {@code $in} query. Ids with no stored document are skipped.
     */
    public List<T> list() {
        List<Object> ids = ids();
        if (ids.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, T> byId = new HashMap<>();
        List<Object> missing = new ArrayList<>();
        for (Object id : ids) {
            T partner = known.get(id.toString());
            if (partner != null) {
                byId.put(id.toString(), partner);
            } else {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            EntityType<T> type = targetType();
            for (T partner : datastore().find(type)
                    .where(new Document(DocumentEntity.ID, new Document("$in", missing)))) {
                byId.put(partner.getId(), partner);
            }
        }
        List<T> partners = new ArrayList<>(ids.size());
        for (Object id : ids) {
            T partner = byId.get(id.toString());
            if (partner != null) {
                partners.add(partner);
            }
        }
        return partners;
    }

    public int size() {
        return ids().size();
    }

    /**
     * Partners appended since the last save that have no stored document yet. They are saved with
     * the owner, so the owner's save validates them first.
     */
    @Override
    public List<DocumentEntity> unsavedDependents() {
        List<DocumentEntity> unsaved = new ArrayList<>();
        for (PendingLink<T> link : pending) {
            if (link.isAdded() && link.getPartner().isNewRecord() && !unsaved.contains(link.getPartner())) {
                unsaved.add(link.getPartner());
            }
        }
        return unsaved;
    }

    @Override
    public void afterOwnerSaved(Datastore datastore) {
        if (pending.isEmpty()) {
            return;
        }
        Object ownerId = owner.getStoredId();
        String inverseKey = descriptor.getInverseForeignKey();
        String collection = descriptor.getTarget().requireCollection();
        for (PendingLink<T> link : pending) {
            T partner = link.getPartner();
            if (!partner.isPersisted()) {
                if (link.isAdded() && partner.isNewRecord()) {
                    if (partner.getDatastore() == null) {
                        partner.bind(datastore);
                    }
                    // validated with the owner, so a failure here is a constraint that changed since
                    datastore.saveStrict(partner);
                    LOG.debugf("Saved new %s %s with %s %s", partner.getEntityType().getName(),
                            partner.getId(), owner.getEntityType().getName(), ownerId);
                }
                continue;
            }
            if (!descriptor.isBidirectional()) {
                continue;
            }
            String operator = link.isAdded() ? "$addToSet" : "$pull";
            datastore.getStore().updateOne(collection,
                    new Document(DocumentEntity.ID, partner.getStoredId()),
                    new Document(operator, new Document(inverseKey, ownerId)));
            List<Object> persisted = new ArrayList<>();
            Object stored = partner.getSnapshotValue(inverseKey);
            if (stored instanceof List) {
                persisted.addAll((List<?>) stored);
            }
            int at = indexOf(persisted, ownerId);
            if (link.isAdded() && at < 0) {
                persisted.add(ownerId);
            } else if (!link.isAdded() && at >= 0) {
                persisted.remove(at);
            }
            partner.refreshSnapshot(inverseKey, persisted);
        }
        pending.clear();
        state = SlotState.ATTACHED;
    }

    private static void requireId(DocumentEntity entity) {
        if (entity.getId() == null) {
            throw new MissingIdentityException(entity.getEntityType().getName(), entity.getEntityType().getIdentityField());
        }
    }

    static int indexOf(List<?> ids, Object id) {
        for (int i = 0; i < ids.size(); i++) {
            if (IdCodec.sameId(ids.get(i), id)) {
                return i;
            }
        }
        return -1;
    }

    private static void addId(DocumentEntity entity, String key, Object id) {
        List<Object> ids = entity.read(key);
        List<Object> updated = ids == null ? new ArrayList<>() : ids;
        if (indexOf(updated, id) < 0) {
            updated.add(id);
            entity.write(key, updated);
        }
    }

    private static void removeId(DocumentEntity entity, String key, Object id) {
        List<Object> ids = entity.read(key);
        if (ids == null) {
            return;
        }
        int at = indexOf(ids, id);
        if (at >= 0) {
            ids.remove(at);
            entity.write(key, ids);
        }
    }

    @Value
    private static class PendingLink<T> {
        T partner;
        boolean added;
    }
}
