package com.e2eq.docmap.store.memory;

import com.e2eq.docmap.exceptions.DocumentStoreException;
import com.e2eq.docmap.store.DocumentStore;
import com.e2eq.docmap.store.Documents;
import org.bson.Document;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link DocumentStore} held in memory. Documents keep insertion order, which stands in for the
 * store's natural order. Every read returns deep copies so callers never share state with the store.
 * <p>
 * Geo proximity queries require a {@code 2dsphere} index on the queried field, as MongoDB does.
 * </p>
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger LOG = Logger.getLogger(InMemoryDocumentStore.class);

    private final Map<String, List<Document>> collections = new ConcurrentHashMap<>();
    private final Map<String, List<Document>> indexes = new ConcurrentHashMap<>();

    private List<Document> bucket(String collection) {
        return collections.computeIfAbsent(collection, c -> new ArrayList<>());
    }

    @Override
    public void insert(String collection, Document document) {
        Object id = document.get("_id");
        if (id == null) {
            throw new DocumentStoreException(collection, "Document has no _id");
        }
        List<Document> docs = bucket(collection);
        synchronized (docs) {
            for (Document existing : docs) {
                if (Documents.valuesEqual(existing.get("_id"), id)) {
                    throw new DocumentStoreException(collection,
                            "E11000 duplicate key error collection: " + collection + " _id: " + id);
                }
            }
            docs.add(Documents.deepCopy(document));
        }
        LOG.debugf("insert %s _id=%s", collection, id);
    }

    @Override
    public Document findOne(String collection, Document filter) {
        Iterator<Document> it = findMany(collection, filter).iterator();
        return it.hasNext() ? it.next() : null;
    }

    @Override
    public List<Document> findMany(String collection, Document filter) {
        String nearField = nearField(filter);
        if (nearField != null) {
            requireGeoIndex(collection, nearField);
        }
        List<Document> docs = bucket(collection);
        List<Document> out = new ArrayList<>();
        Map<Document, Double> distances = new IdentityHashMap<>();
        synchronized (docs) {
            for (Document doc : docs) {
                if (FilterEvaluator.matches(doc, filter)) {
                    Document copy = Documents.deepCopy(doc);
                    out.add(copy);
                    if (nearField != null) {
                        Map<?, ?> condition = (Map<?, ?>) filter.get(nearField);
                        Object near = condition.containsKey("$near") ? condition.get("$near") : condition.get("$nearSphere");
                        distances.put(copy, FilterEvaluator.withinDistance(
                                FilterEvaluator.resolve(doc, nearField), near, condition.get("$maxDistance")));
                    }
                }
            }
        }
        if (nearField != null) {
            // List.sort is stable, so equal distances keep store order
            out.sort(Comparator.comparingDouble(distances::get));
        }
        return out;
    }

    @Override
    public long updateOne(String collection, Document filter, Document mutation) {
        List<Document> docs = bucket(collection);
        synchronized (docs) {
            for (Document doc : docs) {
                if (FilterEvaluator.matches(doc, filter)) {
                    try {
                        UpdateApplier.apply(doc, mutation);
                    } catch (IllegalArgumentException | UnsupportedOperationException e) {
                        throw new DocumentStoreException(collection, e.getMessage(), e);
                    }
                    LOG.debugf("updateOne %s filter=%s mutation=%s", collection, filter, mutation);
                    return 1;
                }
            }
        }
        return 0;
    }

    @Override
    public long deleteOne(String collection, Document filter) {
        List<Document> docs = bucket(collection);
        synchronized (docs) {
            Iterator<Document> it = docs.iterator();
            while (it.hasNext()) {
                if (FilterEvaluator.matches(it.next(), filter)) {
                    it.remove();
                    LOG.debugf("deleteOne %s filter=%s", collection, filter);
                    return 1;
                }
            }
        }
        return 0;
    }

    @Override
    public long deleteMany(String collection, Document filter) {
        List<Document> docs = bucket(collection);
        long deleted = 0;
        synchronized (docs) {
            Iterator<Document> it = docs.iterator();
            while (it.hasNext()) {
                if (FilterEvaluator.matches(it.next(), filter)) {
                    it.remove();
                    deleted++;
                }
            }
        }
        LOG.debugf("deleteMany %s filter=%s deleted=%d", collection, filter, deleted);
        return deleted;
    }

    @Override
    public long count(String collection, Document filter) {
        List<Document> docs = bucket(collection);
        long count = 0;
        synchronized (docs) {
            for (Document doc : docs) {
                if (FilterEvaluator.matches(doc, filter)) {
                    count++;
                }
            }
        }
        return count;
    }

    @Override
    public void createIndex(String collection, Document keys) {
        List<Document> specs = indexes.computeIfAbsent(collection, c -> new ArrayList<>());
        synchronized (specs) {
            if (specs.stream().noneMatch(keys::equals)) {
                specs.add(Documents.deepCopy(keys));
            }
        }
        LOG.debugf("createIndex %s %s", collection, keys);
    }

    public List<Document> listIndexes(String collection) {
        List<Document> specs = indexes.getOrDefault(collection, List.of());
        synchronized (specs) {
            return new ArrayList<>(specs);
        }
    }

    public void drop(String collection) {
        collections.remove(collection);
        indexes.remove(collection);
    }

    private String nearField(Document filter) {
        if (filter == null) {
            return null;
        }
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            if (entry.getValue() instanceof Map) {
                Map<?, ?> condition = (Map<?, ?>) entry.getValue();
                if (condition.containsKey("$near") || condition.containsKey("$nearSphere")) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    private void requireGeoIndex(String collection, String field) {
        for (Document spec : indexes.getOrDefault(collection, List.of())) {
            if ("2dsphere".equals(spec.get(field))) {
                return;
            }
        }
        throw new DocumentStoreException(collection,
                "unable to find index for $geoNear query on " + collection + "." + field);
    }
}
