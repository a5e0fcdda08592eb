package com.e2eq.docmap.query;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A lazy, immutable query over one entity type. Nothing is read until iteration, and every
 * iteration queries the store again. Refinements return new queries.
 */
public class EntityQuery<E extends DocumentEntity> implements Iterable<E> {

    private final Datastore datastore;
    private final EntityType<E> type;
    private final Document filter;
    private final Integer limit;

    public EntityQuery(Datastore datastore, EntityType<E> type) {
        this(datastore, type, new Document(), null);
    }

    private EntityQuery(Datastore datastore, EntityType<E> type, Document filter, Integer limit) {
        this.datastore = datastore;
        this.type = type;
        this.filter = filter;
        this.limit = limit;
    }

    public EntityQuery<E> where(Criteria criteria) {
        return where(criteria.toFilter(type));
    }

    /**
     * Adds a raw filter. Keys already constrained by this query are combined with {@code $and}.
     */
    public EntityQuery<E> where(Document rawFilter) {
        Document merged;
        if (filter.isEmpty()) {
            merged = new Document(rawFilter);
        } else if (overlaps(filter, rawFilter)) {
            merged = new Document("$and", List.of(filter, rawFilter));
        } else {
            merged = new Document(filter);
            merged.putAll(rawFilter);
        }
        return new EntityQuery<>(datastore, type, merged, limit);
    }

    /**
     * Truncates the decoded results. Applied after decoding, so documents skipped by the limit
     * are still fetched by stores that do not push it down.
     */
    public EntityQuery<E> limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        return new EntityQuery<>(datastore, type, filter, limit);
    }

    public EntityType<E> getType() {
        return type;
    }

    public Document getFilter() {
        return new Document(filter);
    }

    @Override
    public Iterator<E> iterator() {
        Iterator<Document> documents = datastore.getStore()
                .findMany(type.requireCollection(), filter)
                .iterator();
        return new Iterator<>() {
            private int served;

            @Override
            public boolean hasNext() {
                return (limit == null || served < limit) && documents.hasNext();
            }

            @Override
            public E next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                served++;
                return datastore.load(type, documents.next());
            }
        };
    }

    public Stream<E> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<E> toList() {
        List<E> results = new ArrayList<>();
        for (E entity : this) {
            results.add(entity);
        }
        return results;
    }

    public Optional<E> first() {
        Iterator<E> iterator = limit(1).iterator();
        return iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
    }

    public long count() {
        if (limit == null && !containsOperator(filter, "$near")) {
            return datastore.getStore().count(type.requireCollection(), filter);
        }
        long count = 0;
        Iterator<Document> documents = datastore.getStore().findMany(type.requireCollection(), filter).iterator();
        while (documents.hasNext() && (limit == null || count < limit)) {
            documents.next();
            count++;
        }
        return count;
    }

    public boolean exists() {
        return first().isPresent();
    }

    private static boolean overlaps(Document a, Document b) {
        for (String key : b.keySet()) {
            if (a.containsKey(key)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsOperator(Object value, String operator) {
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (operator.equals(entry.getKey()) || containsOperator(entry.getValue(), operator)) {
                    return true;
                }
            }
        } else if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                if (containsOperator(element, operator)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "EntityQuery[" + type.getName() + " " + filter + (limit != null ? " limit " + limit : "") + "]";
    }
}
