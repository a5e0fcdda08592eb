package com.e2eq.docmap.store;

import org.bson.Document;

/**
 * Driver contract the mapping layer consumes. Filters and mutations use the MongoDB query
 * and update operator vocabulary ({@code $in}, {@code $near}, {@code $set}, {@code $pull} ...).
 * <p>
 * No operation spans more than one document atomically and no implementation is expected
 * to provide isolation between callers.
 * </p>
 */
public interface DocumentStore {

    void insert(String collection, Document document);

    Document findOne(String collection, Document filter);

    /**
     * Returns the matching documents in store order, or nearest first when the filter
     * holds a {@code $near} predicate.
     */
    Iterable<Document> findMany(String collection, Document filter);

    /**
     * @return the number of documents matched (0 or 1)
     */
    long updateOne(String collection, Document filter, Document mutation);

    long deleteOne(String collection, Document filter);

    long deleteMany(String collection, Document filter);

    long count(String collection, Document filter);

    /**
     * @param keys index key specification, for example {@code {"place_of_birth.geolocation": "2dsphere"}}
     */
    void createIndex(String collection, Document keys);
}
