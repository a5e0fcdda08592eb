package com.e2eq.docmap.fixtures;

import com.e2eq.docmap.store.DocumentStore;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating store that counts reads per collection and records every mutation, so tests can
 * assert how many round trips an operation made.
 */
public class CountingDocumentStore implements DocumentStore {

    private final DocumentStore delegate;
    private final Map<String, AtomicInteger> reads = new ConcurrentHashMap<>();
    private final List<String> mutations = new ArrayList<>();

    public CountingDocumentStore(DocumentStore delegate) {
        this.delegate = delegate;
    }

    public int getReadCount(String collection) {
        return reads.getOrDefault(collection, new AtomicInteger(0)).get();
    }

    public int getTotalReads() {
        return reads.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public List<String> getMutations() {
        return mutations;
    }

    public void reset() {
        reads.clear();
        mutations.clear();
    }

    private void read(String collection) {
        reads.computeIfAbsent(collection, c -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public void insert(String collection, Document document) {
        mutations.add("insert " + collection);
        delegate.insert(collection, document);
    }

    @Override
    public Document findOne(String collection, Document filter) {
        read(collection);
        return delegate.findOne(collection, filter);
    }

    @Override
    public Iterable<Document> findMany(String collection, Document filter) {
        read(collection);
        return delegate.findMany(collection, filter);
    }

    @Override
    public long updateOne(String collection, Document filter, Document mutation) {
        mutations.add("update " + collection + " " + mutation.keySet());
        return delegate.updateOne(collection, filter, mutation);
    }

    @Override
    public long deleteOne(String collection, Document filter) {
        mutations.add("deleteOne " + collection);
        return delegate.deleteOne(collection, filter);
    }

    @Override
    public long deleteMany(String collection, Document filter) {
        mutations.add("deleteMany " + collection);
        return delegate.deleteMany(collection, filter);
    }

    @Override
    public long count(String collection, Document filter) {
        read(collection);
        return delegate.count(collection, filter);
    }

    @Override
    public void createIndex(String collection, Document keys) {
        delegate.createIndex(collection, keys);
    }
}
