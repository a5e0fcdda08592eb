package com.e2eq.docmap.mongo;

import com.e2eq.docmap.config.DocMapConfig;
import com.e2eq.docmap.exceptions.DocumentStoreException;
import com.e2eq.docmap.store.DocumentStore;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.bson.codecs.configuration.CodecRegistries;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.codecs.jsr310.Jsr310CodecProvider;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} backed by the synchronous MongoDB driver. Driver failures surface as
 * {@link DocumentStoreException} carrying the collection name.
 */
public class MongoDocumentStore implements DocumentStore, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(MongoDocumentStore.class);

    private final MongoClient client;
    private final MongoDatabase database;
    private final boolean ownsClient;

    public MongoDocumentStore(MongoClient client, String databaseName) {
        this(client, databaseName, false);
    }

    private MongoDocumentStore(MongoClient client, String databaseName, boolean ownsClient) {
        this.client = client;
        this.database = client.getDatabase(databaseName).withCodecRegistry(codecRegistry());
        this.ownsClient = ownsClient;
    }

    /**
     * Opens a client for the configured connection string. The returned store closes the client.
     */
    public static MongoDocumentStore fromConfig(DocMapConfig config) {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(config.getConnectionString()))
                .codecRegistry(codecRegistry())
                .build();
        LOG.infof("Connecting to %s database %s", config.getConnectionString(), config.getDatabase());
        return new MongoDocumentStore(MongoClients.create(settings), config.getDatabase(), true);
    }

    static CodecRegistry codecRegistry() {
        return CodecRegistries.fromRegistries(
                CodecRegistries.fromProviders(new Jsr310CodecProvider()),
                MongoClientSettings.getDefaultCodecRegistry());
    }

    public MongoDatabase getDatabase() {
        return database;
    }

    private MongoCollection<Document> collection(String name) {
        return database.getCollection(name);
    }

    private <T> T execute(String collection, String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (MongoException e) {
            LOG.warnf("%s on %s failed: %s", operation, collection, e.getMessage());
            throw new DocumentStoreException(collection, operation + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void insert(String collection, Document document) {
        execute(collection, "insert", () -> collection(collection).insertOne(document));
        LOG.debugf("insert %s _id=%s", collection, document.get("_id"));
    }

    @Override
    public Document findOne(String collection, Document filter) {
        return execute(collection, "find", () -> collection(collection).find(filter).first());
    }

    @Override
    public Iterable<Document> findMany(String collection, Document filter) {
        return execute(collection, "find", () -> collection(collection).find(filter).into(new ArrayList<>()));
    }

    @Override
    public long updateOne(String collection, Document filter, Document mutation) {
        long matched = execute(collection, "update",
                () -> collection(collection).updateOne(filter, mutation).getMatchedCount());
        LOG.debugf("updateOne %s filter=%s mutation=%s matched=%d", collection, filter, mutation, matched);
        return matched;
    }

    @Override
    public long deleteOne(String collection, Document filter) {
        return execute(collection, "delete", () -> collection(collection).deleteOne(filter).getDeletedCount());
    }

    @Override
    public long deleteMany(String collection, Document filter) {
        return execute(collection, "delete", () -> collection(collection).deleteMany(filter).getDeletedCount());
    }

    @Override
    public long count(String collection, Document filter) {
        return execute(collection, "count", () -> collection(collection).countDocuments(filter));
    }

    @Override
    public void createIndex(String collection, Document keys) {
        String name = execute(collection, "createIndex", () -> collection(collection).createIndex(keys));
        LOG.debugf("createIndex %s %s as %s", collection, keys, name);
    }

    public List<Document> listIndexes(String collection) {
        return execute(collection, "listIndexes",
                () -> collection(collection).listIndexes().into(new ArrayList<>()));
    }

    public void drop(String collection) {
        execute(collection, "drop", () -> {
            collection(collection).drop();
            return null;
        });
    }

    @Override
    public void close() {
        if (ownsClient) {
            client.close();
        }
    }
}
