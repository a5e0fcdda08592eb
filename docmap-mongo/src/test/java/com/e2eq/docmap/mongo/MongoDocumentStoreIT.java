package com.e2eq.docmap.mongo;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.config.DocMapConfig;
import com.e2eq.docmap.geo.Point;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.query.Criteria;
import com.mongodb.MongoException;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs against the server named by {@code docmap.mongo.connection-string}; skipped when none answers.
 */
class MongoDocumentStoreIT {

    public static class Venue extends DocumentEntity {
        public static final EntityType<Venue> TYPE = EntityType.builder(Venue.class, Venue::new)
                .collection("venues")
                .field("name", String.class)
                .field("location", Point.class)
                .geoIndex("location")
                .timestamps()
                .build();

        public Venue() {
            super(TYPE);
        }

        public String getName() {
            return read("name");
        }

        public Venue setName(String name) {
            write("name", name);
            return this;
        }

        public Venue setLocation(Point location) {
            write("location", location);
            return this;
        }
    }

    private MongoDocumentStore store;
    private Datastore datastore;

    @BeforeEach
    void connect() {
        DocMapConfig config = DocMapConfig.load().toBuilder().database("docmap_it").build();
        store = MongoDocumentStore.fromConfig(config);
        boolean reachable;
        try {
            store.getDatabase().runCommand(new Document("ping", 1));
            reachable = true;
        } catch (MongoException e) {
            reachable = false;
        }
        if (!reachable) {
            store.close();
        }
        assumeTrue(reachable, "no MongoDB server at " + config.getConnectionString());
        store.drop("venues");
        datastore = new Datastore(store, config);
        datastore.ensureIndexes(Venue.TYPE);
    }

    @AfterEach
    void disconnect() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    void testSaveFindAndUpdate() {
        Venue venue = new Venue().setName("Village Vanguard").setLocation(new Point(-74.0018, 40.7359));
        assertTrue(datastore.save(venue));

        Venue found = datastore.findById(Venue.TYPE, venue.getId()).orElseThrow();
        assertEquals("Village Vanguard", found.getName());
        assertNotNull(found.read(EntityType.CREATED_AT));

        found.setName("The Village Vanguard");
        assertTrue(datastore.save(found));
        assertEquals("The Village Vanguard",
                datastore.findById(Venue.TYPE, venue.getId()).orElseThrow().getName());
    }

    @Test
    void testNearQueryReturnsNearestFirst() {
        datastore.save(new Venue().setName("far").setLocation(new Point(-73.50, 40.70)));
        datastore.save(new Venue().setName("near").setLocation(new Point(-74.00, 40.73)));
        datastore.save(new Venue().setName("middle").setLocation(new Point(-73.80, 40.72)));

        List<String> names = datastore.find(Venue.TYPE)
                .where(Criteria.where("location").near(new Point(-74.01, 40.73)))
                .stream()
                .map(Venue::getName)
                .collect(Collectors.toList());
        assertEquals(List.of("near", "middle", "far"), names);
    }

    @Test
    void testDestroyRemovesTheDocument() {
        Venue venue = new Venue().setName("Blue Note");
        datastore.save(venue);
        assertTrue(datastore.destroy(venue));
        assertTrue(datastore.findById(Venue.TYPE, venue.getId()).isEmpty());
        assertEquals(0, store.count("venues", new Document()));
    }
}
