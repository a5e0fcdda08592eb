package com.e2eq.docmap;

import com.e2eq.docmap.config.DocMapConfig;
import com.e2eq.docmap.exceptions.DocumentValidationException;
import com.e2eq.docmap.exceptions.MissingIdentityException;
import com.e2eq.docmap.fixtures.CountingDocumentStore;
import com.e2eq.docmap.fixtures.Label;
import com.e2eq.docmap.fixtures.Record;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.store.memory.InMemoryDocumentStore;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatastoreTest {

    private CountingDocumentStore store;
    private Datastore datastore;

    @BeforeEach
    void setUp() {
        store = new CountingDocumentStore(new InMemoryDocumentStore());
        datastore = new Datastore(store);
    }

    private Document stored(Label label) {
        return store.findOne("labels", new Document("_id", label.getId()));
    }

    @Test
    void testInsertThenUpdateOnlyChangedKeys() {
        Label label = datastore.newEntity(Label.TYPE).setName("Criterion").setRank(3);
        assertTrue(label.isNewRecord());
        assertTrue(datastore.save(label));
        assertTrue(label.isPersisted());
        assertEquals(List.of("insert labels"), store.getMutations());

        store.reset();
        assertTrue(datastore.save(label));
        assertTrue(store.getMutations().isEmpty());

        label.setRank(null);
        label.setName("Criterion Collection");
        datastore.save(label);
        assertEquals(List.of("update labels [$set, $unset]"), store.getMutations());
        Document document = stored(label);
        assertEquals("Criterion Collection", document.get("name"));
        assertFalse(document.containsKey("rank"));
    }

    @Test
    void testUpdateOfADocumentRemovedElsewhereReportsFailure() {
        Label label = datastore.newEntity(Label.TYPE).setName("Miramax");
        datastore.save(label);
        store.deleteOne("labels", new Document("_id", label.getId()));

        label.setRank(7);
        assertFalse(datastore.save(label));
        assertNull(stored(label));
        assertNull(label.getSnapshotValue("rank"));
    }

    @Test
    void testTimestamps() throws InterruptedException {
        Label label = datastore.newEntity(Label.TYPE).setName("A24");
        datastore.save(label);
        Date created = (Date) stored(label).get("created_at");
        assertNotNull(created);
        assertEquals(created, stored(label).get("updated_at"));

        Thread.sleep(5);
        label.setName("A24 Films");
        datastore.save(label);
        Document document = stored(label);
        assertEquals(created, document.get("created_at"));
        assertTrue(((Date) document.get("updated_at")).after(created));
    }

    @Test
    void testValidationFailuresAreCollected() {
        Label label = datastore.newEntity(Label.TYPE).setName(" ").setRank(-1);
        assertFalse(datastore.save(label));
        assertEquals(2, label.getViolations().size());
        assertEquals("name", label.getViolations().get(0).getField());
        assertEquals("rank", label.getViolations().get(1).getField());
        assertTrue(store.getMutations().isEmpty());
        assertFalse(label.isPersisted());

        label.setName("Fixed").setRank(1);
        assertTrue(datastore.save(label));
        assertTrue(label.getViolations().isEmpty());
    }

    @Test
    void testStrictSaveThrows() {
        Label label = datastore.newEntity(Label.TYPE);
        DocumentValidationException ex = assertThrows(DocumentValidationException.class, () -> datastore.saveStrict(label));
        assertEquals("Label", ex.getEntityType());
        assertTrue(ex.getMessage().contains("name"));

        Datastore strict = new Datastore(store, DocMapConfig.builder().strictValidation(true).build());
        assertThrows(DocumentValidationException.class, () -> strict.save(label));
    }

    @Test
    void testRootWithoutIdentityCannotBeSaved() {
        EntityType<Record> place = Record.type()
                .collection("places")
                .field("address", String.class)
                .identityFrom("address")
                .build();
        Record record = datastore.newEntity(place);
        assertThrows(MissingIdentityException.class, () -> datastore.save(record));
        record.write("address", "10 Downing St");
        assertTrue(datastore.save(record));
        assertEquals("10 Downing St", store.findOne("places", new Document()).get("_id"));
    }

    @Test
    void testFindByIdAndDelete() {
        Label label = datastore.newEntity(Label.TYPE).setName("Janus");
        datastore.save(label);

        Label found = datastore.findById(Label.TYPE, label.getId()).orElseThrow();
        assertEquals("Janus", found.getName());
        assertTrue(found.isPersisted());
        assertSame(datastore, found.getDatastore());
        assertTrue(datastore.findById(Label.TYPE, "missing").isEmpty());
        assertTrue(datastore.findById(Label.TYPE, null).isEmpty());

        assertTrue(datastore.delete(found));
        assertFalse(datastore.delete(found));
        assertTrue(datastore.findById(Label.TYPE, label.getId()).isEmpty());
        assertThrows(IllegalStateException.class, () -> datastore.save(found));
    }

    @Test
    void testEnsureIndexes() {
        InMemoryDocumentStore memory = new InMemoryDocumentStore();
        EntityType<Record> indexed = Record.type()
                .collection("indexed")
                .index(new Document("name", 1))
                .geoIndex("location")
                .build();
        new Datastore(memory).ensureIndexes(indexed);
        assertEquals(List.of(new Document("name", 1), new Document("location", "2dsphere")), memory.listIndexes("indexed"));
    }
}
