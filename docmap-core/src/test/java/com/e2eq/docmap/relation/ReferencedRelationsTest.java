package com.e2eq.docmap.relation;

import com.e2eq.docmap.Datastore;
import com.e2eq.docmap.fixtures.CountingDocumentStore;
import com.e2eq.docmap.fixtures.Record;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.store.memory.InMemoryDocumentStore;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ReferencedRelationsTest {

    private final AtomicReference<EntityType<Record>> houseRef = new AtomicReference<>();
    private final AtomicReference<EntityType<Record>> filmRef = new AtomicReference<>();

    private final EntityType<Record> owner = Record.type()
            .collection("owners")
            .field("name", String.class)
            .belongsTo("residence", houseRef::get, "residence_id")
            .hasManyEmbedded("credits", filmRef::get, "cast")
            .build();

    private final EntityType<Record> house = Record.type()
            .collection("houses")
            .field("name", String.class)
            .hasMany("residents", () -> owner, "residence_id", CascadePolicy.ORPHAN)
            .hasOne("caretaker", () -> owner, "residence_id", CascadePolicy.ORPHAN)
            .build();

    private final EntityType<Record> credit = Record.type()
            .field("character", String.class)
            .belongsTo("performer", () -> owner, "_id")
            .build();

    private final EntityType<Record> film = Record.type()
            .collection("films")
            .field("name", String.class)
            .embedsMany("cast", () -> credit)
            .build();

    private CountingDocumentStore store;
    private Datastore datastore;

    @BeforeEach
    void setUp() {
        houseRef.set(house);
        filmRef.set(film);
        store = new CountingDocumentStore(new InMemoryDocumentStore());
        datastore = new Datastore(store);
    }

    @Test
    void testUnsetForeignKeyIssuesNoQuery() {
        Record someone = datastore.newEntity(owner);
        datastore.save(someone);
        store.reset();

        assertTrue(someone.parent("residence").get().isEmpty());
        assertEquals(0, store.getTotalReads());
    }

    @Test
    void testSetForeignKeyIssuesExactlyOneQuery() {
        Record home = datastore.newEntity(house).setName("Home");
        datastore.save(home);
        Record someone = datastore.newEntity(owner).setName("Someone");
        someone.parent("residence").assign(home);
        datastore.save(someone);

        Record reloaded = datastore.findById(owner, someone.getId()).orElseThrow();
        store.reset();
        assertEquals("Home", reloaded.parent("residence").get().orElseThrow().getName());
        assertEquals(1, store.getReadCount("houses"));
        assertEquals(1, store.getTotalReads());

        reloaded.parent("residence").get();
        assertEquals(1, store.getTotalReads());
    }

    @Test
    void testAssignStagesTheForeignKey() {
        Record home = datastore.newEntity(house).setName("Home");
        datastore.save(home);
        Record someone = datastore.newEntity(owner);
        datastore.save(someone);

        someone.parent("residence").assign(home);
        assertEquals(home.getId(), someone.read("residence_id"));
        assertNull(store.findOne("owners", new org.bson.Document("_id", someone.getId())).get("residence_id"));

        datastore.save(someone);
        assertEquals(home.getId(), store.findOne("owners", new org.bson.Document("_id", someone.getId())).get("residence_id"));

        someone.parent("residence").assign(null);
        datastore.save(someone);
        assertFalse(store.findOne("owners", new org.bson.Document("_id", someone.getId())).containsKey("residence_id"));
    }

    @Test
    void testDanglingReferenceResolvesToEmpty() {
        Record someone = datastore.newEntity(owner);
        someone.write("residence_id", "gone");
        datastore.save(someone);
        assertTrue(someone.parent("residence").get().isEmpty());
    }

    @Test
    void testReferencedChildrenAreQueriedByForeignKey() {
        Record home = datastore.newEntity(house).setName("Home");
        datastore.save(home);
        Record a = datastore.newEntity(owner).setName("A");
        Record b = datastore.newEntity(owner).setName("B");
        home.children("residents").append(a);
        home.children("residents").append(b);
        datastore.save(datastore.newEntity(owner).setName("Elsewhere"));

        assertEquals(List.of("A", "B"), home.children("residents").list().stream()
                .map(Record::getName).collect(Collectors.toList()));
        assertEquals(2, home.children("residents").count());
        assertEquals("A", home.children("caretaker").first().orElseThrow().getName());
        assertTrue(a.isPersisted());
    }

    @Test
    void testObjectIdOwnerKeepsItsIdFormInForeignKeys() {
        ObjectId homeId = new ObjectId();
        store.insert("houses", new org.bson.Document("_id", homeId).append("name", "Home"));
        Record home = datastore.findById(house, homeId).orElseThrow();

        Record resident = datastore.newEntity(owner).setName("Resident");
        assertTrue(home.children("residents").append(resident));
        assertEquals(homeId, store.findOne("owners", new org.bson.Document("_id", resident.getId())).get("residence_id"));
        assertEquals(List.of("Resident"), home.children("residents").list().stream()
                .map(Record::getName).collect(Collectors.toList()));

        Record visitor = datastore.newEntity(owner).setName("Visitor");
        visitor.parent("residence").assign(home);
        datastore.save(visitor);
        Record reloaded = datastore.findById(owner, visitor.getId()).orElseThrow();
        assertEquals(homeId, reloaded.rawAttribute("residence_id"));
        assertEquals("Home", reloaded.parent("residence").get().orElseThrow().getName());
        assertEquals(2, home.children("residents").count());
    }

    @Test
    void testEmbeddedChildrenResolveInTwoSteps() {
        Record actor = datastore.newEntity(owner).setName("Robert");
        datastore.save(actor);
        Record other = datastore.newEntity(owner).setName("Al");
        datastore.save(other);

        Record heat = datastore.newEntity(film).setName("Heat");
        Record ronin = datastore.newEntity(film).setName("Ronin");
        Record insomnia = datastore.newEntity(film).setName("Insomnia");
        addCredit(heat, actor, "Neil");
        addCredit(heat, other, "Vincent");
        addCredit(ronin, actor, "Sam");
        addCredit(insomnia, other, "Will");
        datastore.save(heat);
        datastore.save(ronin);
        datastore.save(insomnia);

        EmbeddedChildren<Record, Record> credits = actor.embedded("credits");
        assertEquals(List.of("Heat", "Ronin"), credits.parents().toList().stream()
                .map(Record::getName).collect(Collectors.toList()));

        store.reset();
        List<Record> children = credits.children();
        assertEquals(1, store.getTotalReads());
        assertEquals(List.of("Neil", "Sam"), children.stream()
                .map(c -> (String) c.read("character")).collect(Collectors.toList()));
        assertEquals("Heat", ((Record) children.get(0).getEmbeddedParent()).getName());
        assertEquals("Robert", children.get(1).parent("performer").get().orElseThrow().getName());
    }

    private void addCredit(Record movie, Record performer, String character) {
        Record role = credit.newInstance();
        role.write("character", character);
        role.parent("performer").assign(performer);
        movie.many("cast").append(role);
    }
}
