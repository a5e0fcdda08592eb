package com.e2eq.docmap.json;

import com.e2eq.docmap.exceptions.DocMapException;
import com.e2eq.docmap.fixtures.Record;
import com.e2eq.docmap.geo.Point;
import com.e2eq.docmap.mapping.EntityType;
import com.fasterxml.jackson.databind.JsonNode;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentJsonTest {

    private final DocumentJson json = new DocumentJson();

    private final EntityType<Record> film = Record.type()
            .collection("films")
            .field("name", String.class)
            .field("year", Integer.class)
            .field("released_on", "releasedOn", LocalDate.class)
            .field("genres", List.class)
            .field("location", Point.class)
            .build();

    @Test
    void testRendersStoredKeysAndIsoDates() throws Exception {
        Record record = film.newInstance();
        record.setId("heat");
        record.setName("Heat");
        record.write("releasedOn", LocalDate.of(1995, 12, 15));
        record.write("location", new Point(-118.24, 34.05));

        JsonNode node = json.getObjectMapper().readTree(json.toJson(record));
        assertEquals("heat", node.get("_id").asText());
        assertEquals("Heat", node.get("name").asText());
        assertTrue(node.get("released_on").asText().startsWith("1995-12-15T00:00:00"));
        assertEquals("Point", node.get("location").get("type").asText());
    }

    @Test
    void testObjectIdsRenderAsHex() throws Exception {
        ObjectId id = new ObjectId();
        JsonNode node = json.getObjectMapper().readTree(json.toJson(new Document("_id", id)));
        assertEquals(id.toHexString(), node.get("_id").asText());
    }

    @Test
    void testAssignFromJsonNormalizesValues() {
        Record record = json.assignFromJson(film.newInstance(),
                "{\"name\":\"Ronin\",\"year\":\"1998\",\"genres\":\"Action, Thriller\","
                        + "\"releasedOn\":\"1998-09-25\",\"location\":{\"lng\":2.35,\"lat\":48.85}}");
        assertEquals("Ronin", record.getName());
        assertEquals(Integer.valueOf(1998), record.read("year"));
        assertEquals(List.of("Action", "Thriller"), record.read("genres"));
        assertEquals(LocalDate.of(1998, 9, 25), record.read("released_on"));
        assertEquals(new Point(2.35, 48.85), record.read("location"));
    }

    @Test
    void testMalformedJsonIsReported() {
        assertThrows(DocMapException.class, () -> json.parse("{not json"));
        assertEquals(Map.of("a", 1), json.parse("{\"a\":1}"));
    }
}
