package com.e2eq.docmap.json;

import com.e2eq.docmap.exceptions.DocMapException;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.DocumentMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON rendering of entity documents and mass assignment from JSON payloads. Keys are rendered
 * as stored, dates as ISO-8601 strings and ObjectIds as hex strings.
 */
public class DocumentJson {

    private final ObjectMapper objectMapper;

    public DocumentJson() {
        this(new ObjectMapper());
    }

    public DocumentJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        objectMapper.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false);
        SimpleModule module = new SimpleModule();
        module.addSerializer(ObjectId.class, new ObjectIdJsonSerializer());
        objectMapper.registerModule(module);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String toJson(DocumentEntity entity) {
        return toJson(DocumentMapper.instance().toDocument(entity));
    }

    public String toJson(Document document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new DocMapException("Unable to render document as JSON", e);
        }
    }

    public Map<String, Object> parse(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw new DocMapException("Malformed JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a JSON object and mass-assigns its members to the entity.
     */
    public <E extends DocumentEntity> E assignFromJson(E entity, String json) {
        entity.assignAttributes(parse(json));
        return entity;
    }
}
