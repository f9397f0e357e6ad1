package com.docrepo.repositories.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Converts models to and from BSON documents through their Jackson bean
 * representation. The driver-assigned {@code _id} is never exposed to models.
 */
class DocumentMapper<M> {
    private static final Logger logger = LoggerFactory.getLogger(DocumentMapper.class);
    private static final String ID_FIELD = "_id";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    // java.time values are stored as ISO-8601 strings so they read back unchanged
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Class<M> modelType;

    DocumentMapper(Class<M> modelType) {
        this.modelType = modelType;
    }

    Document toDocument(M model) {
        return new Document(objectMapper.convertValue(model, MAP_TYPE));
    }

    M fromDocument(Document document) {
        if (document == null) {
            return null;
        }
        Document copy = new Document(document);
        copy.remove(ID_FIELD);
        return objectMapper.convertValue(copy, modelType);
    }

    /**
     * Converts a key to the same representation it has inside a stored
     * document, so filters compare like with like (a UUID key is stored as text).
     */
    Object toBsonValue(Object key) {
        return key == null ? null : objectMapper.convertValue(key, Object.class);
    }

    /**
     * JSON snapshot of the model for error reports. Falls back to
     * {@code toString()} when the model cannot be serialized.
     */
    String toJson(M model) {
        try {
            return objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException | RuntimeException e) {
            logger.warn("Unable to serialize {} for error context: {}", modelType.getSimpleName(), e.getMessage());
            return String.valueOf(model);
        }
    }
}
