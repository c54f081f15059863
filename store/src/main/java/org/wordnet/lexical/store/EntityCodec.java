package org.wordnet.lexical.store;

import static org.wordnet.lexical.common.MapperUtils.getObjectMapper;

import java.io.IOException;

import org.apache.lucene.document.Document;
import org.wordnet.lexical.common.exception.StorageException;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Entities are stored as JSON in a single stored field.
 */
final class EntityCodec {
    private EntityCodec() {
        // Utility class
    }

    static String encode(Object entity) {
        try {
            return getObjectMapper().writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to encode " + entity, e);
        }
    }

    static <T> T decode(Document document, Class<T> type) {
        String json = document.get(StoreFields.JSON);
        if (json == null) {
            throw new StorageException("Document " + document.get(StoreFields.ID) + " has no stored entity");
        }
        try {
            return getObjectMapper().readValue(json, type);
        } catch (IOException e) {
            throw new StorageException("Unable to decode " + type.getSimpleName() + " " + document.get(StoreFields.ID), e);
        }
    }
}
