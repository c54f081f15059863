package org.wordnet.lexical.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON mapper shared by the entity codec of the store and the exports.
 * Unknown properties are ignored when reading, null fields are left out when
 * writing.
 */
public final class MapperUtils {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static ObjectMapper getObjectMapper() {
        return MAPPER;
    }

    private MapperUtils() {}
}
