package com.substrate.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Locale;

/**
 * Derives the lower-cased search key for an arbitrary content object. The key
 * is only used for matching; stored content is never touched.
 */
final class ContentProjection {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .findAndAddModules()
            .build();

    private ContentProjection() {}

    static String searchKey(Object content) {
        return text(content).toLowerCase(Locale.ROOT);
    }

    static String text(Object content) {
        if (content == null
                || content instanceof CharSequence
                || content instanceof Number
                || content instanceof Boolean
                || content instanceof Character
                || content instanceof Enum<?>) {
            return String.valueOf(content);
        }
        try {
            return MAPPER.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            return String.valueOf(content);
        }
    }
}
