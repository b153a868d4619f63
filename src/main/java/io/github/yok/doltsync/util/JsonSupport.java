package io.github.yok.doltsync.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.lang.reflect.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.Generated;

/**
 * JSON transcoding shared by the fingerprinter and the dialect adapters.
 *
 * <p>
 * Arrays and JSON documents have no common native representation across MySQL, PostgreSQL and
 * Oracle, so they are written as JSON text. Map keys are sorted so that the same logical document
 * always produces the same text.
 * </p>
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * Prevents instantiation.
     */
    @Generated
    private JsonSupport() {}

    /**
     * Returns whether a value needs JSON transcoding (collections, arrays other than
     * {@code byte[]}, maps, JDBC arrays).
     *
     * @param value value
     * @return {@code true} if the value is array- or document-like
     */
    public static boolean isJsonLike(Object value) {
        if (value == null || value instanceof byte[]) {
            return false;
        }
        return value instanceof Map || value instanceof Collection
                || value instanceof java.sql.Array || value.getClass().isArray();
    }

    /**
     * Serializes an array- or document-like value to canonical JSON text.
     *
     * @param value value
     * @return JSON text
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(normalize(value));
        } catch (JsonProcessingException | SQLException e) {
            throw new IllegalArgumentException("Value cannot be encoded as JSON: " + value, e);
        }
    }

    /**
     * Parses JSON text produced by {@link #toJson(Object)} back into a list.
     *
     * @param json JSON array text
     * @return list
     * @throws IllegalArgumentException if the text is not a JSON array
     */
    public static List<Object> parseList(String json) {
        try {
            return MAPPER.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON array: " + json, e);
        }
    }

    /**
     * Parses JSON text back into a map.
     *
     * @param json JSON object text
     * @return map
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Map<String, Object> parseMap(String json) {
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON object: " + json, e);
        }
    }

    /**
     * Converts JDBC and primitive arrays into lists so they serialize as JSON arrays.
     *
     * @param value value
     * @return serializable value
     * @throws SQLException if a JDBC array cannot be read
     */
    private static Object normalize(Object value) throws SQLException {
        if (value instanceof java.sql.Array) {
            return normalize(((java.sql.Array) value).getArray());
        }
        if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(normalize(Array.get(value, i)));
            }
            return list;
        }
        return value;
    }
}
