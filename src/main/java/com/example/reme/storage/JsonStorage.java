package com.example.reme.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.example.reme.model.*;

import java.io.*;
import java.util.*;

/**
 * JSON plumbing shared by the store, the import/export layer and the seed loaders.
 * Seed files live under {@code /sample-data} on the classpath.
 */
public class JsonStorage {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .registerModule(new JavaTimeModule());

    public static ObjectMapper mapper() { return MAPPER; }

    /** Deep copy through the JSON tree, so the result shares no mutable state with {@code value}. */
    public static <T> T copy(T value, Class<T> type) {
        if (value == null) return null;
        try {
            return MAPPER.treeToValue(MAPPER.valueToTree(value), type);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot copy " + type.getSimpleName(), ex);
        }
    }

    public List<CatalogIngredient> loadIngredients(InputStream in) throws IOException {
        return readList(in, "ingredients", new TypeReference<List<CatalogIngredient>>() {},
                "Failed to parse ingredients JSON. Provide an array or {\"ingredients\":[...]}.");
    }

    public List<Recipe> loadRecipes(InputStream in) throws IOException {
        return readList(in, "recipes", new TypeReference<List<Recipe>>() {},
                "Failed to parse recipes JSON. Provide an array or {\"recipes\":[...]}.");
    }

    /** Synonym groups as a list of lists; the first entry of each group is its canonical key. */
    public List<List<String>> loadSynonymGroups(InputStream in) throws IOException {
        try {
            return MAPPER.readValue(in, new TypeReference<List<List<String>>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse synonyms JSON. Expect a list of groups: [[canonical, alias, ...], ...]", ex);
        }
    }

    public Map<String, Map<String, Double>> loadUnits(InputStream in) throws IOException {
        try {
            return MAPPER.readValue(in, new TypeReference<Map<String, Map<String, Double>>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse units JSON. Expect a nested map with conversion anchors.", ex);
        }
    }

    /** Opens a classpath resource, failing loudly when it is missing from the build. */
    public static InputStream resource(String path) throws IOException {
        InputStream in = JsonStorage.class.getResourceAsStream(path);
        if (in == null) throw new FileNotFoundException("Classpath resource not found: " + path);
        return in;
    }

    private <T> List<T> readList(InputStream in, String wrapperKey, TypeReference<List<T>> type, String message) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException ex) {
            throw new IOException(message, ex);
        }
        JsonNode list = root != null && root.isObject() ? root.get(wrapperKey) : root;
        if (list == null || !list.isArray()) throw new IOException(message);
        return MAPPER.convertValue(list, type);
    }
}
