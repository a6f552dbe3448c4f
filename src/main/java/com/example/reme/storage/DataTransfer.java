package com.example.reme.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Snapshot export and tolerant import, one {@link Domain} at a time.
 *
 * <p>Exports look like {@code {version, exportDate, count, <domainKey>: [...]}}. Imports accept
 * that form, a bare array, {@code {<domainKey>: [...]}}, {@code {data: [...]}} and
 * {@code {metadata: {...}, data: [...]}}.
 */
public class DataTransfer {
    private static final Logger log = LoggerFactory.getLogger(DataTransfer.class);
    public static final String VERSION = "1.0.0";

    private final RecordStore store;
    private final Clock clock;
    private final ObjectMapper mapper = JsonStorage.mapper();

    public DataTransfer(RecordStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public String export(Domain domain) {
        List<JsonNode> rows = store.getAll(domain.collection, JsonNode.class);
        ObjectNode root = mapper.createObjectNode();
        root.put("version", VERSION);
        root.put("exportDate", LocalDate.now(clock).toString());
        root.put("count", rows.size());
        ArrayNode data = root.putArray(domain.key);
        rows.forEach(data::add);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new StoreException("Failed to serialize " + domain.key, ex);
        }
    }

    /** Every domain keyed by its snapshot property name. */
    public Map<String, String> exportAll() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Domain domain : Domain.values()) out.put(domain.key, export(domain));
        return out;
    }

    public Map<Domain, Integer> stats() {
        Map<Domain, Integer> out = new EnumMap<>(Domain.class);
        for (Domain domain : Domain.values()) out.put(domain, store.count(domain.collection));
        return out;
    }

    public ImportResult importJson(Domain domain, String json, ImportMode mode) throws ImportParseException {
        return importJson(domain, json, mode, ConfirmationPrompt.ALWAYS);
    }

    /**
     * Parses, validates and writes. Invalid records are skipped and reported; the rest are
     * written. A {@link ImportMode#REPLACE} over a non-empty collection asks {@code prompt}
     * first and is cancelled, untouched, when the answer is no.
     *
     * @throws ImportParseException when the input is not JSON or has no recognisable record list
     */
    public ImportResult importJson(Domain domain, String json, ImportMode mode, ConfirmationPrompt prompt)
            throws ImportParseException {
        ArrayNode items = extractItems(domain, json);

        ImportResult result = new ImportResult();
        RecordValidator validator = RecordValidator.forDomain(domain);
        List<JsonNode> valid = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<ValidationFailure> failures = validator.validate(i, items.get(i));
            if (failures.isEmpty()) {
                valid.add(items.get(i));
                positions.add(i);
            } else {
                result.failures.addAll(failures);
                result.errors.add("Item at index " + i + " failed validation: " + describe(failures));
            }
        }

        if (mode == ImportMode.REPLACE) {
            int existing = store.count(domain.collection);
            if (existing > 0 && !prompt.confirm("Replace " + existing + " existing " + domain.key + " records?")) {
                log.info("Import of {} cancelled by user", domain.key);
                return ImportResult.cancelled();
            }
            store.clear(domain.collection);
        }

        BulkWriteResult written = store.bulkPut(domain.collection, valid);
        result.success = written.written;
        for (BulkWriteResult.Failure failure : written.failures) {
            result.errors.add("Item at index " + positions.get(failure.index) + " could not be written: " + failure.message);
        }
        log.info("Imported {} {} ({} errors, mode {})", result.success, domain.key, result.errors.size(), mode);
        return result;
    }

    private ArrayNode extractItems(Domain domain, String json) throws ImportParseException {
        JsonNode root;
        try {
            root = json == null ? null : mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ImportParseException("Failed to parse JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || root.isMissingNode()) throw new ImportParseException("Failed to parse JSON: empty input");
        if (root.isArray()) return (ArrayNode) root;
        if (root.isObject()) {
            JsonNode named = root.get(domain.key);
            if (named != null && named.isArray()) return (ArrayNode) named;
            JsonNode data = root.get("data");
            if (data != null && data.isArray()) return (ArrayNode) data;
        }
        throw new ImportParseException("Invalid JSON format: expected array or object with \""
                + domain.key + "\" or \"data\" property");
    }

    private static String describe(List<ValidationFailure> failures) {
        StringJoiner joiner = new StringJoiner(", ");
        for (ValidationFailure f : failures) joiner.add(f.describe());
        return joiner.toString();
    }
}
