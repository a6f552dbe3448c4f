package com.example.reme.storage;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Generic record store over named collections with secondary indexes.
 *
 * <p>Records are kept as JSON trees and converted through the shared {@link ObjectMapper},
 * so every read hands out an independent copy and callers may mutate it freely until they
 * {@link #put} it back. Writers to the same collection are serialized by a per-collection
 * write lock; reads take the read lock and therefore see a consistent snapshot.
 *
 * <p>Instances are created explicitly and passed to the services that need them; there is no
 * process-wide connection.
 */
public class RecordStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecordStore.class);

    private final StoreBackend backend;
    private final ObjectMapper mapper = JsonStorage.mapper();
    private final Map<String, Table> tables = new ConcurrentHashMap<>();
    private final List<StoreListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    private RecordStore(StoreBackend backend) { this.backend = backend; }

    /**
     * Opens the backend, restores whatever collections it already holds and then applies
     * {@code schemas} through {@link #ensureSchema}.
     *
     * @throws StorageUnavailableException when the backend cannot be opened or read
     */
    public static RecordStore open(StoreBackend backend, List<CollectionSchema> schemas) {
        RecordStore store = new RecordStore(backend);
        backend.open();
        for (CollectionSchema persisted : backend.readSchemas()) {
            store.tables.put(persisted.name, store.loadTable(copyOf(persisted)));
        }
        for (CollectionSchema schema : schemas) store.ensureSchema(schema);
        log.info("Record store opened with {} collections", store.tables.size());
        return store;
    }

    public static RecordStore inMemory(List<CollectionSchema> schemas) {
        return open(new InMemoryBackend(), schemas);
    }

    // ------------------------------------------------------------------ schema

    /**
     * Creates the collection or any of its missing indexes. Existing collections and indexes
     * are left untouched, so calling this repeatedly against a populated store is safe.
     *
     * <p>All or nothing: when one index is rejected, indexes added by this call are dropped
     * again and a new collection is not registered.
     *
     * @throws ConstraintViolationException when a new unique index meets duplicate values
     */
    public synchronized void ensureSchema(CollectionSchema schema) {
        ensureOpen();
        Table existing = tables.get(schema.name);
        Table table = existing != null ? existing
                : loadTable(new CollectionSchema(schema.name, schema.keyPath, List.of()));
        List<IndexSpec> added = new ArrayList<>();
        try {
            for (IndexSpec spec : schema.indexes) {
                if (table.schema.index(spec.name) != null) continue;
                table.addIndex(spec);
                added.add(spec);
            }
        } catch (ConstraintViolationException ex) {
            if (existing != null) for (IndexSpec spec : added) table.dropIndex(spec.name);
            throw ex;
        }
        if (existing == null) {
            tables.put(schema.name, table);
            log.debug("Created collection {}", schema.name);
        }
        for (IndexSpec spec : added) log.debug("Created index {}.{}", schema.name, spec.name);
        if (existing == null || !added.isEmpty()) persistSchemas();
    }

    public Set<String> collectionNames() { return new TreeSet<>(tables.keySet()); }

    public CollectionSchema schemaOf(String collection) { return copyOf(table(collection).schema); }

    // ------------------------------------------------------------------ reads

    public <T> Optional<T> get(String collection, String id, Class<T> type) {
        Table table = table(collection);
        return table.read(() -> {
            ObjectNode node = table.rows.get(id);
            return node == null ? Optional.<T>empty() : Optional.of(convert(node, type));
        });
    }

    /** Snapshot of the whole collection in insertion order. */
    public <T> List<T> getAll(String collection, Class<T> type) {
        Table table = table(collection);
        return table.read(() -> {
            List<T> out = new ArrayList<>(table.rows.size());
            for (ObjectNode node : table.rows.values()) out.add(convert(node, type));
            return out;
        });
    }

    /** All records whose indexed field equals {@code value}; records missing the field are not indexed. */
    public <T> List<T> getByIndex(String collection, String indexName, Object value, Class<T> type) {
        Table table = table(collection);
        return table.read(() -> {
            Index index = table.indexes.get(indexName);
            if (index == null) throw new IllegalArgumentException("No index '" + indexName + "' on " + collection);
            String key = indexKey(mapper.valueToTree(value));
            Set<String> ids = key == null ? Set.of() : index.entries.getOrDefault(key, Set.of());
            List<T> out = new ArrayList<>(ids.size());
            for (String id : ids) out.add(convert(table.rows.get(id), type));
            return out;
        });
    }

    public int count(String collection) {
        Table table = table(collection);
        return table.read(table.rows::size);
    }

    // ------------------------------------------------------------------ writes

    /**
     * Inserts or replaces by primary key and returns the item as given.
     *
     * @throws ConstraintViolationException when a unique index already holds the value
     */
    public <T> T put(String collection, T item) {
        Table table = table(collection);
        ObjectNode node = toNode(item);
        String id = table.write(() -> {
            String key = keyOf(table, node);
            table.checkUnique(key, node);
            Map<String, ObjectNode> before = table.snapshot();
            table.apply(key, node);
            persistOrRollback(table, before);
            return key;
        });
        fire(new StoreEvent(collection, StoreEvent.Type.PUT, id));
        return item;
    }

    /**
     * Insert-only variant of {@link #put}.
     *
     * @throws ConstraintViolationException when the key already exists
     */
    public <T> T add(String collection, T item) {
        Table table = table(collection);
        ObjectNode node = toNode(item);
        String id = table.write(() -> {
            String key = keyOf(table, node);
            if (table.rows.containsKey(key)) {
                throw new ConstraintViolationException("Record '" + key + "' already exists in " + collection);
            }
            table.checkUnique(key, node);
            Map<String, ObjectNode> before = table.snapshot();
            table.apply(key, node);
            persistOrRollback(table, before);
            return key;
        });
        fire(new StoreEvent(collection, StoreEvent.Type.PUT, id));
        return item;
    }

    /**
     * Writes many items under one write lock. Each item succeeds or fails on its own: a
     * constraint violation or a missing key is reported in the result and the remaining
     * items are still written. When the backend cannot save the batch, nothing is kept and
     * every item that had been accepted is reported as failed.
     */
    public <T> BulkWriteResult bulkPut(String collection, List<T> items) {
        Table table = table(collection);
        List<String> written = new ArrayList<>();
        List<Integer> writtenAt = new ArrayList<>();
        List<BulkWriteResult.Failure> failures = new ArrayList<>();
        table.write(() -> {
            Map<String, ObjectNode> before = table.snapshot();
            for (int i = 0; i < items.size(); i++) {
                String key = null;
                try {
                    ObjectNode node = toNode(items.get(i));
                    key = keyOf(table, node);
                    table.checkUnique(key, node);
                    table.apply(key, node);
                    written.add(key);
                    writtenAt.add(i);
                } catch (StoreException | IllegalArgumentException ex) {
                    failures.add(new BulkWriteResult.Failure(i, key, ex.getMessage()));
                }
            }
            if (written.isEmpty()) return null;
            try {
                persist(table);
            } catch (RuntimeException ex) {
                table.restore(before);
                log.error("Bulk write to {} could not be saved, {} items dropped", collection, written.size(), ex);
                for (int j = 0; j < written.size(); j++) {
                    failures.add(new BulkWriteResult.Failure(writtenAt.get(j), written.get(j), "Not saved: " + ex.getMessage()));
                }
                failures.sort(Comparator.comparingInt(f -> f.index));
                written.clear();
            }
            return null;
        });
        if (!failures.isEmpty()) {
            log.warn("Bulk write to {}: {} written, {} failed", collection, written.size(), failures.size());
        }
        for (String id : written) fire(new StoreEvent(collection, StoreEvent.Type.PUT, id));
        return new BulkWriteResult(written.size(), failures);
    }

    /** Deletes by key; returns false when there was nothing to delete. */
    public boolean delete(String collection, String id) {
        Table table = table(collection);
        boolean removed = table.write(() -> {
            if (!table.rows.containsKey(id)) return false;
            Map<String, ObjectNode> before = table.snapshot();
            table.remove(id);
            persistOrRollback(table, before);
            return true;
        });
        if (removed) fire(new StoreEvent(collection, StoreEvent.Type.DELETE, id));
        return removed;
    }

    public void clear(String collection) {
        Table table = table(collection);
        table.write(() -> {
            Map<String, ObjectNode> before = table.snapshot();
            table.restore(Map.of());
            persistOrRollback(table, before);
            return null;
        });
        fire(new StoreEvent(collection, StoreEvent.Type.CLEAR, null));
    }

    // ------------------------------------------------------------------ observers

    public Subscription subscribe(StoreListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        listeners.clear();
        try {
            backend.close();
        } catch (Exception ex) {
            throw new StorageUnavailableException("Failed to close store backend", ex);
        }
    }

    // ------------------------------------------------------------------ internals

    private Table table(String collection) {
        ensureOpen();
        Table table = tables.get(collection);
        if (table == null) throw new IllegalArgumentException("Unknown collection: " + collection);
        return table;
    }

    private void ensureOpen() {
        if (closed) throw new StorageUnavailableException("Record store is closed");
    }

    private Table loadTable(CollectionSchema schema) {
        Table table = new Table(schema);
        ArrayNode rows = backend.read(schema.name);
        for (JsonNode row : rows) {
            if (!row.isObject()) continue;
            String key = textAt(row, table.keyPointer);
            if (key == null) {
                log.warn("Skipping stored {} record without key", schema.name);
                continue;
            }
            table.rows.put(key, (ObjectNode) row);
        }
        List<IndexSpec> specs = new ArrayList<>(schema.indexes);
        schema.indexes.clear();
        for (IndexSpec spec : specs) table.addIndex(spec);
        return table;
    }

    private void persist(Table table) {
        ArrayNode rows = mapper.createArrayNode();
        for (ObjectNode node : table.rows.values()) rows.add(node);
        backend.write(table.schema.name, rows);
    }

    /** Saves the table or, when the backend fails, puts its rows and indexes back as they were. */
    private void persistOrRollback(Table table, Map<String, ObjectNode> before) {
        try {
            persist(table);
        } catch (RuntimeException ex) {
            table.restore(before);
            log.error("Write to {} could not be saved, change rolled back", table.schema.name, ex);
            throw ex;
        }
    }

    private void persistSchemas() {
        List<CollectionSchema> schemas = new ArrayList<>();
        for (Table table : tables.values()) schemas.add(copyOf(table.schema));
        schemas.sort(Comparator.comparing(s -> s.name));
        backend.writeSchemas(schemas);
    }

    private void fire(StoreEvent event) {
        for (StoreListener listener : listeners) {
            try {
                listener.onChange(event);
            } catch (RuntimeException ex) {
                log.warn("Store listener failed on {}", event, ex);
            }
        }
    }

    private ObjectNode toNode(Object item) {
        if (item == null) throw new IllegalArgumentException("Cannot store null");
        JsonNode node = item instanceof JsonNode ? ((JsonNode) item).deepCopy() : mapper.valueToTree(item);
        if (!node.isObject()) throw new IllegalArgumentException("Records must be JSON objects");
        return (ObjectNode) node;
    }

    private <T> T convert(ObjectNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node.deepCopy(), type);
        } catch (com.fasterxml.jackson.core.JsonProcessingException ex) {
            throw new StoreException("Stored record cannot be read as " + type.getSimpleName(), ex);
        }
    }

    private String keyOf(Table table, JsonNode node) {
        String key = textAt(node, table.keyPointer);
        if (key == null) {
            throw new IllegalArgumentException("Record has no '" + table.schema.keyPath + "' key for " + table.schema.name);
        }
        return key;
    }

    private static String textAt(JsonNode node, JsonPointer pointer) {
        JsonNode value = node.at(pointer);
        if (value.isMissingNode() || value.isNull()) return null;
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    /** Index key of a field value; numbers compare by value so 30 and 30.0 share a key. */
    private static String indexKey(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) return null;
        if (value.isNumber()) return "n:" + value.decimalValue().stripTrailingZeros().toPlainString();
        if (value.isBoolean()) return "b:" + value.asBoolean();
        if (value.isTextual()) return "s:" + value.asText();
        return "j:" + value;
    }

    private static JsonPointer pointer(String path) {
        return JsonPointer.compile("/" + path.replace('.', '/'));
    }

    private static CollectionSchema copyOf(CollectionSchema schema) {
        List<IndexSpec> indexes = new ArrayList<>();
        for (IndexSpec spec : schema.indexes) indexes.add(new IndexSpec(spec.name, spec.field, spec.unique));
        return new CollectionSchema(schema.name, schema.keyPath, indexes);
    }

    private interface LockedAction<R> { R run(); }

    private static final class Index {
        final IndexSpec spec;
        final JsonPointer pointer;
        final Map<String, Set<String>> entries = new HashMap<>();
        Index(IndexSpec spec) { this.spec = spec; this.pointer = pointer(spec.field); }

        void add(String id, JsonNode record) {
            String key = indexKey(record.at(pointer));
            if (key != null) entries.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(id);
        }
        void remove(String id, JsonNode record) {
            String key = indexKey(record.at(pointer));
            if (key == null) return;
            Set<String> ids = entries.get(key);
            if (ids == null) return;
            ids.remove(id);
            if (ids.isEmpty()) entries.remove(key);
        }
    }

    private final class Table {
        final CollectionSchema schema;
        final JsonPointer keyPointer;
        final Map<String, ObjectNode> rows = new LinkedHashMap<>();
        final Map<String, Index> indexes = new LinkedHashMap<>();
        final ReadWriteLock lock = new ReentrantReadWriteLock();

        Table(CollectionSchema schema) { this.schema = schema; this.keyPointer = pointer(schema.keyPath); }

        <R> R read(LockedAction<R> action) {
            lock.readLock().lock();
            try { return action.run(); } finally { lock.readLock().unlock(); }
        }

        <R> R write(LockedAction<R> action) {
            lock.writeLock().lock();
            try { return action.run(); } finally { lock.writeLock().unlock(); }
        }

        void addIndex(IndexSpec spec) {
            write(() -> {
                Index index = new Index(spec);
                for (Map.Entry<String, ObjectNode> e : rows.entrySet()) index.add(e.getKey(), e.getValue());
                if (spec.unique) {
                    for (Map.Entry<String, Set<String>> e : index.entries.entrySet()) {
                        if (e.getValue().size() > 1) {
                            throw new ConstraintViolationException("Cannot create unique index " + schema.name + "."
                                    + spec.name + ": value " + e.getKey().substring(2) + " is shared by " + e.getValue());
                        }
                    }
                }
                indexes.put(spec.name, index);
                schema.indexes.add(spec);
                return null;
            });
        }

        void dropIndex(String name) {
            write(() -> {
                indexes.remove(name);
                schema.indexes.removeIf(spec -> spec.name.equals(name));
                return null;
            });
        }

        void checkUnique(String id, JsonNode node) {
            for (Index index : indexes.values()) {
                if (!index.spec.unique) continue;
                String key = indexKey(node.at(index.pointer));
                if (key == null) continue;
                Set<String> holders = index.entries.getOrDefault(key, Set.of());
                for (String holder : holders) {
                    if (!holder.equals(id)) {
                        throw new ConstraintViolationException("Duplicate value " + node.at(index.pointer).asText()
                                + " for unique index " + schema.name + "." + index.spec.name);
                    }
                }
            }
        }

        void apply(String id, ObjectNode node) {
            ObjectNode previous = rows.get(id);
            if (previous != null) for (Index index : indexes.values()) index.remove(id, previous);
            rows.put(id, node);
            for (Index index : indexes.values()) index.add(id, node);
        }

        void remove(String id) {
            ObjectNode previous = rows.remove(id);
            if (previous != null) for (Index index : indexes.values()) index.remove(id, previous);
        }

        // rows are replaced, never edited in place, so copying the map is enough
        Map<String, ObjectNode> snapshot() { return new LinkedHashMap<>(rows); }

        void restore(Map<String, ObjectNode> saved) {
            rows.clear();
            rows.putAll(saved);
            for (Index index : indexes.values()) {
                index.entries.clear();
                for (Map.Entry<String, ObjectNode> e : rows.entrySet()) index.add(e.getKey(), e.getValue());
            }
        }
    }
}
