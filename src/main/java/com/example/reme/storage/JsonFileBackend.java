package com.example.reme.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;

/**
 * One {@code <collection>.json} array per collection inside a data directory, plus
 * {@code _schema.json} describing collections and indexes. Files are replaced atomically.
 */
public class JsonFileBackend implements StoreBackend {
    private static final Logger log = LoggerFactory.getLogger(JsonFileBackend.class);
    private static final String SCHEMA_FILE = "_schema.json";

    private final Path dir;
    private final ObjectMapper mapper = JsonStorage.mapper();

    public JsonFileBackend(Path dir) { this.dir = dir; }

    public Path getDirectory() { return dir; }

    @Override
    public void open() {
        try {
            Files.createDirectories(dir);
        } catch (IOException ex) {
            throw new StorageUnavailableException("Cannot create data directory " + dir, ex);
        }
        if (!Files.isDirectory(dir) || !Files.isReadable(dir) || !Files.isWritable(dir)) {
            throw new StorageUnavailableException("Data directory is not readable and writable: " + dir);
        }
        log.debug("Opened file store at {}", dir);
    }

    @Override
    public List<CollectionSchema> readSchemas() {
        Path file = dir.resolve(SCHEMA_FILE);
        if (!Files.exists(file)) return new ArrayList<>();
        try {
            return mapper.readValue(file.toFile(), new TypeReference<List<CollectionSchema>>() {});
        } catch (IOException ex) {
            throw new StorageUnavailableException("Corrupt schema file " + file, ex);
        }
    }

    @Override
    public void writeSchemas(List<CollectionSchema> schemas) {
        writeAtomically(dir.resolve(SCHEMA_FILE), mapper.valueToTree(schemas));
    }

    @Override
    public ArrayNode read(String collection) {
        Path file = fileFor(collection);
        if (!Files.exists(file)) return mapper.createArrayNode();
        try {
            JsonNode node = mapper.readTree(file.toFile());
            if (node == null || node.isMissingNode()) return mapper.createArrayNode();
            if (!node.isArray()) throw new StorageUnavailableException("Collection file is not a JSON array: " + file);
            return (ArrayNode) node;
        } catch (IOException ex) {
            throw new StorageUnavailableException("Cannot read collection file " + file, ex);
        }
    }

    @Override
    public void write(String collection, ArrayNode rows) {
        writeAtomically(fileFor(collection), rows);
    }

    private Path fileFor(String collection) { return dir.resolve(collection + ".json"); }

    private void writeAtomically(Path target, JsonNode content) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new StorageUnavailableException("Cannot write " + target, ex);
        }
    }
}
