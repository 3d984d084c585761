package com.promptstability.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * Keeps response records as a single JSON array in {@code <dataDir>/test_results.json}.
 *
 * <p>Elements are bound one at a time. An element that cannot be bound to a
 * {@link ResponseRecord} is returned as {@code null} so the aggregator drops and counts it,
 * and it is written back unchanged on {@link #append(ResponseRecord)}.
 */
public class JsonResponseStore implements ResponseStore {
    private static final Logger log = LoggerFactory.getLogger(JsonResponseStore.class);

    public static final String DATA_FILE_NAME = "test_results.json";

    private final Path storageDir;
    private final Path dataFile;
    private final Clock clock;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonResponseStore(Path storageDir) {
        this(storageDir, Clock.systemUTC());
    }

    JsonResponseStore(Path storageDir, Clock clock) {
        this.storageDir = storageDir;
        this.dataFile = storageDir.resolve(DATA_FILE_NAME);
        this.clock = clock;
    }

    @Override
    public List<ResponseRecord> loadAll() throws IOException {
        List<ResponseRecord> records = new ArrayList<>();
        for (JsonNode element : readElements()) {
            records.add(toRecord(element));
        }
        return records;
    }

    @Override
    public void append(ResponseRecord record) throws IOException {
        ResponseRecord stamped = record.timestamp() == null ? record.withTimestamp(clock.instant().toString()) : record;
        ArrayNode elements = readElements();
        elements.add(objectMapper.valueToTree(stamped));
        save(elements);
    }

    @Override
    public void clear() throws IOException {
        save(objectMapper.createArrayNode());
    }

    public Path dataFile() {
        return dataFile;
    }

    private ArrayNode readElements() throws IOException {
        if (!Files.exists(dataFile) || Files.size(dataFile) == 0L) {
            return objectMapper.createArrayNode();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(dataFile.toFile());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable response store {}: {}", dataFile, e.getOriginalMessage());
            return objectMapper.createArrayNode();
        }
        if (root == null || !root.isArray()) {
            log.warn("Ignoring {}: expected a JSON array of response records", dataFile);
            return objectMapper.createArrayNode();
        }
        return (ArrayNode) root;
    }

    private ResponseRecord toRecord(JsonNode element) {
        if (!element.isObject()) {
            log.debug("Skipping non-object element in {}: {}", dataFile, element);
            return null;
        }
        try {
            return objectMapper.treeToValue(element, ResponseRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable response record in {}: {}", dataFile, e.getOriginalMessage());
            return null;
        }
    }

    private void save(ArrayNode elements) throws IOException {
        Files.createDirectories(storageDir);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(dataFile.toFile(), elements);
    }
}
