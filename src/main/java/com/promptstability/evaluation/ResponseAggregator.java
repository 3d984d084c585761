package com.promptstability.evaluation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.promptstability.storage.ResponseRecord;

/**
 * Groups response texts by base prompt and agent, keeping observation order.
 *
 * <p>Records with a null or empty base prompt, agent name or response are dropped and counted rather
 * than rejected, since stores may hold legacy or partially written entries.
 */
public class ResponseAggregator {
    private static final Logger log = LoggerFactory.getLogger(ResponseAggregator.class);

    private final Map<String, Map<String, List<String>>> responses = new LinkedHashMap<>();
    private int acceptedRecords;
    private int droppedRecords;

    public boolean addRecord(ResponseRecord record) {
        if (record == null
                || isMissing(record.basePrompt())
                || isMissing(record.agentName())
                || isMissing(record.response())) {
            droppedRecords++;
            log.debug("Dropping incomplete response record {}", record);
            return false;
        }
        responses.computeIfAbsent(record.basePrompt(), prompt -> new LinkedHashMap<>())
                .computeIfAbsent(record.agentName(), agent -> new ArrayList<>())
                .add(record.response());
        acceptedRecords++;
        return true;
    }

    public void addRecords(List<ResponseRecord> records) {
        records.forEach(this::addRecord);
    }

    public Map<String, List<String>> responseSets(String basePrompt) {
        Map<String, List<String>> byAgent = responses.get(basePrompt);
        if (byAgent == null) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        byAgent.forEach((agent, texts) -> copy.put(agent, List.copyOf(texts)));
        return copy;
    }

    public List<String> allPrompts() {
        return List.copyOf(responses.keySet());
    }

    public int acceptedRecords() {
        return acceptedRecords;
    }

    public int droppedRecords() {
        return droppedRecords;
    }

    private static boolean isMissing(String value) {
        return value == null || value.isEmpty();
    }
}
