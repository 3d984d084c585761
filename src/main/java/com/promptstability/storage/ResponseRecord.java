package com.promptstability.storage;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One agent response to a stylistically modified prompt. Only {@code basePrompt},
 * {@code agentName} and {@code response} take part in stability evaluation.
 *
 * <p>The timestamp is kept as written by the producer; older files carry local ISO date-times
 * without an offset.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseRecord(
        @JsonProperty("base_prompt") String basePrompt,
        @JsonProperty("agent_name") String agentName,
        @JsonProperty("response") String response,
        @JsonProperty("style_combination") String styleCombination,
        @JsonProperty("full_prompt") String fullPrompt,
        @JsonProperty("sentiment") Map<String, Object> sentiment,
        @JsonProperty("timestamp") String timestamp) {

    public ResponseRecord(String basePrompt, String agentName, String response) {
        this(basePrompt, agentName, response, null, null, null, null);
    }

    public ResponseRecord withTimestamp(String value) {
        return new ResponseRecord(basePrompt, agentName, response, styleCombination, fullPrompt, sentiment, value);
    }
}
