package com.promptstability.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Per-prompt evaluation output, keyed by base prompt in first-observation order.
 */
public record EvaluationResult(Map<String, PromptEvaluation> prompts) {

    public EvaluationResult {
        prompts = Collections.unmodifiableMap(new LinkedHashMap<>(prompts));
    }

    public static EvaluationResult empty() {
        return new EvaluationResult(Map.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return prompts.isEmpty();
    }

    public PromptEvaluation get(String basePrompt) {
        return prompts.get(basePrompt);
    }
}
