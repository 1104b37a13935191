package com.vidnyan.sigmaeval.adapter.out.evaluator.semantic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sigmaeval.adapter.out.evaluator.BoundedCalls;
import com.vidnyan.sigmaeval.application.port.out.CapabilityException;
import com.vidnyan.sigmaeval.application.port.out.LlmJudge;
import com.vidnyan.sigmaeval.domain.evaluation.SemanticComparisonResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Asks an LLM judge to compare the two rules and parses its JSON verdict.
 */
@Slf4j
@RequiredArgsConstructor
class JudgeSemanticStrategy implements SemanticStrategy {

    private static final String PROMPT_TEMPLATE = """
            You are evaluating SIGMA detection rules. Compare the generated rule against the reference rule.

            Reference Rule:
            ```yaml
            %s
            ```

            Generated Rule:
            ```yaml
            %s
            ```

            Evaluate:
            1. Does the generated rule detect the same behaviors as the reference?
            2. Are any behaviors missing from the generated rule?
            3. Are any irrelevant behaviors added to the generated rule?
            4. Is there overfitting (IOC-based logic)?
            5. Are there false-positive amplifiers?

            Respond in JSON format:
            {
                "similarity_score": 0.0-1.0,
                "missing_behaviors": ["behavior1", "behavior2"],
                "extraneous_behaviors": ["behavior1", "behavior2"],
                "overfitting_detected": true/false,
                "fp_risk": "low/medium/high",
                "explanation": "brief explanation"
            }
            """;

    private final LlmJudge judge;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    @Override
    public String name() {
        return "llm-judge";
    }

    @Override
    public SemanticComparisonResult compare(String generatedRule, String referenceRule) {
        String prompt = PROMPT_TEMPLATE.formatted(referenceRule, generatedRule);
        String response = BoundedCalls.call("LLM judge", timeout, () -> judge.judge(prompt));
        return parseVerdict(response);
    }

    SemanticComparisonResult parseVerdict(String response) {
        String json = JudgeResponseParser.extractJsonObject(response);
        if (json == null) {
            throw new CapabilityException("Judge response contains no JSON object");
        }
        JsonNode verdict;
        try {
            verdict = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CapabilityException("Judge response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode score = verdict.get("similarity_score");
        if (score == null || !score.isNumber()) {
            throw new CapabilityException("Judge response has no numeric similarity_score");
        }

        List<String> missing = textList(verdict.get("missing_behaviors"));
        List<String> extraneous = textList(verdict.get("extraneous_behaviors"));
        JsonNode overfitting = verdict.get("overfitting_detected");

        return new SemanticComparisonResult(
                Math.max(0.0, Math.min(1.0, score.asDouble())),
                missing.size(),
                extraneous.size(),
                missing,
                extraneous,
                overfitting != null && overfitting.isBoolean() ? overfitting.asBoolean() : null,
                textOrNull(verdict.get("fp_risk")),
                textOrNull(verdict.get("explanation")),
                SemanticComparisonResult.Method.LLM_JUDGE,
                false);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
