package com.vidnyan.sigmaeval.adapter.out.evaluator.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sigmaeval.adapter.out.evaluator.CanonicalFingerprinter;
import com.vidnyan.sigmaeval.application.port.out.EmbeddingProvider;
import com.vidnyan.sigmaeval.application.port.out.LlmJudge;
import com.vidnyan.sigmaeval.config.EvaluationProperties;
import com.vidnyan.sigmaeval.domain.evaluation.BehavioralCore;
import com.vidnyan.sigmaeval.domain.evaluation.SemanticComparisonResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Semantic comparison of a generated rule against a reference rule.
 *
 * Identical behavioral cores score 1.0 without calling out. Otherwise the LLM judge
 * is tried first, then embeddings; a result from a later strategy is marked degraded.
 * When nothing is available the result is a neutral 0.5.
 */
@Slf4j
@Component
public class SemanticScorer {

    private final CanonicalFingerprinter fingerprinter;
    private final List<SemanticStrategy> strategies;

    @Autowired
    public SemanticScorer(CanonicalFingerprinter fingerprinter,
                          ObjectProvider<LlmJudge> judge,
                          ObjectProvider<EmbeddingProvider> embeddings,
                          EvaluationProperties properties,
                          ObjectMapper objectMapper) {
        this(fingerprinter, judge.getIfAvailable(), embeddings.getIfAvailable(), objectMapper,
                properties.getAi().getTimeout());
    }

    public SemanticScorer(CanonicalFingerprinter fingerprinter, LlmJudge judge, EmbeddingProvider embeddings,
                          ObjectMapper objectMapper, Duration timeout) {
        this.fingerprinter = fingerprinter;
        List<SemanticStrategy> configured = new ArrayList<>();
        if (judge != null) {
            configured.add(new JudgeSemanticStrategy(judge, objectMapper, timeout));
        }
        if (embeddings != null) {
            configured.add(new EmbeddingSemanticStrategy(embeddings, timeout));
        }
        this.strategies = List.copyOf(configured);
        log.info("Semantic strategies: {}", strategies.stream().map(SemanticStrategy::name).toList());
    }

    public SemanticComparisonResult compareRules(String generatedRule, String referenceRule) {
        return compareRules(generatedRule, referenceRule,
                fingerprinter.extractBehavioralCore(generatedRule),
                fingerprinter.extractBehavioralCore(referenceRule));
    }

    /**
     * Compare using cores that were already extracted.
     */
    public SemanticComparisonResult compareRules(String generatedRule, String referenceRule,
                                                 BehavioralCore generatedCore, BehavioralCore referenceCore) {
        if (!generatedCore.coreHash().isEmpty() && generatedCore.coreHash().equals(referenceCore.coreHash())) {
            return SemanticComparisonResult.identicalCores();
        }

        for (int i = 0; i < strategies.size(); i++) {
            SemanticStrategy strategy = strategies.get(i);
            try {
                SemanticComparisonResult result = strategy.compare(generatedRule, referenceRule);
                return i == 0 ? result : result.asFallback();
            } catch (RuntimeException e) {
                log.warn("Semantic strategy {} failed, falling back: {}", strategy.name(), e.getMessage());
            }
        }

        if (strategies.isEmpty()) {
            return SemanticComparisonResult.neutral("No semantic capability configured; neutral score");
        }
        return SemanticComparisonResult.neutral("All semantic capabilities failed; neutral score");
    }
}
