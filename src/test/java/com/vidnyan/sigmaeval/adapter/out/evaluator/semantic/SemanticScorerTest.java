package com.vidnyan.sigmaeval.adapter.out.evaluator.semantic;

import com.vidnyan.sigmaeval.RuleFixtures;
import com.vidnyan.sigmaeval.application.port.out.CapabilityException;
import com.vidnyan.sigmaeval.application.port.out.EmbeddingProvider;
import com.vidnyan.sigmaeval.application.port.out.LlmJudge;
import com.vidnyan.sigmaeval.domain.evaluation.SemanticComparisonResult;
import com.vidnyan.sigmaeval.domain.evaluation.SemanticComparisonResult.Method;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SemanticScorerTest {

    private static final String GENERATED = RuleFixtures.SCHTASKS_RULE;
    private static final String REFERENCE = RuleFixtures.ENCODED_POWERSHELL_RULE;
    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @Mock
    private LlmJudge judge;

    @Mock
    private EmbeddingProvider embeddings;

    private SemanticScorer scorer(LlmJudge judge, EmbeddingProvider embeddings, Duration timeout) {
        return new SemanticScorer(RuleFixtures.fingerprinter(), judge, embeddings, RuleFixtures.objectMapper(), timeout);
    }

    @Test
    void compareRules_ShouldShortCircuitIdenticalCores() {
        String reordered = GENERATED.replace(
                "    CommandLine|contains: 'schtasks'\n    CommandLine|contains: '/create'",
                "    CommandLine|contains: '/create'\n    CommandLine|contains: 'SCHTASKS'");

        SemanticComparisonResult result = scorer(judge, embeddings, TIMEOUT).compareRules(reordered, GENERATED);

        assertEquals(1.0, result.similarityScore());
        assertEquals(Method.CORE_HASH, result.method());
        assertFalse(result.degraded());
        verifyNoInteractions(judge, embeddings);
    }

    @Test
    void compareRules_ShouldParseJudgeVerdictWrappedInProse() {
        when(judge.judge(anyString())).thenReturn("""
                Here is my evaluation:
                ```json
                {"similarity_score": 0.4, "missing_behaviors": ["encoded command", "parent {cmd}"],
                 "extraneous_behaviors": [], "overfitting_detected": false, "fp_risk": "low",
                 "explanation": "Different behaviors"}
                ```
                """);

        SemanticComparisonResult result = scorer(judge, embeddings, TIMEOUT).compareRules(GENERATED, REFERENCE);

        assertEquals(Method.LLM_JUDGE, result.method());
        assertEquals(0.4, result.similarityScore(), 1e-9);
        assertEquals(2, result.missingBehaviors());
        assertEquals(0, result.extraneousBehaviors());
        assertEquals(Boolean.FALSE, result.overfittingDetected());
        assertEquals("low", result.fpRisk());
        assertFalse(result.degraded());
        verifyNoInteractions(embeddings);
    }

    @Test
    void compareRules_ShouldClampJudgeScore() {
        when(judge.judge(anyString())).thenReturn("{\"similarity_score\": 1.7}");

        SemanticComparisonResult result = scorer(judge, null, TIMEOUT).compareRules(GENERATED, REFERENCE);

        assertEquals(1.0, result.similarityScore());
        assertEquals(0, result.missingBehaviors());
    }

    @Test
    void compareRules_ShouldFallBackToEmbeddingsOnUnparsableVerdict() {
        when(judge.judge(anyString())).thenReturn("I think they are fairly similar.");
        when(embeddings.embed(GENERATED)).thenReturn(new float[]{1f, 0f});
        when(embeddings.embed(REFERENCE)).thenReturn(new float[]{1f, 0f});

        SemanticComparisonResult result = scorer(judge, embeddings, TIMEOUT).compareRules(GENERATED, REFERENCE);

        assertEquals(Method.EMBEDDING, result.method());
        assertEquals(1.0, result.similarityScore(), 1e-6);
        assertTrue(result.degraded());
    }

    @Test
    void compareRules_ShouldFallBackWhenJudgeFails() {
        when(judge.judge(anyString())).thenThrow(new CapabilityException("HTTP 503"));

        SemanticComparisonResult result = scorer(judge, null, TIMEOUT).compareRules(GENERATED, REFERENCE);

        assertEquals(Method.NEUTRAL, result.method());
        assertEquals(0.5, result.similarityScore());
        assertTrue(result.degraded());
        assertEquals("All semantic capabilities failed; neutral score", result.explanation());
    }

    @Test
    void compareRules_ShouldEstimateDifferencesFromEmbeddings() {
        when(embeddings.embed(GENERATED)).thenReturn(new float[]{1f, 0f, 0f});
        when(embeddings.embed(REFERENCE)).thenReturn(new float[]{0f, 1f, 0f});

        SemanticComparisonResult result = scorer(null, embeddings, TIMEOUT).compareRules(GENERATED, REFERENCE);

        assertEquals(Method.EMBEDDING, result.method());
        assertEquals(0.0, result.similarityScore(), 1e-9);
        assertEquals(2, result.missingBehaviors());
        assertEquals(1, result.extraneousBehaviors());
        assertFalse(result.degraded());
    }

    @Test
    void compareRules_ShouldReturnNeutralWithoutCapabilities() {
        SemanticComparisonResult result = scorer(null, null, TIMEOUT).compareRules(GENERATED, REFERENCE);

        assertEquals(Method.NEUTRAL, result.method());
        assertEquals(0.5, result.similarityScore());
        assertEquals("No semantic capability configured; neutral score", result.explanation());
    }

    @Test
    void compareRules_ShouldTreatSlowJudgeAsFailure() {
        when(judge.judge(anyString())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return "{\"similarity_score\": 0.9}";
        });

        SemanticComparisonResult result = scorer(judge, null, Duration.ofMillis(200)).compareRules(GENERATED, REFERENCE);

        assertEquals(Method.NEUTRAL, result.method());
        assertTrue(result.degraded());
    }

    @Test
    void cosine_ShouldRejectMismatchedDimensions() {
        assertThrows(CapabilityException.class,
                () -> EmbeddingSemanticStrategy.cosine(new float[]{1f}, new float[]{1f, 2f}));
        assertEquals(0.0, EmbeddingSemanticStrategy.cosine(new float[]{0f, 0f}, new float[]{1f, 1f}));
    }
}
