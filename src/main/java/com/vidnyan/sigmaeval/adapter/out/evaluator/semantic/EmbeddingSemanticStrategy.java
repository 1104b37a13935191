package com.vidnyan.sigmaeval.adapter.out.evaluator.semantic;

import com.vidnyan.sigmaeval.adapter.out.evaluator.BoundedCalls;
import com.vidnyan.sigmaeval.application.port.out.CapabilityException;
import com.vidnyan.sigmaeval.application.port.out.EmbeddingProvider;
import com.vidnyan.sigmaeval.domain.evaluation.SemanticComparisonResult;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Cosine similarity of the two raw rule texts' embeddings.
 * Behavior differences cannot be enumerated this way, so the counts are estimates.
 */
@RequiredArgsConstructor
class EmbeddingSemanticStrategy implements SemanticStrategy {

    private final EmbeddingProvider embeddings;
    private final Duration timeout;

    @Override
    public String name() {
        return "embedding";
    }

    @Override
    public SemanticComparisonResult compare(String generatedRule, String referenceRule) {
        float[] generated = BoundedCalls.call("Embedding", timeout, () -> embeddings.embed(generatedRule));
        float[] reference = BoundedCalls.call("Embedding", timeout, () -> embeddings.embed(referenceRule));

        double similarity = Math.max(0.0, Math.min(1.0, cosine(generated, reference)));
        int missing = similarity < 0.7 ? (int) ((1 - similarity) * 2) : 0;
        int extraneous = similarity < 0.7 ? (int) ((1 - similarity) * 1) : 0;

        return new SemanticComparisonResult(similarity, missing, extraneous, List.of(), List.of(), null, null,
                "Embedding cosine similarity; behavior differences estimated",
                SemanticComparisonResult.Method.EMBEDDING, false);
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            throw new CapabilityException("Embedding vectors are empty or of different dimensions");
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
