package com.vidnyan.sigmaeval.adapter.out.evaluator;

import com.vidnyan.sigmaeval.adapter.out.evaluator.semantic.SemanticScorer;
import com.vidnyan.sigmaeval.application.port.out.RuleGenerator;
import com.vidnyan.sigmaeval.config.EvaluationProperties;
import com.vidnyan.sigmaeval.domain.evaluation.BehavioralCore;
import com.vidnyan.sigmaeval.domain.evaluation.StabilityResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Measures how consistently a generator produces the same behavior for one input.
 *
 * Generation runs execute concurrently; a run that fails or exceeds its timeout is skipped.
 */
@Slf4j
@Component
public class StabilityTester {

    private static final int MAX_PARALLEL_RUNS = 4;

    private final CanonicalFingerprinter fingerprinter;
    private final SemanticScorer semanticScorer;
    private final Duration runTimeout;
    private final int defaultRuns;

    @Autowired
    public StabilityTester(CanonicalFingerprinter fingerprinter, SemanticScorer semanticScorer,
                           EvaluationProperties properties) {
        this(fingerprinter, semanticScorer, properties.getEvaluation().getStabilityRunTimeout(),
                properties.getEvaluation().getStabilityRuns());
    }

    public StabilityTester(CanonicalFingerprinter fingerprinter, SemanticScorer semanticScorer,
                           Duration runTimeout, int defaultRuns) {
        this.fingerprinter = fingerprinter;
        this.semanticScorer = semanticScorer;
        this.runTimeout = runTimeout;
        this.defaultRuns = defaultRuns;
    }

    public StabilityResult testStability(String inputId, RuleGenerator generator, String referenceRule) {
        return testStability(inputId, generator, referenceRule, defaultRuns);
    }

    public StabilityResult testStability(String inputId, RuleGenerator generator, String referenceRule,
                                         int numRuns) {
        log.info("Stability test for input {}: {} runs", inputId, numRuns);
        List<String> rules = generate(inputId, generator, Math.max(0, numRuns));
        if (rules.isEmpty()) {
            log.warn("Stability test for input {}: no successful runs", inputId);
            return StabilityResult.noSuccessfulRuns(numRuns);
        }

        BehavioralCore referenceCore = referenceRule != null
                ? fingerprinter.extractBehavioralCore(referenceRule) : null;

        List<String> hashes = new ArrayList<>();
        List<Double> selectorCounts = new ArrayList<>();
        List<Double> similarities = new ArrayList<>();
        for (String rule : rules) {
            BehavioralCore core = fingerprinter.extractBehavioralCore(rule);
            hashes.add(core.coreHash());
            selectorCounts.add((double) core.selectorCount());
            if (referenceCore != null) {
                similarities.add(semanticScorer
                        .compareRules(rule, referenceRule, core, referenceCore)
                        .similarityScore());
            }
        }

        Map<String, Integer> frequencies = new LinkedHashMap<>();
        hashes.forEach(hash -> frequencies.merge(hash, 1, Integer::sum));
        Map.Entry<String, Integer> modal = frequencies.entrySet().stream()
                .reduce((best, candidate) -> candidate.getValue() > best.getValue() ? candidate : best)
                .orElseThrow();

        double hashConsistency = (double) modal.getValue() / rules.size();
        double selectorsVariance = coefficientOfVariation(selectorCounts);
        double semanticVariance = coefficientOfVariation(similarities);
        double score = 0.5 * hashConsistency
                + 0.3 * (1 - Math.min(1.0, selectorsVariance))
                + 0.2 * (1 - Math.min(1.0, semanticVariance));

        log.info("Stability for input {}: {}/{} runs, {} unique hashes, score {}",
                inputId, rules.size(), numRuns, frequencies.size(), score);
        return new StabilityResult(numRuns, rules.size(), frequencies.size(), modal.getKey(), hashConsistency,
                selectorsVariance, semanticVariance, score, score >= StabilityResult.STABLE_THRESHOLD, hashes);
    }

    private List<String> generate(String inputId, RuleGenerator generator, int numRuns) {
        List<String> rules = new ArrayList<>();
        if (numRuns == 0) {
            return rules;
        }
        ExecutorService runs = Executors.newFixedThreadPool(Math.min(numRuns, MAX_PARALLEL_RUNS), runnable -> {
            Thread thread = new Thread(runnable, "stability-" + inputId);
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < numRuns; i++) {
                futures.add(runs.submit(() -> generator.generate(inputId)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Future<String> future = futures.get(i);
                try {
                    String rule = future.get(runTimeout.toMillis(), TimeUnit.MILLISECONDS);
                    if (rule == null || rule.isBlank()) {
                        log.warn("Stability run {} for input {} produced no rule; skipped", i + 1, inputId);
                    } else {
                        rules.add(rule);
                    }
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("Stability run {} for input {} timed out; skipped", i + 1, inputId);
                } catch (ExecutionException e) {
                    log.warn("Stability run {} for input {} failed; skipped: {}",
                            i + 1, inputId, e.getCause().getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Stability test for input {} interrupted after {} runs", inputId, rules.size());
        } finally {
            runs.shutdownNow();
        }
        return rules;
    }

    /**
     * Population standard deviation over mean; 0 for fewer than two values or a zero mean.
     */
    static double coefficientOfVariation(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (mean == 0.0) {
            return 0.0;
        }
        double variance = values.stream()
                .mapToDouble(value -> (value - mean) * (value - mean))
                .average()
                .orElse(0.0);
        return Math.sqrt(variance) / mean;
    }
}
