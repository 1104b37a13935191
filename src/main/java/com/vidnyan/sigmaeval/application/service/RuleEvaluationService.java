package com.vidnyan.sigmaeval.application.service;

import com.vidnyan.sigmaeval.adapter.out.evaluator.CanonicalFingerprinter;
import com.vidnyan.sigmaeval.adapter.out.evaluator.HuntabilityScorer;
import com.vidnyan.sigmaeval.adapter.out.evaluator.NoveltyDetector;
import com.vidnyan.sigmaeval.adapter.out.evaluator.StabilityTester;
import com.vidnyan.sigmaeval.adapter.out.evaluator.StructuralValidator;
import com.vidnyan.sigmaeval.adapter.out.evaluator.semantic.SemanticScorer;
import com.vidnyan.sigmaeval.adapter.out.parser.SigmaRuleParser;
import com.vidnyan.sigmaeval.application.port.in.EvaluateRuleUseCase;
import com.vidnyan.sigmaeval.application.port.out.RuleCorpus;
import com.vidnyan.sigmaeval.application.port.out.RuleGenerator;
import com.vidnyan.sigmaeval.config.EvaluationProperties;
import com.vidnyan.sigmaeval.domain.evaluation.BehavioralCore;
import com.vidnyan.sigmaeval.domain.evaluation.CorpusMetrics;
import com.vidnyan.sigmaeval.domain.evaluation.ExtendedValidationResult;
import com.vidnyan.sigmaeval.domain.evaluation.HuntabilityScore;
import com.vidnyan.sigmaeval.domain.evaluation.NoveltyResult;
import com.vidnyan.sigmaeval.domain.evaluation.NoveltyStatus;
import com.vidnyan.sigmaeval.domain.evaluation.RuleReport;
import com.vidnyan.sigmaeval.domain.evaluation.SemanticComparisonResult;
import com.vidnyan.sigmaeval.domain.rule.RuleParseException;
import com.vidnyan.sigmaeval.domain.rule.SigmaRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.ToDoubleFunction;

/**
 * Main application service that orchestrates the evaluation pipeline.
 * Implements the primary use case.
 */
@Slf4j
@Service
public class RuleEvaluationService implements EvaluateRuleUseCase {

    private final StructuralValidator structuralValidator;
    private final SigmaRuleParser parser;
    private final CanonicalFingerprinter fingerprinter;
    private final SemanticScorer semanticScorer;
    private final HuntabilityScorer huntabilityScorer;
    private final NoveltyDetector noveltyDetector;
    private final StabilityTester stabilityTester;
    private final EvaluationProperties properties;
    private final ExecutorService evaluationExecutor;

    public RuleEvaluationService(StructuralValidator structuralValidator,
                                 SigmaRuleParser parser,
                                 CanonicalFingerprinter fingerprinter,
                                 SemanticScorer semanticScorer,
                                 HuntabilityScorer huntabilityScorer,
                                 NoveltyDetector noveltyDetector,
                                 StabilityTester stabilityTester,
                                 EvaluationProperties properties,
                                 @Qualifier("evaluationExecutor") ExecutorService evaluationExecutor) {
        this.structuralValidator = structuralValidator;
        this.parser = parser;
        this.fingerprinter = fingerprinter;
        this.semanticScorer = semanticScorer;
        this.huntabilityScorer = huntabilityScorer;
        this.noveltyDetector = noveltyDetector;
        this.stabilityTester = stabilityTester;
        this.properties = properties;
        this.evaluationExecutor = evaluationExecutor;
    }

    @Override
    public RuleReport evaluateRule(String ruleText, String referenceRule, RuleCorpus corpus) {
        try {
            return runPipeline(ruleText, referenceRule, corpus);
        } catch (RuntimeException e) {
            log.error("Rule evaluation failed unexpectedly", e);
            return RuleReport.failed(null, "Evaluation failed: " + e.getMessage());
        }
    }

    private RuleReport runPipeline(String ruleText, String referenceRule, RuleCorpus corpus) {
        // Step 1: Structural validation (hard gate)
        log.debug("Step 1: Structural validation...");
        ExtendedValidationResult structural = structuralValidator.validate(ruleText);
        SigmaRule rule = parseQuietly(ruleText);
        String ruleId = rule != null ? rule.id() : null;
        String ruleTitle = rule != null ? rule.title() : null;

        if (!structural.finalPass()) {
            log.info("Rule '{}' failed structural validation: {} errors", ruleTitle, structural.errors().size());
            return RuleReport.structuralFailure(null, ruleId, ruleTitle, structural);
        }

        // Step 2: Behavioral core, shared by the semantic and novelty stages
        log.debug("Step 2: Extracting behavioral core...");
        BehavioralCore core = fingerprinter.extractBehavioralCore(rule);

        // Step 3: Semantic comparison
        SemanticComparisonResult semantic = null;
        if (referenceRule != null) {
            log.debug("Step 3: Semantic comparison against reference...");
            semantic = semanticScorer.compareRules(ruleText, referenceRule, core,
                    fingerprinter.extractBehavioralCore(referenceRule));
        }

        // Step 4: Huntability
        log.debug("Step 4: Huntability scoring...");
        HuntabilityScore huntability = huntabilityScorer.scoreRule(ruleText, rule);

        // Step 5: Novelty
        NoveltyResult novelty = null;
        if (corpus != null) {
            log.debug("Step 5: Novelty detection...");
            novelty = noveltyDetector.detectNovelty(core, corpus);
        }

        log.info("Rule '{}' evaluated: huntability {}, similarity {}, novelty {}",
                ruleTitle,
                huntability.score(),
                semantic != null ? semantic.similarityScore() : "n/a",
                novelty != null ? novelty.noveltyStatus().label() : "n/a");
        return new RuleReport(null, ruleId, ruleTitle, structural, core, semantic, huntability,
                null, novelty, null);
    }

    private SigmaRule parseQuietly(String ruleText) {
        try {
            return parser.parse(ruleText);
        } catch (RuleParseException e) {
            log.debug("Rule text not parseable: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public DatasetEvaluation evaluateDataset(List<DatasetItem> items, RuleGenerator generator, RuleCorpus corpus) {
        Instant startTime = Instant.now();
        log.info("Starting dataset evaluation of {} items", items.size());

        List<Future<RuleReport>> futures = new ArrayList<>();
        for (DatasetItem item : items) {
            futures.add(evaluationExecutor.submit(() -> evaluateItem(item, generator, corpus)));
        }

        List<RuleReport> reports = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String itemId = items.get(i).itemId();
            try {
                reports.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("Item {} failed", itemId, e.getCause());
                reports.add(RuleReport.failed(itemId, "Evaluation failed: " + e.getCause().getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Dataset evaluation interrupted at item {}", itemId);
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    reports.add(RuleReport.failed(items.get(j).itemId(), "Evaluation interrupted"));
                }
                break;
            }
        }

        CorpusMetrics metrics = computeMetrics(reports);
        log.info("Dataset evaluation complete in {}ms: {} items, {} errors, pass rate {}",
                Duration.between(startTime, Instant.now()).toMillis(),
                metrics.total(), metrics.errors(), metrics.structuralPassRate());
        return new DatasetEvaluation(List.copyOf(reports), metrics);
    }

    private RuleReport evaluateItem(DatasetItem item, RuleGenerator generator, RuleCorpus corpus) {
        String ruleText = item.ruleText();
        if (ruleText == null) {
            if (generator == null || item.inputId() == null) {
                return RuleReport.failed(item.itemId(), "No rule text and no generator input available");
            }
            try {
                ruleText = generator.generate(item.inputId());
            } catch (Exception e) {
                log.warn("Rule generation failed for item {}: {}", item.itemId(), e.getMessage());
                return RuleReport.failed(item.itemId(), "Rule generation failed: " + e.getMessage());
            }
            if (ruleText == null || ruleText.isBlank()) {
                return RuleReport.failed(item.itemId(), "Rule generation returned no rule");
            }
        }

        RuleReport report = evaluateRule(ruleText, item.referenceRule(), corpus).withItemId(item.itemId());

        if (generator != null && item.inputId() != null && report.passed()
                && properties.getEvaluation().isStabilityEnabled()) {
            report = report.withStability(
                    stabilityTester.testStability(item.inputId(), generator, item.referenceRule()));
        }
        return report;
    }

    /**
     * Aggregate metrics. Errored items count towards {@code total} only.
     */
    static CorpusMetrics computeMetrics(List<RuleReport> reports) {
        int total = reports.size();
        List<RuleReport> evaluated = reports.stream().filter(report -> report.error() == null).toList();
        int errors = total - evaluated.size();

        long passed = evaluated.stream().filter(RuleReport::passed).count();
        double passRate = evaluated.isEmpty() ? 0.0 : (double) passed / evaluated.size();

        Double meanHuntability = mean(evaluated.stream()
                .filter(report -> report.huntability() != null).toList(),
                report -> report.huntability().score());
        Double meanSimilarity = mean(evaluated.stream()
                .filter(report -> report.semanticComparison() != null).toList(),
                report -> report.semanticComparison().similarityScore());
        Double meanStability = mean(evaluated.stream()
                .filter(report -> report.stability() != null).toList(),
                report -> report.stability().stabilityScore());

        List<NoveltyResult> novelties = evaluated.stream()
                .map(RuleReport::novelty)
                .filter(Objects::nonNull)
                .toList();
        CorpusMetrics.NoveltyDistribution distribution = null;
        if (!novelties.isEmpty()) {
            distribution = new CorpusMetrics.NoveltyDistribution(
                    count(novelties, NoveltyStatus.DUPLICATE),
                    count(novelties, NoveltyStatus.VARIANT),
                    count(novelties, NoveltyStatus.NOVEL));
        }

        return new CorpusMetrics(total, evaluated.size(), errors, passRate,
                meanHuntability, meanSimilarity, meanStability, distribution);
    }

    private static Double mean(List<RuleReport> reports, ToDoubleFunction<RuleReport> value) {
        OptionalDouble average = reports.stream().mapToDouble(value).average();
        return average.isPresent() ? average.getAsDouble() : null;
    }

    private static int count(List<NoveltyResult> novelties,
                             NoveltyStatus status) {
        return (int) novelties.stream().filter(novelty -> novelty.noveltyStatus() == status).count();
    }
}
