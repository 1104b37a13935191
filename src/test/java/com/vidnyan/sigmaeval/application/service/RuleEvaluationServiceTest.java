package com.vidnyan.sigmaeval.application.service;

import com.vidnyan.sigmaeval.RuleFixtures;
import com.vidnyan.sigmaeval.adapter.out.corpus.InMemoryRuleCorpus;
import com.vidnyan.sigmaeval.adapter.out.evaluator.CanonicalFingerprinter;
import com.vidnyan.sigmaeval.adapter.out.evaluator.HuntabilityScorer;
import com.vidnyan.sigmaeval.adapter.out.evaluator.NoveltyDetector;
import com.vidnyan.sigmaeval.adapter.out.evaluator.StabilityTester;
import com.vidnyan.sigmaeval.adapter.out.evaluator.semantic.SemanticScorer;
import com.vidnyan.sigmaeval.adapter.out.parser.SigmaRuleParser;
import com.vidnyan.sigmaeval.application.port.in.EvaluateRuleUseCase.DatasetEvaluation;
import com.vidnyan.sigmaeval.application.port.in.EvaluateRuleUseCase.DatasetItem;
import com.vidnyan.sigmaeval.application.port.out.RuleCorpus;
import com.vidnyan.sigmaeval.application.port.out.RuleCorpus.CorpusRule;
import com.vidnyan.sigmaeval.application.port.out.RuleGenerator;
import com.vidnyan.sigmaeval.config.EvaluationProperties;
import com.vidnyan.sigmaeval.domain.evaluation.CorpusMetrics;
import com.vidnyan.sigmaeval.domain.evaluation.NoveltyStatus;
import com.vidnyan.sigmaeval.domain.evaluation.RuleReport;
import com.vidnyan.sigmaeval.domain.evaluation.SemanticComparisonResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class RuleEvaluationServiceTest {

    private static final String TAUTOLOGY_RULE =
            RuleFixtures.SCHTASKS_RULE.replace("condition: selection", "condition: selection or not selection");

    private final EvaluationProperties properties = new EvaluationProperties();
    private ExecutorService executor;
    private RuleEvaluationService service;

    @BeforeEach
    void setUp() {
        SigmaRuleParser parser = RuleFixtures.parser();
        CanonicalFingerprinter fingerprinter = new CanonicalFingerprinter(parser);
        SemanticScorer semanticScorer =
                new SemanticScorer(fingerprinter, null, null, RuleFixtures.objectMapper(), Duration.ofSeconds(1));
        executor = Executors.newFixedThreadPool(2);
        service = new RuleEvaluationService(
                RuleFixtures.structuralValidator(),
                parser,
                fingerprinter,
                semanticScorer,
                new HuntabilityScorer(parser),
                new NoveltyDetector(fingerprinter),
                new StabilityTester(fingerprinter, semanticScorer, Duration.ofSeconds(5), 3),
                properties,
                executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void evaluateRule_ShouldRunAllStagesForPassingRule() {
        RuleCorpus corpus = InMemoryRuleCorpus.of(
                new CorpusRule("r-2", "Run keys", RuleFixtures.UNRELATED_REGISTRY_RULE),
                new CorpusRule("r-1", "Schtasks", RuleFixtures.SCHTASKS_RULE));

        RuleReport report = service.evaluateRule(RuleFixtures.SCHTASKS_RULE, RuleFixtures.SCHTASKS_RULE, corpus);

        assertTrue(report.passed());
        assertEquals("T", report.ruleTitle());
        assertEquals(2, report.behavioralCore().selectorCount());
        assertEquals(1.0, report.semanticComparison().similarityScore());
        assertEquals(SemanticComparisonResult.Method.CORE_HASH, report.semanticComparison().method());
        assertTrue(report.huntability().score() > 5.0);
        assertEquals(NoveltyStatus.DUPLICATE, report.novelty().noveltyStatus());
        assertEquals("r-1", report.novelty().closestMatchId());
        assertNull(report.stability());
        assertNull(report.error());
    }

    @Test
    void evaluateRule_ShouldSkipOptionalStagesWithoutInputs() {
        RuleReport report = service.evaluateRule(RuleFixtures.ENCODED_POWERSHELL_RULE, null, null);

        assertTrue(report.passed(), () -> "errors: " + report.structural().errors());
        assertEquals("6f1c2e0a-0000-4000-8000-000000000001", report.ruleId());
        assertNotNull(report.huntability());
        assertNull(report.semanticComparison());
        assertNull(report.novelty());
    }

    @Test
    void evaluateRule_ShouldStopAfterStructuralFailure() {
        RuleReport report = service.evaluateRule(TAUTOLOGY_RULE, RuleFixtures.SCHTASKS_RULE,
                InMemoryRuleCorpus.of());

        assertFalse(report.passed());
        assertFalse(report.structural().conditionValid());
        assertEquals("T", report.ruleTitle());
        assertNull(report.behavioralCore());
        assertNull(report.semanticComparison());
        assertNull(report.huntability());
        assertNull(report.novelty());
        assertNull(report.error());
    }

    @Test
    void evaluateRule_ShouldReportUnparsableRuleAsStructuralFailure() {
        RuleReport report = service.evaluateRule("title: [unclosed", null, null);

        assertFalse(report.structural().baseGrammarPassed());
        assertFalse(report.structural().errors().isEmpty());
        assertNull(report.ruleTitle());
        assertNull(report.error());
    }

    @Test
    void evaluateDataset_ShouldAggregateMetrics() {
        List<DatasetItem> items = List.of(
                new DatasetItem("a", RuleFixtures.SCHTASKS_RULE, RuleFixtures.ENCODED_POWERSHELL_RULE, null),
                DatasetItem.ofRule("b", TAUTOLOGY_RULE),
                new DatasetItem("c", null, null, null));
        RuleCorpus corpus = InMemoryRuleCorpus.of(
                new CorpusRule("r-3", "Encoded", RuleFixtures.ENCODED_POWERSHELL_RULE));

        DatasetEvaluation evaluation = service.evaluateDataset(items, null, corpus);

        List<RuleReport> reports = evaluation.reports();
        assertEquals(List.of("a", "b", "c"), reports.stream().map(RuleReport::itemId).toList());
        assertEquals("No rule text and no generator input available", reports.get(2).error());
        assertEquals(SemanticComparisonResult.Method.NEUTRAL, reports.get(0).semanticComparison().method());

        CorpusMetrics metrics = evaluation.metrics();
        assertEquals(3, metrics.total());
        assertEquals(2, metrics.evaluated());
        assertEquals(1, metrics.errors());
        assertEquals(0.5, metrics.structuralPassRate(), 1e-9);
        assertEquals(8.25, metrics.meanHuntability(), 1e-9);
        assertEquals(0.5, metrics.meanSemanticSimilarity(), 1e-9);
        assertNull(metrics.meanStability());
        assertEquals(new CorpusMetrics.NoveltyDistribution(0, 0, 1), metrics.noveltyDistribution());
    }

    @Test
    void evaluateDataset_ShouldGenerateRulesAndTestStability() {
        RuleGenerator generator = inputId -> {
            if ("broken-input".equals(inputId)) {
                throw new IllegalStateException("generator down");
            }
            return RuleFixtures.SCHTASKS_RULE;
        };
        List<DatasetItem> items = List.of(
                new DatasetItem("g1", null, null, "article-1"),
                new DatasetItem("g2", null, null, "broken-input"),
                DatasetItem.ofRule("g3", RuleFixtures.SCHTASKS_RULE));

        DatasetEvaluation evaluation = service.evaluateDataset(items, generator, null);

        RuleReport generated = evaluation.reports().get(0);
        assertTrue(generated.passed());
        assertEquals(3, generated.stability().totalRuns());
        assertEquals(1.0, generated.stability().hashConsistency());
        assertTrue(generated.stability().stable());

        assertEquals("Rule generation failed: generator down", evaluation.reports().get(1).error());
        assertNull(evaluation.reports().get(2).stability());

        CorpusMetrics metrics = evaluation.metrics();
        assertEquals(1, metrics.errors());
        assertEquals(1.0, metrics.meanStability(), 1e-9);
        assertNull(metrics.noveltyDistribution());
    }

    @Test
    void evaluateDataset_ShouldSkipStabilityWhenDisabled() {
        properties.getEvaluation().setStabilityEnabled(false);

        DatasetEvaluation evaluation = service.evaluateDataset(
                List.of(new DatasetItem("g1", null, null, "article-1")),
                inputId -> RuleFixtures.SCHTASKS_RULE, null);

        assertTrue(evaluation.reports().get(0).passed());
        assertNull(evaluation.reports().get(0).stability());
    }

    @Test
    void evaluateDataset_ShouldKeepInputOrder() {
        List<DatasetItem> items = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String rule = i % 3 == 0 ? TAUTOLOGY_RULE : RuleFixtures.SCHTASKS_RULE;
            items.add(DatasetItem.ofRule("item-" + i, rule));
        }

        DatasetEvaluation evaluation = service.evaluateDataset(items, null, null);

        assertEquals(items.stream().map(DatasetItem::itemId).toList(),
                evaluation.reports().stream().map(RuleReport::itemId).toList());
        assertEquals(8.0 / 12.0, evaluation.metrics().structuralPassRate(), 1e-9);
    }

    @Test
    void computeMetrics_ShouldReturnNullMeansForEmptyDataset() {
        CorpusMetrics metrics = RuleEvaluationService.computeMetrics(List.of());

        assertEquals(0, metrics.total());
        assertEquals(0.0, metrics.structuralPassRate());
        assertNull(metrics.meanHuntability());
        assertNull(metrics.meanSemanticSimilarity());
        assertNull(metrics.noveltyDistribution());
    }
}
