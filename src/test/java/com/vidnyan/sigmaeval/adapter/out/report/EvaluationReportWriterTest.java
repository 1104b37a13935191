package com.vidnyan.sigmaeval.adapter.out.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sigmaeval.RuleFixtures;
import com.vidnyan.sigmaeval.adapter.out.corpus.InMemoryRuleCorpus;
import com.vidnyan.sigmaeval.adapter.out.evaluator.CanonicalFingerprinter;
import com.vidnyan.sigmaeval.adapter.out.evaluator.HuntabilityScorer;
import com.vidnyan.sigmaeval.adapter.out.evaluator.NoveltyDetector;
import com.vidnyan.sigmaeval.application.port.in.EvaluateRuleUseCase.DatasetEvaluation;
import com.vidnyan.sigmaeval.application.port.out.RuleCorpus.CorpusRule;
import com.vidnyan.sigmaeval.domain.evaluation.BehavioralCore;
import com.vidnyan.sigmaeval.domain.evaluation.CorpusMetrics;
import com.vidnyan.sigmaeval.domain.evaluation.RuleReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationReportWriterTest {

    private final ObjectMapper objectMapper = RuleFixtures.objectMapper();
    private final EvaluationReportWriter writer = new EvaluationReportWriter(objectMapper);

    private RuleReport passingReport() {
        CanonicalFingerprinter fingerprinter = RuleFixtures.fingerprinter();
        BehavioralCore core = fingerprinter.extractBehavioralCore(RuleFixtures.SCHTASKS_RULE);
        return new RuleReport("item-1", null, "T",
                RuleFixtures.structuralValidator().validate(RuleFixtures.SCHTASKS_RULE),
                core,
                null,
                new HuntabilityScorer(RuleFixtures.parser()).scoreRule(RuleFixtures.SCHTASKS_RULE),
                null,
                new NoveltyDetector(fingerprinter).detectNovelty(core,
                        InMemoryRuleCorpus.of(new CorpusRule("c-1", "Schtasks", RuleFixtures.SCHTASKS_RULE))),
                null);
    }

    @Test
    void toJson_ShouldUseSnakeCaseAndLowercaseLabels() throws IOException {
        JsonNode json = objectMapper.readTree(writer.toJson(passingReport()));

        assertEquals("item-1", json.get("item_id").asText());
        assertTrue(json.get("structural").get("final_pass").asBoolean());
        assertTrue(json.get("behavioral_core").get("core_hash").asText().startsWith("sha256:"));
        assertEquals("low", json.get("huntability").get("false_positive_risk").asText());
        assertEquals("duplicate", json.get("novelty").get("novelty_status").asText());
        assertEquals("c-1", json.get("novelty").get("closest_match_id").asText());
        assertTrue(json.get("semantic_comparison").isNull());
    }

    @Test
    void write_ShouldCreateParentDirectories(@TempDir Path tempDir) throws IOException {
        CorpusMetrics metrics = new CorpusMetrics(1, 1, 0, 1.0, 8.25, null, null,
                new CorpusMetrics.NoveltyDistribution(1, 0, 0));
        Path target = tempDir.resolve("out/nested/report.json");

        writer.write(new DatasetEvaluation(List.of(passingReport()), metrics), target);

        JsonNode json = objectMapper.readTree(target.toFile());
        assertEquals(1, json.get("reports").size());
        assertEquals(1.0, json.get("metrics").get("structural_pass_rate").asDouble());
        assertEquals(1, json.get("metrics").get("novelty_distribution").get("duplicates").asInt());
        assertTrue(json.get("metrics").get("mean_semantic_similarity").isNull());
    }
}
