package com.vidnyan.sigmaeval.adapter.out.corpus;

import com.vidnyan.sigmaeval.RuleFixtures;
import com.vidnyan.sigmaeval.application.port.out.RuleCorpus.CorpusRule;
import com.vidnyan.sigmaeval.config.EvaluationProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemRuleCorpusTest {

    @TempDir
    Path tempDir;

    private FileSystemRuleCorpus corpusFor(String path) {
        EvaluationProperties properties = new EvaluationProperties();
        properties.getCorpus().setPath(path);
        FileSystemRuleCorpus corpus = new FileSystemRuleCorpus(RuleFixtures.parser(), properties);
        corpus.loadRules();
        return corpus;
    }

    @Test
    void loadRules_ShouldReadYamlFilesAndFallBackToFileName() throws IOException {
        Files.writeString(tempDir.resolve("encoded.yml"), RuleFixtures.ENCODED_POWERSHELL_RULE);
        Files.writeString(tempDir.resolve("schtasks.yaml"), RuleFixtures.SCHTASKS_RULE);
        Files.writeString(tempDir.resolve("broken.yml"), "title: [unclosed");
        Files.writeString(tempDir.resolve("notes.txt"), RuleFixtures.SCHTASKS_RULE);

        String base = tempDir.toUri().toString();
        FileSystemRuleCorpus corpus = corpusFor(base + "*.yml, " + base + "*.yaml");

        List<CorpusRule> rules = corpus.findAll();
        assertEquals(3, rules.size());
        assertEquals(3, corpus.size());

        Map<String, CorpusRule> byId = rules.stream()
                .collect(Collectors.toMap(CorpusRule::id, Function.identity()));
        assertEquals("Encoded PowerShell Command Line", byId.get("6f1c2e0a-0000-4000-8000-000000000001").title());
        assertEquals("T", byId.get("schtasks").title());
        assertEquals("broken.yml", byId.get("broken").title());
        assertEquals("title: [unclosed", byId.get("broken").ruleText());
    }

    @Test
    void loadRules_ShouldLoadNothingFromMissingDirectory() {
        FileSystemRuleCorpus corpus = corpusFor(tempDir.resolve("missing").toUri() + "/*.yml");

        assertTrue(corpus.findAll().isEmpty());
    }

    @Test
    void loadRules_ShouldReadClasspathCorpus() {
        FileSystemRuleCorpus corpus = corpusFor("classpath*:corpus/*.yml,classpath*:corpus/*.yaml");

        assertEquals(2, corpus.size());
    }

    @Test
    void patterns_ShouldSplitOnCommas() {
        assertEquals(List.of("a/*.yml", "b/*.yaml"), FileSystemRuleCorpus.patterns(" a/*.yml ,, b/*.yaml"));
    }
}
