package com.vidnyan.sigmaeval.adapter.out.evaluator;

import com.vidnyan.sigmaeval.RuleFixtures;
import com.vidnyan.sigmaeval.adapter.out.corpus.InMemoryRuleCorpus;
import com.vidnyan.sigmaeval.application.port.out.RuleCorpus;
import com.vidnyan.sigmaeval.application.port.out.RuleCorpus.CorpusRule;
import com.vidnyan.sigmaeval.domain.evaluation.NoveltyResult;
import com.vidnyan.sigmaeval.domain.evaluation.NoveltyStatus;
import org.junit.jupiter.api.Test;

import static com.vidnyan.sigmaeval.RuleFixtures.processCreationRule;
import static org.junit.jupiter.api.Assertions.*;

class NoveltyDetectorTest {

    private static final String FOUR_SELECTOR_RULE = processCreationRule("Certutil download",
            "Image|endswith: '\\certutil.exe'",
            "CommandLine|contains|all:",
            "  - 'urlcache'",
            "  - '-split'",
            "  - '-f'");

    private final NoveltyDetector detector = new NoveltyDetector(RuleFixtures.fingerprinter());

    @Test
    void detectNovelty_ShouldReportDuplicateOfIdenticalRule() {
        RuleCorpus corpus = InMemoryRuleCorpus.of(
                new CorpusRule("r-2", "Registry", RuleFixtures.UNRELATED_REGISTRY_RULE),
                new CorpusRule("r-1", "Schtasks", RuleFixtures.SCHTASKS_RULE));

        NoveltyResult result = detector.detectNovelty(RuleFixtures.SCHTASKS_RULE, corpus);

        assertEquals(NoveltyStatus.DUPLICATE, result.noveltyStatus());
        assertEquals(0, result.noveltyScore());
        assertEquals(1.0, result.closestMatchSimilarity());
        assertEquals("r-1", result.closestMatchId());
        assertEquals("Schtasks", result.closestMatchTitle());
    }

    @Test
    void detectNovelty_ShouldReportVariantForOneAddedSelector() {
        String extended = FOUR_SELECTOR_RULE.replace("  condition: selection",
                "  extra:\n    ParentImage|endswith: '\\explorer.exe'\n  condition: selection and extra");
        RuleCorpus corpus = InMemoryRuleCorpus.of(new CorpusRule("c-1", "Certutil", FOUR_SELECTOR_RULE));

        NoveltyResult result = detector.detectNovelty(extended, corpus);

        assertEquals(NoveltyStatus.VARIANT, result.noveltyStatus());
        assertEquals(0.8, result.closestMatchSimilarity(), 1e-9);
        assertEquals("c-1", result.closestMatchId());
    }

    @Test
    void detectNovelty_ShouldReportNovelForUnrelatedRule() {
        RuleCorpus corpus = InMemoryRuleCorpus.of(new CorpusRule("r-2", "Registry", RuleFixtures.UNRELATED_REGISTRY_RULE));

        NoveltyResult result = detector.detectNovelty(RuleFixtures.SCHTASKS_RULE, corpus);

        assertEquals(NoveltyStatus.NOVEL, result.noveltyStatus());
        assertEquals(2, result.noveltyScore());
        assertEquals(0.0, result.closestMatchSimilarity(), 1e-9);
        assertEquals(1, result.rulesCompared());
    }

    @Test
    void detectNovelty_ShouldAssumeNovelWithoutCorpus() {
        NoveltyResult result = detector.detectNovelty(RuleFixtures.SCHTASKS_RULE, (RuleCorpus) null);

        assertEquals(NoveltyStatus.NOVEL, result.noveltyStatus());
        assertNull(result.closestMatchId());
        assertNull(result.closestMatchTitle());
        assertNull(result.closestMatchSimilarity());
    }

    @Test
    void detectNovelty_ShouldReportNovelForEmptyCorpus() {
        NoveltyResult result = detector.detectNovelty(RuleFixtures.SCHTASKS_RULE, InMemoryRuleCorpus.of());

        assertEquals(NoveltyStatus.NOVEL, result.noveltyStatus());
        assertEquals(0, result.rulesCompared());
        assertNull(result.closestMatchId());
    }

    @Test
    void detectNovelty_ShouldSkipUnparsableCorpusRules() {
        RuleCorpus corpus = InMemoryRuleCorpus.of(
                new CorpusRule("broken", "broken.yml", "title: [unclosed"),
                new CorpusRule("r-2", "Registry", RuleFixtures.UNRELATED_REGISTRY_RULE));

        NoveltyResult result = detector.detectNovelty(RuleFixtures.SCHTASKS_RULE, corpus);

        assertEquals(1, result.rulesSkipped());
        assertEquals(1, result.rulesCompared());
    }

    @Test
    void detectNovelty_ShouldAssumeNovelWhenCorpusFails() {
        RuleCorpus failing = () -> {
            throw new IllegalStateException("corpus offline");
        };

        NoveltyResult result = detector.detectNovelty(RuleFixtures.SCHTASKS_RULE, failing);

        assertEquals(NoveltyStatus.NOVEL, result.noveltyStatus());
    }

    @Test
    void classify_ShouldApplyThresholds() {
        assertEquals(NoveltyStatus.DUPLICATE, NoveltyDetector.classify(0.95));
        assertEquals(NoveltyStatus.VARIANT, NoveltyDetector.classify(0.9499));
        assertEquals(NoveltyStatus.VARIANT, NoveltyDetector.classify(0.70));
        assertEquals(NoveltyStatus.NOVEL, NoveltyDetector.classify(0.6999));
    }
}
