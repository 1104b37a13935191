package com.vidnyan.sigmaeval.adapter.out.evaluator;

import com.vidnyan.sigmaeval.application.port.out.RuleCorpus;
import com.vidnyan.sigmaeval.domain.evaluation.BehavioralCore;
import com.vidnyan.sigmaeval.domain.evaluation.CoreComparison;
import com.vidnyan.sigmaeval.domain.evaluation.NoveltyResult;
import com.vidnyan.sigmaeval.domain.evaluation.NoveltyStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies a rule as duplicate, variant or novel against a corpus of existing rules.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NoveltyDetector {

    public static final double DUPLICATE_THRESHOLD = 0.95;
    public static final double VARIANT_THRESHOLD = 0.70;

    private final CanonicalFingerprinter fingerprinter;

    public NoveltyResult detectNovelty(String ruleText, RuleCorpus corpus) {
        return detectNovelty(fingerprinter.extractBehavioralCore(ruleText), corpus);
    }

    public NoveltyResult detectNovelty(BehavioralCore candidate, RuleCorpus corpus) {
        if (corpus == null) {
            return NoveltyResult.withoutCorpus();
        }

        List<RuleCorpus.CorpusRule> rules;
        try {
            rules = corpus.findAll();
        } catch (RuntimeException e) {
            log.warn("Rule corpus unavailable, assuming novel: {}", e.getMessage());
            return NoveltyResult.withoutCorpus();
        }

        int compared = 0;
        int skipped = 0;
        RuleCorpus.CorpusRule best = null;
        double bestSimilarity = -1;

        for (RuleCorpus.CorpusRule existing : rules) {
            BehavioralCore core = fingerprinter.extractBehavioralCore(existing.ruleText());
            if (core.selectorCount() == 0) {
                skipped++;
                continue;
            }
            compared++;

            CoreComparison comparison = fingerprinter.compareCores(candidate, core);
            if (comparison.hashMatch()) {
                log.debug("Exact core match with corpus rule {}", existing.id());
                return NoveltyResult.of(NoveltyStatus.DUPLICATE, existing.id(), existing.title(), 1.0,
                        compared, skipped);
            }
            if (comparison.similarity() > bestSimilarity) {
                bestSimilarity = comparison.similarity();
                best = existing;
            }
        }

        if (best == null) {
            return NoveltyResult.of(NoveltyStatus.NOVEL, null, null, null, compared, skipped);
        }
        NoveltyStatus status = classify(bestSimilarity);
        log.debug("Closest corpus rule {} at {} -> {}", best.id(), bestSimilarity, status.label());
        return NoveltyResult.of(status, best.id(), best.title(), bestSimilarity, compared, skipped);
    }

    static NoveltyStatus classify(double similarity) {
        if (similarity >= DUPLICATE_THRESHOLD) {
            return NoveltyStatus.DUPLICATE;
        }
        return similarity >= VARIANT_THRESHOLD ? NoveltyStatus.VARIANT : NoveltyStatus.NOVEL;
    }
}
