package com.vidnyan.sigmaeval.application.port.in;

import com.vidnyan.sigmaeval.application.port.out.RuleCorpus;
import com.vidnyan.sigmaeval.application.port.out.RuleGenerator;
import com.vidnyan.sigmaeval.domain.evaluation.CorpusMetrics;
import com.vidnyan.sigmaeval.domain.evaluation.RuleReport;

import java.util.List;

/**
 * Primary use case: evaluate generated detection rules.
 * This is the main entry point to the application.
 */
public interface EvaluateRuleUseCase {

    /**
     * Evaluate one rule.
     * @param ruleText rule to evaluate
     * @param referenceRule optional reference for semantic scoring
     * @param corpus optional corpus for novelty detection
     * @return report; never throws
     */
    RuleReport evaluateRule(String ruleText, String referenceRule, RuleCorpus corpus);

    /**
     * Evaluate a dataset of items.
     * @param items dataset items
     * @param generator optional generator for items without rule text and for stability runs
     * @param corpus optional corpus for novelty detection
     */
    DatasetEvaluation evaluateDataset(List<DatasetItem> items, RuleGenerator generator, RuleCorpus corpus);

    /**
     * One dataset entry. Either {@code ruleText} or {@code inputId} (with a generator) is needed.
     */
    record DatasetItem(
        String itemId,
        String ruleText,
        String referenceRule,
        String inputId
    ) {
        public static DatasetItem ofRule(String itemId, String ruleText) {
            return new DatasetItem(itemId, ruleText, null, null);
        }
    }

    /**
     * Reports in input order plus the aggregated metrics.
     */
    record DatasetEvaluation(
        List<RuleReport> reports,
        CorpusMetrics metrics
    ) {}
}
