package com.vidnyan.sigmaeval.adapter.out.evaluator.semantic;

import com.vidnyan.sigmaeval.domain.evaluation.SemanticComparisonResult;

/**
 * One way of scoring semantic equivalence between two rule texts.
 */
interface SemanticStrategy {

    String name();

    /**
     * @throws com.vidnyan.sigmaeval.application.port.out.CapabilityException when the backing capability fails
     */
    SemanticComparisonResult compare(String generatedRule, String referenceRule);
}
