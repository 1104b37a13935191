package com.vidnyan.sigmaeval.application.port.out;

import java.util.List;

/**
 * Port for reading an existing rule corpus.
 * Implemented by adapters that read from files, databases, etc.
 */
public interface RuleCorpus {

    /**
     * Load all rules of the corpus.
     */
    List<CorpusRule> findAll();

    /**
     * Existing rule with its raw text.
     */
    record CorpusRule(String id, String title, String ruleText) {}
}
