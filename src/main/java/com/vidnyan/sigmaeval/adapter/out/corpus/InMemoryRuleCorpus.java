package com.vidnyan.sigmaeval.adapter.out.corpus;

import com.vidnyan.sigmaeval.application.port.out.RuleCorpus;

import java.util.List;

/**
 * Fixed corpus held in memory.
 */
public class InMemoryRuleCorpus implements RuleCorpus {

    private final List<CorpusRule> rules;

    public InMemoryRuleCorpus(List<CorpusRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static InMemoryRuleCorpus of(CorpusRule... rules) {
        return new InMemoryRuleCorpus(List.of(rules));
    }

    @Override
    public List<CorpusRule> findAll() {
        return rules;
    }
}
