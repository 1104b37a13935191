package com.vidnyan.sigmaeval.domain.evaluation;

import java.util.List;

/**
 * Canonical fingerprint of what a rule matches.
 * Selectors are deduplicated in first-seen order; the hash is computed over their sorted set.
 */
public record BehavioralCore(
    List<String> behaviorSelectors,
    List<String> commandlines,
    List<String> processChains,
    String coreHash,
    int selectorCount
) {

    public BehavioralCore {
        behaviorSelectors = List.copyOf(behaviorSelectors);
        commandlines = List.copyOf(commandlines);
        processChains = List.copyOf(processChains);
    }

    public static BehavioralCore empty() {
        return new BehavioralCore(List.of(), List.of(), List.of(), "", 0);
    }
}
