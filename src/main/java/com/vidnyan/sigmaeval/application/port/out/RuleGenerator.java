package com.vidnyan.sigmaeval.application.port.out;

/**
 * Callback producing a rule for a given input (e.g. a threat-intel article).
 * Generation is typically slow and may fail.
 */
@FunctionalInterface
public interface RuleGenerator {

    String generate(String inputId) throws Exception;
}
