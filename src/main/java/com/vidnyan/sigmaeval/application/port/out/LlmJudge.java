package com.vidnyan.sigmaeval.application.port.out;

/**
 * Port for an LLM used as a judge.
 * Implemented by LLM adapters.
 */
@FunctionalInterface
public interface LlmJudge {

    /**
     * Send a prompt and return the raw response text.
     * @throws CapabilityException when the call fails
     */
    String judge(String prompt);
}
