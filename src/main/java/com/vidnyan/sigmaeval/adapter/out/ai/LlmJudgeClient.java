package com.vidnyan.sigmaeval.adapter.out.ai;

import com.vidnyan.sigmaeval.application.port.out.LlmJudge;
import lombok.RequiredArgsConstructor;

/**
 * {@link LlmJudge} backed by a chat model.
 */
@RequiredArgsConstructor
public class LlmJudgeClient implements LlmJudge {

    private static final String SYSTEM_PROMPT =
            "You are an expert SIGMA rule evaluator. Analyze and compare SIGMA detection rules.";

    private final LlmClient llmClient;
    private final String model;

    @Override
    public String judge(String prompt) {
        return llmClient.chat(model, SYSTEM_PROMPT, prompt);
    }
}
