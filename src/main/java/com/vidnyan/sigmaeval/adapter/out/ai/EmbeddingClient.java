package com.vidnyan.sigmaeval.adapter.out.ai;

import com.vidnyan.sigmaeval.application.port.out.EmbeddingProvider;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class EmbeddingClient implements EmbeddingProvider {

    private final LlmClient llmClient;
    private final String model;

    @Override
    public float[] embed(String text) {
        return llmClient.embed(model, text);
    }
}
