package com.vidnyan.sigmaeval.application.port.out;

/**
 * Port for text embeddings.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * @throws CapabilityException when the call fails
     */
    float[] embed(String text);
}
