package com.vidnyan.sigmaeval.application.port.out;

/**
 * An external capability (LLM judge, embeddings, rule generator) failed or timed out.
 */
public class CapabilityException extends RuntimeException {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
