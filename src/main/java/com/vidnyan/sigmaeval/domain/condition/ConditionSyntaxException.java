package com.vidnyan.sigmaeval.domain.condition;

/**
 * Condition string does not follow the SIGMA condition grammar.
 */
public class ConditionSyntaxException extends RuntimeException {

    public ConditionSyntaxException(String message) {
        super(message);
    }
}
