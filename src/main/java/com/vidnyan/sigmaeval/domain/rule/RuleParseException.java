package com.vidnyan.sigmaeval.domain.rule;

/**
 * Rule text could not be read as a YAML rule document.
 */
public class RuleParseException extends Exception {

    public RuleParseException(String message) {
        super(message);
    }

    public RuleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
