package com.bank.governance.client;

/**
 * The semantic classifier could not produce a verdict (timeout, transport error, bad response).
 */
public class SemanticClassifierException extends RuntimeException {

    public SemanticClassifierException(String message) {
        super(message);
    }

    public SemanticClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
