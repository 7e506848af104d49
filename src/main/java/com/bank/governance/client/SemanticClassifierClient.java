package com.bank.governance.client;

public interface SemanticClassifierClient {

    /**
     * @throws SemanticClassifierException if no verdict could be obtained within the configured timeout
     */
    SemanticVerdict classify(String text);
}
