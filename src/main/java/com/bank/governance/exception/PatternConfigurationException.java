package com.bank.governance.exception;

/**
 * A detection pattern set could not be loaded. The previously published snapshot stays active.
 */
public class PatternConfigurationException extends GovernanceConfigurationException {

    public PatternConfigurationException(String message) {
        super(message);
    }

    public PatternConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
