package com.bank.governance.exception;

/**
 * Invalid governance configuration, raised when thresholds or pattern definitions fail validation.
 */
public class GovernanceConfigurationException extends RuntimeException {

    public GovernanceConfigurationException(String message) {
        super(message);
    }

    public GovernanceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
