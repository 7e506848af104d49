package com.bank.governance.exception;

import com.bank.governance.model.ValidationError;

public class GovernanceValidationException extends RuntimeException {

    private final ValidationError error;

    public GovernanceValidationException(ValidationError error) {
        super(error.field() + ": " + error.message());
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }
}
