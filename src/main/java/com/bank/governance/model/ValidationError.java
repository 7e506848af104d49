package com.bank.governance.model;

/**
 * A rejected caller input: which field and why.
 */
public record ValidationError(String field, String message) {}
