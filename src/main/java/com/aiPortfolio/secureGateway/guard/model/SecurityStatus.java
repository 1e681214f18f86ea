package com.aiPortfolio.secureGateway.guard.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Security verdict status, declared from least to most severe.
 */
public enum SecurityStatus {

    PASSED("passed"),
    WARNING("warning"),
    BLOCKED("blocked");

    private final String code;

    SecurityStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public SecurityStatus mostSevere(SecurityStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
