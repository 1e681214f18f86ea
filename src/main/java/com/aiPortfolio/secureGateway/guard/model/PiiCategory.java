package com.aiPortfolio.secureGateway.guard.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of personally identifiable information the gateway scrubs.
 */
public enum PiiCategory {

    EMAIL("email", "[EMAIL REDACTED]"),
    PHONE("phone", "[PHONE REDACTED]"),
    SSN("ssn", "[SSN REDACTED]"),
    CREDIT_CARD("credit_card", "[CARD REDACTED]");

    private final String code;
    private final String placeholder;

    PiiCategory(String code, String placeholder) {
        this.code = code;
        this.placeholder = placeholder;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Fixed token substituted for every match of this category.
     */
    public String getPlaceholder() {
        return placeholder;
    }
}
