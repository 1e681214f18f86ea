package com.aiPortfolio.secureGateway.audit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal outcome of a gateway call.
 */
public enum AuditOutcome {

    COMPLETED("completed"),
    INVALID_REQUEST("invalid_request"),
    RATE_LIMITED("rate_limited"),
    BLOCKED("blocked"),
    UPSTREAM_ERROR("upstream_error"),
    INTERNAL_ERROR("internal_error");

    private final String code;

    AuditOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
