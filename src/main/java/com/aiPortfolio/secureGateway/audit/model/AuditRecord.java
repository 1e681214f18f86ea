package com.aiPortfolio.secureGateway.audit.model;

import com.aiPortfolio.secureGateway.guard.model.SecurityStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One structured record per gateway call, whatever the outcome.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditRecord {

    private String requestId;
    private Instant timestamp;

    /**
     * Unmasked caller identity (forwarded address or peer address).
     */
    private String clientIdentity;

    private String method;

    /**
     * Gateway route template, e.g. "/incident/cases/{caseId}".
     */
    private String route;

    private int statusCode;
    private double latencyMs;
    private AuditOutcome outcome;

    /**
     * Null when the call ended before the security checks ran.
     */
    private SecurityStatus securityStatus;

    private Long rateLimitRemaining;
    private Double costUsd;
    private String blockedReason;

    /**
     * Route-specific fields picked from the upstream response (suite name, pass rate, ...).
     */
    private Map<String, Object> details;
}
