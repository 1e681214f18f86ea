package com.aiPortfolio.secureGateway.gateway.exception;

import com.aiPortfolio.secureGateway.audit.model.AuditOutcome;
import com.aiPortfolio.secureGateway.guard.model.SecurityVerdict;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when prompt injection is detected. The request is never forwarded.
 */
public class SecurityBlockedException extends GatewayException {

    private final SecurityVerdict verdict;

    public SecurityBlockedException(String requestId, SecurityVerdict verdict) {
        super(requestId, verdict.getBlockedReason() != null ? verdict.getBlockedReason() : "Request blocked");
        this.verdict = verdict;
    }

    public SecurityVerdict getVerdict() {
        return verdict;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }

    @Override
    public AuditOutcome getOutcome() {
        return AuditOutcome.BLOCKED;
    }

    @Override
    public boolean isBlocked() {
        return true;
    }
}
