package com.aiPortfolio.secureGateway.gateway.exception;

import com.aiPortfolio.secureGateway.audit.model.AuditOutcome;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the caller has exhausted its token bucket.
 */
public class RateLimitExceededException extends GatewayException {

    private final long remaining;

    public RateLimitExceededException(String requestId, long remaining) {
        super(requestId, "Rate limit exceeded");
        this.remaining = remaining;
    }

    public long getRemaining() {
        return remaining;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.TOO_MANY_REQUESTS;
    }

    @Override
    public AuditOutcome getOutcome() {
        return AuditOutcome.RATE_LIMITED;
    }

    @Override
    public boolean isBlocked() {
        return true;
    }
}
