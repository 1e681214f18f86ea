package com.aiPortfolio.secureGateway.gateway.exception;

import com.aiPortfolio.secureGateway.audit.model.AuditOutcome;
import org.springframework.http.HttpStatus;

/**
 * Base class for every way the gateway ends a call early.
 * Carries the request id so the error body can echo it.
 */
public abstract class GatewayException extends RuntimeException {

    private final String requestId;

    protected GatewayException(String requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    protected GatewayException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }

    public abstract HttpStatus getStatus();

    public abstract AuditOutcome getOutcome();

    /**
     * Whether the gateway itself refused the call.
     */
    public boolean isBlocked() {
        return false;
    }
}
