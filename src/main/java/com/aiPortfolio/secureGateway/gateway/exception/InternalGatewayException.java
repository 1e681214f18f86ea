package com.aiPortfolio.secureGateway.gateway.exception;

import com.aiPortfolio.secureGateway.audit.model.AuditOutcome;
import org.springframework.http.HttpStatus;

/**
 * Wraps an unexpected failure inside the pipeline. The message returned to callers is generic;
 * the cause is only logged.
 */
public class InternalGatewayException extends GatewayException {

    public InternalGatewayException(String requestId, Throwable cause) {
        super(requestId, "Internal gateway error", cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @Override
    public AuditOutcome getOutcome() {
        return AuditOutcome.INTERNAL_ERROR;
    }
}
