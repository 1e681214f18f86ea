package com.aiPortfolio.secureGateway.gateway.exception;

import com.aiPortfolio.secureGateway.audit.model.AuditOutcome;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a downstream service fails: transport error, timeout or non-2xx status.
 * Not retried by the gateway.
 */
public class UpstreamUnavailableException extends GatewayException {

    public UpstreamUnavailableException(String requestId, String message) {
        super(requestId, message);
    }

    public UpstreamUnavailableException(String requestId, String message, Throwable cause) {
        super(requestId, message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }

    @Override
    public AuditOutcome getOutcome() {
        return AuditOutcome.UPSTREAM_ERROR;
    }
}
