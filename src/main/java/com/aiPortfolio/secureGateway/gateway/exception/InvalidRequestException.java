package com.aiPortfolio.secureGateway.gateway.exception;

import com.aiPortfolio.secureGateway.audit.model.AuditOutcome;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the request body is not valid JSON, misses a required field or holds
 * a non-text value where the guard expects text.
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String requestId, String message) {
        super(requestId, message);
    }

    public InvalidRequestException(String requestId, String message, Throwable cause) {
        super(requestId, message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public AuditOutcome getOutcome() {
        return AuditOutcome.INVALID_REQUEST;
    }
}
