package com.aiPortfolio.secureGateway.gateway.controller;

import com.aiPortfolio.secureGateway.gateway.dto.GatewayErrorResponse;
import com.aiPortfolio.secureGateway.gateway.exception.GatewayException;
import com.aiPortfolio.secureGateway.gateway.exception.InternalGatewayException;
import com.aiPortfolio.secureGateway.gateway.exception.RateLimitExceededException;
import com.aiPortfolio.secureGateway.gateway.exception.SecurityBlockedException;
import com.aiPortfolio.secureGateway.gateway.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for the Gateway.
 * Turns every {@link GatewayException} into the error body callers see.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<GatewayErrorResponse> handleRateLimitExceeded(RateLimitExceededException ex) {
        return ResponseEntity.status(ex.getStatus())
                .body(baseResponse(ex)
                        .rateLimitRemaining(ex.getRemaining())
                        .build());
    }

    @ExceptionHandler(SecurityBlockedException.class)
    public ResponseEntity<GatewayErrorResponse> handleSecurityBlocked(SecurityBlockedException ex) {
        return ResponseEntity.status(ex.getStatus())
                .body(baseResponse(ex)
                        .security(ex.getVerdict())
                        .build());
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<GatewayErrorResponse> handleUpstreamUnavailable(UpstreamUnavailableException ex) {
        log.warn("Upstream unavailable - requestId: {}, error: {}", ex.getRequestId(), ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(baseResponse(ex).build());
    }

    @ExceptionHandler(InternalGatewayException.class)
    public ResponseEntity<GatewayErrorResponse> handleInternal(InternalGatewayException ex) {
        return ResponseEntity.status(ex.getStatus()).body(baseResponse(ex).build());
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<GatewayErrorResponse> handleGatewayException(GatewayException ex) {
        log.warn("Gateway request rejected - requestId: {}, status: {}, error: {}",
                ex.getRequestId(), ex.getStatus().value(), ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(baseResponse(ex).build());
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<GatewayErrorResponse> handleUnknownRoute(Exception ex) {
        HttpStatus status = ex instanceof NoResourceFoundException ? HttpStatus.NOT_FOUND : HttpStatus.METHOD_NOT_ALLOWED;
        log.debug("Unroutable request: {}", ex.getMessage());
        return ResponseEntity.status(status)
                .body(GatewayErrorResponse.builder()
                        .error(status.getReasonPhrase())
                        .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<GatewayErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(GatewayErrorResponse.builder()
                        .error("Internal gateway error")
                        .build());
    }

    private static GatewayErrorResponse.GatewayErrorResponseBuilder baseResponse(GatewayException ex) {
        return GatewayErrorResponse.builder()
                .error(ex.getMessage())
                .requestId(ex.getRequestId())
                .blocked(ex.isBlocked());
    }
}
