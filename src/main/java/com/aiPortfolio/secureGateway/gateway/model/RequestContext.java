package com.aiPortfolio.secureGateway.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Request context passed through the pipeline.
 * Contains the resolved client identity and the request id used for tracking.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * Request ID for tracking and audit, returned to the caller in every response.
     */
    private String requestId;

    /**
     * Client identity used as the rate limit key (trusted forwarding header or peer address).
     */
    private String clientIdentity;

    private GatewayRoute route;

    /**
     * Values for the placeholders of the route's upstream path.
     */
    private Map<String, String> pathVariables;

    /**
     * Timestamp when request was received at the gateway.
     */
    private Instant receivedAt;

    /**
     * Monotonic start time used for latency measurement.
     */
    private long startNanos;

    /**
     * Generates a request id, echoed in responses, audit records and the upstream call.
     */
    public static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    public double elapsedMillis() {
        return Math.round((System.nanoTime() - startNanos) / 10_000.0) / 100.0;
    }
}
