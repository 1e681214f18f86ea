package com.aiPortfolio.secureGateway.gateway.dto;

import com.aiPortfolio.secureGateway.cost.model.CostEstimate;
import com.aiPortfolio.secureGateway.guard.model.SecurityVerdict;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The {@code gateway} block attached to every successful upstream response.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayMetadata {

    private String requestId;
    private Instant timestamp;
    private double latencyMs;
    private SecurityVerdict security;

    /**
     * Only present for routes that incur model spend.
     */
    private CostEstimate cost;

    private long rateLimitRemaining;
}
