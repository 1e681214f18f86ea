package com.aiPortfolio.secureGateway.gateway.dto;

import com.aiPortfolio.secureGateway.guard.model.SecurityVerdict;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned when the gateway ends a call itself.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayErrorResponse {

    private String error;
    private String requestId;

    /**
     * True when the gateway refused the call (rate limit or security block).
     */
    private boolean blocked;

    private SecurityVerdict security;
    private Long rateLimitRemaining;
}
