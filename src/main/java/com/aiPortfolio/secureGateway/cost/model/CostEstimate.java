package com.aiPortfolio.secureGateway.cost.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token usage and estimated spend for one proxied call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CostEstimate {

    private int inputTokens;
    private int outputTokens;
    private int totalTokens;

    /**
     * Linear in the token counts, rounded to 6 decimal places.
     */
    private double estimatedCostUsd;
}
