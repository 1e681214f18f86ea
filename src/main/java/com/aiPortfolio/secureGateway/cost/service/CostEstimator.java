package com.aiPortfolio.secureGateway.cost.service;

import com.aiPortfolio.secureGateway.cost.model.CostEstimate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Estimates token usage and spend for a request/response pair.
 *
 * cost = inputTokens / 1000 * costPer1kInput + outputTokens / 1000 * costPer1kOutput,
 * rounded half-up to {@value #COST_SCALE} decimal places.
 */
@Slf4j
@Service
public class CostEstimator {

    static final int COST_SCALE = 6;

    private final TokenCounter tokenCounter;
    private final double costPer1kInput;
    private final double costPer1kOutput;

    public CostEstimator(TokenCounter tokenCounter,
                         @Value("${gateway.cost.per-1k-input-tokens:0.0015}") double costPer1kInput,
                         @Value("${gateway.cost.per-1k-output-tokens:0.002}") double costPer1kOutput) {
        if (costPer1kInput < 0 || costPer1kOutput < 0) {
            throw new IllegalArgumentException("Cost rates must be >= 0");
        }
        this.tokenCounter = tokenCounter;
        this.costPer1kInput = costPer1kInput;
        this.costPer1kOutput = costPer1kOutput;
    }

    /**
     * @param inputText prompt text sent upstream
     * @param outputText text produced by the upstream model
     * @return token counts and the rounded cost
     */
    public CostEstimate estimate(String inputText, String outputText) {
        int inputTokens = tokenCounter.count(inputText);
        int outputTokens = tokenCounter.count(outputText);

        double cost = (inputTokens / 1000.0) * costPer1kInput + (outputTokens / 1000.0) * costPer1kOutput;

        CostEstimate estimate = CostEstimate.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .estimatedCostUsd(BigDecimal.valueOf(cost).setScale(COST_SCALE, RoundingMode.HALF_UP).doubleValue())
                .build();

        log.debug("Cost estimated - inputTokens: {}, outputTokens: {}, costUsd: {}",
                inputTokens, outputTokens, estimate.getEstimatedCostUsd());
        return estimate;
    }
}
