package com.aiPortfolio.secureGateway.gateway.model;

/**
 * How a route's model spend is estimated.
 *
 * @param enabled whether the route incurs model spend at all
 * @param outputField upstream response field holding the generated text; null means the
 *                    whole response body counts as output
 */
public record CostEstimation(boolean enabled, String outputField) {

    private static final CostEstimation NONE = new CostEstimation(false, null);
    private static final CostEstimation WHOLE_RESPONSE = new CostEstimation(true, null);

    public static CostEstimation none() {
        return NONE;
    }

    public static CostEstimation fromField(String outputField) {
        return new CostEstimation(true, outputField);
    }

    public static CostEstimation fromWholeResponse() {
        return WHOLE_RESPONSE;
    }

    public boolean usesWholeResponse() {
        return enabled && outputField == null;
    }
}
