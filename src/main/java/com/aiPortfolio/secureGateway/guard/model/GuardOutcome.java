package com.aiPortfolio.secureGateway.guard.model;

/**
 * Text to forward (always PII-redacted) and the verdict reached for it.
 */
public record GuardOutcome(String processedText, SecurityVerdict verdict) {
}
