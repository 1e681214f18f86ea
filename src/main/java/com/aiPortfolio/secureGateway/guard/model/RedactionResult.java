package com.aiPortfolio.secureGateway.guard.model;

import java.util.Set;

/**
 * Redacted text together with the PII categories that were replaced.
 */
public record RedactionResult(String text, Set<PiiCategory> categories) {

    public boolean isRedacted() {
        return !categories.isEmpty();
    }
}
