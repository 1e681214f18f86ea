package com.aiPortfolio.secureGateway.cost.service;

/**
 * Counts model tokens in a piece of text.
 */
public interface TokenCounter {

    /**
     * @param text text to count, null or empty counts as zero
     * @return number of tokens, never negative
     */
    int count(String text);
}
