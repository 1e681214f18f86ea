package com.aiPortfolio.secureGateway.cost.service;

/**
 * Approximate token counts for when no tokenizer can be loaded: about 4 characters per token.
 */
public class CharacterTokenCounter implements TokenCounter {

    public static final int CHARS_PER_TOKEN = 4;

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.length() / CHARS_PER_TOKEN;
    }
}
