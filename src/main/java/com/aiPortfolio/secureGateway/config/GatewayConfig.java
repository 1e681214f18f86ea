package com.aiPortfolio.secureGateway.config;

import com.aiPortfolio.secureGateway.cost.service.CharacterTokenCounter;
import com.aiPortfolio.secureGateway.cost.service.JtokkitTokenCounter;
import com.aiPortfolio.secureGateway.cost.service.TokenCounter;
import com.aiPortfolio.secureGateway.ratelimit.service.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the gateway components that need settings at construction time.
 */
@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    public RateLimiter rateLimiter(
            @Value("${gateway.rate-limit.enabled:true}") boolean enabled,
            @Value("${gateway.rate-limit.capacity:100}") long capacity,
            @Value("${gateway.rate-limit.refill-rate:10.0}") double refillRate,
            @Value("${gateway.rate-limit.per-client:true}") boolean perClient,
            @Value("${gateway.rate-limit.idle-ttl-seconds:3600}") long idleTtlSeconds,
            @Value("${gateway.rate-limit.max-clients:100000}") long maxClients) {
        log.info("Rate limiter configured - enabled: {}, capacity: {}, refillRate: {}/s, perClient: {}, idleTtl: {}s, maxClients: {}",
                enabled, capacity, refillRate, perClient, idleTtlSeconds, maxClients);
        return new RateLimiter(capacity, refillRate, perClient, enabled,
                Duration.ofSeconds(idleTtlSeconds), maxClients, System::nanoTime);
    }

    /**
     * cl100k_base token counts when the encoding loads, otherwise the character heuristic.
     */
    @Bean
    public TokenCounter tokenCounter() {
        try {
            TokenCounter counter = new JtokkitTokenCounter();
            log.info("Token counter: jtokkit cl100k_base");
            return counter;
        } catch (RuntimeException | LinkageError e) {
            log.warn("Tokenizer unavailable, falling back to {} chars per token - error: {}",
                    CharacterTokenCounter.CHARS_PER_TOKEN, e.getMessage());
            return new CharacterTokenCounter();
        }
    }
}
