package com.aiPortfolio.secureGateway.gateway.service;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the identity used as the rate limit key.
 *
 * The first entry of the forwarding header wins when the header is trusted (the gateway sits
 * behind a proxy that sets it), then the peer address, then {@code "unknown"}.
 */
@Component
public class ClientIdentityResolver {

    static final String UNKNOWN = "unknown";

    private final boolean trustForwardedHeader;
    private final String forwardedHeader;

    public ClientIdentityResolver(
            @Value("${gateway.client-identity.trust-forwarded-header:true}") boolean trustForwardedHeader,
            @Value("${gateway.client-identity.forwarded-header:X-Forwarded-For}") String forwardedHeader) {
        this.trustForwardedHeader = trustForwardedHeader;
        this.forwardedHeader = forwardedHeader;
    }

    public String resolve(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }

        if (trustForwardedHeader) {
            String forwarded = request.getHeader(forwardedHeader);
            if (forwarded != null && !forwarded.isBlank()) {
                String first = forwarded.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }

        String remoteAddr = request.getRemoteAddr();
        if (remoteAddr != null && !remoteAddr.isBlank()) {
            return remoteAddr;
        }
        return UNKNOWN;
    }
}
