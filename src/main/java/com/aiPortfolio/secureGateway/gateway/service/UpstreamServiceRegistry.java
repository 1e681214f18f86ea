package com.aiPortfolio.secureGateway.gateway.service;

import com.aiPortfolio.secureGateway.gateway.model.UpstreamService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Base URLs of the downstream services.
 */
@Component
public class UpstreamServiceRegistry {

    @Value("${gateway.upstream.rag-url:http://localhost:8001}")
    private String ragUrl;

    @Value("${gateway.upstream.eval-url:http://localhost:8002}")
    private String evalUrl;

    @Value("${gateway.upstream.incident-url:http://localhost:8003}")
    private String incidentUrl;

    @Value("${gateway.upstream.devops-url:http://localhost:8004}")
    private String devopsUrl;

    @Value("${gateway.upstream.architecture-url:http://localhost:8005}")
    private String architectureUrl;

    /**
     * @return the base URL without a trailing slash
     */
    public String baseUrl(UpstreamService service) {
        String url = switch (service) {
            case RAG -> ragUrl;
            case EVAL -> evalUrl;
            case INCIDENT -> incidentUrl;
            case DEVOPS -> devopsUrl;
            case ARCHITECTURE -> architectureUrl;
        };
        return stripTrailingSlash(url);
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
