package com.aiPortfolio.secureGateway.gateway.model;

import lombok.Getter;

/**
 * Downstream AI services the gateway proxies to.
 */
@Getter
public enum UpstreamService {

    RAG("RAG service"),
    EVAL("Eval service"),
    INCIDENT("Incident service"),
    DEVOPS("DevOps service"),
    ARCHITECTURE("Architecture service");

    private final String displayName;

    UpstreamService(String displayName) {
        this.displayName = displayName;
    }
}
