package com.aiPortfolio.secureGateway.gateway.service;

import com.aiPortfolio.secureGateway.gateway.exception.UpstreamUnavailableException;
import com.aiPortfolio.secureGateway.gateway.model.GatewayRoute;
import com.aiPortfolio.secureGateway.gateway.model.RequestContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards sanitized requests to the downstream services.
 *
 * One {@link RestClient} is kept per read timeout; they share a single JDK {@link HttpClient}
 * and its connection pool. Any transport failure, timeout or non-2xx status becomes an
 * {@link UpstreamUnavailableException}. Redirects are not followed and count as failures.
 * Nothing is retried.
 */
@Slf4j
@Service
public class UpstreamClient {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final UpstreamServiceRegistry serviceRegistry;
    private final HttpClient httpClient;
    private final Duration maxReadTimeout;
    private final Map<Duration, RestClient> clientsByTimeout = new ConcurrentHashMap<>();

    public UpstreamClient(UpstreamServiceRegistry serviceRegistry,
                          @Value("${gateway.upstream.connect-timeout-ms:5000}") long connectTimeoutMs,
                          @Value("${gateway.upstream.max-read-timeout-ms:0}") long maxReadTimeoutMs) {
        this.serviceRegistry = serviceRegistry;
        this.maxReadTimeout = maxReadTimeoutMs > 0 ? Duration.ofMillis(maxReadTimeoutMs) : null;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    /**
     * Calls the route's upstream endpoint.
     *
     * @param context request context carrying the route, path variables and request id
     * @param body sanitized JSON body, ignored for GET routes
     * @return the upstream JSON, an empty object when the upstream sent no body
     * @throws UpstreamUnavailableException if the call fails for any reason
     */
    public JsonNode forward(RequestContext context, JsonNode body) {
        GatewayRoute route = context.getRoute();
        String requestId = context.getRequestId();
        String serviceName = route.getUpstreamService().getDisplayName();
        String url = serviceRegistry.baseUrl(route.getUpstreamService()) + route.getUpstreamPath();
        Map<String, String> pathVariables = context.getPathVariables() != null ? context.getPathVariables() : Map.of();

        log.debug("Forwarding to upstream - requestId: {}, service: {}, method: {}, path: {}",
                requestId, route.getUpstreamService(), route.getMethod(), route.getUpstreamPath());

        try {
            RestClient.RequestBodySpec request = clientFor(readTimeout(route))
                    .method(route.getMethod())
                    .uri(url, pathVariables)
                    .header(REQUEST_ID_HEADER, requestId);

            if (route.hasRequestBody()) {
                request.contentType(MediaType.APPLICATION_JSON)
                        .body(body != null ? body : JsonNodeFactory.instance.objectNode());
            }

            JsonNode response = request.retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (req, res) -> {
                        log.error("Upstream returned non-2xx status - requestId: {}, service: {}, status: {}",
                                requestId, route.getUpstreamService(), res.getStatusCode());
                        throw new UpstreamUnavailableException(requestId,
                                serviceName + " error: " + res.getStatusCode().value() + " " + res.getStatusText());
                    })
                    .body(JsonNode.class);

            return response != null ? response : JsonNodeFactory.instance.objectNode();

        } catch (RestClientException e) {
            log.error("Error calling upstream - requestId: {}, service: {}, error: {}",
                    requestId, route.getUpstreamService(), e.getMessage(), e);
            throw new UpstreamUnavailableException(requestId, serviceName + " error: " + e.getMessage(), e);
        }
    }

    /**
     * Route timeout, lowered to {@code gateway.upstream.max-read-timeout-ms} when that cap is set.
     */
    Duration readTimeout(GatewayRoute route) {
        if (maxReadTimeout != null && maxReadTimeout.compareTo(route.getTimeout()) < 0) {
            return maxReadTimeout;
        }
        return route.getTimeout();
    }

    private RestClient clientFor(Duration readTimeout) {
        return clientsByTimeout.computeIfAbsent(readTimeout, timeout -> {
            JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
            requestFactory.setReadTimeout(timeout);
            return RestClient.builder()
                    .requestFactory(requestFactory)
                    .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        });
    }
}
