package com.aiPortfolio.secureGateway.gateway.service;

import com.aiPortfolio.secureGateway.audit.model.AuditOutcome;
import com.aiPortfolio.secureGateway.audit.model.AuditRecord;
import com.aiPortfolio.secureGateway.audit.service.AuditSink;
import com.aiPortfolio.secureGateway.cost.model.CostEstimate;
import com.aiPortfolio.secureGateway.cost.service.CostEstimator;
import com.aiPortfolio.secureGateway.gateway.dto.GatewayMetadata;
import com.aiPortfolio.secureGateway.gateway.exception.GatewayException;
import com.aiPortfolio.secureGateway.gateway.exception.InternalGatewayException;
import com.aiPortfolio.secureGateway.gateway.exception.InvalidRequestException;
import com.aiPortfolio.secureGateway.gateway.exception.RateLimitExceededException;
import com.aiPortfolio.secureGateway.gateway.exception.SecurityBlockedException;
import com.aiPortfolio.secureGateway.gateway.model.CostEstimation;
import com.aiPortfolio.secureGateway.gateway.model.GatewayRoute;
import com.aiPortfolio.secureGateway.gateway.model.RequestContext;
import com.aiPortfolio.secureGateway.gateway.util.ClientIdentityMasker;
import com.aiPortfolio.secureGateway.gateway.util.JsonFieldWalker;
import com.aiPortfolio.secureGateway.guard.model.GuardOutcome;
import com.aiPortfolio.secureGateway.guard.model.SecurityVerdict;
import com.aiPortfolio.secureGateway.guard.service.GuardService;
import com.aiPortfolio.secureGateway.ratelimit.model.RateLimitResult;
import com.aiPortfolio.secureGateway.ratelimit.service.RateLimiter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway service - runs every proxied call through the same pipeline.
 *
 * Steps, strictly in order:
 * - resolve the client identity and generate a request id
 * - parse the JSON body and check the route's required fields (400 on failure)
 * - charge the route's cost against the client's token bucket (429 on rejection)
 * - redact PII in the inspected fields and look for prompt injection (403 on block)
 * - forward the sanitized body upstream (502 on any upstream failure)
 * - estimate cost for routes with model spend and attach the {@code gateway} block
 *
 * Exactly one audit record is emitted per call, whatever the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    static final String GATEWAY_FIELD = "gateway";
    static final String WRAPPED_DATA_FIELD = "data";
    static final String TOKENS_DETAIL = "tokens";

    private final ClientIdentityResolver clientIdentityResolver;
    private final RateLimiter rateLimiter;
    private final GuardService guardService;
    private final CostEstimator costEstimator;
    private final UpstreamClient upstreamClient;
    private final AuditSink auditSink;
    private final ObjectMapper objectMapper;

    /**
     * Processes one call to a gateway route.
     *
     * @param route matched route
     * @param request incoming HTTP request, used for the client identity
     * @param rawBody raw request body, null for GET routes or an empty POST
     * @param pathVariables values for the route's path placeholders
     * @return upstream JSON with the {@code gateway} block attached
     * @throws GatewayException for every outcome other than success
     */
    public ObjectNode handle(GatewayRoute route,
                             HttpServletRequest request,
                             String rawBody,
                             Map<String, String> pathVariables) {
        RequestContext context = RequestContext.builder()
                .requestId(RequestContext.newRequestId())
                .clientIdentity(clientIdentityResolver.resolve(request))
                .route(route)
                .pathVariables(pathVariables != null ? pathVariables : Map.of())
                .receivedAt(Instant.now())
                .startNanos(System.nanoTime())
                .build();
        String requestId = context.getRequestId();

        AuditRecord audit = AuditRecord.builder()
                .requestId(requestId)
                .timestamp(context.getReceivedAt())
                .clientIdentity(context.getClientIdentity())
                .method(route.getMethod().name())
                .route(route.getPath())
                .statusCode(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .outcome(AuditOutcome.INTERNAL_ERROR)
                .build();

        log.info("Gateway request received - requestId: {}, route: {} {}, client: {}",
                requestId, route.getMethod(), route.getPath(), ClientIdentityMasker.mask(context.getClientIdentity()));

        try {
            ObjectNode body = parseAndValidate(route, rawBody, requestId);

            RateLimitResult rateLimit = rateLimiter.check(context.getClientIdentity(), route.getRateLimitCost());
            audit.setRateLimitRemaining(rateLimit.remaining());
            if (!rateLimit.allowed()) {
                throw new RateLimitExceededException(requestId, rateLimit.remaining());
            }

            Inspection inspection = inspect(route, body);
            SecurityVerdict verdict = inspection.verdict();
            audit.setSecurityStatus(verdict.getStatus());
            if (verdict.isBlocked()) {
                audit.setBlockedReason(verdict.getBlockedReason());
                log.warn("Request blocked by security guard - requestId: {}, route: {}, injections: {}",
                        requestId, route.getPath(), verdict.getInjectionDetected());
                throw new SecurityBlockedException(requestId, verdict);
            }

            JsonNode upstreamResponse = upstreamClient.forward(context, body);
            ObjectNode response = asObject(upstreamResponse);

            CostEstimate cost = estimateCost(route.getCostEstimation(), inspection.inputText(), upstreamResponse);
            Map<String, Object> details = auditDetails(route, response, cost);
            if (cost != null) {
                audit.setCostUsd(cost.getEstimatedCostUsd());
            }
            audit.setDetails(details.isEmpty() ? null : details);

            GatewayMetadata metadata = GatewayMetadata.builder()
                    .requestId(requestId)
                    .timestamp(Instant.now())
                    .latencyMs(context.elapsedMillis())
                    .security(verdict)
                    .cost(cost)
                    .rateLimitRemaining(rateLimit.remaining())
                    .build();
            response.set(GATEWAY_FIELD, objectMapper.valueToTree(metadata));

            audit.setStatusCode(HttpStatus.OK.value());
            audit.setOutcome(AuditOutcome.COMPLETED);
            return response;

        } catch (GatewayException e) {
            audit.setStatusCode(e.getStatus().value());
            audit.setOutcome(e.getOutcome());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error in gateway pipeline - requestId: {}, route: {}", requestId, route.getPath(), e);
            audit.setStatusCode(HttpStatus.INTERNAL_SERVER_ERROR.value());
            audit.setOutcome(AuditOutcome.INTERNAL_ERROR);
            throw new InternalGatewayException(requestId, e);
        } finally {
            audit.setLatencyMs(context.elapsedMillis());
            emit(audit);
            log.info("Gateway request completed - requestId: {}, route: {}, status: {}, latencyMs: {}",
                    requestId, route.getPath(), audit.getStatusCode(), audit.getLatencyMs());
        }
    }

    /**
     * Parses the body into a JSON object, checks the route's required fields and the shape of
     * its inspected fields. GET routes always get an empty object.
     */
    private ObjectNode parseAndValidate(GatewayRoute route, String rawBody, String requestId) {
        if (!route.hasRequestBody() || rawBody == null || rawBody.isBlank()) {
            ObjectNode empty = objectMapper.createObjectNode();
            checkRequiredFields(route, empty, requestId);
            return empty;
        }

        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            log.warn("Malformed request body - requestId: {}, route: {}, error: {}",
                    requestId, route.getPath(), e.getOriginalMessage());
            throw new InvalidRequestException(requestId, "Malformed JSON body", e);
        }
        if (!(parsed instanceof ObjectNode)) {
            throw new InvalidRequestException(requestId, "Request body must be a JSON object");
        }

        ObjectNode body = (ObjectNode) parsed;
        checkRequiredFields(route, body, requestId);
        checkInspectedFields(route, body, requestId);
        return body;
    }

    private void checkRequiredFields(GatewayRoute route, ObjectNode body, String requestId) {
        for (String field : route.getRequiredFields()) {
            JsonNode value = body.get(field);
            boolean missing = value == null
                    || value.isNull()
                    || (value.isTextual() && value.textValue().isBlank());
            if (missing) {
                log.warn("Missing required field - requestId: {}, route: {}, field: {}", requestId, route.getPath(), field);
                throw new InvalidRequestException(requestId, "Missing required field: " + field);
            }
        }
    }

    /**
     * Rejects inspected fields holding anything but text, so arrays or objects cannot carry
     * content past the guard.
     */
    private void checkInspectedFields(GatewayRoute route, ObjectNode body, String requestId) {
        for (String path : route.getInspectedFields()) {
            try {
                JsonFieldWalker.checkShape(body, path);
            } catch (JsonFieldWalker.UnexpectedShapeException e) {
                log.warn("Inspected field has unexpected type - requestId: {}, route: {}, field: {}",
                        requestId, route.getPath(), e.getPath());
                throw new InvalidRequestException(requestId, e.getMessage());
            }
        }
    }

    /**
     * Runs the security guard on every inspected field, replacing each value with its redacted
     * form, and merges the per-field verdicts.
     */
    private Inspection inspect(GatewayRoute route, ObjectNode body) {
        List<SecurityVerdict> verdicts = new ArrayList<>();
        List<String> sanitized = new ArrayList<>();

        for (String path : route.getInspectedFields()) {
            JsonFieldWalker.rewrite(body, path, text -> {
                GuardOutcome outcome = guardService.process(text);
                verdicts.add(outcome.verdict());
                sanitized.add(outcome.processedText());
                return outcome.processedText();
            });
        }

        return new Inspection(guardService.merge(verdicts), String.join(" ", sanitized));
    }

    private CostEstimate estimateCost(CostEstimation estimation, String inputText, JsonNode upstreamResponse) {
        if (!estimation.enabled()) {
            return null;
        }

        String outputText;
        if (estimation.usesWholeResponse()) {
            outputText = upstreamResponse.toString();
        } else {
            JsonNode output = upstreamResponse.path(estimation.outputField());
            outputText = output.isTextual() ? output.textValue() : (output.isMissingNode() || output.isNull() ? "" : output.toString());
        }
        return costEstimator.estimate(inputText, outputText);
    }

    private Map<String, Object> auditDetails(GatewayRoute route, ObjectNode response, CostEstimate cost) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (String field : route.getAuditFields()) {
            JsonNode value = response.get(field);
            if (value != null && !value.isNull()) {
                details.put(field, objectMapper.convertValue(value, Object.class));
            }
        }
        if (cost != null) {
            details.put(TOKENS_DETAIL, cost.getTotalTokens());
        }
        return details;
    }

    private ObjectNode asObject(JsonNode upstreamResponse) {
        if (upstreamResponse instanceof ObjectNode) {
            return (ObjectNode) upstreamResponse;
        }
        ObjectNode wrapped = objectMapper.createObjectNode();
        wrapped.set(WRAPPED_DATA_FIELD, upstreamResponse);
        return wrapped;
    }

    private void emit(AuditRecord audit) {
        try {
            auditSink.emit(audit);
        } catch (RuntimeException e) {
            log.error("Failed to emit audit record - requestId: {}", audit.getRequestId(), e);
        }
    }

    private record Inspection(SecurityVerdict verdict, String inputText) {}
}
