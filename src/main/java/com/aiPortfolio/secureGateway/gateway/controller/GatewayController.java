package com.aiPortfolio.secureGateway.gateway.controller;

import com.aiPortfolio.secureGateway.gateway.model.GatewayRoute;
import com.aiPortfolio.secureGateway.gateway.service.GatewayService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway REST controller - thin HTTP layer over the gateway pipeline.
 *
 * Each endpoint only names its {@link GatewayRoute} and hands the raw body and path variables
 * to {@link GatewayService}. Bodies are taken as raw strings so malformed JSON reaches the
 * pipeline and is audited like any other rejection.
 */
@RestController
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class GatewayController {

    static final String SERVICE_NAME = "secure-ai-gateway";

    private final GatewayService gatewayService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("service", SERVICE_NAME);
        return ResponseEntity.ok(response);
    }

    // RAG

    @PostMapping("/rag/ask")
    public ResponseEntity<ObjectNode> ragAsk(HttpServletRequest request,
                                             @RequestBody(required = false) String body) {
        return forward(GatewayRoute.RAG_ASK, request, body, Map.of());
    }

    // Evaluation

    @PostMapping("/eval/run")
    public ResponseEntity<ObjectNode> evalRun(HttpServletRequest request,
                                              @RequestBody(required = false) String body) {
        return forward(GatewayRoute.EVAL_RUN, request, body, Map.of());
    }

    // Incident analysis

    @PostMapping("/incident/ingest")
    public ResponseEntity<ObjectNode> incidentIngest(HttpServletRequest request,
                                                     @RequestBody(required = false) String body) {
        return forward(GatewayRoute.INCIDENT_INGEST, request, body, Map.of());
    }

    @PostMapping("/incident/analyze")
    public ResponseEntity<ObjectNode> incidentAnalyze(HttpServletRequest request,
                                                      @RequestBody(required = false) String body) {
        return forward(GatewayRoute.INCIDENT_ANALYZE, request, body, Map.of());
    }

    @GetMapping("/incident/cases")
    public ResponseEntity<ObjectNode> incidentCases(HttpServletRequest request) {
        return forward(GatewayRoute.INCIDENT_LIST, request, null, Map.of());
    }

    @GetMapping("/incident/cases/{caseId}")
    public ResponseEntity<ObjectNode> incidentCase(HttpServletRequest request,
                                                   @PathVariable String caseId) {
        return forward(GatewayRoute.INCIDENT_DETAIL, request, null, Map.of("caseId", caseId));
    }

    @PostMapping("/incident/cases/{caseId}/rerun")
    public ResponseEntity<ObjectNode> incidentRerun(HttpServletRequest request,
                                                    @PathVariable String caseId,
                                                    @RequestBody(required = false) String body) {
        return forward(GatewayRoute.INCIDENT_RERUN, request, body, Map.of("caseId", caseId));
    }

    @PostMapping("/incident/cases/{caseId}/feedback")
    public ResponseEntity<ObjectNode> incidentFeedback(HttpServletRequest request,
                                                       @PathVariable String caseId,
                                                       @RequestBody(required = false) String body) {
        return forward(GatewayRoute.INCIDENT_FEEDBACK, request, body, Map.of("caseId", caseId));
    }

    // Change risk

    @PostMapping("/devops/changes/ingest")
    public ResponseEntity<ObjectNode> devopsIngest(HttpServletRequest request,
                                                   @RequestBody(required = false) String body) {
        return forward(GatewayRoute.DEVOPS_INGEST, request, body, Map.of());
    }

    @PostMapping("/devops/changes/analyze")
    public ResponseEntity<ObjectNode> devopsAnalyze(HttpServletRequest request,
                                                    @RequestBody(required = false) String body) {
        return forward(GatewayRoute.DEVOPS_ANALYZE, request, body, Map.of());
    }

    @GetMapping("/devops/changes")
    public ResponseEntity<ObjectNode> devopsChanges(HttpServletRequest request) {
        return forward(GatewayRoute.DEVOPS_LIST, request, null, Map.of());
    }

    @GetMapping("/devops/changes/{changeId}")
    public ResponseEntity<ObjectNode> devopsChange(HttpServletRequest request,
                                                   @PathVariable String changeId) {
        return forward(GatewayRoute.DEVOPS_DETAIL, request, null, Map.of("changeId", changeId));
    }

    // Architecture review

    @PostMapping("/architecture/review")
    public ResponseEntity<ObjectNode> architectureReview(HttpServletRequest request,
                                                         @RequestBody(required = false) String body) {
        return forward(GatewayRoute.ARCHITECTURE_REVIEW, request, body, Map.of());
    }

    @GetMapping("/architecture/reviews")
    public ResponseEntity<ObjectNode> architectureReviews(HttpServletRequest request) {
        return forward(GatewayRoute.ARCHITECTURE_LIST, request, null, Map.of());
    }

    @GetMapping("/architecture/reviews/{reviewId}")
    public ResponseEntity<ObjectNode> architectureReviewDetail(HttpServletRequest request,
                                                               @PathVariable String reviewId) {
        return forward(GatewayRoute.ARCHITECTURE_DETAIL, request, null, Map.of("reviewId", reviewId));
    }

    @PostMapping("/architecture/reviews/{reviewId}/feedback")
    public ResponseEntity<ObjectNode> architectureFeedback(HttpServletRequest request,
                                                           @PathVariable String reviewId,
                                                           @RequestBody(required = false) String body) {
        return forward(GatewayRoute.ARCHITECTURE_FEEDBACK, request, body, Map.of("reviewId", reviewId));
    }

    private ResponseEntity<ObjectNode> forward(GatewayRoute route,
                                               HttpServletRequest request,
                                               String body,
                                               Map<String, String> pathVariables) {
        return ResponseEntity.ok(gatewayService.handle(route, request, body, pathVariables));
    }
}
