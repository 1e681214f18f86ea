package com.aiPortfolio.secureGateway.gateway.model;

import lombok.Getter;
import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.util.List;

/**
 * Every route the gateway exposes, with the metadata the request pipeline needs.
 *
 * Inspected fields are dotted paths into the JSON body; a segment ending in {@code []} fans
 * out over the elements of an array ({@code artifacts[].content}). Required fields are
 * top-level names that must be present and non-blank.
 */
@Getter
public enum GatewayRoute {

    RAG_ASK(HttpMethod.POST, "/rag/ask", UpstreamService.RAG, "/ask", 1, 30,
            List.of("question"), List.of("question"),
            CostEstimation.fromField("answer"), List.of()),

    EVAL_RUN(HttpMethod.POST, "/eval/run", UpstreamService.EVAL, "/runs", 5, 120,
            List.of(), List.of(),
            CostEstimation.none(), List.of("suite_name", "pass_rate")),

    INCIDENT_INGEST(HttpMethod.POST, "/incident/ingest", UpstreamService.INCIDENT, "/ingest", 3, 60,
            List.of("incident_summary", "artifacts[].content"), List.of("title", "incident_summary", "artifacts"),
            CostEstimation.none(), List.of("case_id")),

    INCIDENT_ANALYZE(HttpMethod.POST, "/incident/analyze", UpstreamService.INCIDENT, "/analyze", 5, 120,
            List.of("user_notes"), List.of("case_id"),
            CostEstimation.none(), List.of("case_id", "confidence_overall")),

    INCIDENT_LIST(HttpMethod.GET, "/incident/cases", UpstreamService.INCIDENT, "/cases", 1, 30,
            List.of(), List.of(),
            CostEstimation.none(), List.of("total_cases")),

    INCIDENT_DETAIL(HttpMethod.GET, "/incident/cases/{caseId}", UpstreamService.INCIDENT, "/cases/{caseId}", 1, 30,
            List.of(), List.of(),
            CostEstimation.none(), List.of("case_id")),

    INCIDENT_RERUN(HttpMethod.POST, "/incident/cases/{caseId}/rerun", UpstreamService.INCIDENT,
            "/cases/{caseId}/rerun", 5, 120,
            List.of("user_notes"), List.of(),
            CostEstimation.none(), List.of("case_id", "confidence_overall")),

    INCIDENT_FEEDBACK(HttpMethod.POST, "/incident/cases/{caseId}/feedback", UpstreamService.INCIDENT,
            "/cases/{caseId}/feedback", 1, 30,
            List.of("reviewer_note"), List.of("hypothesis_rank", "feedback_type"),
            CostEstimation.none(), List.of("feedback_id")),

    DEVOPS_INGEST(HttpMethod.POST, "/devops/changes/ingest", UpstreamService.DEVOPS, "/changes/ingest", 2, 60,
            List.of("diff_summary", "description"), List.of("change_type", "service", "diff_summary"),
            CostEstimation.none(), List.of("change_id")),

    DEVOPS_ANALYZE(HttpMethod.POST, "/devops/changes/analyze", UpstreamService.DEVOPS, "/changes/analyze", 5, 120,
            List.of(), List.of("change_id"),
            CostEstimation.none(), List.of("change_id")),

    DEVOPS_LIST(HttpMethod.GET, "/devops/changes", UpstreamService.DEVOPS, "/changes", 1, 30,
            List.of(), List.of(),
            CostEstimation.none(), List.of("total_changes")),

    DEVOPS_DETAIL(HttpMethod.GET, "/devops/changes/{changeId}", UpstreamService.DEVOPS, "/changes/{changeId}", 1, 30,
            List.of(), List.of(),
            CostEstimation.none(), List.of("change_id")),

    ARCHITECTURE_REVIEW(HttpMethod.POST, "/architecture/review", UpstreamService.ARCHITECTURE, "/review", 1, 120,
            List.of("problem_statement", "user_notes"), List.of("problem_statement"),
            CostEstimation.fromWholeResponse(), List.of("review_id")),

    ARCHITECTURE_LIST(HttpMethod.GET, "/architecture/reviews", UpstreamService.ARCHITECTURE, "/reviews", 1, 30,
            List.of(), List.of(),
            CostEstimation.none(), List.of("total")),

    ARCHITECTURE_DETAIL(HttpMethod.GET, "/architecture/reviews/{reviewId}", UpstreamService.ARCHITECTURE,
            "/reviews/{reviewId}", 1, 30,
            List.of(), List.of(),
            CostEstimation.none(), List.of("review_id")),

    ARCHITECTURE_FEEDBACK(HttpMethod.POST, "/architecture/reviews/{reviewId}/feedback", UpstreamService.ARCHITECTURE,
            "/reviews/{reviewId}/feedback", 1, 30,
            List.of("notes"), List.of("feedback_type"),
            CostEstimation.none(), List.of("review_id", "feedback_type"));

    private final HttpMethod method;

    /**
     * Path template exposed by the gateway.
     */
    private final String path;

    private final UpstreamService upstreamService;

    /**
     * Path template on the upstream service, relative to its base URL.
     */
    private final String upstreamPath;

    /**
     * Tokens charged against the caller's bucket.
     */
    private final long rateLimitCost;

    private final Duration timeout;
    private final List<String> inspectedFields;
    private final List<String> requiredFields;
    private final CostEstimation costEstimation;

    /**
     * Upstream response fields copied into the audit record.
     */
    private final List<String> auditFields;

    GatewayRoute(HttpMethod method,
                 String path,
                 UpstreamService upstreamService,
                 String upstreamPath,
                 long rateLimitCost,
                 long timeoutSeconds,
                 List<String> inspectedFields,
                 List<String> requiredFields,
                 CostEstimation costEstimation,
                 List<String> auditFields) {
        this.method = method;
        this.path = path;
        this.upstreamService = upstreamService;
        this.upstreamPath = upstreamPath;
        this.rateLimitCost = rateLimitCost;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.inspectedFields = inspectedFields;
        this.requiredFields = requiredFields;
        this.costEstimation = costEstimation;
        this.auditFields = auditFields;
    }

    public boolean hasRequestBody() {
        return !HttpMethod.GET.equals(method);
    }
}
