package com.aiPortfolio.secureGateway.guard.service;

import com.aiPortfolio.secureGateway.guard.model.GuardOutcome;
import com.aiPortfolio.secureGateway.guard.model.InjectionCategory;
import com.aiPortfolio.secureGateway.guard.model.PiiCategory;
import com.aiPortfolio.secureGateway.guard.model.RedactionResult;
import com.aiPortfolio.secureGateway.guard.model.SecurityStatus;
import com.aiPortfolio.secureGateway.guard.model.SecurityVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Security guard service - combines PII redaction and prompt injection detection
 * into a single verdict.
 *
 * Precedence:
 * - any injection category detected (and the block policy agrees) -> BLOCKED
 * - otherwise any PII detected -> WARNING, the request proceeds with redacted text
 * - otherwise -> PASSED
 *
 * The processed text is always the redacted text, whatever the status, so raw PII is never
 * forwarded. A detector that fails is treated as having found nothing and logged as a warning;
 * it never fails the request.
 */
@Slf4j
@Service
public class GuardService {

    private static final String BLOCKED_REASON_PREFIX = "Detected injection attempt: ";

    private final PiiRedactor piiRedactor;
    private final InjectionDetector injectionDetector;
    private final boolean piiRedactionEnabled;
    private final boolean injectionDetectionEnabled;

    public GuardService(PiiRedactor piiRedactor,
                        InjectionDetector injectionDetector,
                        @Value("${gateway.security.pii-redaction-enabled:true}") boolean piiRedactionEnabled,
                        @Value("${gateway.security.injection-detection-enabled:true}") boolean injectionDetectionEnabled) {
        this.piiRedactor = piiRedactor;
        this.injectionDetector = injectionDetector;
        this.piiRedactionEnabled = piiRedactionEnabled;
        this.injectionDetectionEnabled = injectionDetectionEnabled;
    }

    /**
     * Runs the enabled checks on one piece of text.
     *
     * @param text text from the caller, null is treated as empty
     * @return the text to forward and the verdict
     */
    public GuardOutcome process(String text) {
        String original = text == null ? "" : text;

        RedactionResult redaction = piiRedactionEnabled
                ? redactSafely(original)
                : new RedactionResult(original, Collections.emptySet());

        Set<InjectionCategory> injections = injectionDetectionEnabled
                ? detectSafely(original)
                : Collections.emptySet();

        SecurityVerdict.SecurityVerdictBuilder verdict = SecurityVerdict.builder()
                .piiDetected(redaction.categories())
                .piiRedacted(redaction.isRedacted())
                .injectionDetected(injections);

        if (!injections.isEmpty() && injectionDetector.shouldBlock(injections)) {
            verdict.status(SecurityStatus.BLOCKED).blockedReason(blockedReason(injections));
        } else if (!redaction.categories().isEmpty()) {
            verdict.status(SecurityStatus.WARNING);
        } else {
            verdict.status(SecurityStatus.PASSED);
        }

        return new GuardOutcome(redaction.text(), verdict.build());
    }

    /**
     * Folds the verdicts of several fields of the same request into one: categories are
     * united and the most severe status wins.
     *
     * @param verdicts per-field verdicts, may be empty
     * @return the combined verdict, PASSED when there is nothing to combine
     */
    public SecurityVerdict merge(Collection<SecurityVerdict> verdicts) {
        if (verdicts == null || verdicts.isEmpty()) {
            return SecurityVerdict.passed();
        }
        if (verdicts.size() == 1) {
            return verdicts.iterator().next();
        }

        SecurityStatus status = SecurityStatus.PASSED;
        Set<PiiCategory> pii = EnumSet.noneOf(PiiCategory.class);
        Set<InjectionCategory> injections = EnumSet.noneOf(InjectionCategory.class);
        boolean redacted = false;

        for (SecurityVerdict verdict : verdicts) {
            status = status.mostSevere(verdict.getStatus());
            pii.addAll(verdict.getPiiDetected());
            injections.addAll(verdict.getInjectionDetected());
            redacted |= verdict.isPiiRedacted();
        }

        return SecurityVerdict.builder()
                .status(status)
                .piiDetected(pii)
                .piiRedacted(redacted)
                .injectionDetected(injections)
                .blockedReason(status == SecurityStatus.BLOCKED ? blockedReason(injections) : null)
                .build();
    }

    private RedactionResult redactSafely(String text) {
        try {
            return piiRedactor.redact(text);
        } catch (RuntimeException e) {
            log.warn("PII redaction failed, treating text as clean - length: {}, error: {}",
                    text.length(), e.getMessage(), e);
            return new RedactionResult(text, Collections.emptySet());
        }
    }

    private Set<InjectionCategory> detectSafely(String text) {
        try {
            return injectionDetector.detect(text);
        } catch (RuntimeException e) {
            log.warn("Injection detection failed, treating text as clean - length: {}, error: {}",
                    text.length(), e.getMessage(), e);
            return Collections.emptySet();
        }
    }

    private static String blockedReason(Set<InjectionCategory> injections) {
        return BLOCKED_REASON_PREFIX + injections.stream()
                .map(InjectionCategory::getCode)
                .collect(Collectors.joining(", "));
    }
}
