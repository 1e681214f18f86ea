package com.aiPortfolio.secureGateway.guard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Result of the security checks run on one piece of text (or merged across several).
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecurityVerdict {

    private final SecurityStatus status;

    /**
     * PII categories found in the text.
     */
    private final Set<PiiCategory> piiDetected;

    /**
     * Whether the forwarded text differs from the original because of redaction.
     */
    private final boolean piiRedacted;

    /**
     * Prompt injection categories found in the text.
     */
    private final Set<InjectionCategory> injectionDetected;

    /**
     * Present iff status is BLOCKED.
     */
    private final String blockedReason;

    @Builder
    private SecurityVerdict(SecurityStatus status,
                            Set<PiiCategory> piiDetected,
                            boolean piiRedacted,
                            Set<InjectionCategory> injectionDetected,
                            String blockedReason) {
        this.status = status != null ? status : SecurityStatus.PASSED;
        this.piiDetected = immutableCopy(piiDetected, PiiCategory.class);
        this.piiRedacted = piiRedacted;
        this.injectionDetected = immutableCopy(injectionDetected, InjectionCategory.class);
        this.blockedReason = this.status == SecurityStatus.BLOCKED ? blockedReason : null;
    }

    public static SecurityVerdict passed() {
        return SecurityVerdict.builder().status(SecurityStatus.PASSED).build();
    }

    @JsonIgnore
    public boolean isBlocked() {
        return status == SecurityStatus.BLOCKED;
    }

    private static <E extends Enum<E>> Set<E> immutableCopy(Set<E> source, Class<E> type) {
        if (source == null || source.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(type));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(source));
    }
}
