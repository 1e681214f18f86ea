package com.aiPortfolio.secureGateway.guard.service;

import com.aiPortfolio.secureGateway.guard.model.PiiCategory;
import com.aiPortfolio.secureGateway.guard.model.RedactionResult;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based PII scanner and redactor.
 *
 * Stateless: compiled patterns are immutable and shared, so concurrent calls need no locking.
 *
 * Digit patterns can overlap (a card number contains phone- and SSN-shaped runs), so redaction
 * runs in {@link #REDACTION_ORDER}, most specific first, each pattern applied to the output of
 * the previous one. Digits consumed by the card pattern are no longer visible to the phone
 * pattern. {@link #scan(String)} on the other hand tests every pattern against the raw text.
 */
@Component
public class PiiRedactor {

    static final List<PiiCategory> REDACTION_ORDER = List.of(
            PiiCategory.CREDIT_CARD,
            PiiCategory.SSN,
            PiiCategory.PHONE,
            PiiCategory.EMAIL
    );

    private static final Map<PiiCategory, Pattern> PATTERNS = compilePatterns();

    /**
     * Reports every PII category present in the text.
     *
     * @param text text to scan, null is treated as empty
     * @return detected categories, empty when clean
     */
    public Set<PiiCategory> scan(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptySet();
        }
        Set<PiiCategory> detected = EnumSet.noneOf(PiiCategory.class);
        for (PiiCategory category : REDACTION_ORDER) {
            if (PATTERNS.get(category).matcher(text).find()) {
                detected.add(category);
            }
        }
        return Collections.unmodifiableSet(detected);
    }

    /**
     * Replaces every match of every category with that category's placeholder.
     *
     * @param text text to redact, null is treated as empty
     * @return redacted text and the categories that were replaced
     */
    public RedactionResult redact(String text) {
        if (text == null || text.isEmpty()) {
            return new RedactionResult(text == null ? "" : text, Collections.emptySet());
        }
        Set<PiiCategory> detected = EnumSet.noneOf(PiiCategory.class);
        String redacted = text;
        for (PiiCategory category : REDACTION_ORDER) {
            Matcher matcher = PATTERNS.get(category).matcher(redacted);
            if (matcher.find()) {
                detected.add(category);
                redacted = matcher.replaceAll(Matcher.quoteReplacement(category.getPlaceholder()));
            }
        }
        return new RedactionResult(redacted, Collections.unmodifiableSet(detected));
    }

    private static Map<PiiCategory, Pattern> compilePatterns() {
        Map<PiiCategory, Pattern> patterns = new EnumMap<>(PiiCategory.class);
        for (PiiCategory category : PiiCategory.values()) {
            patterns.put(category, Pattern.compile(patternFor(category)));
        }
        return Collections.unmodifiableMap(patterns);
    }

    private static String patternFor(PiiCategory category) {
        return switch (category) {
            case EMAIL -> "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b";
            case PHONE -> "\\b(?:\\+1[-.\\s]?)?\\(?[0-9]{3}\\)?[-.\\s]?[0-9]{3}[-.\\s]?[0-9]{4}\\b";
            case SSN -> "\\b\\d{3}[-\\s]?\\d{2}[-\\s]?\\d{4}\\b";
            case CREDIT_CARD -> "\\b(?:\\d{4}[-\\s]?){3}\\d{4}\\b";
        };
    }
}
