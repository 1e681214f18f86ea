package com.aiPortfolio.secureGateway.guard.service;

import com.aiPortfolio.secureGateway.guard.model.InjectionCategory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pattern-based prompt injection classifier.
 *
 * Each category is matched by a small family of case-insensitive patterns and is flagged on
 * the first hit within its family. Stateless and safe for concurrent use.
 */
@Component
public class InjectionDetector {

    private static final Map<InjectionCategory, List<Pattern>> FAMILIES = compileFamilies();

    /**
     * Detects injection attempts in the text.
     *
     * @param text text to classify, null is treated as empty
     * @return detected categories, empty when the text looks benign
     */
    public Set<InjectionCategory> detect(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptySet();
        }
        Set<InjectionCategory> detected = EnumSet.noneOf(InjectionCategory.class);
        for (Map.Entry<InjectionCategory, List<Pattern>> family : FAMILIES.entrySet()) {
            for (Pattern pattern : family.getValue()) {
                if (pattern.matcher(text).find()) {
                    detected.add(family.getKey());
                    break;
                }
            }
        }
        return Collections.unmodifiableSet(detected);
    }

    /**
     * Any detected category blocks the request. There is no partial tolerance.
     */
    public boolean shouldBlock(Set<InjectionCategory> detected) {
        return detected != null && !detected.isEmpty();
    }

    private static Map<InjectionCategory, List<Pattern>> compileFamilies() {
        Map<InjectionCategory, List<Pattern>> families = new EnumMap<>(InjectionCategory.class);
        for (InjectionCategory category : InjectionCategory.values()) {
            families.put(category, patternsFor(category).stream()
                    .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                    .toList());
        }
        return Collections.unmodifiableMap(families);
    }

    private static List<String> patternsFor(InjectionCategory category) {
        return switch (category) {
            case SYSTEM_OVERRIDE -> List.of(
                    "ignore\\s+(previous|all|above)\\s+(instructions?|prompts?)",
                    "disregard\\s+(previous|all|above)",
                    "forget\\s+(everything|all|previous)",
                    "you\\s+are\\s+now\\s+(?:a|an)\\b",
                    "new\\s+instructions?\\s*:",
                    "system\\s*:\\s*you\\s+are",
                    "override\\s+(system|instructions?)",
                    // injected chat turns such as "] [system"
                    "\\]\\s*\\[\\s*system"
            );
            case DATA_EXFILTRATION -> List.of(
                    "reveal\\s+(your|the|system)\\s+(prompt|instructions?)",
                    "show\\s+me\\s+(your|the)\\s+(system|prompt|instructions?)",
                    "what\\s+(are|is)\\s+(your|the)\\s+(system|instructions?|prompt)",
                    "print\\s+(your|the|all)\\s+(instructions?|prompt)",
                    "repeat\\s+(your|the)\\s+(system|prompt|instructions?)",
                    "output\\s+(your|the|system)\\s+(prompt|instructions?)"
            );
            case JAILBREAK -> List.of(
                    "\\bDAN\\s+mode",
                    "developer\\s+mode",
                    "jailbreak",
                    "bypass\\s+(filters?|restrictions?|safety)",
                    "pretend\\s+(you\\s+)?have\\s+no\\s+(restrictions?|limits?)",
                    "act\\s+as\\s+if\\s+(you\\s+)?have\\s+no\\s+rules"
            );
        };
    }
}
