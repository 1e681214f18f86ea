package com.aiPortfolio.secureGateway.guard.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Families of prompt injection attempts.
 */
public enum InjectionCategory {

    /** "ignore previous instructions", "you are now a ...", fake system turns. */
    SYSTEM_OVERRIDE("system_override"),

    /** Attempts to read back the system prompt or instructions. */
    DATA_EXFILTRATION("data_exfiltration"),

    /** "developer mode", "bypass filters", "pretend you have no restrictions". */
    JAILBREAK("jailbreak");

    private final String code;

    InjectionCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
