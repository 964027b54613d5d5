package com.libragraph.triage.types;

/** Ordered risk classification: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL. */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
