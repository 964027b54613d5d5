package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.types.RiskLevel;

/**
 * Lower bounds of the MEDIUM, HIGH and CRITICAL bands on the 0-100 risk
 * score; anything below {@code medium} is LOW.
 */
public record RiskBands(double medium, double high, double critical) {

    public static final RiskBands DEFAULT = new RiskBands(40, 70, 90);

    public RiskBands {
        if (!(0 < medium && medium < high && high < critical && critical <= 100)) {
            throw new IllegalArgumentException("Risk bands must satisfy 0 < medium < high < critical <= 100, got "
                    + medium + "/" + high + "/" + critical);
        }
    }

    public RiskLevel classify(double score) {
        if (score >= critical) return RiskLevel.CRITICAL;
        if (score >= high) return RiskLevel.HIGH;
        if (score >= medium) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }
}
