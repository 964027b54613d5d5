package com.libragraph.triage.core.anomaly;

/**
 * Suspicious traits an activity can carry. Each has a prior weight, the
 * indicator line shown when anomalous activities carry it, and an optional
 * recommendation.
 */
public enum IndicatorCategory {
    OFF_HOURS(0.45, "Activity outside business hours",
            "Correlate off-hours activity with the user's working schedule"),
    WEEKEND(0.20, "Weekend activity", null),
    USB_ACTIVITY(0.50, "Unauthorized USB device connections detected",
            "Investigate USB device usage - potential data exfiltration"),
    FILE_DELETION(0.40, "Suspicious file deletion activity",
            "Recover and review deleted files for evidence destruction"),
    LOGON_FAILURE(0.60, "Failed logon attempts",
            "Review the accounts and sources of failed logons"),
    LOGON_BURST(0.40, "Bursts of failed logons (possible password guessing)",
            "Check account lockout policy and block the source of repeated logon failures"),
    EXPLICIT_LOGON(0.50, "Logons with explicitly supplied credentials",
            "Review explicit-credential logons for lateral movement"),
    PERSISTENCE(0.55, "Autostart persistence entries",
            "Verify autostart entries against approved software"),
    EXECUTABLE_DOWNLOAD(0.60, "Executable files downloaded from the web",
            "Scan downloaded executables and confirm their origin"),
    RARE_PROGRAM(0.30, "Programs executed only once",
            "Review programs that ran only once"),
    LOG_CLEARED(0.80, "Event log cleared",
            "Determine who cleared the event log - possible anti-forensics");

    private final double weight;
    private final String indicator;
    private final String recommendation;

    IndicatorCategory(double weight, String indicator, String recommendation) {
        this.weight = weight;
        this.indicator = indicator;
        this.recommendation = recommendation;
    }

    /** Contribution to a node's prior, in [0, 1). */
    public double weight() {
        return weight;
    }

    public String indicator() {
        return indicator;
    }

    /** Null when the category calls for no specific action. */
    public String recommendation() {
        return recommendation;
    }
}
