package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.types.RiskLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns node scores into a risk score, a risk level and report text.
 * <p>
 * {@code score = 100 * (0.6 * peak + 0.4 * density)} where {@code peak} is the
 * mean of the top-k anomalous scores and {@code density = min(1, 4 * anomalous / total)};
 * zero when nothing is anomalous.
 */
public class RiskAggregator {

    static final double PEAK_WEIGHT = 0.6;
    static final double DENSITY_WEIGHT = 0.4;
    static final double DENSITY_SCALE = 4.0;

    static final String ESCALATE = "Immediate investigation required - potential security incident";
    static final String REVIEW = "Review all flagged activities with security team";
    static final String MONITOR = "Continue monitoring - no immediate action required";

    private final AnomalySettings settings;

    public RiskAggregator(AnomalySettings settings) {
        this.settings = settings;
    }

    public RiskAssessment assess(ActivityGraph graph, ScoringResult scoring) {
        if (scoring.scores().size() != graph.size()) {
            throw new IllegalArgumentException("Scorer returned " + scoring.scores().size()
                    + " score(s) for " + graph.size() + " node(s)");
        }
        List<Integer> anomalous = new ArrayList<>();
        for (int i = 0; i < graph.size(); i++) {
            if (scoring.score(i) >= settings.severityThreshold()) anomalous.add(i);
        }
        anomalous.sort(Comparator.comparingDouble((Integer i) -> scoring.score(i)).reversed()
                .thenComparing(Comparator.naturalOrder()));

        double score = riskScore(anomalous, scoring, graph.size());
        RiskLevel level = settings.bands().classify(score);

        Map<IndicatorCategory, Integer> fired = new EnumMap<>(IndicatorCategory.class);
        Map<ArtifactType, Integer> uncategorized = new EnumMap<>(ArtifactType.class);
        Map<ArtifactType, Integer> byType = new EnumMap<>(ArtifactType.class);
        for (int i : anomalous) {
            ActivityNode node = graph.node(i);
            byType.merge(node.type(), 1, Integer::sum);
            if (node.indicators().isEmpty()) {
                uncategorized.merge(node.type(), 1, Integer::sum);
            }
            for (IndicatorCategory c : node.indicators()) {
                fired.merge(c, 1, Integer::sum);
            }
        }

        List<String> indicators = new ArrayList<>();
        fired.forEach((c, count) -> indicators.add(c.indicator() + " (" + count + ")"));
        uncategorized.forEach((t, count) -> indicators.add("Anomalous " + t.label().replace('_', ' ')
                + " activity (" + count + ")"));

        Map<String, Integer> activities = new LinkedHashMap<>();
        byType.forEach((t, count) -> activities.put(t.label(), count));
        String mostSuspicious = "none";
        int most = 0;
        for (Map.Entry<ArtifactType, Integer> e : byType.entrySet()) {
            if (e.getValue() > most) {
                most = e.getValue();
                mostSuspicious = e.getKey().label();
            }
        }

        return new RiskAssessment(List.copyOf(anomalous), score, level, indicators,
                recommendations(level, fired.keySet()), activities, mostSuspicious);
    }

    double riskScore(List<Integer> anomalousByScore, ScoringResult scoring, int total) {
        if (anomalousByScore.isEmpty() || total == 0) return 0.0;
        int k = Math.min(settings.topK(), anomalousByScore.size());
        double peak = 0;
        for (int i = 0; i < k; i++) {
            peak += scoring.score(anomalousByScore.get(i));
        }
        peak /= k;
        double density = Math.min(1.0, DENSITY_SCALE * anomalousByScore.size() / total);
        double score = 100.0 * (PEAK_WEIGHT * peak + DENSITY_WEIGHT * density);
        return Math.round(score * 100.0) / 100.0;
    }

    static List<String> recommendations(RiskLevel level, Set<IndicatorCategory> fired) {
        Set<String> out = new LinkedHashSet<>();
        if (level.isAtLeast(RiskLevel.HIGH)) {
            out.add(ESCALATE);
            out.add(REVIEW);
        }
        for (IndicatorCategory c : fired) {
            if (c.recommendation() != null) out.add(c.recommendation());
        }
        if (out.isEmpty()) out.add(MONITOR);
        return List.copyOf(out);
    }
}
