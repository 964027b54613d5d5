package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.types.RiskLevel;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.libragraph.triage.core.anomaly.Activities.*;
import static org.assertj.core.api.Assertions.*;

class RiskAggregatorTest {

    private static final String CASE = "r1";
    private static final Instant MORNING = Instant.parse("2021-05-04T09:00:00Z");

    private final RiskAggregator aggregator = new RiskAggregator(AnomalySettings.DEFAULTS);

    private static ActivityGraph quietDay(int events) {
        List<Artifact> artifacts = new ArrayList<>();
        for (int i = 0; i < events; i++) {
            artifacts.add(serviceEvent(CASE, i, MORNING.plusSeconds(3600L * i / 4)));
        }
        return new ActivityGraphBuilder(AnomalySettings.DEFAULTS).build(artifacts);
    }

    private static ScoringResult scores(int size, double... leading) {
        List<Double> scores = new ArrayList<>(Collections.nCopies(size, 0.1));
        for (int i = 0; i < leading.length; i++) scores.set(i, leading[i]);
        return new ScoringResult(scores, 0.9, "fixed");
    }

    @Test
    void riskScoreShouldBlendPeakAndDensity() {
        ActivityGraph graph = quietDay(10);

        RiskAssessment risk = aggregator.assess(graph, scores(10, 0.8, 0.9));

        // peak 0.85, density min(1, 4 * 2 / 10) = 0.8
        assertThat(risk.overallRiskScore()).isCloseTo(83.0, within(0.01));
        assertThat(risk.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(risk.anomalous()).containsExactly(1, 0);
        assertThat(risk.criticalIndicators()).containsExactly("Anomalous event log activity (2)");
        assertThat(risk.anomalousActivities()).containsEntry("event_log", 2);
        assertThat(risk.mostSuspiciousActivity()).isEqualTo("event_log");
        assertThat(risk.recommendations()).startsWith(RiskAggregator.ESCALATE, RiskAggregator.REVIEW);
    }

    @Test
    void peakShouldAverageOnlyTheTopScores() {
        ActivityGraph graph = quietDay(40);

        RiskAssessment risk = aggregator.assess(graph, scores(40, 1.0, 1.0, 1.0, 1.0, 1.0, 0.7, 0.7));

        // peak 1.0 from the top five, density 4 * 7 / 40 = 0.7
        assertThat(risk.overallRiskScore()).isCloseTo(88.0, within(0.01));
        assertThat(risk.riskLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void nothingAnomalousShouldBeLowRiskWithMonitoringAdvice() {
        ActivityGraph graph = quietDay(5);

        RiskAssessment risk = aggregator.assess(graph, scores(5));

        assertThat(risk.anomalous()).isEmpty();
        assertThat(risk.overallRiskScore()).isZero();
        assertThat(risk.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(risk.criticalIndicators()).isEmpty();
        assertThat(risk.mostSuspiciousActivity()).isEqualTo("none");
        assertThat(risk.recommendations()).containsExactly(RiskAggregator.MONITOR);
    }

    @Test
    void scoreCountMustMatchTheGraph() {
        assertThatThrownBy(() -> aggregator.assess(quietDay(3), scores(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Scorer returned 2 score(s) for 3 node(s)");
    }

    @Test
    void recommendationsShouldFollowFiredCategories() {
        Set<IndicatorCategory> fired = EnumSet.of(IndicatorCategory.USB_ACTIVITY, IndicatorCategory.WEEKEND);

        assertThat(RiskAggregator.recommendations(RiskLevel.MEDIUM, fired))
                .containsExactly(IndicatorCategory.USB_ACTIVITY.recommendation());
        assertThat(RiskAggregator.recommendations(RiskLevel.CRITICAL, fired))
                .containsExactly(RiskAggregator.ESCALATE, RiskAggregator.REVIEW,
                        IndicatorCategory.USB_ACTIVITY.recommendation());
        assertThat(RiskAggregator.recommendations(RiskLevel.LOW, EnumSet.of(IndicatorCategory.WEEKEND)))
                .containsExactly(RiskAggregator.MONITOR);
    }

    @Test
    void bandsShouldClassifyAtTheirLowerBounds() {
        RiskBands bands = RiskBands.DEFAULT;

        assertThat(bands.classify(0)).isEqualTo(RiskLevel.LOW);
        assertThat(bands.classify(39.99)).isEqualTo(RiskLevel.LOW);
        assertThat(bands.classify(40)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(bands.classify(70)).isEqualTo(RiskLevel.HIGH);
        assertThat(bands.classify(89.99)).isEqualTo(RiskLevel.HIGH);
        assertThat(bands.classify(90)).isEqualTo(RiskLevel.CRITICAL);
        assertThatThrownBy(() -> new RiskBands(50, 40, 90)).isInstanceOf(IllegalArgumentException.class);
    }
}
