package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.InstalledProgram;
import com.libragraph.triage.core.artifact.SystemSetting;
import com.libragraph.triage.types.ArtifactType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.libragraph.triage.core.anomaly.Activities.*;
import static org.assertj.core.api.Assertions.*;

class ActivityGraphBuilderTest {

    private static final String CASE = "g1";
    /** A Tuesday. */
    private static final Instant WORKDAY = Instant.parse("2021-05-04T10:00:00Z");

    private final ActivityGraphBuilder builder = new ActivityGraphBuilder(AnomalySettings.DEFAULTS);

    @Test
    void untimedArtifactsShouldBeDroppedAndTheRestOrdered() {
        Artifact untimed = Artifact.of(CASE, ArtifactType.SYSTEM_SETTING, "k", null, "vol0:SYSTEM", "",
                new SystemSetting("Computer name", "WS01", "SYSTEM"));

        ActivityGraph graph = builder.build(List.of(
                serviceEvent(CASE, 2, WORKDAY.plusSeconds(60)), untimed, serviceEvent(CASE, 1, WORKDAY)));

        assertThat(graph.size()).isEqualTo(2);
        assertThat(graph.nodes()).extracting(ActivityNode::timestamp).containsExactly(WORKDAY, WORKDAY.plusSeconds(60));
        assertThat(graph.node(0).artifactId()).isEqualTo(-1);
    }

    @Test
    void timeOfDayAndWeekendShouldBeComputedInUtc() {
        Instant night = Instant.parse("2021-05-04T23:30:00Z");
        Instant saturday = Instant.parse("2021-05-08T12:00:00Z");

        ActivityGraph graph = builder.build(List.of(serviceEvent(CASE, 1, WORKDAY),
                serviceEvent(CASE, 2, night), serviceEvent(CASE, 3, saturday)));

        assertThat(graph.node(0).indicators()).isEmpty();
        assertThat(graph.node(1).hour()).isEqualTo(23);
        assertThat(graph.node(1).indicators()).containsExactly(IndicatorCategory.OFF_HOURS);
        assertThat(graph.node(2).weekend()).isTrue();
        assertThat(graph.node(2).indicators()).containsExactly(IndicatorCategory.WEEKEND);
    }

    @Test
    void installDatesShouldNotCountAsOffHours() {
        Instant midnight = Instant.parse("2021-03-01T00:00:00Z");
        Artifact program = Artifact.of(CASE, ArtifactType.INSTALLED_PROGRAM, "SOFTWARE\\7-Zip", midnight,
                "vol0:SOFTWARE", "Installed program 7-Zip",
                new InstalledProgram("7-Zip", "19.00", null, null, midnight, "SOFTWARE\\7-Zip"));

        assertThat(builder.build(List.of(program)).node(0).indicators()).isEmpty();
    }

    @Test
    void threeFailedLogonsWithinTheWindowShouldFormABurst() {
        Instant t = Instant.parse("2021-05-04T11:00:00Z");

        ActivityGraph burst = builder.build(List.of(failedLogon(CASE, 1, t, "eve"),
                failedLogon(CASE, 2, t.plusSeconds(120), "eve"), failedLogon(CASE, 3, t.plusSeconds(240), "eve")));
        ActivityGraph spread = builder.build(List.of(failedLogon(CASE, 1, t, "eve"),
                failedLogon(CASE, 2, t.plusSeconds(400), "eve"), failedLogon(CASE, 3, t.plusSeconds(800), "eve")));

        assertThat(burst.nodes()).allSatisfy(n -> assertThat(n.indicators())
                .contains(IndicatorCategory.LOGON_FAILURE, IndicatorCategory.LOGON_BURST));
        assertThat(spread.nodes()).allSatisfy(n -> assertThat(n.indicators())
                .contains(IndicatorCategory.LOGON_FAILURE)
                .doesNotContain(IndicatorCategory.LOGON_BURST));
    }

    @Test
    void relationsShouldBeChainedBetweenConsecutiveMatches() {
        Instant t = Instant.parse("2021-05-04T11:00:00Z");

        ActivityGraph graph = builder.build(List.of(
                failedLogon(CASE, 1, t, "eve"),
                usb(CASE, "SER1", t.plusSeconds(60)),
                failedLogon(CASE, 2, t.plusSeconds(3600), "eve"),
                failedLogon(CASE, 3, t.plusSeconds(7200), "bob")));

        assertThat(graph.edgeCounts().get(EdgeType.TEMPORAL)).isEqualTo(1);
        // same account an hour apart exceeds the session window
        assertThat(graph.edgeCounts().get(EdgeType.SAME_SESSION)).isZero();
        assertThat(graph.edgeCounts().get(EdgeType.SAME_SOURCE)).isEqualTo(2);
        assertThat(graph.neighbours(1)).extracting(ActivityEdge::type).containsExactly(EdgeType.TEMPORAL);
    }

    @Test
    void sessionEdgesShouldJoinAProfileWithinTheWindow() {
        Instant t = Instant.parse("2021-05-04T11:00:00Z");

        ActivityGraph graph = builder.build(List.of(failedLogon(CASE, 1, t, "eve"),
                failedLogon(CASE, 2, t.plusSeconds(600), "eve")));

        assertThat(graph.edgeCounts().get(EdgeType.SAME_SESSION)).isEqualTo(1);
        assertThat(graph.edgeCounts().get(EdgeType.TEMPORAL)).isZero();
    }
}
