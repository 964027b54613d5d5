package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.ArtifactPayload;
import com.libragraph.triage.core.artifact.BrowserDownload;
import com.libragraph.triage.core.artifact.EventLogEntry;
import com.libragraph.triage.core.artifact.ExecutionCount;
import com.libragraph.triage.core.artifact.PrefetchRun;
import com.libragraph.triage.types.ArtifactType;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns timestamped artifacts into an {@link ActivityGraph}. Relations are
 * chained: each node links to the previous node sharing the relation, which
 * keeps the edge count linear in the number of activities.
 */
public class ActivityGraphBuilder {

    /** Business day is [06:00, 22:00) UTC. */
    static final int DAY_START_HOUR = 6;
    static final int DAY_END_HOUR = 22;

    /** Failed logons within one temporal window that make a burst. */
    static final int BURST_SIZE = 3;

    /** Types whose timestamp is a date rather than a moment. */
    private static final Set<ArtifactType> DATE_ONLY = EnumSet.of(ArtifactType.INSTALLED_PROGRAM);

    private final Duration temporalWindow;
    private final Duration sessionWindow;

    public ActivityGraphBuilder(AnomalySettings settings) {
        this.temporalWindow = settings.temporalWindow();
        this.sessionWindow = settings.sessionWindow();
    }

    /**
     * Builds the graph. Artifacts without a timestamp are ignored; the rest
     * are ordered by timestamp, keeping the input order among equal times.
     */
    public ActivityGraph build(List<Artifact> artifacts) {
        List<Artifact> timed = new ArrayList<>();
        for (Artifact a : artifacts) {
            if (a.timestamp() != null) timed.add(a);
        }
        timed.sort(Comparator.comparing(Artifact::timestamp));

        boolean[] bursts = logonBursts(timed);
        List<ActivityNode> nodes = new ArrayList<>(timed.size());
        for (int i = 0; i < timed.size(); i++) {
            nodes.add(node(i, timed.get(i), bursts[i]));
        }

        List<ActivityEdge> edges = new ArrayList<>();
        for (int i = 1; i < nodes.size(); i++) {
            if (within(nodes.get(i - 1), nodes.get(i), temporalWindow)) {
                edges.add(new ActivityEdge(i - 1, i, EdgeType.TEMPORAL));
            }
        }
        chain(nodes, ActivityNode::profile, EdgeType.SAME_SESSION, sessionWindow, edges);
        chain(nodes, ActivityNode::sourcePath, EdgeType.SAME_SOURCE, null, edges);
        chain(nodes, ActivityNode::identity, EdgeType.SAME_IDENTITY, null, edges);
        return new ActivityGraph(nodes, edges, temporalWindow);
    }

    private ActivityNode node(int index, Artifact a, boolean burst) {
        ZonedDateTime at = a.timestamp().atZone(ZoneOffset.UTC);
        int hour = at.getHour();
        boolean weekend = at.getDayOfWeek() == DayOfWeek.SATURDAY || at.getDayOfWeek() == DayOfWeek.SUNDAY;
        ArtifactPayload payload = a.payload();
        Set<IndicatorCategory> indicators = EnumSet.noneOf(IndicatorCategory.class);

        if (!DATE_ONLY.contains(a.type())) {
            if (hour < DAY_START_HOUR || hour >= DAY_END_HOUR) indicators.add(IndicatorCategory.OFF_HOURS);
            if (weekend) indicators.add(IndicatorCategory.WEEKEND);
        }
        switch (a.type()) {
            case USB_DEVICE -> indicators.add(IndicatorCategory.USB_ACTIVITY);
            case DELETED_FILE -> indicators.add(IndicatorCategory.FILE_DELETION);
            case RUN_KEY -> indicators.add(IndicatorCategory.PERSISTENCE);
            default -> { }
        }
        if (payload instanceof EventLogEntry event) {
            if (event.failedLogon()) indicators.add(IndicatorCategory.LOGON_FAILURE);
            if (event.explicitLogon()) indicators.add(IndicatorCategory.EXPLICIT_LOGON);
            if (event.logCleared()) indicators.add(IndicatorCategory.LOG_CLEARED);
        }
        if (burst) indicators.add(IndicatorCategory.LOGON_BURST);
        if (payload instanceof BrowserDownload download && download.executable()) {
            indicators.add(IndicatorCategory.EXECUTABLE_DOWNLOAD);
        }
        if (rarelyRun(payload)) indicators.add(IndicatorCategory.RARE_PROGRAM);

        return new ActivityNode(index, a.id() == null ? -1 : a.id(), a.type(), a.type().category(), a.timestamp(),
                hour, weekend, payload.profile(), payload.identity(), a.sourcePath(), a.description(), payload,
                indicators);
    }

    private static boolean rarelyRun(ArtifactPayload payload) {
        if (payload instanceof PrefetchRun run) return run.runCount() == 1;
        if (payload instanceof ExecutionCount count) return count.runCount() == 1;
        return false;
    }

    /** Marks failed logons that have at least {@link #BURST_SIZE} failures within the window around them. */
    private boolean[] logonBursts(List<Artifact> timed) {
        boolean[] burst = new boolean[timed.size()];
        List<Integer> failures = new ArrayList<>();
        for (int i = 0; i < timed.size(); i++) {
            if (timed.get(i).payload() instanceof EventLogEntry e && e.failedLogon()) failures.add(i);
        }
        int lo = 0;
        int hi = 0;
        for (int k = 0; k < failures.size(); k++) {
            Instant t = timed.get(failures.get(k)).timestamp();
            while (timed.get(failures.get(lo)).timestamp().isBefore(t.minus(temporalWindow))) lo++;
            if (hi < k) hi = k;
            while (hi + 1 < failures.size()
                    && !timed.get(failures.get(hi + 1)).timestamp().isAfter(t.plus(temporalWindow))) hi++;
            if (hi - lo + 1 >= BURST_SIZE) burst[failures.get(k)] = true;
        }
        return burst;
    }

    private static void chain(List<ActivityNode> nodes, Function<ActivityNode, String> key, EdgeType type,
                              Duration window, List<ActivityEdge> edges) {
        Map<String, Integer> last = new HashMap<>();
        for (ActivityNode node : nodes) {
            String k = key.apply(node);
            if (k == null || k.isBlank()) continue;
            Integer previous = last.put(k, node.index());
            if (previous != null && (window == null || within(nodes.get(previous), node, window))) {
                edges.add(new ActivityEdge(previous, node.index(), type));
            }
        }
    }

    private static boolean within(ActivityNode earlier, ActivityNode later, Duration window) {
        return Duration.between(earlier.timestamp(), later.timestamp()).compareTo(window) <= 0;
    }
}
