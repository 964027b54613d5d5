package com.libragraph.triage.core.anomaly;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Activities of a case and the relations between them. Immutable once built.
 */
public final class ActivityGraph {

    private final List<ActivityNode> nodes;
    private final List<ActivityEdge> edges;
    private final List<List<ActivityEdge>> adjacency;
    private final Duration temporalWindow;

    ActivityGraph(List<ActivityNode> nodes, List<ActivityEdge> edges, Duration temporalWindow) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.temporalWindow = temporalWindow;
        List<List<ActivityEdge>> adj = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) adj.add(new ArrayList<>());
        for (ActivityEdge e : edges) {
            adj.get(e.from()).add(e);
            adj.get(e.to()).add(e);
        }
        List<List<ActivityEdge>> frozen = new ArrayList<>(adj.size());
        for (List<ActivityEdge> list : adj) frozen.add(Collections.unmodifiableList(list));
        this.adjacency = Collections.unmodifiableList(frozen);
    }

    public List<ActivityNode> nodes() {
        return nodes;
    }

    public List<ActivityEdge> edges() {
        return edges;
    }

    public ActivityNode node(int index) {
        return nodes.get(index);
    }

    /** Edges touching the node. */
    public List<ActivityEdge> neighbours(int index) {
        return adjacency.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** Window the temporal edges were built with. */
    public Duration temporalWindow() {
        return temporalWindow;
    }

    public Map<EdgeType, Integer> edgeCounts() {
        Map<EdgeType, Integer> counts = new EnumMap<>(EdgeType.class);
        for (EdgeType t : EdgeType.values()) counts.put(t, 0);
        for (ActivityEdge e : edges) counts.merge(e.type(), 1, Integer::sum);
        return counts;
    }
}
