package com.libragraph.triage.core.anomaly;

/** Undirected relation between two nodes, by index. */
public record ActivityEdge(int from, int to, EdgeType type) {

    public int other(int node) {
        return node == from ? to : from;
    }
}
