package com.libragraph.triage.core.anomaly;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Heuristic priors refined by attention over graph neighbours.
 * <p>
 * A node's prior combines the weights of its indicator categories as
 * independent evidence on top of a base rate. Each propagation layer then
 * mixes a node's prior with the attention-weighted states of its
 * neighbours; attention favours strong relation types and neighbours of the
 * same artifact type. Confidence is the share of nodes whose propagated
 * label (anomalous or not) agrees with their prior label.
 */
@ApplicationScoped
public class GraphAttentionScorer implements AnomalyScorer {

    private static final Logger log = Logger.getLogger(GraphAttentionScorer.class);

    static final String NAME = "graph-attention-v1";
    static final double BASE_RATE = 0.05;
    static final int LAYERS = 2;
    /** Share of a node's state taken from its neighbours. */
    static final double NEIGHBOUR_SHARE = 0.35;
    static final double SAME_TYPE_BONUS = 1.5;

    @ConfigProperty(name = "triage.anomaly.severity-threshold", defaultValue = "0.7")
    double severityThreshold;

    public GraphAttentionScorer() {
    }

    public GraphAttentionScorer(double severityThreshold) {
        this.severityThreshold = severityThreshold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ScoringResult score(ActivityGraph graph) {
        int n = graph.size();
        double[] prior = new double[n];
        for (int i = 0; i < n; i++) {
            prior[i] = prior(graph.node(i));
        }

        double[] state = prior.clone();
        for (int layer = 0; layer < LAYERS; layer++) {
            double[] next = new double[n];
            for (int i = 0; i < n; i++) {
                next[i] = propagate(graph, i, prior[i], state);
            }
            state = next;
        }

        List<Double> scores = new ArrayList<>(n);
        int agree = 0;
        for (int i = 0; i < n; i++) {
            double s = Math.min(1.0, Math.max(0.0, state[i]));
            scores.add(s);
            if ((s >= severityThreshold) == (prior[i] >= severityThreshold)) agree++;
        }
        double confidence = n == 0 ? 0.0 : (double) agree / n;
        log.debugf("Scored %d node(s) over %d edge(s), confidence %.3f", n, graph.edges().size(), Double.valueOf(confidence));
        return new ScoringResult(scores, confidence, NAME);
    }

    static double prior(ActivityNode node) {
        double benign = 1.0 - BASE_RATE;
        for (IndicatorCategory c : node.indicators()) {
            benign *= 1.0 - c.weight();
        }
        return 1.0 - benign;
    }

    private static double propagate(ActivityGraph graph, int i, double prior, double[] state) {
        List<ActivityEdge> edges = graph.neighbours(i);
        if (edges.isEmpty()) return prior;
        ActivityNode self = graph.node(i);

        // softmax over edge logits; logits are small and positive, no max shift needed
        double total = 0;
        double weighted = 0;
        for (ActivityEdge e : edges) {
            int j = e.other(i);
            double logit = e.type().weight() * (graph.node(j).type() == self.type() ? SAME_TYPE_BONUS : 1.0);
            double w = Math.exp(logit);
            total += w;
            weighted += w * state[j];
        }
        return (1.0 - NEIGHBOUR_SHARE) * prior + NEIGHBOUR_SHARE * (weighted / total);
    }
}
