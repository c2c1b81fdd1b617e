package org.calista.clausegraph.solve.score.impl;

import org.calista.clausegraph.graph.ParentEdgeCandidate;
import org.calista.clausegraph.solve.score.EdgeScorer;
import org.calista.clausegraph.util.Scores;

/**
 * Edge score = sum(soft_score_components) - sum(edge_penalties), not clamped.
 */
public final class SoftPenaltyEdgeScorer implements EdgeScorer {

    @Override
    public double score(ParentEdgeCandidate edge) {
        double positive = 0.0;
        for (double v : edge.softScoreComponents.values()) positive += v;

        double penalties = 0.0;
        for (double v : edge.edgePenalties.values()) penalties += v;

        return Scores.round6(positive - penalties);
    }
}
