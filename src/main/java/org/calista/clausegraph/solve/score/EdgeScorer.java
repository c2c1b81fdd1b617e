package org.calista.clausegraph.solve.score;

import org.calista.clausegraph.graph.ParentEdgeCandidate;

/**
 * Scores a parent-edge candidate. Unbounded: positive signals raise it, penalties lower it.
 */
public interface EdgeScorer {
    double score(ParentEdgeCandidate edge);
}
