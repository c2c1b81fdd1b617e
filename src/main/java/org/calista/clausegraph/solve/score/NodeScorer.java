package org.calista.clausegraph.solve.score;

import org.calista.clausegraph.graph.NodeCandidate;

/**
 * Scores how plausible a node candidate is as a real clause start.
 *
 * Implementations must be deterministic and pure: the same candidate always yields the same
 * score, which is expected to lie in [0, 1] and be rounded to six decimals.
 */
public interface NodeScorer {
    double score(NodeCandidate candidate);
}
