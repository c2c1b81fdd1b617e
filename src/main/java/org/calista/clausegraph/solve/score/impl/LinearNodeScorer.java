package org.calista.clausegraph.solve.score.impl;

import org.calista.clausegraph.graph.FeatureKeys;
import org.calista.clausegraph.graph.FeatureVector;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.solve.score.NodeScorer;
import org.calista.clausegraph.util.Scores;

/**
 * Fixed linear node model:
 *
 * <pre>
 * score = 0.35*anchor + 0.20*line_start + 0.10*indentation
 *       + (0.15 if depth_hint == 1 else 0.08)
 *       - 0.12*xref_keyword_pre - 0.20*xref_preposition_pre
 * </pre>
 *
 * clamped to [0, 1]. The weights are hand-authored and must stay bit-compatible with persisted
 * solutions, including the asymmetric depth bonus.
 */
public final class LinearNodeScorer implements NodeScorer {

    public static final double W_ANCHOR = 0.35;
    public static final double W_LINE_START = 0.20;
    public static final double W_INDENTATION = 0.10;
    public static final double ROOT_DEPTH_BONUS = 0.15;
    public static final double NESTED_DEPTH_BONUS = 0.08;
    public static final double XREF_KEYWORD_PENALTY = 0.12;
    public static final double XREF_PREPOSITION_PENALTY = 0.20;

    @Override
    public double score(NodeCandidate candidate) {
        FeatureVector f = candidate.featureVector;

        double anchor = f.flag(FeatureKeys.ANCHOR) ? W_ANCHOR : 0.0;
        double lineStart = f.flag(FeatureKeys.LINE_START) ? W_LINE_START : 0.0;
        double indentation = W_INDENTATION * f.number(FeatureKeys.INDENTATION);
        double depthBias = candidate.depthHint == 1 ? ROOT_DEPTH_BONUS : NESTED_DEPTH_BONUS;
        double keywordPenalty = f.flag(FeatureKeys.XREF_KEYWORD_PRE) ? XREF_KEYWORD_PENALTY : 0.0;
        double prepositionPenalty = f.flag(FeatureKeys.XREF_PREPOSITION_PRE) ? XREF_PREPOSITION_PENALTY : 0.0;

        double raw = anchor + lineStart + depthBias + indentation - keywordPenalty - prepositionPenalty;
        return Scores.round6(Scores.clamp01(raw));
    }
}
