package org.calista.clausegraph;

import org.calista.clausegraph.graph.CandidateGraph;
import org.calista.clausegraph.graph.FeatureKeys;
import org.calista.clausegraph.graph.FeatureVector;
import org.calista.clausegraph.graph.LevelType;
import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.graph.ParentEdgeCandidate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-built candidate graphs with known scores under the default linear model.
 *
 * anchor + line_start at depth 1 scores 0.70, at depth 2 0.63; a lone candidate is therefore
 * accepted with margin 0.30.
 */
public final class GraphFixtures {

    private GraphFixtures() {}

    public static FeatureVector features(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return FeatureVector.of(m);
    }

    public static FeatureVector anchoredLineStart() {
        return features(FeatureKeys.ANCHOR, true, FeatureKeys.LINE_START, true);
    }

    /** Anchored line-start candidate: 0.70 at depth 1, 0.63 at depth 2. */
    public static NodeCandidate strong(String id, String tokenId, int tokenIndex, String label, int depth, int start) {
        return NodeCandidate.builder(id, tokenId)
                .tokenIndex(tokenIndex)
                .label(label)
                .rawLabel("(" + label + ")")
                .levelType(depth == 1 ? LevelType.ALPHA : LevelType.ROMAN)
                .depthHint(depth)
                .span(start, start + label.length() + 2)
                .features(anchoredLineStart())
                .build();
    }

    /** Featureless depth-2 candidate: scores 0.08, below the minimum top-1 score. */
    public static NodeCandidate weak(String id, String tokenId, int tokenIndex, String label, int start) {
        return NodeCandidate.builder(id, tokenId)
                .tokenIndex(tokenIndex)
                .label(label)
                .levelType(LevelType.ALPHA)
                .depthHint(2)
                .span(start, start + label.length() + 2)
                .build();
    }

    public static NodeCandidate candidate(String id, String tokenId, int tokenIndex, String label, int depth,
                                          int start, FeatureVector f) {
        return NodeCandidate.builder(id, tokenId)
                .tokenIndex(tokenIndex)
                .label(label)
                .levelType(LevelType.ALPHA)
                .depthHint(depth)
                .span(start, start + label.length() + 2)
                .features(f)
                .build();
    }

    public static ParentEdgeCandidate root(String edgeId, String child, double score) {
        return ParentEdgeCandidate.toRoot(edgeId, child, Map.of("layout", score));
    }

    public static ParentEdgeCandidate parent(String edgeId, String child, String parent, double score) {
        return ParentEdgeCandidate.toParent(edgeId, child, parent, Map.of("layout", score), Map.of());
    }

    /**
     * Four-token section "(a) (i) (ii) (b)":
     * <ul>
     *   <li>t1 a1 root, 0.70</li>
     *   <li>t2 i1 (0.63, child of a1) competing with i_alpha (0.35, root reading)</li>
     *   <li>t3 ii1 (0.63, child of a1)</li>
     *   <li>t4 b1 root, 0.70</li>
     * </ul>
     * Edge total 1.8, node total 2.66, every token accepted.
     */
    public static CandidateGraph simpleSection() {
        NodeCandidate a1 = strong("a1", "t1", 0, "a", 1, 0);
        NodeCandidate i1 = strong("i1", "t2", 1, "i", 2, 10);
        NodeCandidate iAlpha = candidate("i_alpha", "t2", 1, "i", 1, 10,
                features(FeatureKeys.LINE_START, true));
        NodeCandidate ii1 = strong("ii1", "t3", 2, "ii", 2, 20);
        NodeCandidate b1 = strong("b1", "t4", 3, "b", 1, 30);

        List<ParentEdgeCandidate> edges = List.of(
                root("e_a_root", "a1", 0.4),
                parent("e_i_a", "i1", "a1", 0.5),
                root("e_i_root", "i1", 0.1),
                root("e_ialpha_root", "i_alpha", 0.9),
                ParentEdgeCandidate.toParent("e_ii_a", "ii1", "a1",
                        Map.of("layout", 0.5, "sequence", 0.1), Map.of("gap", 0.1)),
                root("e_b_root", "b1", 0.4)
        );
        return new CandidateGraph(List.of(a1, i1, iAlpha, ii1, b1), edges);
    }
}
