package org.calista.clausegraph.solve.decision;

import org.calista.clausegraph.graph.NodeCandidate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one decision pass: decisions in token processing order plus solver warnings.
 */
public final class TokenDecisions {

    public final List<TokenDecision> decisions;
    public final List<String> warnings;

    public TokenDecisions(List<TokenDecision> decisions, List<String> warnings) {
        this.decisions = List.copyOf(decisions);
        this.warnings = List.copyOf(warnings);
    }

    /** Selected candidates keyed by candidate id, in token processing order. */
    public Map<String, NodeCandidate> selectedCandidates() {
        LinkedHashMap<String, NodeCandidate> out = new LinkedHashMap<>();
        for (TokenDecision d : decisions) {
            if (d.hasSelection()) out.put(d.selected.nodeCandidateId, d.selected);
        }
        return out;
    }

    public Map<String, TokenDecision> byTokenId() {
        LinkedHashMap<String, TokenDecision> out = new LinkedHashMap<>();
        for (TokenDecision d : decisions) out.put(d.tokenId, d);
        return out;
    }
}
