package org.calista.clausegraph.solve.decision;

import org.calista.clausegraph.graph.NodeCandidate;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;
import org.calista.clausegraph.solve.Scored;

import java.util.List;
import java.util.Objects;

/**
 * Outcome for one token: either a selected candidate with status accepted/review, or an
 * abstention with no candidate. The factories are the only way to build one, so an abstain
 * decision can never carry a selection and a selection can never be abstain.
 */
public final class TokenDecision {

    public final String tokenId;

    /** Null exactly when {@link #status} is {@link ParseStatus#ABSTAIN}. */
    public final NodeCandidate selected;

    public final ParseStatus status;

    /** Ordered set (sorted by code). Empty for accepted decisions. */
    public final List<ReasonCode> reasonCodes;

    public final double marginAbs;

    /** Score of the top-ranked candidate, recorded for abstentions as well. */
    public final double confidenceScore;

    /** Top-2 ranked candidates with their scores, in rank order. */
    public final List<Scored<NodeCandidate>> alternatives;

    private TokenDecision(String tokenId,
                          NodeCandidate selected,
                          ParseStatus status,
                          List<ReasonCode> reasonCodes,
                          double marginAbs,
                          double confidenceScore,
                          List<Scored<NodeCandidate>> alternatives) {
        this.tokenId = Objects.requireNonNull(tokenId, "tokenId");
        this.selected = selected;
        this.status = Objects.requireNonNull(status, "status");
        this.reasonCodes = ReasonCode.orderedSet(reasonCodes);
        this.marginAbs = marginAbs;
        this.confidenceScore = confidenceScore;
        this.alternatives = List.copyOf(alternatives);
    }

    public static TokenDecision accepted(String tokenId, NodeCandidate selected, double marginAbs,
                                         double confidenceScore, List<Scored<NodeCandidate>> alternatives) {
        Objects.requireNonNull(selected, "selected");
        return new TokenDecision(tokenId, selected, ParseStatus.ACCEPTED, List.of(), marginAbs, confidenceScore, alternatives);
    }

    public static TokenDecision review(String tokenId, NodeCandidate selected, ReasonCode reason, double marginAbs,
                                       double confidenceScore, List<Scored<NodeCandidate>> alternatives) {
        Objects.requireNonNull(selected, "selected");
        Objects.requireNonNull(reason, "reason");
        return new TokenDecision(tokenId, selected, ParseStatus.REVIEW, List.of(reason), marginAbs, confidenceScore, alternatives);
    }

    public static TokenDecision abstain(String tokenId, List<ReasonCode> reasons, double marginAbs,
                                        double confidenceScore, List<Scored<NodeCandidate>> alternatives) {
        if (reasons == null || reasons.isEmpty()) {
            throw new IllegalArgumentException("abstain decision must include reason codes (token " + tokenId + ")");
        }
        return new TokenDecision(tokenId, null, ParseStatus.ABSTAIN, reasons, marginAbs, confidenceScore, alternatives);
    }

    public boolean hasSelection() {
        return selected != null;
    }

    public boolean isSelected(String nodeCandidateId) {
        return selected != null && selected.nodeCandidateId.equals(nodeCandidateId);
    }

    @Override
    public String toString() {
        return "TokenDecision{" + tokenId + " " + status.code()
                + (selected == null ? "" : " -> " + selected.nodeCandidateId)
                + " margin=" + marginAbs + " reasons=" + reasonCodes + "}";
    }
}
