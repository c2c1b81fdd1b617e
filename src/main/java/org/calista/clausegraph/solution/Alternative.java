package org.calista.clausegraph.solution;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;

/**
 * One of the top-2 ranked interpretations of a token, as reported in the flattened alternatives.
 */
@JsonPropertyOrder({"token_id", "rank", "node_candidate_id", "score", "selected"})
public final class Alternative {

    /** Report order: token id, then rank, then candidate id. */
    public static final Comparator<Alternative> REPORT_ORDER =
            Comparator.<Alternative, String>comparing(a -> a.tokenId)
                    .thenComparingInt(a -> a.rank)
                    .thenComparing(a -> a.nodeCandidateId);

    @JsonProperty("token_id")
    public final String tokenId;

    /** 1-based. */
    @JsonProperty("rank")
    public final int rank;

    @JsonProperty("node_candidate_id")
    public final String nodeCandidateId;

    @JsonProperty("score")
    public final double score;

    @JsonProperty("selected")
    public final boolean selected;

    public Alternative(String tokenId, int rank, String nodeCandidateId, double score, boolean selected) {
        this.tokenId = tokenId;
        this.rank = rank;
        this.nodeCandidateId = nodeCandidateId;
        this.score = score;
        this.selected = selected;
    }

    @Override
    public String toString() {
        return "Alternative{" + tokenId + "#" + rank + " " + nodeCandidateId + "=" + score + (selected ? " *" : "") + "}";
    }
}
