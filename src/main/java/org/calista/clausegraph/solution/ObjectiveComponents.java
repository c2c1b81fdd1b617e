package org.calista.clausegraph.solution;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Breakdown of the section objective. Serialized with keys in sorted order.
 */
@JsonPropertyOrder(alphabetic = true)
public final class ObjectiveComponents {

    @JsonProperty("edge_score_total")
    public final double edgeScoreTotal;

    @JsonProperty("margin_abs_avg")
    public final double marginAbsAvg;

    @JsonProperty("node_score_total")
    public final double nodeScoreTotal;

    public ObjectiveComponents(double nodeScoreTotal, double edgeScoreTotal, double marginAbsAvg) {
        this.nodeScoreTotal = nodeScoreTotal;
        this.edgeScoreTotal = edgeScoreTotal;
        this.marginAbsAvg = marginAbsAvg;
    }
}
