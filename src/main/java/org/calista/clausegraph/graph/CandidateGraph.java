package org.calista.clausegraph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * CandidateGraph: every node candidate and parent-edge candidate for one section of text.
 *
 * Immutable. Built once per section by the upstream graph producer and read by the solver.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"node_candidates", "parent_edge_candidates", "diagnostics"})
public final class CandidateGraph {

    private static final CandidateGraph EMPTY = new CandidateGraph(List.of(), List.of(), GraphDiagnostics.empty());

    @JsonProperty("node_candidates")
    public final List<NodeCandidate> nodeCandidates;

    @JsonProperty("parent_edge_candidates")
    public final List<ParentEdgeCandidate> parentEdgeCandidates;

    @JsonProperty("diagnostics")
    public final GraphDiagnostics diagnostics;

    @JsonCreator
    public CandidateGraph(@JsonProperty("node_candidates") List<NodeCandidate> nodeCandidates,
                          @JsonProperty("parent_edge_candidates") List<ParentEdgeCandidate> parentEdgeCandidates,
                          @JsonProperty("diagnostics") GraphDiagnostics diagnostics) {
        this.nodeCandidates = nodeCandidates == null ? List.of() : List.copyOf(nodeCandidates);
        this.parentEdgeCandidates = parentEdgeCandidates == null ? List.of() : List.copyOf(parentEdgeCandidates);
        this.diagnostics = diagnostics == null ? GraphDiagnostics.empty() : diagnostics;
    }

    public CandidateGraph(List<NodeCandidate> nodeCandidates, List<ParentEdgeCandidate> parentEdgeCandidates) {
        this(nodeCandidates, parentEdgeCandidates, GraphDiagnostics.empty());
    }

    public static CandidateGraph empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodeCandidates.isEmpty();
    }

    @Override
    public String toString() {
        return "CandidateGraph{nodes=" + nodeCandidates.size() + ", edges=" + parentEdgeCandidates.size() + "}";
    }
}
