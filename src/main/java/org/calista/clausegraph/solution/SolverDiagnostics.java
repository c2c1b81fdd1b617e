package org.calista.clausegraph.solution;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Solver-wide counts and warnings. Contains no timing so that repeated solves serialize identically.
 */
@JsonPropertyOrder({"input_node_candidates", "input_edge_candidates", "selected_nodes", "selected_edges", "warnings"})
public final class SolverDiagnostics {

    @JsonProperty("input_node_candidates")
    public final int inputNodeCandidates;

    @JsonProperty("input_edge_candidates")
    public final int inputEdgeCandidates;

    @JsonProperty("selected_nodes")
    public final int selectedNodes;

    @JsonProperty("selected_edges")
    public final int selectedEdges;

    /** Sorted and de-duplicated. */
    @JsonProperty("warnings")
    public final List<String> warnings;

    public SolverDiagnostics(int inputNodeCandidates, int inputEdgeCandidates, int selectedNodes,
                             int selectedEdges, List<String> warnings) {
        this.inputNodeCandidates = inputNodeCandidates;
        this.inputEdgeCandidates = inputEdgeCandidates;
        this.selectedNodes = selectedNodes;
        this.selectedEdges = selectedEdges;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
