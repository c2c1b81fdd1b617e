package org.calista.clausegraph.solve.edge;

import org.calista.clausegraph.graph.ParentEdgeCandidate;

import java.util.List;

/**
 * Selected edges in resolution order, parent-conflict warnings and the summed edge score.
 */
public final class EdgeResolution {

    public final List<ParentEdgeCandidate> selectedEdges;
    public final List<String> warnings;
    public final double edgeScoreTotal;

    public EdgeResolution(List<ParentEdgeCandidate> selectedEdges, List<String> warnings, double edgeScoreTotal) {
        this.selectedEdges = List.copyOf(selectedEdges);
        this.warnings = List.copyOf(warnings);
        this.edgeScoreTotal = edgeScoreTotal;
    }

    public boolean hasConflicts() {
        return !warnings.isEmpty();
    }
}
