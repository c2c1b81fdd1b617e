package org.calista.clausegraph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Build statistics reported by the graph producer. Carried through unchanged; the solver does
 * not interpret them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"graph_stats", "pruned_edges_by_reason", "ambiguous_tokens", "construction_warnings"})
public final class GraphDiagnostics {

    private static final GraphDiagnostics EMPTY = new GraphDiagnostics(null, null, null, null);

    @JsonProperty("graph_stats")
    public final Map<String, Integer> graphStats;

    @JsonProperty("pruned_edges_by_reason")
    public final Map<String, Integer> prunedEdgesByReason;

    @JsonProperty("ambiguous_tokens")
    public final List<String> ambiguousTokens;

    @JsonProperty("construction_warnings")
    public final List<String> constructionWarnings;

    @JsonCreator
    public GraphDiagnostics(@JsonProperty("graph_stats") Map<String, Integer> graphStats,
                            @JsonProperty("pruned_edges_by_reason") Map<String, Integer> prunedEdgesByReason,
                            @JsonProperty("ambiguous_tokens") List<String> ambiguousTokens,
                            @JsonProperty("construction_warnings") List<String> constructionWarnings) {
        this.graphStats = sorted(graphStats);
        this.prunedEdgesByReason = sorted(prunedEdgesByReason);
        this.ambiguousTokens = ambiguousTokens == null ? List.of() : List.copyOf(ambiguousTokens);
        this.constructionWarnings = constructionWarnings == null ? List.of() : List.copyOf(constructionWarnings);
    }

    public static GraphDiagnostics empty() {
        return EMPTY;
    }

    private static Map<String, Integer> sorted(Map<String, Integer> m) {
        if (m == null || m.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new TreeMap<>(m));
    }
}
