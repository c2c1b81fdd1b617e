package org.calista.clausegraph.solution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;

import java.util.List;
import java.util.Objects;

/**
 * SolverSolution: the immutable report of one solve call.
 *
 * Holds the selections, the objective and its components, the flattened alternatives,
 * diagnostics, the ordered clause tree and the section-level verdict. A plain value with no side
 * effects; identical input and options always produce an identical solution.
 */
@JsonPropertyOrder({"parse_run_id", "parser_version", "section_key", "selected_node_candidates",
        "selected_parent_edges", "abstained_token_ids", "objective_score", "objective_components",
        "top_k_alternatives", "solver_diagnostics", "nodes", "section_parse_status", "section_reason_codes",
        "critical_node_abstain_ratio", "top1_score", "top2_score", "margin_abs", "margin_ratio"})
public final class SolverSolution {

    @JsonProperty("parse_run_id")
    public final String parseRunId;

    @JsonProperty("parser_version")
    public final String parserVersion;

    @JsonProperty("section_key")
    public final String sectionKey;

    /** Sorted. */
    @JsonProperty("selected_node_candidates")
    public final List<String> selectedNodeCandidates;

    /** Sorted. */
    @JsonProperty("selected_parent_edges")
    public final List<String> selectedParentEdges;

    /** Sorted. */
    @JsonProperty("abstained_token_ids")
    public final List<String> abstainedTokenIds;

    @JsonProperty("objective_score")
    public final double objectiveScore;

    @JsonProperty("objective_components")
    public final ObjectiveComponents objectiveComponents;

    @JsonProperty("top_k_alternatives")
    public final List<Alternative> topKAlternatives;

    @JsonProperty("solver_diagnostics")
    public final SolverDiagnostics solverDiagnostics;

    /** Sorted by (span_start, clause_id). */
    @JsonProperty("nodes")
    public final List<SolvedClauseNode> nodes;

    @JsonProperty("section_parse_status")
    public final ParseStatus sectionParseStatus;

    @JsonProperty("section_reason_codes")
    public final List<ReasonCode> sectionReasonCodes;

    @JsonProperty("critical_node_abstain_ratio")
    public final double criticalNodeAbstainRatio;

    @JsonProperty("top1_score")
    public final double top1Score;

    @JsonProperty("top2_score")
    public final double top2Score;

    @JsonProperty("margin_abs")
    public final double marginAbs;

    @JsonProperty("margin_ratio")
    public final double marginRatio;

    private SolverSolution(Builder b) {
        this.parseRunId = Objects.requireNonNull(b.parseRunId, "parseRunId");
        this.parserVersion = Objects.requireNonNull(b.parserVersion, "parserVersion");
        this.sectionKey = Objects.requireNonNull(b.sectionKey, "sectionKey");
        this.selectedNodeCandidates = List.copyOf(b.selectedNodeCandidates);
        this.selectedParentEdges = List.copyOf(b.selectedParentEdges);
        this.abstainedTokenIds = List.copyOf(b.abstainedTokenIds);
        this.objectiveScore = b.objectiveScore;
        this.objectiveComponents = Objects.requireNonNull(b.objectiveComponents, "objectiveComponents");
        this.topKAlternatives = List.copyOf(b.topKAlternatives);
        this.solverDiagnostics = Objects.requireNonNull(b.solverDiagnostics, "solverDiagnostics");
        this.nodes = List.copyOf(b.nodes);
        this.sectionParseStatus = Objects.requireNonNull(b.sectionParseStatus, "sectionParseStatus");
        this.sectionReasonCodes = ReasonCode.orderedSet(b.sectionReasonCodes);
        this.criticalNodeAbstainRatio = b.criticalNodeAbstainRatio;
        this.top1Score = b.top1Score;
        this.top2Score = b.top2Score;
        this.marginAbs = b.marginAbs;
        this.marginRatio = b.marginRatio;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public List<String> clauseIds() {
        return nodes.stream().map(n -> n.clauseId).toList();
    }

    public static final class Builder {
        private String parseRunId;
        private String parserVersion;
        private String sectionKey;
        private List<String> selectedNodeCandidates = List.of();
        private List<String> selectedParentEdges = List.of();
        private List<String> abstainedTokenIds = List.of();
        private double objectiveScore;
        private ObjectiveComponents objectiveComponents;
        private List<Alternative> topKAlternatives = List.of();
        private SolverDiagnostics solverDiagnostics;
        private List<SolvedClauseNode> nodes = List.of();
        private ParseStatus sectionParseStatus;
        private List<ReasonCode> sectionReasonCodes = List.of();
        private double criticalNodeAbstainRatio;
        private double top1Score;
        private double top2Score;
        private double marginAbs;
        private double marginRatio;

        private Builder() {}

        public Builder parseRunId(String v) { this.parseRunId = v; return this; }

        public Builder parserVersion(String v) { this.parserVersion = v; return this; }

        public Builder sectionKey(String v) { this.sectionKey = v; return this; }

        public Builder selectedNodeCandidates(List<String> v) { this.selectedNodeCandidates = v; return this; }

        public Builder selectedParentEdges(List<String> v) { this.selectedParentEdges = v; return this; }

        public Builder abstainedTokenIds(List<String> v) { this.abstainedTokenIds = v; return this; }

        public Builder objectiveScore(double v) { this.objectiveScore = v; return this; }

        public Builder objectiveComponents(ObjectiveComponents v) { this.objectiveComponents = v; return this; }

        public Builder topKAlternatives(List<Alternative> v) { this.topKAlternatives = v; return this; }

        public Builder solverDiagnostics(SolverDiagnostics v) { this.solverDiagnostics = v; return this; }

        public Builder nodes(List<SolvedClauseNode> v) { this.nodes = v; return this; }

        public Builder sectionParseStatus(ParseStatus v) { this.sectionParseStatus = v; return this; }

        public Builder sectionReasonCodes(List<ReasonCode> v) { this.sectionReasonCodes = v; return this; }

        public Builder criticalNodeAbstainRatio(double v) { this.criticalNodeAbstainRatio = v; return this; }

        public Builder top1Score(double v) { this.top1Score = v; return this; }

        public Builder top2Score(double v) { this.top2Score = v; return this; }

        public Builder marginAbs(double v) { this.marginAbs = v; return this; }

        public Builder marginRatio(double v) { this.marginRatio = v; return this; }

        public SolverSolution build() {
            return new SolverSolution(this);
        }
    }

    @Override
    public String toString() {
        return "SolverSolution{" + parseRunId + " section=" + sectionKey + " status=" + sectionParseStatus.code()
                + " nodes=" + nodes.size() + " abstained=" + abstainedTokenIds.size()
                + " objective=" + objectiveScore + "}";
    }
}
