package org.calista.clausegraph.solution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.clausegraph.graph.LevelType;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;

import java.util.List;
import java.util.Objects;

/**
 * One node of the solved clause tree.
 */
@JsonPropertyOrder({"node_candidate_id", "clause_id", "parent_id", "depth", "level_type", "span_start", "span_end",
        "is_structural_candidate", "xref_suspected", "parse_status", "abstain_reason_codes", "solver_margin",
        "confidence_score"})
public final class SolvedClauseNode {

    @JsonProperty("node_candidate_id")
    public final String nodeCandidateId;

    /** Dotted path, unique within the section, e.g. "a.iv_2". */
    @JsonProperty("clause_id")
    public final String clauseId;

    /** Clause id of the parent; empty for roots. */
    @JsonProperty("parent_id")
    public final String parentId;

    @JsonProperty("depth")
    public final int depth;

    @JsonProperty("level_type")
    public final LevelType levelType;

    @JsonProperty("span_start")
    public final int spanStart;

    @JsonProperty("span_end")
    public final int spanEnd;

    @JsonProperty("is_structural_candidate")
    public final boolean structuralCandidate;

    @JsonProperty("xref_suspected")
    public final boolean xrefSuspected;

    @JsonProperty("parse_status")
    public final ParseStatus parseStatus;

    /** Empty unless the node is not accepted. */
    @JsonProperty("abstain_reason_codes")
    public final List<ReasonCode> abstainReasonCodes;

    @JsonProperty("solver_margin")
    public final double solverMargin;

    @JsonProperty("confidence_score")
    public final double confidenceScore;

    public SolvedClauseNode(String nodeCandidateId,
                            String clauseId,
                            String parentId,
                            int depth,
                            LevelType levelType,
                            int spanStart,
                            int spanEnd,
                            boolean structuralCandidate,
                            boolean xrefSuspected,
                            ParseStatus parseStatus,
                            List<ReasonCode> abstainReasonCodes,
                            double solverMargin,
                            double confidenceScore) {
        this.nodeCandidateId = Objects.requireNonNull(nodeCandidateId, "nodeCandidateId");
        this.clauseId = Objects.requireNonNull(clauseId, "clauseId");
        this.parentId = parentId == null ? "" : parentId;
        this.depth = depth;
        this.levelType = Objects.requireNonNull(levelType, "levelType");
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.structuralCandidate = structuralCandidate;
        this.xrefSuspected = xrefSuspected;
        this.parseStatus = Objects.requireNonNull(parseStatus, "parseStatus");
        this.abstainReasonCodes = ReasonCode.orderedSet(abstainReasonCodes);
        this.solverMargin = solverMargin;
        this.confidenceScore = confidenceScore;

        if (spanStart < 0) throw new IllegalArgumentException("span_start must be >= 0");
        if (spanEnd <= spanStart) throw new IllegalArgumentException("span_end must be > span_start");
        if (depth <= 0) throw new IllegalArgumentException("depth must be > 0");
        if (parseStatus == ParseStatus.ABSTAIN && this.abstainReasonCodes.isEmpty()) {
            throw new IllegalArgumentException("abstain node must include reason codes");
        }
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId.isEmpty();
    }

    @Override
    public String toString() {
        return "SolvedClauseNode{" + clauseId + " <- " + nodeCandidateId + ", depth=" + depth
                + ", " + parseStatus.code() + "}";
    }
}
