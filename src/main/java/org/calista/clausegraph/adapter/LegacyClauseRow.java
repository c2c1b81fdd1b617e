package org.calista.clausegraph.adapter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;

import java.util.List;

/**
 * Clause row in the older linking contract, enriched with solver status fields.
 */
@JsonPropertyOrder({"id", "label", "depth", "level_type", "span_start", "span_end", "header_text", "parent_id",
        "children_ids", "anchor_ok", "run_length_ok", "gap_ok", "indentation_score", "xref_suspected",
        "is_structural_candidate", "parse_confidence", "demotion_reason", "parse_status",
        "abstain_reason_codes", "solver_margin"})
public final class LegacyClauseRow {

    /** Clause id. */
    @JsonProperty("id")
    public final String id;

    @JsonProperty("label")
    public final String label;

    @JsonProperty("depth")
    public final int depth;

    @JsonProperty("level_type")
    public final String levelType;

    /** Document-global offset. */
    @JsonProperty("span_start")
    public final int spanStart;

    /** Document-global offset. */
    @JsonProperty("span_end")
    public final int spanEnd;

    @JsonProperty("header_text")
    public final String headerText;

    @JsonProperty("parent_id")
    public final String parentId;

    @JsonProperty("children_ids")
    public final List<String> childrenIds;

    @JsonProperty("anchor_ok")
    public final boolean anchorOk;

    @JsonProperty("run_length_ok")
    public final boolean runLengthOk;

    @JsonProperty("gap_ok")
    public final boolean gapOk;

    @JsonProperty("indentation_score")
    public final double indentationScore;

    @JsonProperty("xref_suspected")
    public final boolean xrefSuspected;

    @JsonProperty("is_structural_candidate")
    public final boolean structuralCandidate;

    @JsonProperty("parse_confidence")
    public final double parseConfidence;

    @JsonProperty("demotion_reason")
    public final String demotionReason;

    @JsonProperty("parse_status")
    public final ParseStatus parseStatus;

    @JsonProperty("abstain_reason_codes")
    public final List<ReasonCode> abstainReasonCodes;

    @JsonProperty("solver_margin")
    public final double solverMargin;

    LegacyClauseRow(String id, String label, int depth, String levelType, int spanStart, int spanEnd,
                    String headerText, String parentId, List<String> childrenIds, boolean anchorOk,
                    boolean runLengthOk, boolean gapOk, double indentationScore, boolean xrefSuspected,
                    boolean structuralCandidate, double parseConfidence, String demotionReason,
                    ParseStatus parseStatus, List<ReasonCode> abstainReasonCodes, double solverMargin) {
        this.id = id;
        this.label = label;
        this.depth = depth;
        this.levelType = levelType;
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.headerText = headerText;
        this.parentId = parentId;
        this.childrenIds = List.copyOf(childrenIds);
        this.anchorOk = anchorOk;
        this.runLengthOk = runLengthOk;
        this.gapOk = gapOk;
        this.indentationScore = indentationScore;
        this.xrefSuspected = xrefSuspected;
        this.structuralCandidate = structuralCandidate;
        this.parseConfidence = parseConfidence;
        this.demotionReason = demotionReason;
        this.parseStatus = parseStatus;
        this.abstainReasonCodes = List.copyOf(abstainReasonCodes);
        this.solverMargin = solverMargin;
    }
}
