package org.calista.clausegraph.adapter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.solve.ReasonCode;

import java.util.List;

/**
 * Section-level link payload: solver verdict plus the legacy clause rows.
 */
@JsonPropertyOrder({"parse_run_id", "parser_version", "section_key", "section_parse_status",
        "section_reason_codes", "critical_node_abstain_ratio", "abstained_token_ids", "nodes"})
public final class LinkPayload {

    @JsonProperty("parse_run_id")
    public final String parseRunId;

    @JsonProperty("parser_version")
    public final String parserVersion;

    @JsonProperty("section_key")
    public final String sectionKey;

    @JsonProperty("section_parse_status")
    public final ParseStatus sectionParseStatus;

    @JsonProperty("section_reason_codes")
    public final List<ReasonCode> sectionReasonCodes;

    @JsonProperty("critical_node_abstain_ratio")
    public final double criticalNodeAbstainRatio;

    @JsonProperty("abstained_token_ids")
    public final List<String> abstainedTokenIds;

    @JsonProperty("nodes")
    public final List<LegacyClauseRow> nodes;

    LinkPayload(String parseRunId, String parserVersion, String sectionKey, ParseStatus sectionParseStatus,
                List<ReasonCode> sectionReasonCodes, double criticalNodeAbstainRatio,
                List<String> abstainedTokenIds, List<LegacyClauseRow> nodes) {
        this.parseRunId = parseRunId;
        this.parserVersion = parserVersion;
        this.sectionKey = sectionKey;
        this.sectionParseStatus = sectionParseStatus;
        this.sectionReasonCodes = List.copyOf(sectionReasonCodes);
        this.criticalNodeAbstainRatio = criticalNodeAbstainRatio;
        this.abstainedTokenIds = List.copyOf(abstainedTokenIds);
        this.nodes = List.copyOf(nodes);
    }
}
