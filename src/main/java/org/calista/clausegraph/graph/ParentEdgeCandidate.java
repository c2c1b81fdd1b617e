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
 * ParentEdgeCandidate: one proposed parent for one node candidate, or a root marker.
 *
 * An edge can only be selected when {@link #hardValid} is set and, unless it is a root edge, its
 * parent is itself a selected node candidate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"edge_id", "child_candidate_id", "parent_candidate_id", "root", "hard_valid",
        "hard_invalid_reasons", "soft_score_components", "edge_penalties"})
public final class ParentEdgeCandidate {

    @JsonProperty("edge_id")
    public final String edgeId;

    @JsonProperty("child_candidate_id")
    public final String childCandidateId;

    /** Empty for root edges. */
    @JsonProperty("parent_candidate_id")
    public final String parentCandidateId;

    @JsonProperty("root")
    public final boolean root;

    @JsonProperty("hard_valid")
    public final boolean hardValid;

    @JsonProperty("hard_invalid_reasons")
    public final List<String> hardInvalidReasons;

    @JsonProperty("soft_score_components")
    public final Map<String, Double> softScoreComponents;

    @JsonProperty("edge_penalties")
    public final Map<String, Double> edgePenalties;

    @JsonCreator
    public ParentEdgeCandidate(@JsonProperty("edge_id") String edgeId,
                               @JsonProperty("child_candidate_id") String childCandidateId,
                               @JsonProperty("parent_candidate_id") String parentCandidateId,
                               @JsonProperty("root") boolean root,
                               @JsonProperty("hard_valid") boolean hardValid,
                               @JsonProperty("hard_invalid_reasons") List<String> hardInvalidReasons,
                               @JsonProperty("soft_score_components") Map<String, Double> softScoreComponents,
                               @JsonProperty("edge_penalties") Map<String, Double> edgePenalties) {
        this.edgeId = edgeId;
        this.childCandidateId = childCandidateId;
        // root edges ignore whatever parent id the producer left behind
        this.parentCandidateId = (root || parentCandidateId == null) ? "" : parentCandidateId;
        this.root = root;
        this.hardValid = hardValid;
        this.hardInvalidReasons = hardInvalidReasons == null ? List.of() : List.copyOf(hardInvalidReasons);
        this.softScoreComponents = sortedCopy(softScoreComponents, "soft_score_components", edgeId);
        this.edgePenalties = sortedCopy(edgePenalties, "edge_penalties", edgeId);
        validate();
    }

    private void validate() {
        if (edgeId == null || edgeId.isBlank()) throw new IllegalArgumentException("edge_id cannot be empty");
        if (childCandidateId == null || childCandidateId.isBlank()) {
            throw new IllegalArgumentException("child_candidate_id cannot be empty (edge " + edgeId + ")");
        }
        if (!root && parentCandidateId.isBlank()) {
            throw new IllegalArgumentException("non-root edge must carry parent_candidate_id (edge " + edgeId + ")");
        }
        if (hardValid && !hardInvalidReasons.isEmpty()) {
            throw new IllegalArgumentException("hard_valid edge cannot have hard_invalid_reasons (edge " + edgeId + ")");
        }
    }

    private static Map<String, Double> sortedCopy(Map<String, Double> raw, String field, String edgeId) {
        if (raw == null || raw.isEmpty()) return Map.of();
        TreeMap<String, Double> out = new TreeMap<>();
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            Double v = e.getValue();
            if (e.getKey() == null || v == null) continue;
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException(field + "." + e.getKey() + " must be finite (edge " + edgeId + ")");
            }
            out.put(e.getKey(), v);
        }
        return Collections.unmodifiableMap(out);
    }

    public static ParentEdgeCandidate toRoot(String edgeId, String childCandidateId, Map<String, Double> soft) {
        return new ParentEdgeCandidate(edgeId, childCandidateId, "", true, true, List.of(), soft, Map.of());
    }

    public static ParentEdgeCandidate toParent(String edgeId, String childCandidateId, String parentCandidateId,
                                               Map<String, Double> soft, Map<String, Double> penalties) {
        return new ParentEdgeCandidate(edgeId, childCandidateId, parentCandidateId, false, true, List.of(), soft, penalties);
    }

    public static ParentEdgeCandidate invalid(String edgeId, String childCandidateId, String parentCandidateId,
                                              List<String> reasons) {
        boolean root = parentCandidateId == null || parentCandidateId.isBlank();
        return new ParentEdgeCandidate(edgeId, childCandidateId, parentCandidateId, root, false, reasons, Map.of(), Map.of());
    }

    @Override
    public String toString() {
        return "ParentEdgeCandidate{" + edgeId + ": " + childCandidateId + " -> "
                + (root ? "<root>" : parentCandidateId) + (hardValid ? "" : " (hard-invalid)") + "}";
    }
}
