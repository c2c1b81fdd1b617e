package org.calista.clausegraph.solution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.clausegraph.solve.ParseStatus;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Side-by-side comparison of two solutions of the same section, used by shadow runs and
 * change detection between parser versions or threshold settings.
 */
@JsonPropertyOrder({"section_key", "left_run_id", "right_run_id", "run_id_changed", "left_status",
        "right_status", "status_changed", "left_node_count", "right_node_count", "shared_clause_ids",
        "only_left_clause_ids", "only_right_clause_ids"})
public final class SolutionDiff {

    @JsonProperty("section_key")
    public final String sectionKey;

    @JsonProperty("left_run_id")
    public final String leftRunId;

    @JsonProperty("right_run_id")
    public final String rightRunId;

    @JsonProperty("run_id_changed")
    public final boolean runIdChanged;

    @JsonProperty("left_status")
    public final ParseStatus leftStatus;

    @JsonProperty("right_status")
    public final ParseStatus rightStatus;

    @JsonProperty("status_changed")
    public final boolean statusChanged;

    @JsonProperty("left_node_count")
    public final int leftNodeCount;

    @JsonProperty("right_node_count")
    public final int rightNodeCount;

    @JsonProperty("shared_clause_ids")
    public final int sharedClauseIds;

    /** Sorted. */
    @JsonProperty("only_left_clause_ids")
    public final List<String> onlyLeftClauseIds;

    /** Sorted. */
    @JsonProperty("only_right_clause_ids")
    public final List<String> onlyRightClauseIds;

    private SolutionDiff(SolverSolution left, SolverSolution right) {
        this.sectionKey = left.sectionKey;
        this.leftRunId = left.parseRunId;
        this.rightRunId = right.parseRunId;
        this.runIdChanged = !left.parseRunId.equals(right.parseRunId);
        this.leftStatus = left.sectionParseStatus;
        this.rightStatus = right.sectionParseStatus;
        this.statusChanged = left.sectionParseStatus != right.sectionParseStatus;
        this.leftNodeCount = left.nodes.size();
        this.rightNodeCount = right.nodes.size();

        TreeSet<String> l = new TreeSet<>(left.clauseIds());
        TreeSet<String> r = new TreeSet<>(right.clauseIds());

        TreeSet<String> shared = new TreeSet<>(l);
        shared.retainAll(r);
        this.sharedClauseIds = shared.size();

        TreeSet<String> onlyL = new TreeSet<>(l);
        onlyL.removeAll(r);
        TreeSet<String> onlyR = new TreeSet<>(r);
        onlyR.removeAll(l);
        this.onlyLeftClauseIds = List.copyOf(onlyL);
        this.onlyRightClauseIds = List.copyOf(onlyR);
    }

    public static SolutionDiff compare(SolverSolution left, SolverSolution right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!left.sectionKey.equals(right.sectionKey)) {
            throw new IllegalArgumentException("cannot compare solutions of different sections: "
                    + left.sectionKey + " vs " + right.sectionKey);
        }
        return new SolutionDiff(left, right);
    }

    /** True when both sides produced the same selections and the same verdict. */
    @JsonIgnore
    public boolean isUnchanged() {
        return !runIdChanged && !statusChanged && onlyLeftClauseIds.isEmpty() && onlyRightClauseIds.isEmpty();
    }

    @Override
    public String toString() {
        return "SolutionDiff{" + sectionKey + " status " + leftStatus.code() + "->" + rightStatus.code()
                + " nodes " + leftNodeCount + "->" + rightNodeCount
                + " -" + onlyLeftClauseIds.size() + " +" + onlyRightClauseIds.size() + "}";
    }
}
