package org.calista.clausegraph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * NodeCandidate: one competing interpretation of one token as a clause node.
 *
 * All candidates sharing a {@link #tokenId} are mutually exclusive readings of the same text
 * position; the solver selects at most one of them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"node_candidate_id", "token_id", "token_index", "normalized_label", "raw_label",
        "level_type", "ordinal", "depth_hint", "span_start", "span_end", "feature_vector"})
public final class NodeCandidate {

    @JsonProperty("node_candidate_id")
    public final String nodeCandidateId;

    @JsonProperty("token_id")
    public final String tokenId;

    /** Ordering key within a section. */
    @JsonProperty("token_index")
    public final int tokenIndex;

    /** Label without punctuation, e.g. "a", "iv", "1". */
    @JsonProperty("normalized_label")
    public final String normalizedLabel;

    /** Label as written, e.g. "(iv)". Empty when the producer did not supply it. */
    @JsonProperty("raw_label")
    public final String rawLabel;

    @JsonProperty("level_type")
    public final LevelType levelType;

    /** 1-based position inside the enumerator family ("c" = 3, "iv" = 4). */
    @JsonProperty("ordinal")
    public final int ordinal;

    /** Proposed nesting depth; 1 is the most likely root level. */
    @JsonProperty("depth_hint")
    public final int depthHint;

    @JsonProperty("span_start")
    public final int spanStart;

    @JsonProperty("span_end")
    public final int spanEnd;

    @JsonProperty("feature_vector")
    public final FeatureVector featureVector;

    @JsonCreator
    public NodeCandidate(@JsonProperty("node_candidate_id") String nodeCandidateId,
                         @JsonProperty("token_id") String tokenId,
                         @JsonProperty("token_index") int tokenIndex,
                         @JsonProperty("normalized_label") String normalizedLabel,
                         @JsonProperty("raw_label") String rawLabel,
                         @JsonProperty("level_type") LevelType levelType,
                         @JsonProperty("ordinal") Integer ordinal,
                         @JsonProperty("depth_hint") int depthHint,
                         @JsonProperty("span_start") int spanStart,
                         @JsonProperty("span_end") int spanEnd,
                         @JsonProperty("feature_vector") FeatureVector featureVector) {
        this.nodeCandidateId = nodeCandidateId;
        this.tokenId = tokenId;
        this.tokenIndex = tokenIndex;
        this.normalizedLabel = normalizedLabel == null ? "" : normalizedLabel;
        this.rawLabel = rawLabel == null ? "" : rawLabel;
        this.levelType = levelType == null ? LevelType.OTHER : levelType;
        this.ordinal = ordinal == null ? 1 : ordinal;
        this.depthHint = depthHint;
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.featureVector = featureVector == null ? FeatureVector.empty() : featureVector;
        validate();
    }

    private void validate() {
        if (nodeCandidateId == null || nodeCandidateId.isBlank()) {
            throw new IllegalArgumentException("node_candidate_id cannot be empty");
        }
        if (tokenId == null || tokenId.isBlank()) {
            throw new IllegalArgumentException("token_id cannot be empty (node " + nodeCandidateId + ")");
        }
        if (tokenIndex < 0) throw new IllegalArgumentException("token_index must be >= 0 (node " + nodeCandidateId + ")");
        if (ordinal <= 0) throw new IllegalArgumentException("ordinal must be > 0 (node " + nodeCandidateId + ")");
        if (depthHint <= 0) throw new IllegalArgumentException("depth_hint must be > 0 (node " + nodeCandidateId + ")");
        if (spanStart < 0) throw new IllegalArgumentException("span_start must be >= 0 (node " + nodeCandidateId + ")");
        if (spanEnd <= spanStart) {
            throw new IllegalArgumentException("span_end must be > span_start (node " + nodeCandidateId + ")");
        }
    }

    public static Builder builder(String nodeCandidateId, String tokenId) {
        return new Builder(nodeCandidateId, tokenId);
    }

    public static final class Builder {
        private final String nodeCandidateId;
        private final String tokenId;
        private int tokenIndex;
        private String normalizedLabel = "";
        private String rawLabel = "";
        private LevelType levelType = LevelType.OTHER;
        private int ordinal = 1;
        private int depthHint = 1;
        private int spanStart;
        private int spanEnd = 1;
        private FeatureVector featureVector = FeatureVector.empty();

        private Builder(String nodeCandidateId, String tokenId) {
            this.nodeCandidateId = nodeCandidateId;
            this.tokenId = tokenId;
        }

        public Builder tokenIndex(int v) { this.tokenIndex = v; return this; }

        public Builder label(String normalized) { this.normalizedLabel = normalized; return this; }

        public Builder rawLabel(String v) { this.rawLabel = v; return this; }

        public Builder levelType(LevelType v) { this.levelType = v; return this; }

        public Builder ordinal(int v) { this.ordinal = v; return this; }

        public Builder depthHint(int v) { this.depthHint = v; return this; }

        public Builder span(int start, int end) {
            this.spanStart = start;
            this.spanEnd = end;
            return this;
        }

        public Builder features(FeatureVector v) {
            this.featureVector = Objects.requireNonNull(v, "featureVector");
            return this;
        }

        public NodeCandidate build() {
            return new NodeCandidate(nodeCandidateId, tokenId, tokenIndex, normalizedLabel, rawLabel,
                    levelType, ordinal, depthHint, spanStart, spanEnd, featureVector);
        }
    }

    @Override
    public String toString() {
        return "NodeCandidate{" + nodeCandidateId + ", token=" + tokenId + ", " + levelType.code()
                + ":" + normalizedLabel + ", depth=" + depthHint + ", span=" + spanStart + ".." + spanEnd + "}";
    }
}
