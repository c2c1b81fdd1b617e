package org.calista.clausegraph.core;

import java.util.Objects;

/**
 * SolverOptions: the immutable policy for one solve call.
 *
 * Thresholds are policy knobs, not algorithm constants. Build from {@link SolverConfig} or the
 * builder and override any knob per call through {@link #toBuilder()}.
 */
public final class SolverOptions {

    public static final String DEFAULT_PARSER_VERSION = "parser_v2_solver_v1";
    public static final double DEFAULT_ABSTAIN_MARGIN_THRESHOLD = 0.08;
    public static final double DEFAULT_REVIEW_MARGIN_THRESHOLD = 0.20;
    public static final double DEFAULT_SECTION_ABSTAIN_RATIO_THRESHOLD = 0.40;
    public static final double DEFAULT_MIN_TOP1_SCORE = 0.12;
    public static final double DEFAULT_SINGLE_CANDIDATE_GAP = 0.30;

    private static final SolverOptions DEFAULTS = builder().build();

    /** Tag embedded verbatim in every solution. */
    public final String parserVersion;

    /** Tokens whose top-2 margin is below this abstain. */
    public final double abstainMarginThreshold;

    /** Selected tokens whose margin is below this go to review. */
    public final double reviewMarginThreshold;

    /** Section abstains when abstained/total tokens reaches this ratio. */
    public final double sectionAbstainRatioThreshold;

    /** Tokens whose best score is below this abstain regardless of margin. */
    public final double minTop1Score;

    /** Synthetic competitor distance for tokens with a single candidate. */
    public final double singleCandidateGap;

    private SolverOptions(Builder b) {
        if (b.parserVersion == null || b.parserVersion.isBlank()) {
            throw new IllegalArgumentException("parserVersion cannot be empty");
        }
        this.parserVersion = b.parserVersion;
        this.abstainMarginThreshold = nonNegative(b.abstainMarginThreshold, DEFAULT_ABSTAIN_MARGIN_THRESHOLD);
        // review band never sits below the abstain band
        this.reviewMarginThreshold = Math.max(abstainMarginThreshold,
                nonNegative(b.reviewMarginThreshold, DEFAULT_REVIEW_MARGIN_THRESHOLD));
        this.sectionAbstainRatioThreshold = nonNegative(b.sectionAbstainRatioThreshold, DEFAULT_SECTION_ABSTAIN_RATIO_THRESHOLD);
        this.minTop1Score = nonNegative(b.minTop1Score, DEFAULT_MIN_TOP1_SCORE);
        this.singleCandidateGap = nonNegative(b.singleCandidateGap, DEFAULT_SINGLE_CANDIDATE_GAP);
    }

    public static SolverOptions defaults() {
        return DEFAULTS;
    }

    public static SolverOptions from(SolverConfig.Solver cfg) {
        Objects.requireNonNull(cfg, "cfg");
        return builder()
                .parserVersion(cfg.parserVersion)
                .abstainMarginThreshold(cfg.abstainMarginThreshold)
                .reviewMarginThreshold(cfg.reviewMarginThreshold)
                .sectionAbstainRatioThreshold(cfg.sectionAbstainRatioThreshold)
                .minTop1Score(cfg.minTop1Score)
                .singleCandidateGap(cfg.singleCandidateGap)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .parserVersion(parserVersion)
                .abstainMarginThreshold(abstainMarginThreshold)
                .reviewMarginThreshold(reviewMarginThreshold)
                .sectionAbstainRatioThreshold(sectionAbstainRatioThreshold)
                .minTop1Score(minTop1Score)
                .singleCandidateGap(singleCandidateGap);
    }

    public static final class Builder {
        private String parserVersion = DEFAULT_PARSER_VERSION;
        private double abstainMarginThreshold = DEFAULT_ABSTAIN_MARGIN_THRESHOLD;
        private double reviewMarginThreshold = DEFAULT_REVIEW_MARGIN_THRESHOLD;
        private double sectionAbstainRatioThreshold = DEFAULT_SECTION_ABSTAIN_RATIO_THRESHOLD;
        private double minTop1Score = DEFAULT_MIN_TOP1_SCORE;
        private double singleCandidateGap = DEFAULT_SINGLE_CANDIDATE_GAP;

        private Builder() {}

        public Builder parserVersion(String v) { this.parserVersion = v; return this; }

        public Builder abstainMarginThreshold(double v) { this.abstainMarginThreshold = v; return this; }

        public Builder reviewMarginThreshold(double v) { this.reviewMarginThreshold = v; return this; }

        public Builder sectionAbstainRatioThreshold(double v) { this.sectionAbstainRatioThreshold = v; return this; }

        public Builder minTop1Score(double v) { this.minTop1Score = v; return this; }

        public Builder singleCandidateGap(double v) { this.singleCandidateGap = v; return this; }

        public SolverOptions build() {
            return new SolverOptions(this);
        }
    }

    private static double nonNegative(double v, double fallback) {
        if (!Double.isFinite(v) || v < 0.0) return fallback;
        return v;
    }

    @Override
    public String toString() {
        return "SolverOptions{parserVersion=" + parserVersion
                + ", abstainMargin=" + abstainMarginThreshold
                + ", reviewMargin=" + reviewMarginThreshold
                + ", sectionAbstainRatio=" + sectionAbstainRatioThreshold
                + ", minTop1=" + minTop1Score
                + ", singleGap=" + singleCandidateGap + '}';
    }
}
