package org.calista.clausegraph.graph;

/**
 * FeatureKeys: canonical keys of {@link NodeCandidate#featureVector}.
 *
 * Keys are part of the upstream graph contract; do not rename without migrating producers.
 */
public final class FeatureKeys {
    private FeatureKeys() {}

    // ---- layout ----
    public static final String ANCHOR = "anchor";
    public static final String LINE_START = "line_start";
    public static final String INDENTATION = "indentation";

    // ---- cross-reference context ----
    public static final String XREF_KEYWORD_PRE = "xref_keyword_pre";
    public static final String XREF_PREPOSITION_PRE = "xref_preposition_pre";
}
