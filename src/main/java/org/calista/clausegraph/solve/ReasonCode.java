package org.calista.clausegraph.solve;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Reason codes attached to non-accepted decisions. They are the solver's whole error vocabulary.
 */
public enum ReasonCode {
    /** Section-wide abstain rate too high to trust any result. */
    INSUFFICIENT_CONTEXT("insufficient_context"),
    /** Candidate lacks a structurally anchored position. */
    LAYOUT_UNCERTAIN("layout_uncertain"),
    /** Top candidate not decisively better than its closest competitor. */
    LOW_MARGIN("low_margin"),
    /** A node had no structurally valid parent and was dropped from the tree. */
    PARENT_CONFLICT("parent_conflict"),
    /** Candidate plausibly describes a cross-reference rather than a new clause. */
    XREF_CONFLICT("xref_conflict");

    public static final Comparator<ReasonCode> BY_CODE = Comparator.comparing(ReasonCode::code);

    private final String code;

    ReasonCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** De-duplicated, sorted by code: the ordered-set form used in every report. */
    public static List<ReasonCode> orderedSet(Collection<ReasonCode> codes) {
        TreeSet<ReasonCode> set = new TreeSet<>(BY_CODE);
        if (codes != null) set.addAll(codes);
        return List.copyOf(new ArrayList<>(set));
    }
}
