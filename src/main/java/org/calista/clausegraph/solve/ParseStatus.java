package org.calista.clausegraph.solve;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict for one token or one section.
 */
public enum ParseStatus {
    ACCEPTED("accepted"),
    REVIEW("review"),
    ABSTAIN("abstain");

    private final String code;

    ParseStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
