package org.calista.clausegraph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Enumerator family of a clause marker: "(a)" is alpha, "(iv)" roman, "(A)" caps, "(1)" numeric.
 */
public enum LevelType {
    ALPHA("alpha"),
    ROMAN("roman"),
    CAPS("caps"),
    NUMERIC("numeric"),
    OTHER("other");

    private final String code;

    LevelType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Unknown or missing codes map to {@link #OTHER}. */
    @JsonCreator
    public static LevelType fromCode(String code) {
        if (code == null) return OTHER;
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (LevelType t : values()) {
            if (t.code.equals(c)) return t;
        }
        return OTHER;
    }
}
