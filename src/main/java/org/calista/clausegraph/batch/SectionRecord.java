package org.calista.clausegraph.batch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.clausegraph.graph.CandidateGraph;

/**
 * One line of a section JSONL file: the section key, its candidate graph and, optionally, the
 * section text with its document offset (needed only for legacy clause rows).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"section_key", "global_offset", "text", "graph"})
public final class SectionRecord {

    @JsonProperty("section_key")
    public final String sectionKey;

    @JsonProperty("global_offset")
    public final int globalOffset;

    @JsonProperty("text")
    public final String text;

    @JsonProperty("graph")
    public final CandidateGraph graph;

    @JsonCreator
    public SectionRecord(@JsonProperty("section_key") String sectionKey,
                         @JsonProperty("global_offset") int globalOffset,
                         @JsonProperty("text") String text,
                         @JsonProperty("graph") CandidateGraph graph) {
        this.sectionKey = sectionKey;
        this.globalOffset = globalOffset;
        this.text = text == null ? "" : text;
        this.graph = graph == null ? CandidateGraph.empty() : graph;
    }

    public SectionRecord(String sectionKey, CandidateGraph graph) {
        this(sectionKey, 0, "", graph);
    }

    public void validate() {
        if (sectionKey == null || sectionKey.isBlank()) throw new IllegalArgumentException("section_key cannot be empty");
        if (globalOffset < 0) throw new IllegalArgumentException("global_offset must be >= 0 (section " + sectionKey + ")");
    }
}
