package org.calista.clausegraph.solution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.calista.clausegraph.graph.CandidateGraph;

import java.util.Objects;

/**
 * JSON wire format for graphs and solutions.
 *
 * Output is single-line and deterministic: declared property order on every model class, map
 * entries sorted by key.
 */
public final class SolutionCodec {

    private final ObjectMapper mapper;

    public SolutionCodec() {
        this(defaultMapper());
    }

    public SolutionCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper om = new ObjectMapper();
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        om.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        om.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return om;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String writeSolution(SolverSolution solution) throws JsonProcessingException {
        Objects.requireNonNull(solution, "solution");
        return mapper.writeValueAsString(solution);
    }

    /** Generic tree view of a solution, for snapshot comparison and ad-hoc inspection. */
    public JsonNode toTree(SolverSolution solution) {
        Objects.requireNonNull(solution, "solution");
        return mapper.valueToTree(solution);
    }

    public CandidateGraph readGraph(String json) throws JsonProcessingException {
        Objects.requireNonNull(json, "json");
        CandidateGraph g = mapper.readValue(json, CandidateGraph.class);
        return g == null ? CandidateGraph.empty() : g;
    }

    public String writeGraph(CandidateGraph graph) throws JsonProcessingException {
        Objects.requireNonNull(graph, "graph");
        return mapper.writeValueAsString(graph);
    }
}
