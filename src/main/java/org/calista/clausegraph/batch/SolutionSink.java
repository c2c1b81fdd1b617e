package org.calista.clausegraph.batch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.clausegraph.adapter.LinkPayload;
import org.calista.clausegraph.io.FileIO;
import org.calista.clausegraph.solution.SolutionCodec;
import org.calista.clausegraph.solution.SolverSolution;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes batch sidecars as JSONL. The first line is a schema header, then one record per line in
 * input order, each terminated by {@code \n}. A file only appears once everything has been written.
 */
public final class SolutionSink {
    private static final Logger log = LogManager.getLogger(SolutionSink.class);

    public static final String SCHEMA = "clause-solution-jsonl-v1";
    public static final String LINK_SCHEMA = "clause-link-payload-jsonl-v1";
    public static final String SCHEMA_FIELD = "_schema";

    private final FileIO io;
    private final SolutionCodec codec;

    public SolutionSink(FileIO io, SolutionCodec codec) {
        this.io = Objects.requireNonNull(io, "io");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public void write(Path file, List<SolverSolution> solutions) throws IOException {
        Objects.requireNonNull(solutions, "solutions");
        writeJsonl(file, SCHEMA, solutions, codec::writeSolution);
        log.info("Solutions written: {} ({} sections)", file, solutions.size());
    }

    public void writeLinkPayloads(Path file, List<LinkPayload> payloads) throws IOException {
        Objects.requireNonNull(payloads, "payloads");
        writeJsonl(file, LINK_SCHEMA, payloads, codec.mapper()::writeValueAsString);
        log.info("Link payloads written: {} ({} sections)", file, payloads.size());
    }

    private <T> void writeJsonl(Path file, String schema, List<T> rows, LineEncoder<T> encoder) throws IOException {
        Objects.requireNonNull(file, "file");

        FileIO.WriterHandle h = io.openWriter(file);
        try {
            h.writer.write(codec.mapper().writeValueAsString(Map.of(SCHEMA_FIELD, schema)));
            h.writer.write('\n');
            for (T row : rows) {
                h.writer.write(encoder.encode(row));
                h.writer.write('\n');
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h);
            throw e;
        }
    }

    @FunctionalInterface
    private interface LineEncoder<T> {
        String encode(T row) throws IOException;
    }
}
