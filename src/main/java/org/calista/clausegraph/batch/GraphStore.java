package org.calista.clausegraph.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.clausegraph.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads section records from a JSONL file (plain or .gz). Broken lines are logged and counted;
 * with {@code failFast} the first broken line aborts the load.
 */
public final class GraphStore {
    private static final Logger log = LogManager.getLogger(GraphStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;

    public GraphStore(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Loaded load(Path jsonlFile, boolean failFast) throws IOException {
        Objects.requireNonNull(jsonlFile, "jsonlFile");
        List<SectionRecord> records = new ArrayList<>();
        int ok = 0, bad = 0;

        if (!io.exists(jsonlFile)) {
            log.warn("Section file not found: {}", jsonlFile);
            return new Loaded(records, new LoadReport(jsonlFile, 0, 0));
        }

        List<String> lines = io.readJsonl(jsonlFile);
        for (String line : lines) {
            try {
                SectionRecord r = mapper.readValue(line, SectionRecord.class);
                r.validate();
                records.add(r);
                ok++;
            } catch (Exception e) {
                bad++;
                log.warn("Bad section line in {}: {}", jsonlFile, e.toString());
                if (failFast) throw new IOException("Bad section line in " + jsonlFile + ": " + e, e);
            }
        }

        log.info("Sections loaded: {} (ok={}, bad={})", jsonlFile, ok, bad);
        return new Loaded(records, new LoadReport(jsonlFile, ok, bad));
    }

    public static final class Loaded {
        public final List<SectionRecord> records;
        public final LoadReport report;

        Loaded(List<SectionRecord> records, LoadReport report) {
            this.records = List.copyOf(records);
            this.report = report;
        }
    }

    public static final class LoadReport {
        public final Path file;
        public final int ok;
        public final int bad;

        public LoadReport(Path file, int ok, int bad) {
            this.file = file;
            this.ok = ok;
            this.bad = bad;
        }
    }
}
